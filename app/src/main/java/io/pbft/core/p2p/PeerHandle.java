package io.pbft.core.p2p;

import io.pbft.core.protocol.PbftMessage;

/** Opaque delivery target for one peer; the implementation owns the transport. */
@FunctionalInterface
public interface PeerHandle {
    void deliver(PbftMessage message);
}
