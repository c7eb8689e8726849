package io.pbft.core.node;

import io.pbft.core.protocol.PbftMessage;

import java.util.Objects;

/** A message a node wants delivered to one peer. */
public record Outbound(int to, PbftMessage message) {
    public Outbound {
        Objects.requireNonNull(message, "message");
    }
}
