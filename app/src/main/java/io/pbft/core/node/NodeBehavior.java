package io.pbft.core.node;

import io.pbft.core.protocol.PbftMessage;

/**
 * Message-handling strategy of a node. Implementations must not mutate the given node;
 * they return the updated node together with the messages it emits.
 */
public interface NodeBehavior {

    Delivery handle(Node node, PbftMessage message);

    FaultMode mode();
}
