package io.pbft.core.node;

import io.pbft.core.consensus.ConsensusState;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.PbftMessage;

import java.util.Objects;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Faulty node that picks uniformly per message: obey the protocol, vote for a fabricated
 * block instead of the one received, or drop the message. Only a conflicting PrePrepare
 * answer leaves the node.
 */
public final class RandomFaultBehavior implements NodeBehavior {
    private static final Logger LOG = Logger.getLogger(RandomFaultBehavior.class.getName());

    public enum Choice { OBEY, CONFLICT, SILENT }

    private final Random random;

    public RandomFaultBehavior(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Delivery handle(Node node, PbftMessage message) {
        Choice choice = Choice.values()[random.nextInt(Choice.values().length)];
        LOG.fine(() -> "Node " + node.id() + " chose " + choice + " for " + message);
        return switch (choice) {
            case OBEY -> HonestBehavior.INSTANCE.handle(node, message);
            case CONFLICT -> conflict(node, message);
            case SILENT -> Delivery.of(node);
        };
    }

    @Override
    public FaultMode mode() {
        return FaultMode.RANDOM;
    }

    /**
     * Vote for a block fabricated on the proposal's parent. Only the PrePrepare answer is broadcast;
     * conflicting Prepare and Commit votes are recorded locally, so one round stays bounded.
     */
    private Delivery conflict(Node node, PbftMessage message) {
        Block fake = ByzantineForkBehavior.fabricate(node.id(), message.block(), 1);
        ConsensusState state = node.consensus();
        return switch (message.type()) {
            case PRE_PREPARE -> {
                Node next = node.withConsensus(state.start(fake));
                yield new Delivery(next, next.broadcast(PbftMessage.prepare(fake, node.id())));
            }
            case PREPARE -> Delivery.of(node.withConsensus(state.recordPrepareVote(fake, message.senderId())));
            case COMMIT -> Delivery.of(node.withConsensus(state.recordCommitVote(fake, message.senderId())));
        };
    }
}
