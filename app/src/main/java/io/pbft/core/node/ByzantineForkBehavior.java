package io.pbft.core.node;

import io.pbft.core.consensus.ConsensusState;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.PbftMessage;

import java.util.logging.Logger;

/**
 * Faulty node that tries to fork silently: on a PrePrepare it ignores the proposal, starts its own
 * rounds on fabricated blocks and tells nobody. Votes from other nodes are ignored.
 * Each fabricated hash only ever holds the node's own vote, so it cannot reach quorum.
 */
public final class ByzantineForkBehavior implements NodeBehavior {
    private static final Logger LOG = Logger.getLogger(ByzantineForkBehavior.class.getName());

    public static final ByzantineForkBehavior INSTANCE = new ByzantineForkBehavior();
    public static final int FORKED_BLOCKS = 3;

    private ByzantineForkBehavior() {}

    @Override
    public Delivery handle(Node node, PbftMessage message) {
        return switch (message.type()) {
            case PRE_PREPARE -> fork(node, message.block());
            case PREPARE, COMMIT -> Delivery.of(node);
        };
    }

    @Override
    public FaultMode mode() {
        return FaultMode.FORK_SILENTLY;
    }

    private Delivery fork(Node node, Block proposal) {
        ConsensusState state = node.consensus();
        for (int variant = 1; variant <= FORKED_BLOCKS; variant++) {
            Block fake = fabricate(node.id(), proposal, variant);
            state = state.start(fake);
            LOG.fine(() -> "Node " + node.id() + " started a round on fabricated " + fake);
        }
        return Delivery.of(node.withConsensus(state));
    }

    /** A block on the same parent as {@code proposal} with a forged payload and timestamp. */
    static Block fabricate(int nodeId, Block proposal, int variant) {
        return Block.create(
                "Malicious block " + variant + " from node " + nodeId,
                proposal.timestamp() + variant,
                proposal.prevHash());
    }
}
