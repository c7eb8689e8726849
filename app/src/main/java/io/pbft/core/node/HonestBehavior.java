package io.pbft.core.node;

import io.pbft.core.consensus.ConsensusState;
import io.pbft.core.ledger.Ledger;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.PbftMessage;

import java.util.logging.Logger;

/**
 * Protocol-following node.
 * PrePrepare starts the round and broadcasts a Prepare; reaching the prepare quorum on a block
 * broadcasts a Commit; reaching the commit quorum appends the block once.
 */
public final class HonestBehavior implements NodeBehavior {
    private static final Logger LOG = Logger.getLogger(HonestBehavior.class.getName());

    public static final HonestBehavior INSTANCE = new HonestBehavior();

    private HonestBehavior() {}

    @Override
    public Delivery handle(Node node, PbftMessage message) {
        return switch (message.type()) {
            case PRE_PREPARE -> onPrePrepare(node, message.block());
            case PREPARE -> onPrepare(node, message.block(), message.senderId());
            case COMMIT -> onCommit(node, message.block(), message.senderId());
        };
    }

    @Override
    public FaultMode mode() {
        return FaultMode.HONEST;
    }

    private Delivery onPrePrepare(Node node, Block block) {
        Node next = node.withConsensus(node.consensus().start(block));
        LOG.fine(() -> "Node " + node.id() + " pre-prepared " + block);
        return new Delivery(next, next.broadcast(PbftMessage.prepare(block, node.id())));
    }

    private Delivery onPrepare(Node node, Block block, int sender) {
        ConsensusState before = node.consensus();
        ConsensusState after = before.recordPrepareVote(block, sender);
        Node next = node.withConsensus(after);
        // Commit goes out once, when this vote completes the quorum for this block.
        if (!before.hasPrepareQuorum(block.hash()) && after.hasPrepareQuorum(block.hash())) {
            LOG.fine(() -> "Node " + node.id() + " prepared " + block + " (" + after.prepareVoters(block.hash()) + ")");
            return new Delivery(next, next.broadcast(PbftMessage.commit(block, node.id())));
        }
        return Delivery.of(next);
    }

    private Delivery onCommit(Node node, Block block, int sender) {
        ConsensusState after = node.consensus().recordCommitVote(block, sender);
        Node next = node.withConsensus(after);
        if (!after.hasCommitQuorum(block.hash())) {
            return Delivery.of(next);
        }
        Ledger ledger = next.ledger();
        if (ledger.contains(block.hash())) {
            return Delivery.of(next);
        }
        if (!ledger.canAppend(block)) {
            LOG.warning(() -> "Node " + node.id() + " reached commit quorum on " + block
                    + " but it does not extend " + ledger + "; not appended");
            return Delivery.of(next);
        }
        LOG.info(() -> "Node " + node.id() + " committed " + block + " at height " + ledger.size());
        return Delivery.of(next.withLedger(ledger.appendBlock(block)));
    }
}
