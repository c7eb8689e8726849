package io.pbft.core.node;

import io.pbft.core.consensus.ConfigurationException;
import io.pbft.core.consensus.Phase;
import io.pbft.core.ledger.Ledger;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.MessageType;
import io.pbft.core.protocol.PbftMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private static Block proposal() {
        return Block.create("Block 1", 1_000L, Ledger.genesisBlock().hash());
    }

    @Test
    void constructionEnforcesFaultTolerance() {
        assertThrows(ConfigurationException.class, () -> Node.create(1, 3, 1, false));
        assertThrows(ConfigurationException.class, () -> Node.create(1, 6, 2, true));
        assertDoesNotThrow(() -> Node.create(1, 4, 1, false));
        assertDoesNotThrow(() -> Node.create(7, 7, 2, true));
    }

    @Test
    void constructionRejectsIdsOutsideTheCluster() {
        assertThrows(ConfigurationException.class, () -> Node.create(0, 4, 1, false));
        assertThrows(ConfigurationException.class, () -> Node.create(5, 4, 1, false));
    }

    @Test
    void newNodeStartsFromGenesis() {
        Node node = Node.create(NodeConfig.honest(2, 4, 1));

        assertEquals(1, node.ledger().size());
        assertEquals(Ledger.genesis().hashes(), node.ledger().hashes());
        assertEquals(Phase.INITIAL, node.phase());
        assertFalse(node.isByzantine());
        assertEquals(List.of(1, 3, 4), node.peers().others());
    }

    @Test
    void viewFromConfigPicksTheLeader() {
        Node node = Node.create(new NodeConfig(1, 4, 1, FaultMode.HONEST, 6));
        assertEquals(3, node.consensus().leader());
    }

    @Test
    void honestPrePrepareBroadcastsPrepareToEveryPeer() {
        Node node = Node.create(1, 4, 1, false);
        Block block = proposal();

        Delivery delivery = node.deliver(PbftMessage.prePrepare(block, 1));

        assertEquals(Phase.PREPREPARED, delivery.node().phase());
        assertEquals(3, delivery.outbound().size());
        for (Outbound out : delivery.outbound()) {
            assertEquals(MessageType.PREPARE, out.message().type());
            assertEquals(1, out.message().senderId());
            assertEquals(block, out.message().block());
        }
        assertEquals(Phase.INITIAL, node.phase(), "delivery never changes the receiver");
    }

    @Test
    void commitIsBroadcastOnceWhenPrepareQuorumForms() {
        Block block = proposal();
        Node node = Node.create(1, 7, 2, false).deliver(PbftMessage.prePrepare(block)).node();

        List<Integer> commitsPerVote = new ArrayList<>();
        for (int voter = 2; voter <= 6; voter++) {
            Delivery delivery = node.deliver(PbftMessage.prepare(block, voter));
            node = delivery.node();
            commitsPerVote.add(delivery.outbound().size());
        }

        // threshold 4: own vote plus voters 2, 3, 4
        assertEquals(List.of(0, 0, 6, 0, 0), commitsPerVote);
        assertEquals(Phase.PREPARED, node.phase());
    }

    @Test
    void commitQuorumAppendsTheBlockOnce() {
        Block block = proposal();
        Node node = Node.create(1, 4, 1, false).deliver(PbftMessage.prePrepare(block)).node();
        node = node.deliver(PbftMessage.prepare(block, 2)).node();
        node = node.deliver(PbftMessage.commit(block, 2)).node();
        assertEquals(1, node.ledger().size());

        node = node.deliver(PbftMessage.commit(block, 3)).node();
        node = node.deliver(PbftMessage.commit(block, 4)).node();
        node = node.deliver(PbftMessage.commit(block, 3)).node();

        assertEquals(Phase.COMMITTED, node.phase());
        assertEquals(2, node.ledger().size());
        assertEquals(block, node.ledger().get(1));
        assertTrue(node.ledger().isValid());
    }

    @Test
    void committedBlockThatDoesNotExtendTheLedgerIsSkipped() {
        Block stray = Block.create("stray", 5L, "not-genesis");
        Node node = Node.create(1, 4, 1, false);
        node = node.deliver(PbftMessage.commit(stray, 2)).node();
        node = node.deliver(PbftMessage.commit(stray, 3)).node();

        assertTrue(node.consensus().hasCommitQuorum(stray.hash()));
        assertEquals(1, node.ledger().size());
    }

    @Test
    void forkingNodeStaysSilentAndIgnoresVotes() {
        Block block = proposal();
        Node node = Node.create(2, 7, 2, true);
        assertTrue(node.isByzantine());

        Delivery onProposal = node.deliver(PbftMessage.prePrepare(block, 1));
        assertTrue(onProposal.outbound().isEmpty());
        Node forked = onProposal.node();
        assertEquals(Phase.PREPREPARED, forked.phase());
        assertNotEquals(block, forked.consensus().currentBlock().orElseThrow());
        assertTrue(forked.consensus().currentBlock().orElseThrow().dataAsString().startsWith("Malicious block"));

        Delivery onPrepare = forked.deliver(PbftMessage.prepare(block, 3));
        assertTrue(onPrepare.outbound().isEmpty());
        assertSame(forked, onPrepare.node());
        assertEquals(1, forked.deliver(PbftMessage.commit(block, 3)).node().ledger().size());
    }

    @Test
    void fabricatedBlocksShareTheParentButNotTheHash() {
        Block block = proposal();
        Block fake = ByzantineForkBehavior.fabricate(2, block, 1);

        assertEquals(block.prevHash(), fake.prevHash());
        assertEquals(block.timestamp() + 1, fake.timestamp());
        assertNotEquals(block.hash(), fake.hash());
        assertTrue(fake.hasValidHash());
    }

    @Test
    void dispatchCountsOnlyDeliveredMessages() {
        List<PbftMessage> toTwo = new ArrayList<>();
        Node node = Node.create(1, 4, 1, false).connect(2, toTwo::add);
        Delivery delivery = node.deliver(PbftMessage.prePrepare(proposal()));

        int sent = delivery.node().dispatch(delivery.outbound());

        assertEquals(1, sent);
        assertEquals(1, toTwo.size());
    }
}
