package io.pbft.core.node;

import io.pbft.core.consensus.Phase;
import io.pbft.core.ledger.Ledger;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.MessageType;
import io.pbft.core.protocol.PbftMessage;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RandomFaultBehaviorTest {

    private final Block block = Block.create("Block 1", 1_000L, Ledger.genesisBlock().hash());

    /** Always returns the same choice index. */
    private static final class FixedRandom extends Random {
        private final int value;

        FixedRandom(RandomFaultBehavior.Choice choice) {
            this.value = choice.ordinal();
        }

        @Override
        public int nextInt(int bound) {
            return value;
        }
    }

    private static Node node(RandomFaultBehavior.Choice choice) {
        return Node.create(new NodeConfig(1, 4, 1, FaultMode.RANDOM), new RandomFaultBehavior(new FixedRandom(choice)));
    }

    @Test
    void obeyActsLikeAnHonestNode() {
        Delivery delivery = node(RandomFaultBehavior.Choice.OBEY).deliver(PbftMessage.prePrepare(block));

        assertEquals(block, delivery.node().consensus().currentBlock().orElseThrow());
        assertEquals(3, delivery.outbound().size());
        assertEquals(block, delivery.outbound().get(0).message().block());
    }

    @Test
    void silentDropsTheMessage() {
        Node node = node(RandomFaultBehavior.Choice.SILENT);
        Delivery delivery = node.deliver(PbftMessage.prePrepare(block));

        assertSame(node, delivery.node());
        assertTrue(delivery.outbound().isEmpty());
        assertEquals(Phase.INITIAL, delivery.node().phase());
    }

    @Test
    void conflictingPrePrepareBroadcastsOnePrepareForAFabricatedBlock() {
        Block fake = ByzantineForkBehavior.fabricate(1, block, 1);

        Delivery prePrepare = node(RandomFaultBehavior.Choice.CONFLICT).deliver(PbftMessage.prePrepare(block));

        assertEquals(fake, prePrepare.node().consensus().currentBlock().orElseThrow());
        assertEquals(fake.prevHash(), block.prevHash());
        assertEquals(3, prePrepare.outbound().size());
        assertEquals(MessageType.PREPARE, prePrepare.outbound().get(0).message().type());
        assertEquals(fake, prePrepare.outbound().get(0).message().block());
    }

    @Test
    void conflictingVotesStayLocal() {
        Node node = node(RandomFaultBehavior.Choice.CONFLICT);
        Block fake = ByzantineForkBehavior.fabricate(1, block, 1);

        Delivery prepare = node.deliver(PbftMessage.prepare(block, 2));
        assertTrue(prepare.outbound().isEmpty());
        assertEquals(Set.of(2), prepare.node().consensus().prepareVoters(fake.hash()));
        assertTrue(prepare.node().consensus().prepareVoters(block.hash()).isEmpty());

        Delivery commit = prepare.node().deliver(PbftMessage.commit(block, 3));
        assertTrue(commit.outbound().isEmpty());
        assertEquals(Set.of(3), commit.node().consensus().commitVoters(fake.hash()));
        assertEquals(1, commit.node().ledger().size());
    }

    @Test
    void reportsRandomMode() {
        assertEquals(FaultMode.RANDOM, new RandomFaultBehavior(new Random(1)).mode());
        assertTrue(node(RandomFaultBehavior.Choice.OBEY).isByzantine());
    }

    @Test
    void parsesCliForms() {
        assertEquals(FaultMode.FORK_SILENTLY, FaultMode.parse("fork"));
        assertEquals(FaultMode.FORK_SILENTLY, FaultMode.parse("Fork-Silently"));
        assertEquals(FaultMode.RANDOM, FaultMode.parse(" random "));
        assertEquals(FaultMode.HONEST, FaultMode.parse("HONEST"));
        assertThrows(IllegalArgumentException.class, () -> FaultMode.parse("lazy"));
        assertThrows(IllegalArgumentException.class, () -> FaultMode.parse(""));
    }
}
