package io.pbft.core.ledger;

import io.pbft.core.protocol.Block;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LedgerTest {

    @Test
    void genesisIsIdenticalEverywhere() {
        Ledger a = Ledger.genesis();
        Ledger b = Ledger.genesis();

        assertEquals(1, a.size());
        assertEquals(a.hashes(), b.hashes());
        Block genesis = a.get(0);
        assertEquals(Ledger.GENESIS_DATA, genesis.dataAsString());
        assertEquals(Ledger.GENESIS_PREV_HASH, genesis.prevHash());
        assertEquals(Ledger.GENESIS_TIMESTAMP, genesis.timestamp());
    }

    @Test
    void appendLinksToTailAndLeavesReceiverUntouched() {
        Ledger genesis = Ledger.genesis();
        Ledger next = genesis.append("Block 1", 10L);

        assertEquals(1, genesis.size());
        assertEquals(2, next.size());
        assertEquals(genesis.get(0).hash(), next.get(1).prevHash());
        assertTrue(next.isValid());
    }

    @Test
    void appendToEmptyLedgerFails() {
        assertThrows(IllegalStateException.class, () -> Ledger.empty().append("x"));
        assertTrue(Ledger.empty().isEmpty());
        assertTrue(Ledger.empty().tail().isEmpty());
    }

    @Test
    void appendBlockRejectsUnlinkedOrCorruptBlocks() {
        Ledger ledger = Ledger.genesis();
        Block unlinked = Block.create("orphan", 1L, "deadbeef");
        Block good = Block.create("child", 1L, ledger.tail().orElseThrow().hash());
        Block corrupt = new Block(good.data(), 2L, good.prevHash(), good.hash());

        assertThrows(IllegalArgumentException.class, () -> ledger.appendBlock(unlinked));
        assertThrows(IllegalArgumentException.class, () -> ledger.appendBlock(corrupt));
        assertFalse(ledger.canAppend(unlinked));
        assertTrue(ledger.canAppend(good));
        assertTrue(ledger.appendBlock(good).contains(good.hash()));
    }

    @Test
    void emptyChainIsInvalidAndSingleBlockIsValid() {
        assertFalse(Ledger.isChainValid(List.of()));
        assertFalse(Ledger.isChainValid((Ledger) null));
        assertTrue(Ledger.isChainValid(List.of(Ledger.genesisBlock())));
    }

    @Test
    void tamperedMiddleBlockInvalidatesChain() {
        Ledger ledger = Ledger.genesis().append("one", 1L).append("two", 2L);
        assertTrue(Ledger.isChainValid(ledger));

        Block middle = ledger.get(1);
        Block tampered = new Block(middle.data(), middle.timestamp(), "not-the-genesis", middle.hash());
        List<Block> chain = List.of(ledger.get(0), tampered, ledger.get(2));

        assertFalse(Ledger.isChainValid(chain));
    }

    @Test
    void blockValidityTracksTheHash() {
        Block block = Block.create("data", 7L, "prev");
        assertTrue(Ledger.isBlockValid(block));
        assertFalse(Ledger.isBlockValid(new Block(block.data(), 8L, "prev", block.hash())));
        assertFalse(Ledger.isBlockValid(null));
    }
}
