package io.pbft.core.ledger;

import io.pbft.core.protocol.Block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, hash-linked sequence of blocks. Index 0 is the genesis block.
 * Every mutator returns a new ledger; the receiver is never changed.
 */
public final class Ledger {
    public static final String GENESIS_DATA = "Genesis Block";
    public static final String GENESIS_PREV_HASH = "0";
    /** Fixed so that every node derives the same genesis hash. */
    public static final long GENESIS_TIMESTAMP = 0L;

    private static final Ledger EMPTY = new Ledger(Collections.emptyList());

    private final List<Block> blocks;

    private Ledger(List<Block> blocks) {
        this.blocks = blocks;
    }

    public static Ledger genesis() {
        return new Ledger(List.of(genesisBlock()));
    }

    public static Block genesisBlock() {
        return Block.create(GENESIS_DATA, GENESIS_TIMESTAMP, GENESIS_PREV_HASH);
    }

    /** A ledger with no blocks at all. Nothing can be appended to it. */
    public static Ledger empty() {
        return EMPTY;
    }

    /** Build a new block on top of the tail and return the extended ledger. */
    public Ledger append(String data) {
        return appendBlock(Block.create(data, requireTail().hash()));
    }

    public Ledger append(String data, long timestamp) {
        return appendBlock(Block.create(data, timestamp, requireTail().hash()));
    }

    /**
     * Append a block produced elsewhere (e.g. agreed through consensus).
     * @throws IllegalArgumentException if the block's hash is inconsistent or it does not link to the tail
     */
    public Ledger appendBlock(Block block) {
        Block tail = requireTail();
        if (!isBlockValid(block)) {
            throw new IllegalArgumentException("Block hash mismatch: " + block);
        }
        if (!isLinked(tail, block)) {
            throw new IllegalArgumentException("Block " + block + " does not link to tail " + tail);
        }
        List<Block> next = new ArrayList<>(blocks.size() + 1);
        next.addAll(blocks);
        next.add(block);
        return new Ledger(Collections.unmodifiableList(next));
    }

    public boolean canAppend(Block block) {
        return !blocks.isEmpty() && isBlockValid(block) && isLinked(tail().orElseThrow(), block);
    }

    public boolean contains(String blockHash) {
        for (Block b : blocks) {
            if (b.hash().equals(blockHash)) return true;
        }
        return false;
    }

    public Optional<Block> tail() {
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.get(blocks.size() - 1));
    }

    public List<Block> blocks() { return blocks; }
    public Block get(int index) { return blocks.get(index); }
    public int size() { return blocks.size(); }
    public boolean isEmpty() { return blocks.isEmpty(); }

    public List<String> hashes() {
        List<String> out = new ArrayList<>(blocks.size());
        for (Block b : blocks) out.add(b.hash());
        return out;
    }

    public boolean isValid() {
        return isChainValid(blocks);
    }

    private Block requireTail() {
        return tail().orElseThrow(() -> new IllegalStateException("Cannot append to an empty ledger"));
    }

    // ---- validation ----

    public static boolean isBlockValid(Block block) {
        return block != null && block.hasValidHash();
    }

    public static boolean isLinked(Block prev, Block next) {
        return prev != null && next != null && next.prevHash().equals(prev.hash());
    }

    public static boolean isChainValid(Ledger ledger) {
        return ledger != null && isChainValid(ledger.blocks);
    }

    /**
     * Empty is invalid, a single block is valid, otherwise each block must hash correctly
     * and link to its successor.
     */
    public static boolean isChainValid(List<Block> chain) {
        if (chain == null || chain.isEmpty()) return false;
        for (int i = 0; i + 1 < chain.size(); i++) {
            Block prev = chain.get(i);
            Block next = chain.get(i + 1);
            if (!isBlockValid(prev) || !isLinked(prev, next)) {
                return false;
            }
        }
        return true;
    }

    @Override public String toString() {
        return "Ledger{height=" + blocks.size() + tail().map(b -> ", tip=" + b).orElse("") + "}";
    }
}
