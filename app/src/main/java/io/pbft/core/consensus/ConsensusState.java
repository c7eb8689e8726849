package io.pbft.core.consensus;

import io.pbft.core.protocol.Block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Vote bookkeeping for one node in one block round.
 *
 * Immutable: every operation returns a new state. Votes are tracked per block hash as sets of
 * voter ids, so duplicate or reordered deliveries never change the outcome. Within a round the
 * phase only moves forward; {@link #start(Block)} begins a fresh round.
 */
public final class ConsensusState {
    private final int nodeId;
    private final long view;
    private final Block currentBlock; // null until a round starts
    private final Phase phase;
    private final Map<String, Set<Integer>> prepareVotes;
    private final Map<String, Set<Integer>> commitVotes;
    private final int f;
    private final int totalNodes;

    private ConsensusState(int nodeId,
                           long view,
                           Block currentBlock,
                           Phase phase,
                           Map<String, Set<Integer>> prepareVotes,
                           Map<String, Set<Integer>> commitVotes,
                           int f,
                           int totalNodes) {
        this.nodeId = nodeId;
        this.view = view;
        this.currentBlock = currentBlock;
        this.phase = phase;
        this.prepareVotes = prepareVotes;
        this.commitVotes = commitVotes;
        this.f = f;
        this.totalNodes = totalNodes;
    }

    public static ConsensusState initial(int nodeId, int totalNodes, int f) {
        ConsensusRules.requireFaultTolerance(totalNodes, f);
        return new ConsensusState(nodeId, 0L, null, Phase.INITIAL,
                Collections.emptyMap(), Collections.emptyMap(), f, totalNodes);
    }

    /** Begin a round for {@code block}: own prepare vote seeded, commit votes cleared. */
    public ConsensusState start(Block block) {
        Objects.requireNonNull(block, "block");
        Map<String, Set<Integer>> prepares = addVote(Collections.emptyMap(), block.hash(), nodeId);
        return new ConsensusState(nodeId, view, block, Phase.PREPREPARED,
                prepares, Collections.emptyMap(), f, totalNodes);
    }

    public ConsensusState recordPrepareVote(Block block, int voterId) {
        Objects.requireNonNull(block, "block");
        Map<String, Set<Integer>> prepares = addVote(prepareVotes, block.hash(), voterId);
        Phase next = ConsensusRules.quorumReached(prepares, totalNodes, f)
                ? phase.advanceTo(Phase.PREPARED)
                : phase;
        return new ConsensusState(nodeId, view, currentBlock, next, prepares, commitVotes, f, totalNodes);
    }

    public ConsensusState recordCommitVote(Block block, int voterId) {
        Objects.requireNonNull(block, "block");
        Map<String, Set<Integer>> commits = addVote(commitVotes, block.hash(), voterId);
        Phase next = ConsensusRules.quorumReached(commits, totalNodes, f)
                ? phase.advanceTo(Phase.COMMITTED)
                : phase;
        return new ConsensusState(nodeId, view, currentBlock, next, prepareVotes, commits, f, totalNodes);
    }

    public ConsensusState withView(long newView) {
        if (newView < 0) throw new IllegalArgumentException("view must be >= 0");
        return new ConsensusState(nodeId, newView, currentBlock, phase, prepareVotes, commitVotes, f, totalNodes);
    }

    public int leader() {
        return ConsensusRules.rotateLeader(view, totalNodes);
    }

    public boolean hasPrepareQuorum(String blockHash) {
        return ConsensusRules.hasQuorum(prepareVotes.get(blockHash), totalNodes, f);
    }

    public boolean hasCommitQuorum(String blockHash) {
        return ConsensusRules.hasQuorum(commitVotes.get(blockHash), totalNodes, f);
    }

    public Set<Integer> prepareVoters(String blockHash) {
        return prepareVotes.getOrDefault(blockHash, Collections.emptySet());
    }

    public Set<Integer> commitVoters(String blockHash) {
        return commitVotes.getOrDefault(blockHash, Collections.emptySet());
    }

    public int nodeId() { return nodeId; }
    public long view() { return view; }
    public Optional<Block> currentBlock() { return Optional.ofNullable(currentBlock); }
    public Phase phase() { return phase; }
    public Map<String, Set<Integer>> prepareVotes() { return prepareVotes; }
    public Map<String, Set<Integer>> commitVotes() { return commitVotes; }
    public int f() { return f; }
    public int totalNodes() { return totalNodes; }
    public int quorumThreshold() { return ConsensusRules.quorumThreshold(totalNodes, f); }

    private static Map<String, Set<Integer>> addVote(Map<String, Set<Integer>> votes, String hash, int voterId) {
        Set<Integer> existing = votes.get(hash);
        if (existing != null && existing.contains(voterId)) {
            return votes;
        }
        Map<String, Set<Integer>> copy = new LinkedHashMap<>(votes);
        Set<Integer> voters = existing == null ? new TreeSet<>() : new TreeSet<>(existing);
        voters.add(voterId);
        copy.put(hash, Collections.unmodifiableSet(voters));
        return Collections.unmodifiableMap(copy);
    }

    @Override public String toString() {
        return "ConsensusState{node=" + nodeId + ", view=" + view + ", phase=" + phase
                + ", prepares=" + prepareVotes.size() + " hash(es), commits=" + commitVotes.size() + " hash(es)}";
    }
}
