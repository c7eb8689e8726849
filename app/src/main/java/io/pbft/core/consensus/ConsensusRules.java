package io.pbft.core.consensus;

import java.util.Map;
import java.util.Set;

public final class ConsensusRules {
    private ConsensusRules() {}

    /**
     * Reject cluster shapes that cannot tolerate {@code f} byzantine nodes.
     * @throws ConfigurationException unless {@code totalNodes > 3f} and {@code f >= 0}
     */
    public static void requireFaultTolerance(int totalNodes, int f) {
        if (f < 0) {
            throw new ConfigurationException("f must be >= 0, got " + f);
        }
        if (totalNodes <= 3 * f) {
            String hint = totalNodes >= 1
                    ? "; " + totalNodes + " nodes tolerate at most f=" + maxFaultTolerance(totalNodes)
                    : "";
            throw new ConfigurationException(
                    "n must be greater than 3f (n=" + totalNodes + ", f=" + f + ")" + hint);
        }
    }

    /** Unique voters needed on a single block hash: n - f - 1. */
    public static int quorumThreshold(int totalNodes, int f) {
        return totalNodes - f - 1;
    }

    public static boolean hasQuorum(Set<Integer> voters, int totalNodes, int f) {
        return voters != null && voters.size() >= quorumThreshold(totalNodes, f);
    }

    /**
     * True iff some single block hash has collected at least {@link #quorumThreshold} unique voters.
     * Votes for different hashes are never combined.
     */
    public static boolean quorumReached(Map<String, Set<Integer>> votes, int totalNodes, int f) {
        if (votes == null) return false;
        for (Set<Integer> voters : votes.values()) {
            if (hasQuorum(voters, totalNodes, f)) {
                return true;
            }
        }
        return false;
    }

    /** Leader for a view: (view mod n) + 1, always in [1, n]. */
    public static int rotateLeader(long view, int totalNodes) {
        if (totalNodes <= 0) {
            throw new IllegalArgumentException("totalNodes must be > 0");
        }
        return (int) Math.floorMod(view, (long) totalNodes) + 1;
    }

    /** Largest f that n nodes can tolerate. */
    public static int maxFaultTolerance(int totalNodes) {
        if (totalNodes < 1) {
            throw new IllegalArgumentException("Node number is less than 1: " + totalNodes);
        }
        return (totalNodes - 1) / 3;
    }
}
