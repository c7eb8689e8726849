package io.pbft.core.sim;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pbft.core.ledger.Ledger;
import io.pbft.core.metrics.ConsensusMetrics;
import io.pbft.core.node.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Outcome of one round across all nodes. */
public record SimulationReport(int totalNodes,
                               int faultTolerance,
                               int quorumThreshold,
                               int leaderId,
                               String proposalHash,
                               List<NodeOutcome> nodes,
                               long deliveredMessages,
                               long droppedMessages,
                               long committedBlocks) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public SimulationReport {
        nodes = List.copyOf(nodes);
    }

    static SimulationReport from(SimulationConfig config, int leaderId, String proposalHash,
                                 Collection<Node> finalNodes, ConsensusMetrics metrics) {
        List<NodeOutcome> outcomes = new ArrayList<>(finalNodes.size());
        for (Node node : finalNodes) {
            outcomes.add(NodeOutcome.from(node));
        }
        return new SimulationReport(
                config.totalNodes,
                config.faultTolerance,
                config.totalNodes - config.faultTolerance - 1,
                leaderId,
                proposalHash,
                outcomes,
                metrics.deliveredCount(),
                metrics.droppedCount(),
                metrics.committedCount());
    }

    public List<NodeOutcome> honestNodes() {
        List<NodeOutcome> out = new ArrayList<>();
        for (NodeOutcome n : nodes) {
            if (!n.byzantine()) out.add(n);
        }
        return out;
    }

    public Optional<NodeOutcome> node(int id) {
        for (NodeOutcome n : nodes) {
            if (n.id() == id) return Optional.of(n);
        }
        return Optional.empty();
    }

    /** Every honest node holds the same ledger, block for block. */
    @JsonProperty("honestAgreement")
    public boolean honestAgreement() {
        List<NodeOutcome> honest = honestNodes();
        if (honest.isEmpty()) return true;
        List<String> reference = honest.get(0).blockHashes();
        for (NodeOutcome n : honest) {
            if (!n.blockHashes().equals(reference)) return false;
        }
        return true;
    }

    /** Every honest node appended the proposal. */
    @JsonProperty("proposalCommittedByAllHonest")
    public boolean proposalCommittedByAllHonest() {
        for (NodeOutcome n : honestNodes()) {
            if (!n.blockHashes().contains(proposalHash)) return false;
        }
        return true;
    }

    /** Blocks in honest ledgers that are neither genesis nor the proposal. */
    @JsonProperty("foreignBlocksInHonestLedgers")
    public int foreignBlocksInHonestLedgers() {
        String genesis = Ledger.genesisBlock().hash();
        int count = 0;
        for (NodeOutcome n : honestNodes()) {
            for (String hash : n.blockHashes()) {
                if (!hash.equals(genesis) && !hash.equals(proposalHash)) count++;
            }
        }
        return count;
    }

    public String toJson() {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render report", e);
        }
    }
}
