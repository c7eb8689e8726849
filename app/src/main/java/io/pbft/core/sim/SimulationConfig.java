package io.pbft.core.sim;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pbft.core.consensus.ConfigurationException;
import io.pbft.core.consensus.ConsensusRules;
import io.pbft.core.node.FaultMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Shape of one simulated round. Missing JSON fields fall back to {@link #defaultLocal()} values;
 * a missing byzantine id list means "the first f nodes".
 */
public final class SimulationConfig {
    private static final Logger LOG = Logger.getLogger(SimulationConfig.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    public static final int DEFAULT_NODES = 7;
    public static final int DEFAULT_FAULTY = 2;
    public static final String DEFAULT_BLOCK_DATA = "Block 1";
    public static final int DEFAULT_MAX_DELIVERIES = 1_000_000;

    public final int totalNodes;
    public final int faultTolerance;
    public final List<Integer> byzantineIds;
    public final List<Integer> disconnectedIds;
    public final String blockData;
    public final long view;
    public final FaultMode faultMode;
    public final Long seed;
    public final boolean shuffleDelivery;
    public final int maxDeliveries;

    @JsonCreator
    public SimulationConfig(@JsonProperty("totalNodes") Integer totalNodes,
                            @JsonProperty("faultTolerance") Integer faultTolerance,
                            @JsonProperty("byzantineIds") List<Integer> byzantineIds,
                            @JsonProperty("disconnectedIds") List<Integer> disconnectedIds,
                            @JsonProperty("blockData") String blockData,
                            @JsonProperty("view") Long view,
                            @JsonProperty("faultMode") FaultMode faultMode,
                            @JsonProperty("seed") Long seed,
                            @JsonProperty("shuffleDelivery") Boolean shuffleDelivery,
                            @JsonProperty("maxDeliveries") Integer maxDeliveries) {
        this.totalNodes = totalNodes != null ? totalNodes : DEFAULT_NODES;
        this.faultTolerance = faultTolerance != null ? faultTolerance : DEFAULT_FAULTY;
        this.byzantineIds = byzantineIds != null ? List.copyOf(byzantineIds) : firstIds(this.faultTolerance);
        this.disconnectedIds = disconnectedIds != null ? List.copyOf(disconnectedIds) : List.of();
        this.blockData = blockData != null ? blockData : DEFAULT_BLOCK_DATA;
        this.view = view != null ? view : 0L;
        this.faultMode = faultMode != null ? faultMode : FaultMode.FORK_SILENTLY;
        this.seed = seed;
        this.shuffleDelivery = shuffleDelivery != null && shuffleDelivery;
        this.maxDeliveries = maxDeliveries != null ? maxDeliveries : DEFAULT_MAX_DELIVERIES;
    }

    public static SimulationConfig defaultLocal() {
        return builder().build();
    }

    /** @throws ConfigurationException if the file cannot be read or does not describe a config */
    public static SimulationConfig load(Path path) {
        try {
            return JSON.readValue(Files.readAllBytes(path), SimulationConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read simulation config from " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Check the cluster shape before any node is built.
     * @throws ConfigurationException on {@code n <= 3f} or out-of-range ids
     */
    public SimulationConfig validate() {
        ConsensusRules.requireFaultTolerance(totalNodes, faultTolerance);
        requireIds("byzantine", byzantineIds);
        requireIds("disconnected", disconnectedIds);
        if (faultMode == FaultMode.HONEST && !byzantineIds.isEmpty()) {
            throw new ConfigurationException("faultMode HONEST cannot be used for byzantine nodes " + byzantineIds);
        }
        if (view < 0) {
            throw new ConfigurationException("view must be >= 0, got " + view);
        }
        if (maxDeliveries <= 0) {
            throw new ConfigurationException("maxDeliveries must be > 0, got " + maxDeliveries);
        }
        if (blockData.isEmpty()) {
            throw new ConfigurationException("blockData must not be empty");
        }
        if (byzantineIds.size() > faultTolerance) {
            LOG.warning(() -> byzantineIds.size() + " byzantine nodes exceed the tolerated f=" + faultTolerance);
        }
        return this;
    }

    public boolean isByzantine(int nodeId) {
        return byzantineIds.contains(nodeId);
    }

    public boolean isDisconnected(int nodeId) {
        return disconnectedIds.contains(nodeId);
    }

    public Builder toBuilder() {
        return new Builder()
                .totalNodes(totalNodes)
                .faultTolerance(faultTolerance)
                .byzantineIds(byzantineIds)
                .disconnectedIds(disconnectedIds)
                .blockData(blockData)
                .view(view)
                .faultMode(faultMode)
                .seed(seed)
                .shuffleDelivery(shuffleDelivery)
                .maxDeliveries(maxDeliveries);
    }

    public static Builder builder() {
        return new Builder();
    }

    private void requireIds(String what, List<Integer> ids) {
        Set<Integer> seen = new HashSet<>();
        for (Integer id : ids) {
            if (id == null || id < 1 || id > totalNodes) {
                throw new ConfigurationException(what + " node id " + id + " outside [1, " + totalNodes + "]");
            }
            if (!seen.add(id)) {
                throw new ConfigurationException("duplicate " + what + " node id " + id);
            }
        }
    }

    private static List<Integer> firstIds(int count) {
        List<Integer> ids = new ArrayList<>();
        for (int id = 1; id <= count; id++) {
            ids.add(id);
        }
        return List.copyOf(ids);
    }

    @Override public String toString() {
        return "SimulationConfig{n=" + totalNodes + ", f=" + faultTolerance + ", byzantine=" + byzantineIds
                + ", disconnected=" + disconnectedIds + ", mode=" + faultMode + ", view=" + view
                + ", shuffle=" + shuffleDelivery + (seed != null ? ", seed=" + seed : "") + "}";
    }

    public static final class Builder {
        private Integer totalNodes;
        private Integer faultTolerance;
        private List<Integer> byzantineIds;
        private List<Integer> disconnectedIds;
        private String blockData;
        private Long view;
        private FaultMode faultMode;
        private Long seed;
        private Boolean shuffleDelivery;
        private Integer maxDeliveries;

        public Builder totalNodes(int v) { this.totalNodes = v; return this; }
        public Builder faultTolerance(int v) { this.faultTolerance = v; return this; }
        /** Pass null to fall back to the first f ids. */
        public Builder byzantineIds(List<Integer> v) { this.byzantineIds = v; return this; }
        public Builder disconnectedIds(List<Integer> v) { this.disconnectedIds = v; return this; }
        public Builder blockData(String v) { this.blockData = v; return this; }
        public Builder view(long v) { this.view = v; return this; }
        public Builder faultMode(FaultMode v) { this.faultMode = v; return this; }
        public Builder seed(Long v) { this.seed = v; return this; }
        public Builder shuffleDelivery(boolean v) { this.shuffleDelivery = v; return this; }
        public Builder maxDeliveries(int v) { this.maxDeliveries = v; return this; }

        public SimulationConfig build() {
            return new SimulationConfig(totalNodes, faultTolerance, byzantineIds, disconnectedIds, blockData,
                    view, faultMode, seed, shuffleDelivery, maxDeliveries);
        }
    }
}
