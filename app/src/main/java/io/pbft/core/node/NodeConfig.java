package io.pbft.core.node;

import io.pbft.core.consensus.ConfigurationException;
import io.pbft.core.consensus.ConsensusRules;

import java.util.Objects;

/** Identity and cluster shape for a single node. */
public final class NodeConfig {
    public final int nodeId;
    public final int totalNodes;
    public final int faultTolerance;
    public final FaultMode faultMode;
    public final long view;

    public NodeConfig(int nodeId, int totalNodes, int faultTolerance, FaultMode faultMode) {
        this(nodeId, totalNodes, faultTolerance, faultMode, 0L);
    }

    public NodeConfig(int nodeId, int totalNodes, int faultTolerance, FaultMode faultMode, long view) {
        ConsensusRules.requireFaultTolerance(totalNodes, faultTolerance);
        if (nodeId < 1 || nodeId > totalNodes) {
            throw new ConfigurationException("node id " + nodeId + " outside [1, " + totalNodes + "]");
        }
        this.nodeId = nodeId;
        this.totalNodes = totalNodes;
        this.faultTolerance = faultTolerance;
        this.faultMode = Objects.requireNonNull(faultMode, "faultMode");
        if (view < 0) {
            throw new ConfigurationException("view must be >= 0, got " + view);
        }
        this.view = view;
    }

    public static NodeConfig honest(int nodeId, int totalNodes, int faultTolerance) {
        return new NodeConfig(nodeId, totalNodes, faultTolerance, FaultMode.HONEST);
    }

    public static NodeConfig byzantine(int nodeId, int totalNodes, int faultTolerance) {
        return new NodeConfig(nodeId, totalNodes, faultTolerance, FaultMode.FORK_SILENTLY);
    }

    @Override public String toString() {
        return "NodeConfig{id=" + nodeId + ", n=" + totalNodes + ", f=" + faultTolerance + ", mode=" + faultMode + ", view=" + view + "}";
    }
}
