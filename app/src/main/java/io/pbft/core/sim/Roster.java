package io.pbft.core.sim;

import io.pbft.core.node.FaultMode;
import io.pbft.core.node.Node;
import io.pbft.core.node.NodeConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Builds the nodes described by a validated {@link SimulationConfig}. */
final class Roster {
    private Roster() {}

    static List<Node> build(SimulationConfig config) {
        List<Node> nodes = new ArrayList<>(config.totalNodes);
        for (int id = 1; id <= config.totalNodes; id++) {
            FaultMode mode = config.isByzantine(id) ? config.faultMode : FaultMode.HONEST;
            NodeConfig nodeConfig = new NodeConfig(id, config.totalNodes, config.faultTolerance, mode, config.view);
            Random random = config.seed != null ? new Random(config.seed * 31 + id) : new Random();
            nodes.add(Node.create(nodeConfig, mode.newBehavior(random)));
        }
        return nodes;
    }

    /** Links are registered only between nodes that are both reachable. */
    static boolean linked(SimulationConfig config, int from, int to) {
        return from != to && !config.isDisconnected(from) && !config.isDisconnected(to);
    }
}
