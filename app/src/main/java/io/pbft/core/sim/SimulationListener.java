package io.pbft.core.sim;

import io.pbft.core.consensus.Phase;
import io.pbft.core.node.Node;
import io.pbft.core.protocol.Block;

import java.util.List;

/**
 * Observer for narration and reporting. The concurrent runtime invokes it from node threads,
 * so implementations used there must be thread-safe.
 */
public interface SimulationListener {
    SimulationListener NONE = new SimulationListener() {};

    default void onRoster(List<Node> nodes) {}

    default void onProposal(Block proposal, int leaderId, long view) {}

    default void onPhaseChange(int nodeId, Phase from, Phase to) {}

    default void onCommitted(int nodeId, Block block, int height) {}

    default void onDropped(int nodeId, int count) {}

    default void onFinished(SimulationReport report) {}
}
