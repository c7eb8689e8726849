package io.pbft.core.sim;

import io.pbft.core.consensus.ConfigurationException;
import io.pbft.core.consensus.Phase;
import io.pbft.core.metrics.ConsensusMetrics;
import io.pbft.core.node.FaultMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActorNetworkTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    @ParameterizedTest
    @EnumSource(ActorNetwork.Transport.class)
    void honestClusterCommitsOverEveryTransport(ActorNetwork.Transport transport) {
        SimulationConfig config = SimulationConfig.builder()
                .totalNodes(4)
                .faultTolerance(1)
                .byzantineIds(List.of())
                .faultMode(FaultMode.HONEST)
                .build();
        try (ActorNetwork network = ActorNetwork.create(config, transport)) {
            SimulationReport report = network.run(TIMEOUT);

            for (NodeOutcome node : report.nodes()) {
                assertEquals(2, node.ledgerHeight(), transport + " node " + node.id());
            }
            assertTrue(report.honestAgreement());
            assertEquals(28, report.deliveredMessages());
            assertEquals(4, report.committedBlocks());
        }
    }

    @ParameterizedTest
    @EnumSource(ActorNetwork.Transport.class)
    void forkingNodesAreOutvoted(ActorNetwork.Transport transport) {
        SimulationConfig config = SimulationConfig.builder()
                .totalNodes(7)
                .faultTolerance(2)
                .view(4)
                .build();
        ConsensusMetrics metrics = new ConsensusMetrics();
        try (ActorNetwork network = ActorNetwork.create(config, transport, metrics, SimulationListener.NONE)) {
            SimulationReport report = network.run(TIMEOUT);

            assertEquals(5, report.leaderId());
            assertEquals(0, report.foreignBlocksInHonestLedgers());
            assertTrue(report.proposalCommittedByAllHonest());
            assertEquals(67, metrics.deliveredCount());
            assertEquals(5, metrics.committedCount());
        }
    }

    @Test
    void disconnectedNodeIsLeftBehind() {
        SimulationConfig config = SimulationConfig.builder()
                .totalNodes(4)
                .faultTolerance(1)
                .byzantineIds(List.of())
                .faultMode(FaultMode.HONEST)
                .disconnectedIds(List.of(4))
                .build();
        try (ActorNetwork network = ActorNetwork.create(config, ActorNetwork.Transport.IN_MEMORY)) {
            SimulationReport report = network.run(TIMEOUT);

            assertEquals(Phase.PREPREPARED, report.node(4).orElseThrow().phase());
            assertEquals(9, report.droppedMessages());
            assertFalse(report.honestAgreement());
        }
    }

    @Test
    void invalidConfigIsRejectedUpFront() {
        SimulationConfig config = SimulationConfig.builder().totalNodes(3).faultTolerance(1).build();
        assertThrows(ConfigurationException.class,
                () -> ActorNetwork.create(config, ActorNetwork.Transport.IN_MEMORY));
    }

    @Test
    void aNetworkRunsOnce() {
        try (ActorNetwork network = ActorNetwork.create(SimulationConfig.defaultLocal(), ActorNetwork.Transport.IN_MEMORY)) {
            network.run(TIMEOUT);
            assertThrows(IllegalStateException.class, () -> network.run(TIMEOUT));
        }
    }
}
