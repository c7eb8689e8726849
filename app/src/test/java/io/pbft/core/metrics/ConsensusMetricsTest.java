package io.pbft.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pbft.core.protocol.MessageType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusMetricsTest {

    @Test
    void countsDeliveriesPerType() {
        ConsensusMetrics metrics = new ConsensusMetrics();
        metrics.recordDelivered(MessageType.PREPARE);
        metrics.recordDelivered(MessageType.PREPARE);
        metrics.recordDelivered(MessageType.COMMIT);

        assertEquals(2, metrics.deliveredCount(MessageType.PREPARE));
        assertEquals(1, metrics.deliveredCount(MessageType.COMMIT));
        assertEquals(0, metrics.deliveredCount(MessageType.PRE_PREPARE));
        assertEquals(3, metrics.deliveredCount());
    }

    @Test
    void dropsAndCommitsAccumulate() {
        ConsensusMetrics metrics = new ConsensusMetrics();
        metrics.recordDropped(3);
        metrics.recordDropped(0);
        metrics.recordCommitted();

        assertEquals(3, metrics.droppedCount());
        assertEquals(1, metrics.committedCount());
    }

    @Test
    void roundTimerWrapsTheResult() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ConsensusMetrics metrics = new ConsensusMetrics(registry);

        assertEquals("done", metrics.recordRound(() -> "done"));
        assertEquals(1, registry.get("pbft.round.time").timer().count());
    }

    @Test
    void scrapeListsEveryMeter() {
        ConsensusMetrics metrics = new ConsensusMetrics();
        metrics.recordDelivered(MessageType.COMMIT);
        String text = metrics.scrape();

        assertTrue(text.contains("pbft.messages.delivered{type=COMMIT,stat=COUNT} 1.0"));
        assertTrue(text.contains("pbft.messages.dropped{stat=COUNT} 0.0"));
        assertTrue(text.contains("pbft.blocks.committed"));
        assertTrue(text.contains("pbft.round.time"));
    }
}
