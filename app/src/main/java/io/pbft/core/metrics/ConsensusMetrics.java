package io.pbft.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pbft.core.protocol.MessageType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/** Counters and timers for one simulated round (or several, if the registry is shared). */
public class ConsensusMetrics {
    private final MeterRegistry registry;
    private final Map<MessageType, Counter> delivered = new EnumMap<>(MessageType.class);
    private final Counter dropped;
    private final Counter committed;
    private final Timer roundTime;

    public ConsensusMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ConsensusMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        for (MessageType type : MessageType.values()) {
            delivered.put(type, Counter.builder("pbft.messages.delivered")
                    .tag("type", type.name())
                    .register(registry));
        }
        this.dropped = registry.counter("pbft.messages.dropped");
        this.committed = registry.counter("pbft.blocks.committed");
        this.roundTime = registry.timer("pbft.round.time");
    }

    public void recordDelivered(MessageType type) {
        delivered.get(type).increment();
    }

    public void recordDropped(int count) {
        if (count > 0) {
            dropped.increment(count);
        }
    }

    public void recordCommitted() {
        committed.increment();
    }

    public <T> T recordRound(Supplier<T> round) {
        return roundTime.record(round);
    }

    public long deliveredCount(MessageType type) {
        return (long) delivered.get(type).count();
    }

    public long deliveredCount() {
        long total = 0;
        for (Counter c : delivered.values()) total += (long) c.count();
        return total;
    }

    public long droppedCount() {
        return (long) dropped.count();
    }

    public long committedCount() {
        return (long) committed.count();
    }

    public String scrape() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                String type = m.getId().getTag("type");
                sb.append("{");
                if (type != null) {
                    sb.append("type=").append(type).append(",");
                }
                sb.append("stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
