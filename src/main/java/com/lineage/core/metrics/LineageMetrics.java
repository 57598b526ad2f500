package com.lineage.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for event propagation, real-time fan-out and migrations.
 */
@Service
public class LineageMetrics {

    private final MeterRegistry registry;

    public LineageMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one synthesized event relayed from a child agent to a parent.
     *
     * @param eventName the synthesized event name, e.g. "agent:success"
     */
    public void recordPropagationHop(String eventName) {
        Counter.builder("lineage.propagation.hops")
                .description("Synthesized events relayed to parent agents")
                .tag("event", eventName)
                .register(registry)
                .increment();
    }

    public void recordTimelineEventPublished(boolean persisted) {
        Counter.builder("lineage.timeline.published")
                .tag("result", persisted ? "persisted" : "agent_missing")
                .register(registry)
                .increment();
    }

    public void recordBroadcast(String messageType, int recipients) {
        DistributionSummary.builder("lineage.broadcast.recipients")
                .description("Open connections reached per broadcast")
                .tag("type", messageType)
                .register(registry)
                .record(recipients);
    }

    public void recordDroppedConnection() {
        Counter.builder("lineage.broadcast.dropped_connections")
                .description("Connections removed after a failed send")
                .register(registry)
                .increment();
    }

    public void recordMigrationResult(String migrationType, boolean success) {
        Counter.builder("lineage.migrations.total")
                .tag("type", migrationType)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
