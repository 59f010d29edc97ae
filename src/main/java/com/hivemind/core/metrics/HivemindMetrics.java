package com.hivemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for agent orchestration.
 */
@Service
public class HivemindMetrics {

    private final MeterRegistry registry;

    public HivemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawnDecision(String spawnerLevel, String requestedLevel, boolean allowed) {
        Counter.builder("hivemind.spawn.decisions")
                .tag("spawner", spawnerLevel)
                .tag("requested", requestedLevel)
                .tag("result", allowed ? "allowed" : "denied")
                .register(registry)
                .increment();
    }

    public void recordSignal(String kind) {
        Counter.builder("hivemind.signals.total")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordParseMiss() {
        Counter.builder("hivemind.signals.misses")
                .description("Agent outputs without a recognizable signal")
                .register(registry)
                .increment();
    }

    public void recordRecovery(String errorKind, String action) {
        Counter.builder("hivemind.recovery.decisions")
                .tag("error", errorKind)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordMilestone(String level, int threshold) {
        Counter.builder("hivemind.milestones.reported")
                .tag("level", level)
                .tag("threshold", String.valueOf(threshold))
                .register(registry)
                .increment();
    }

    public void recordCollision() {
        Counter.builder("hivemind.collisions.total")
                .description("Writes to a resource another agent wrote inside the window")
                .register(registry)
                .increment();
    }

    /**
     * Records an alignment score; drift observations are also counted separately.
     */
    public void recordAlignment(double score, boolean drift) {
        DistributionSummary.builder("hivemind.alignment.score")
                .register(registry)
                .record(score);
        if (drift) {
            Counter.builder("hivemind.alignment.drift")
                    .register(registry)
                    .increment();
        }
    }

    public void recordSyncFailure() {
        Counter.builder("hivemind.sync.failures")
                .description("External sync notifications that threw")
                .register(registry)
                .increment();
    }
}
