package com.hivemind.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HivemindMetricsTest {

    private SimpleMeterRegistry registry;
    private HivemindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new HivemindMetrics(registry);
    }

    @Test
    @DisplayName("recordSpawnDecision counts by levels and result")
    void recordSpawnDecision() {
        metrics.recordSpawnDecision("L2", "L3", true);
        metrics.recordSpawnDecision("L2", "L2", false);
        metrics.recordSpawnDecision("L2", "L2", false);

        var allowed = registry.find("hivemind.spawn.decisions").tag("result", "allowed").counter();
        var denied = registry.find("hivemind.spawn.decisions")
                .tag("spawner", "L2").tag("requested", "L2").tag("result", "denied").counter();

        assertNotNull(allowed);
        assertNotNull(denied);
        assertEquals(1.0, allowed.count());
        assertEquals(2.0, denied.count());
    }

    @Test
    @DisplayName("recordRecovery counts by error kind and action")
    void recordRecovery() {
        metrics.recordRecovery("TRANSIENT", "RETRY");
        metrics.recordRecovery("FATAL", "ESCALATE");

        var retry = registry.find("hivemind.recovery.decisions").tag("action", "RETRY").counter();
        assertNotNull(retry);
        assertEquals(1.0, retry.count());
    }

    @Test
    @DisplayName("recordMilestone tags level and threshold")
    void recordMilestone() {
        metrics.recordMilestone("PHASE", 50);

        var counter = registry.find("hivemind.milestones.reported")
                .tag("level", "PHASE").tag("threshold", "50").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordAlignment records the score and counts drift")
    void recordAlignment() {
        metrics.recordAlignment(0.92, false);
        metrics.recordAlignment(0.61, true);

        var summary = registry.find("hivemind.alignment.score").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(1.0, registry.find("hivemind.alignment.drift").counter().count());
    }

    @Test
    @DisplayName("simple counters increment")
    void simpleCounters() {
        metrics.recordParseMiss();
        metrics.recordCollision();
        metrics.recordSyncFailure();
        metrics.recordSignal("COMPLETED");

        assertEquals(1.0, registry.find("hivemind.signals.misses").counter().count());
        assertEquals(1.0, registry.find("hivemind.collisions.total").counter().count());
        assertEquals(1.0, registry.find("hivemind.sync.failures").counter().count());
        assertEquals(1.0, registry.find("hivemind.signals.total").tag("kind", "COMPLETED").counter().count());
    }
}
