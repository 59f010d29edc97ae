package com.hivemind.core.alignment;

import com.hivemind.core.HivemindFixture;
import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.model.Adjustment;
import com.hivemind.core.model.AlignmentObservation;
import com.hivemind.core.model.CompletionSignal;
import com.hivemind.core.model.DriftSeverity;
import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.plan.NodeDefinition;
import com.hivemind.core.state.IntegrityException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AlignmentObserver}. The launch plan estimates 30 days, one Epic
 * and two success criteria, and starts at {@link HivemindFixture#START}.
 */
class AlignmentObserverTest {

    private static final double EPSILON = 1e-9;

    private HivemindFixture fixture;
    private AlignmentObserver observer;

    @BeforeEach
    void setUp() {
        fixture = new HivemindFixture();
        fixture.loadLaunchPlan();
        observer = fixture.observer;
    }

    @AfterEach
    void tearDown() {
        observer.stop();
        fixture.close();
    }

    private void completeAll() {
        for (String task : List.of("t1", "t2", "t3", "t4")) {
            fixture.aggregator.apply("agent-" + task, CompletionSignal.completed(task, List.of(), ""));
        }
    }

    @Nested
    @DisplayName("factor math")
    class FactorTests {

        @Test
        void timelinePenalisesElapsedTimeAheadOfProgress() {
            assertEquals(1.0, AlignmentObserver.timeline(0.3, 0.5), EPSILON);
            assertEquals(0.5, AlignmentObserver.timeline(0.75, 0.25), EPSILON);
            assertEquals(0.0, AlignmentObserver.timeline(2.0, 0.0), EPSILON);
        }

        @Test
        void scopeMeasuresDeviationFromPlannedEpics() {
            assertEquals(1.0, AlignmentObserver.scope(4, 4), EPSILON);
            assertEquals(0.75, AlignmentObserver.scope(5, 4), EPSILON);
            assertEquals(0.5, AlignmentObserver.scope(2, 4), EPSILON);
            assertEquals(1.0, AlignmentObserver.scope(3, 0), EPSILON);
        }

        @Test
        void qualityIsNeutralWithoutProgress() {
            assertEquals(1.0, AlignmentObserver.quality(0.0, 0.0), EPSILON);
            assertEquals(0.5, AlignmentObserver.quality(0.25, 0.5), EPSILON);
            assertEquals(1.0, AlignmentObserver.quality(1.0, 0.5), EPSILON);
        }
    }

    // -- Observations --

    @Test
    @DisplayName("a fresh Vision is fully aligned")
    void freshVision() {
        AlignmentObservation observation = observer.observe("launch", "manual");

        assertEquals(1.0, observation.score(), EPSILON);
        assertEquals(DriftSeverity.NONE, observation.severity());
        assertFalse(observation.driftDetected());
        assertTrue(observation.issues().isEmpty());
        assertTrue(observation.adjustments().isEmpty());
        assertEquals(1, fixture.events(HivemindEvent.VISION_OBSERVED).size());
        assertTrue(fixture.events(HivemindEvent.VISION_DRIFT).isEmpty());
    }

    @Test
    @DisplayName("half the time gone without progress is drift with a timeline adjustment")
    void behindSchedule() {
        fixture.clock.advance(Duration.ofDays(15));

        AlignmentObservation observation = observer.observe("launch", "manual");

        assertEquals(0.5, observation.factors().timeline(), EPSILON);
        assertEquals(0.8, observation.score(), EPSILON);
        assertTrue(observation.driftDetected());
        assertEquals(DriftSeverity.MEDIUM, observation.severity());
        assertEquals(List.of("Behind schedule: 50% of estimated time elapsed, 0% complete"), observation.issues());
        assertEquals(List.of("timeline"), observation.adjustments().stream().map(Adjustment::area).toList());
        assertFalse(observation.adjustments().get(0).critical());
        assertEquals(1, fixture.events(HivemindEvent.VISION_DRIFT).size());
    }

    @Test
    @DisplayName("completion without met criteria is a quality lag until the criteria are met")
    void qualityLag() {
        fixture.clock.advance(Duration.ofDays(15));
        completeAll();

        AlignmentObservation lagging = observer.observe("launch", "manual");
        assertEquals(0.0, lagging.factors().quality(), EPSILON);
        assertEquals(0.7, lagging.score(), EPSILON);
        assertEquals(List.of("Quality lag: 0% of success criteria met at 100% completion"), lagging.issues());
        assertEquals(List.of("quality"), lagging.adjustments().stream().map(Adjustment::area).toList());

        assertTrue(observer.markCriterionMet("launch", "api-live"));
        assertFalse(observer.markCriterionMet("launch", "api-live"));
        observer.markCriterionMet("launch", "docs-published");

        AlignmentObservation recovered = observer.observe("launch", "manual");
        assertEquals(1.0, recovered.score(), EPSILON);
        assertFalse(recovered.driftDetected());
    }

    @Test
    @DisplayName("a score under the critical threshold recommends a replan")
    void criticalReplan() {
        NodeDefinition plan = new NodeDefinition("sprawl", NodeLevel.VISION, "Sprawl", null, List.of(
                epic("e1", "x1"), epic("e2", "x2")),
                new NodeDefinition.PlanDefinition(10, 1, List.of("shipped"), null));
        fixture.loader.load(plan);
        fixture.clock.advance(Duration.ofDays(10));

        AlignmentObservation observation = observer.observe("sprawl", null);

        assertEquals("manual", observation.trigger());
        assertEquals(0.3, observation.score(), EPSILON);
        assertEquals(DriftSeverity.CRITICAL, observation.severity());
        assertEquals(List.of("timeline", "scope", "replan"),
                observation.adjustments().stream().map(Adjustment::area).toList());
        assertTrue(observation.adjustments().get(0).critical());
        assertTrue(observation.issues().contains("Scope creep: 2 Epics against 1 planned"));
    }

    private static NodeDefinition epic(String id, String taskId) {
        return new NodeDefinition(id, NodeLevel.EPIC, id, null,
                List.of(new NodeDefinition(taskId, NodeLevel.TASK, taskId, null, null, null)), null);
    }

    @Test
    @DisplayName("history keeps the newest observations up to the cap")
    void historyCap() {
        HivemindProperties properties = new HivemindProperties();
        properties.setObservationHistorySize(3);
        try (HivemindFixture local = new HivemindFixture(properties)) {
            local.loadLaunchPlan();
            IntStream.range(0, 5).forEach(i -> local.observer.observe("launch", "t" + i));

            List<AlignmentObservation> history = local.observer.history("launch");
            assertEquals(List.of("t2", "t3", "t4"), history.stream().map(AlignmentObservation::trigger).toList());
        }
    }

    @Test
    @DisplayName("Epic, Roadmap and Vision progress triggers observations once started")
    void observesProgressEvents() {
        observer.start();
        fixture.aggregator.apply("a1", CompletionSignal.completed("t1", List.of(), ""));
        assertTrue(observer.history("launch").isEmpty());

        completeAll();

        List<String> triggers = observer.history("launch").stream().map(AlignmentObservation::trigger).toList();
        assertTrue(triggers.contains("roadmap_update"));
        assertTrue(triggers.contains("epic_update"));
        assertTrue(triggers.contains("vision_update"));
    }

    @Test
    @DisplayName("unknown Visions and criteria are rejected")
    void rejectsUnknown() {
        assertThrows(IntegrityException.class, () -> observer.observe("nope", "manual"));
        assertThrows(IllegalArgumentException.class, () -> observer.markCriterionMet("launch", "world-peace"));
    }
}
