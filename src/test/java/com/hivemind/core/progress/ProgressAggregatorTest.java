package com.hivemind.core.progress;

import com.hivemind.core.HivemindFixture;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.model.CompletionSignal;
import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.NodeStatus;
import com.hivemind.core.model.ProgressUpdate;
import com.hivemind.core.plan.NodeDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProgressAggregator} over the launch plan:
 * Vision launch / Epic platform / Roadmap backend / Phases p1 (t1, t2) and p2 (t3, t4, after p1).
 */
class ProgressAggregatorTest {

    private static final NodeRef P1 = NodeRef.of(NodeLevel.PHASE, "p1");
    private static final NodeRef P2 = NodeRef.of(NodeLevel.PHASE, "p2");
    private static final NodeRef BACKEND = NodeRef.of(NodeLevel.ROADMAP, "backend");
    private static final NodeRef PLATFORM = NodeRef.of(NodeLevel.EPIC, "platform");
    private static final NodeRef LAUNCH = NodeRef.of(NodeLevel.VISION, "launch");

    private HivemindFixture fixture;
    private ProgressAggregator aggregator;

    @BeforeEach
    void setUp() {
        fixture = new HivemindFixture();
        fixture.loadLaunchPlan();
        aggregator = fixture.aggregator;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private AggregationResult complete(String taskId) {
        return aggregator.apply("agent-" + taskId, CompletionSignal.completed(taskId, List.of(), "done " + taskId));
    }

    private int percentage(NodeRef ref) {
        return fixture.store.read(state -> state.requireNode(ref).getCompletionPercentage());
    }

    private NodeStatus status(NodeRef ref) {
        return fixture.store.read(state -> state.requireNode(ref).getStatus());
    }

    private List<Integer> milestonesFor(NodeRef ref) {
        return fixture.synced.stream()
                .filter(u -> u.hasMilestone() && u.node().equals(ref))
                .map(ProgressUpdate::milestone)
                .toList();
    }

    // -- Roll-up --

    @Test
    @DisplayName("completing every task rolls the whole tree up to 100%")
    void endToEnd() {
        complete("t1");
        assertEquals(50, percentage(P1));
        assertEquals(NodeStatus.IN_PROGRESS, status(P1));
        assertEquals(0, percentage(BACKEND));

        AggregationResult second = complete("t2");
        assertEquals(NodeStatus.COMPLETED, status(P1));
        assertEquals(List.of(P2), second.advancedNodes());
        assertEquals(NodeStatus.IN_PROGRESS, status(P2));
        assertEquals(50, percentage(BACKEND));

        complete("t3");
        AggregationResult last = complete("t4");

        for (NodeRef ref : List.of(P1, P2, BACKEND, PLATFORM, LAUNCH)) {
            assertEquals(100, percentage(ref), ref.toString());
            assertEquals(NodeStatus.COMPLETED, status(ref), ref.toString());
        }
        assertTrue(last.completedNodes().containsAll(List.of(P2, BACKEND, PLATFORM, LAUNCH)));
        assertEquals(List.of(25, 50, 75, 100), milestonesFor(BACKEND));
        assertEquals(1, fixture.events(HivemindEvent.NODE_ADVANCED).size());
        assertEquals("launch", last.visionId());
    }

    @Test
    @DisplayName("a Phase stays pending until its dependencies complete")
    void gatedPhase() {
        complete("t3");
        assertEquals(50, percentage(P2));
        assertEquals(NodeStatus.PENDING, status(P2));

        complete("t4");
        assertEquals(NodeStatus.PENDING, status(P2));
        assertEquals(0, percentage(BACKEND));

        complete("t1");
        AggregationResult unlock = complete("t2");
        assertEquals(NodeStatus.COMPLETED, status(P2));
        assertTrue(unlock.completedNodes().containsAll(List.of(P1, P2, BACKEND)));
        assertEquals(NodeStatus.COMPLETED, status(LAUNCH));
    }

    @ParameterizedTest(name = "order {0}")
    @ValueSource(strings = {"t1,t2,t3,t4", "t4,t3,t2,t1", "t3,t1,t4,t2", "t2,t4,t1,t3"})
    @DisplayName("the final tree and its milestones do not depend on completion order")
    void orderIndependent(String order) {
        NodeProgress reference;
        try (HivemindFixture baseline = new HivemindFixture()) {
            baseline.loadLaunchPlan();
            for (String task : List.of("t1", "t2", "t3", "t4")) {
                baseline.aggregator.apply("agent-" + task, CompletionSignal.completed(task, List.of(), "done " + task));
            }
            reference = baseline.aggregator.snapshot(LAUNCH).orElseThrow();
        }

        Arrays.stream(order.split(",")).forEach(this::complete);

        assertEquals(reference, aggregator.snapshot(LAUNCH).orElseThrow());
        for (NodeRef ref : List.of(P1, P2, BACKEND, PLATFORM, LAUNCH)) {
            assertEquals(List.of(25, 50, 75, 100), milestonesFor(ref).stream().sorted().toList(), ref.toString());
        }
    }

    @Test
    @DisplayName("a Vision averages the percentages of its Epics")
    void visionAverages() {
        NodeDefinition plan = new NodeDefinition("v", NodeLevel.VISION, "Vision", null, List.of(
                new NodeDefinition("e1", NodeLevel.EPIC, "One", null, List.of(
                        task("x1"), task("x2"), task("x3"), task("x4")), null),
                new NodeDefinition("e2", NodeLevel.EPIC, "Two", null, List.of(task("y1")), null)
        ), null);
        try (HivemindFixture local = new HivemindFixture()) {
            local.loader.load(plan);
            local.aggregator.apply("a", CompletionSignal.completed("x1", List.of(), ""));
            local.aggregator.apply("b", CompletionSignal.completed("y1", List.of(), ""));

            int vision = local.store.read(s -> s.requireNode(NodeRef.of(NodeLevel.VISION, "v")).getCompletionPercentage());
            // (25 + 100) / 2
            assertEquals(63, vision);
        }
    }

    @Test
    @DisplayName("a Roadmap stays pending until the Roadmaps it depends on complete")
    void gatedRoadmap() {
        NodeRef r1 = NodeRef.of(NodeLevel.ROADMAP, "r1");
        NodeRef r2 = NodeRef.of(NodeLevel.ROADMAP, "r2");
        NodeDefinition plan = new NodeDefinition("e", NodeLevel.EPIC, "Epic", null, List.of(
                new NodeDefinition("r1", NodeLevel.ROADMAP, "First", null, List.of(task("a1"), task("a2")), null),
                new NodeDefinition("r2", NodeLevel.ROADMAP, "Second", List.of("r1"), List.of(task("b1")), null)
        ), null);
        try (HivemindFixture local = new HivemindFixture()) {
            local.loader.load(plan);
            local.aggregator.apply("w1", CompletionSignal.completed("b1", List.of(), ""));
            assertEquals(NodeStatus.PENDING, local.node(NodeLevel.ROADMAP, "r2").getStatus());
            assertEquals(100, local.node(NodeLevel.ROADMAP, "r2").getCompletionPercentage());

            local.aggregator.apply("w2", CompletionSignal.completed("a1", List.of(), ""));
            AggregationResult last = local.aggregator.apply("w3", CompletionSignal.completed("a2", List.of(), ""));

            assertEquals(List.of(r2), last.advancedNodes());
            assertTrue(last.completedNodes().containsAll(List.of(r1, r2, NodeRef.of(NodeLevel.EPIC, "e"))));
            assertEquals(NodeStatus.COMPLETED, local.node(NodeLevel.ROADMAP, "r2").getStatus());
            assertEquals(NodeStatus.COMPLETED, local.node(NodeLevel.EPIC, "e").getStatus());
            assertEquals(1, local.events(HivemindEvent.NODE_ADVANCED).size());
        }
    }

    private static NodeDefinition task(String id) {
        return new NodeDefinition(id, NodeLevel.TASK, id, null, null, null);
    }

    // -- Idempotence --

    @Test
    @DisplayName("replaying a completion changes nothing and fires no milestone twice")
    void replay() {
        AggregationResult first = complete("t1");
        int synced = fixture.synced.size();
        AggregationResult again = complete("t1");

        assertTrue(first.applied());
        assertFalse(again.applied());
        assertEquals(synced, fixture.synced.size());
        assertEquals(List.of(25, 50), milestonesFor(P1));
    }

    @Test
    @DisplayName("concurrent sibling completions complete the Phase exactly once")
    void concurrentSiblings() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AggregationResult>> futures = new ArrayList<>();
        for (String task : List.of("t1", "t2")) {
            futures.add(pool.submit(() -> {
                start.await();
                return complete(task);
            }));
        }
        start.countDown();
        Set<NodeRef> completed = new HashSet<>();
        int p1Completions = 0;
        for (Future<AggregationResult> future : futures) {
            for (NodeRef ref : future.get(10, TimeUnit.SECONDS).completedNodes()) {
                if (ref.equals(P1)) {
                    p1Completions++;
                }
                completed.add(ref);
            }
        }
        pool.shutdown();

        assertEquals(1, p1Completions);
        assertEquals(NodeStatus.COMPLETED, status(P1));
        assertEquals(List.of(100), milestonesFor(P1).stream().filter(m -> m == 100).toList());
        assertTrue(completed.contains(P1));
    }

    // -- Other signals --

    @Test
    @DisplayName("a partial result is recorded without moving progress")
    void partialResult() {
        AggregationResult result = aggregator.apply("a1", CompletionSignal.partialResult("t1", "half the tables"));

        assertTrue(result.applied());
        assertTrue(result.updates().isEmpty());
        assertEquals(List.of("half the tables"), fixture.task("t1").getPartialResults());
        assertEquals(0, percentage(P1));
    }

    @Test
    @DisplayName("failure signals are not accepted")
    void rejectsFailure() {
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.apply("a1", CompletionSignal.failed("t1", "boom")));
    }

    @Test
    @DisplayName("unknown tasks are ignored")
    void unknownTask() {
        assertFalse(complete("nope").applied());
        assertTrue(fixture.synced.isEmpty());
    }

    @Test
    @DisplayName("snapshot mirrors the tree")
    void snapshot() {
        complete("t1");
        NodeProgress phase = aggregator.snapshot(P1).orElseThrow();

        assertEquals(50, phase.percentage());
        assertEquals(2, phase.children().size());
        assertEquals(NodeStatus.COMPLETED, phase.children().get(0).status());
        assertTrue(aggregator.snapshot(NodeRef.of(NodeLevel.PHASE, "missing")).isEmpty());
    }

    @Test
    @DisplayName("recompute unlocks a Phase after its dependency was removed")
    void recomputeAfterEdit() {
        complete("t3");
        assertEquals(NodeStatus.PENDING, status(P2));

        fixture.loader.editNode(P2, null, List.of());

        assertEquals(NodeStatus.IN_PROGRESS, status(P2));
        assertEquals(50, percentage(P2));
    }
}
