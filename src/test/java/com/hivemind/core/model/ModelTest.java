package com.hivemind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("AgentLevel")
    class AgentLevelTests {

        @ParameterizedTest(name = "{0} -> {1}: {2}")
        @CsvSource({
                "MAIN, L1, true", "MAIN, L2, true", "MAIN, L3, true",
                "L1, L1, false", "L1, L2, true", "L1, L3, true",
                "L2, L1, false", "L2, L2, false", "L2, L3, true",
                "L3, L1, false", "L3, L2, false", "L3, L3, false"
        })
        @DisplayName("spawn table")
        void spawnTable(AgentLevel spawner, AgentLevel requested, boolean allowed) {
            assertEquals(allowed, spawner.canSpawn(requested));
        }

        @Test
        @DisplayName("parse is case-insensitive")
        void parse() {
            assertEquals(AgentLevel.L2, AgentLevel.parse(" l2 "));
        }
    }

    @Nested
    @DisplayName("NodeRef")
    class NodeRefTests {

        @Test
        @DisplayName("key round-trips through parse")
        void keyRoundTrips() {
            NodeRef ref = NodeRef.of(NodeLevel.ROADMAP, "backend");
            assertEquals("ROADMAP:backend", ref.key());
            assertEquals(ref, NodeRef.parse("roadmap:backend"));
        }

        @Test
        @DisplayName("rejects malformed references")
        void rejectsMalformed() {
            assertThrows(IllegalArgumentException.class, () -> NodeRef.parse("backend"));
            assertThrows(IllegalArgumentException.class, () -> NodeRef.parse("PHASE:"));
            assertThrows(IllegalArgumentException.class, () -> NodeRef.parse("GALAXY:x"));
        }

        @Test
        @DisplayName("ids are scoped by level")
        void idsScopedByLevel() {
            assertNotEquals(NodeRef.of(NodeLevel.PHASE, "p1"), NodeRef.of(NodeLevel.PLAN, "p1"));
        }
    }

    @Nested
    @DisplayName("NodeLevel")
    class NodeLevelTests {

        @Test
        @DisplayName("a level owns only lower levels, skipping allowed")
        void ownership() {
            assertTrue(NodeLevel.ROADMAP.canOwn(NodeLevel.PHASE));
            assertTrue(NodeLevel.PHASE.canOwn(NodeLevel.TASK));
            assertFalse(NodeLevel.PHASE.canOwn(NodeLevel.PHASE));
            assertFalse(NodeLevel.TASK.canOwn(NodeLevel.VISION));
        }
    }

    @Nested
    @DisplayName("CompletionSignal")
    class CompletionSignalTests {

        @Test
        @DisplayName("fingerprint is stable for the same agent and content")
        void fingerprintStable() {
            var a = CompletionSignal.completed("t1", List.of("a.java"), "done");
            var b = CompletionSignal.completed("t1", List.of("a.java"), "done");
            assertEquals(a.fingerprint("agent-1"), b.fingerprint("agent-1"));
            assertEquals(24, a.fingerprint("agent-1").length());
        }

        @Test
        @DisplayName("fingerprint differs per agent and per kind")
        void fingerprintDiffers() {
            var done = CompletionSignal.completed("t1", List.of(), "");
            assertNotEquals(done.fingerprint("agent-1"), done.fingerprint("agent-2"));
            assertNotEquals(done.fingerprint("agent-1"), CompletionSignal.failed("t1", "").fingerprint("agent-1"));
        }

        @Test
        @DisplayName("error and blocker only answer for their own kind")
        void detailAccessors() {
            assertEquals("boom", CompletionSignal.failed("t1", "boom").error());
            assertNull(CompletionSignal.failed("t1", "boom").blocker());
            assertEquals("need creds", CompletionSignal.blocked("t1", "need creds").blocker());
        }
    }

    @Nested
    @DisplayName("DriftSeverity")
    class DriftSeverityTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"1.0, NONE", "0.95, NONE", "0.94, LOW", "0.85, LOW", "0.84, MEDIUM",
                "0.70, MEDIUM", "0.69, HIGH", "0.50, HIGH", "0.49, CRITICAL", "0.0, CRITICAL"})
        @DisplayName("bands")
        void bands(double score, DriftSeverity expected) {
            assertEquals(expected, DriftSeverity.forScore(score));
        }
    }

    @Test
    @DisplayName("alignment weights sum to one")
    void alignmentWeights() {
        assertEquals(1.0, new AlignmentFactors(1, 1, 1).weightedScore(), 1e-9);
        assertEquals(0.4, new AlignmentFactors(1, 0, 0).weightedScore(), 1e-9);
    }
}
