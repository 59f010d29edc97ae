package com.hivemind.core.spawn;

import com.hivemind.core.model.AgentLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentLevelDetectorTest {

    private final AgentLevelDetector detector = new AgentLevelDetector();

    @Test
    @DisplayName("explicit level mention wins over role keywords")
    void explicitMentionWins() {
        var inference = detector.detect("You are an L3 agent that coordinates nothing", "orchestrator-ish");
        assertEquals(AgentLevel.L3, inference.level());
        assertEquals(LevelInference.Basis.EXPLICIT_MENTION, inference.basis());
    }

    @Test
    @DisplayName("recognizes 'level 2'")
    void levelWord() {
        assertEquals(AgentLevel.L2, detector.detect("Act as a Level 2 agent", null).level());
    }

    @Test
    @DisplayName("role keywords map to levels")
    void roleKeywords() {
        assertEquals(AgentLevel.L1, detector.detect("Project orchestrator for the release", null).level());
        assertEquals(AgentLevel.L2, detector.detect("Database specialist", null).level());
        assertEquals(AgentLevel.L3, detector.detect("Search the codebase for usages", null).level());
        assertEquals(LevelInference.Basis.ROLE_KEYWORD, detector.detect(null, "worker").basis());
    }

    @Test
    @DisplayName("model family hints")
    void modelHints() {
        var inference = detector.detect("Use haiku for this", null);
        assertEquals(AgentLevel.L3, inference.level());
        assertEquals(LevelInference.Basis.MODEL_HINT, inference.basis());
        assertEquals(AgentLevel.L1, detector.detect("run on opus", null).level());
    }

    @Test
    @DisplayName("tool-style agents are workers")
    void toolHints() {
        var inference = detector.detect("Explore the repository layout", null);
        assertEquals(AgentLevel.L3, inference.level());
        assertEquals(LevelInference.Basis.TOOL_HINT, inference.basis());
    }

    @Test
    @DisplayName("defaults to L2")
    void defaultsToL2() {
        var inference = detector.detect("Write the release notes", "");
        assertEquals(AgentLevel.L2, inference.level());
        assertEquals(LevelInference.Basis.DEFAULT, inference.basis());
    }

    @Test
    @DisplayName("does not read 'html2' as a level")
    void ignoresEmbeddedDigits() {
        assertEquals(LevelInference.Basis.DEFAULT, detector.detect("convert to html2 output", null).basis());
    }
}
