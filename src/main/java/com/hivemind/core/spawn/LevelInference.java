package com.hivemind.core.spawn;

import com.hivemind.core.model.AgentLevel;

/**
 * Result of inferring the level of an agent about to be spawned.
 *
 * @param level the inferred level
 * @param basis what the inference was based on
 * @param cue   the text fragment that decided it, or null for defaults
 */
public record LevelInference(AgentLevel level, Basis basis, String cue) {

    public enum Basis {
        /** Given by the caller. */
        DECLARED,
        /** "L2", "level 3" etc. in the text. */
        EXPLICIT_MENTION,
        /** Role keyword such as "orchestrator" or "worker". */
        ROLE_KEYWORD,
        /** Model family hint. */
        MODEL_HINT,
        /** Tool-style agent such as explore or bash. */
        TOOL_HINT,
        /** Nothing matched. */
        DEFAULT
    }

    public static LevelInference declared(AgentLevel level) {
        return new LevelInference(level, Basis.DECLARED, null);
    }
}
