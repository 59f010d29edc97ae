package com.hivemind.core.spawn;

import com.hivemind.core.model.AgentLevel;

import java.util.List;

/**
 * Outcome of validating a spawn request.
 *
 * @param allowed            whether the agent was admitted (and registered)
 * @param agentId            id of the admitted agent, or the requested id when denied
 * @param spawnerLevel       resolved level of the spawner
 * @param requestedLevel     declared or inferred level of the new agent
 * @param inference          how the requested level was obtained
 * @param hierarchyViolation whether the transition breaks the hierarchy table
 * @param message            deny reason or warning text, null when there is nothing to say
 * @param annotations        additional notes (suggestions, unknown task, ...)
 */
public record SpawnDecision(
    boolean allowed,
    String agentId,
    AgentLevel spawnerLevel,
    AgentLevel requestedLevel,
    LevelInference inference,
    boolean hierarchyViolation,
    String message,
    List<String> annotations
) {

    public SpawnDecision {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public boolean denied() {
        return !allowed;
    }
}
