package com.hivemind.core.spawn;

import com.hivemind.core.model.AgentLevel;

/**
 * A request to admit a new agent.
 *
 * @param spawnerAgentId id of the spawning agent, null or "main" for the operator
 * @param agentId        id for the new agent; generated when null
 * @param requestedLevel declared level, or null to infer it from the text
 * @param prompt         the prompt the new agent is started with
 * @param description    short description of the new agent
 * @param domain         free-form domain tag
 * @param taskId         the Task the new agent will work, may be null
 */
public record SpawnRequest(
    String spawnerAgentId,
    String agentId,
    AgentLevel requestedLevel,
    String prompt,
    String description,
    String domain,
    String taskId
) {

    public SpawnRequest {
        if (requestedLevel == AgentLevel.MAIN) {
            throw new IllegalArgumentException("main is not a spawnable level");
        }
    }

    public static SpawnRequest of(String spawnerAgentId, String agentId, AgentLevel level, String taskId) {
        return new SpawnRequest(spawnerAgentId, agentId, level, null, null, null, taskId);
    }
}
