package com.hivemind.core.events;

import com.hivemind.core.model.NodeRef;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the orchestration core.
 *
 * @param eventType event type (e.g. "agent.spawned", "node.completed", "milestone.reached", "vision.drift")
 * @param visionId  the Vision whose tree the event belongs to (nullable for agent-level events)
 * @param node      the node the event relates to (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record HivemindEvent(
    String eventType,
    String visionId,
    NodeRef node,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String AGENT_SPAWNED = "agent.spawned";
    public static final String AGENT_DENIED = "agent.denied";
    public static final String NODE_PROGRESS = "node.progress";
    public static final String NODE_COMPLETED = "node.completed";
    public static final String MILESTONE_REACHED = "milestone.reached";
    public static final String NODE_ADVANCED = "node.advanced";
    public static final String TASK_RETRY = "task.retry";
    public static final String TASK_ESCALATED = "task.escalated";
    public static final String TASK_ABORTED = "task.aborted";
    public static final String RESOURCE_COLLISION = "resource.collision";
    public static final String VISION_OBSERVED = "vision.observed";
    public static final String VISION_DRIFT = "vision.drift";
}
