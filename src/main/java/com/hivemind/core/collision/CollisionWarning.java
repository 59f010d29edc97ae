package com.hivemind.core.collision;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Advisory raised when an agent writes a resource another agent wrote shortly before.
 *
 * @param resourceId  the resource written
 * @param agentId     the agent whose write triggered the warning
 * @param otherAgents distinct other agents that wrote inside the window
 * @param smallestGap gap to the closest of those writes
 * @param timestamp   time of the triggering write
 */
public record CollisionWarning(
    String resourceId,
    String agentId,
    List<String> otherAgents,
    Duration smallestGap,
    Instant timestamp
) {

    public CollisionWarning {
        otherAgents = otherAgents == null ? List.of() : List.copyOf(otherAgents);
    }

    public String message() {
        return "Resource " + resourceId + " was also written by " + String.join(", ", otherAgents)
                + " " + smallestGap.toMillis() + "ms apart from " + agentId;
    }
}
