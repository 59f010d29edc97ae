package com.hivemind.core.plan;

import com.hivemind.core.model.NodeLevel;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Authoring form of a hierarchy subtree, as read from a plan file.
 *
 * @param id           node id, unique within its level
 * @param level        node level
 * @param title        display title
 * @param dependencies ids of same-level siblings this node waits for; not allowed on Tasks
 * @param children     nested child definitions, each at a lower level
 * @param plan         Vision baseline for alignment scoring (Vision only)
 */
public record NodeDefinition(
    String id,
    NodeLevel level,
    String title,
    List<String> dependencies,
    List<NodeDefinition> children,
    PlanDefinition plan
) implements Serializable {

    public NodeDefinition {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * @param startedAt defaults to the load time when absent
     */
    public record PlanDefinition(
        double estimatedDays,
        int plannedEpics,
        List<String> successCriteria,
        Instant startedAt
    ) implements Serializable {}
}
