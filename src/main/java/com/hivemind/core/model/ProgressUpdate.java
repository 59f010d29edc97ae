package com.hivemind.core.model;

import java.io.Serializable;

/**
 * Progress of one node, handed to the external sync collaborator.
 *
 * @param node       the node that changed
 * @param percentage its completion percentage after the change
 * @param status     its status after the change
 * @param milestone  the threshold crossed, or null for a plain progress update
 */
public record ProgressUpdate(
    NodeRef node,
    int percentage,
    NodeStatus status,
    Integer milestone
) implements Serializable {

    public boolean hasMilestone() {
        return milestone != null;
    }
}
