package com.hivemind.core.progress;

import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.NodeStatus;

import java.util.List;

/**
 * Read-only view of a node's progress and that of its subtree.
 */
public record NodeProgress(
    NodeRef ref,
    String title,
    NodeStatus status,
    int percentage,
    List<NodeProgress> children
) {

    public NodeProgress {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
