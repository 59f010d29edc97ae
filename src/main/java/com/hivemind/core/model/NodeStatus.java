package com.hivemind.core.model;

/**
 * Lifecycle status of a hierarchy node.
 */
public enum NodeStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
