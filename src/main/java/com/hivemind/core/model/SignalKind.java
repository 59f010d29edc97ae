package com.hivemind.core.model;

/**
 * Kind of completion signal an agent emits at the end of its output.
 * Declared in parse priority order: a failure is never superseded by a later
 * completion claim in the same output.
 */
public enum SignalKind {
    FAILED,
    BLOCKED,
    COMPLETED,
    PARTIAL_RESULT;

    public boolean isNegative() {
        return this == FAILED || this == BLOCKED;
    }
}
