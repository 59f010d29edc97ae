package com.hivemind.core.model;

/**
 * What to do with a task after a failure.
 */
public enum RecoveryAction {
    RETRY,
    ESCALATE,
    ABORT
}
