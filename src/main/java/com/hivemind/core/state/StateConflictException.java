package com.hivemind.core.state;

/**
 * Transient failure: a mutation kept losing compare-and-swap races past the retry cap.
 * Callers may resubmit it.
 */
public class StateConflictException extends HivemindException {
    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
