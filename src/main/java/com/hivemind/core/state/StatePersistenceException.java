package com.hivemind.core.state;

/**
 * Thrown when the state document cannot be read or written.
 */
public class StatePersistenceException extends HivemindException {
    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
