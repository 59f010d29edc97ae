package com.hivemind.core.state;

/**
 * Base type for failures raised by the orchestration core.
 */
public class HivemindException extends RuntimeException {
    public HivemindException(String message) {
        super(message);
    }

    public HivemindException(String message, Throwable cause) {
        super(message, cause);
    }
}
