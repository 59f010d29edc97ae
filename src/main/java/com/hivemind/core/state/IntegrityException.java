package com.hivemind.core.state;

/**
 * Thrown when a mutation references a node or agent that does not exist, or would break
 * the tree shape. Fatal to that single mutation only; the store is left untouched.
 */
public class IntegrityException extends HivemindException {
    public IntegrityException(String message) {
        super(message);
    }
}
