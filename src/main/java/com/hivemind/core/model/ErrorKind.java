package com.hivemind.core.model;

/**
 * Failure family an error message belongs to.
 */
public enum ErrorKind {
    TRANSIENT,
    RECOVERABLE,
    FATAL,
    UNKNOWN
}
