package com.hivemind.core.recovery;

import com.hivemind.core.model.ErrorKind;
import com.hivemind.core.model.RecoveryAction;

/**
 * Maps a classified failure to a recovery action.
 */
public final class RecoveryPolicy {

    private RecoveryPolicy() {}

    /**
     * @param kind       failure family
     * @param attempt    failures so far, including the one being decided
     * @param maxRetries retry ceiling; reaching it aborts regardless of the family
     */
    public static RecoveryAction decide(ErrorKind kind, int attempt, int maxRetries) {
        if (attempt >= maxRetries) {
            return RecoveryAction.ABORT;
        }
        return switch (kind) {
            case TRANSIENT, RECOVERABLE -> RecoveryAction.RETRY;
            case FATAL, UNKNOWN -> RecoveryAction.ESCALATE;
        };
    }
}
