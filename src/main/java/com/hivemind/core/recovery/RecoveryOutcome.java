package com.hivemind.core.recovery;

import com.hivemind.core.model.ErrorKind;
import com.hivemind.core.model.RecoveryAction;

/**
 * What the recovery service did with a failure or blocker signal.
 *
 * @param taskId    the task the signal was resolved to, null when it could not be resolved
 * @param agentId   the agent that emitted the signal
 * @param action    the decided action, null when the signal was ignored
 * @param errorKind classification of the error text, null for blocker signals
 * @param attempt   failure count including this one
 * @param applied   false when the signal changed nothing (replay, terminal task, repeat escalation)
 * @param detail    error or blocker text, or why the signal was ignored
 */
public record RecoveryOutcome(
    String taskId,
    String agentId,
    RecoveryAction action,
    ErrorKind errorKind,
    int attempt,
    boolean applied,
    String detail
) {

    static RecoveryOutcome ignored(String taskId, String agentId, String reason) {
        return new RecoveryOutcome(taskId, agentId, null, null, 0, false, reason);
    }
}
