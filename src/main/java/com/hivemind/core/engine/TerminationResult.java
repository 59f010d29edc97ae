package com.hivemind.core.engine;

import com.hivemind.core.model.CompletionSignal;
import com.hivemind.core.progress.AggregationResult;
import com.hivemind.core.recovery.RecoveryOutcome;

/**
 * What became of an agent's termination.
 *
 * @param agentId  the agent that terminated
 * @param signal   the parsed signal, null when the output carried none
 * @param progress set when a completion or partial result was aggregated
 * @param recovery set when a failure or blocker went through recovery
 * @param error    set when the signal could not be applied to the hierarchy
 */
public record TerminationResult(
    String agentId,
    CompletionSignal signal,
    AggregationResult progress,
    RecoveryOutcome recovery,
    String error
) {

    static TerminationResult noSignal(String agentId) {
        return new TerminationResult(agentId, null, null, null, null);
    }

    static TerminationResult rejected(String agentId, CompletionSignal signal, String error) {
        return new TerminationResult(agentId, signal, null, null, error);
    }

    public boolean hasSignal() {
        return signal != null;
    }
}
