package com.hivemind.core.recovery;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.CompletionSignal;
import com.hivemind.core.model.ErrorKind;
import com.hivemind.core.model.HierarchyNode;
import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.NodeStatus;
import com.hivemind.core.model.RecoveryAction;
import com.hivemind.core.model.SignalKind;
import com.hivemind.core.state.HierarchyState;
import com.hivemind.core.state.HierarchyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies recovery decisions to failed and blocked tasks.
 * <p>
 * Each signal is applied in one store transaction: the decision, the task's new status and
 * the removal of the emitting agent from the active set commit together. A signal already
 * applied to the task (same fingerprint) is ignored, as is any signal for a task that is
 * already COMPLETED or FAILED. An escalated task holds for human action: further failures and
 * blockers leave it untouched until {@link #resolveBlocker} or {@link #abort} releases it.
 */
@Service
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    private final HierarchyStore store;
    private final ErrorClassifier classifier;
    private final HivemindProperties properties;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;

    public RecoveryService(HierarchyStore store, ErrorClassifier classifier, HivemindProperties properties,
                           EventBus eventBus, HivemindMetrics metrics) {
        this.store = store;
        this.classifier = classifier;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Handles a FAILED or BLOCKED signal emitted by {@code agentId}. A signal without a task
     * id is attributed to the task the agent was spawned for.
     */
    public RecoveryOutcome handle(String agentId, CompletionSignal signal) {
        if (!signal.kind().isNegative()) {
            throw new IllegalArgumentException("Recovery only handles failure and blocker signals, got " + signal.kind());
        }
        int maxRetries = properties.getMaxRetries();
        Applied result = store.mutate("recover", state -> apply(state, agentId, signal, maxRetries));
        RecoveryOutcome outcome = result.outcome();

        if (!outcome.applied()) {
            log.debug("Recovery signal from {} ignored: {}", agentId, outcome.detail());
            return outcome;
        }
        metrics.recordRecovery(outcome.errorKind() == null ? "BLOCKED" : outcome.errorKind().name(),
                outcome.action().name());
        switch (outcome.action()) {
            case RETRY -> log.info("Task {} will be retried (attempt {}/{}): {}",
                    outcome.taskId(), outcome.attempt(), maxRetries, outcome.detail());
            case ESCALATE -> log.warn("Task {} escalated: {}", outcome.taskId(), outcome.detail());
            case ABORT -> log.error("Task {} aborted after {} attempts: {}",
                    outcome.taskId(), outcome.attempt(), outcome.detail());
        }
        publish(outcome, result.visionId());
        return outcome;
    }

    /**
     * Marks a task FAILED on operator request. Preempts a pending retry.
     *
     * @return false if the task was already terminal
     */
    public boolean abort(String taskId, String reason) {
        Applied result = store.mutate("abort", state -> {
            HierarchyNode task = state.requireNode(NodeRef.task(taskId));
            if (task.getStatus().isTerminal()) {
                return new Applied(RecoveryOutcome.ignored(taskId, null, "task already " + task.getStatus()), null);
            }
            state.removeAgent(task.getAssignedAgent());
            task.setStatus(NodeStatus.FAILED);
            task.setError(reason == null || reason.isBlank() ? "Aborted" : reason);
            task.setRetryPending(false);
            task.setUpdatedAt(store.clock().instant());
            return new Applied(new RecoveryOutcome(taskId, task.getAssignedAgent(), RecoveryAction.ABORT, null,
                    task.getRetryCount(), true, task.getError()), visionOf(state, task));
        });
        if (result.outcome().applied()) {
            log.warn("Task {} aborted by operator: {}", taskId, result.outcome().detail());
            publish(result.outcome(), result.visionId());
        }
        return result.outcome().applied();
    }

    /**
     * Consumes the pending retry of a task so it is re-dispatched once.
     *
     * @return true if a retry was pending
     */
    public boolean claimRetry(String taskId) {
        return store.mutate("claim-retry", state -> {
            HierarchyNode task = state.requireNode(NodeRef.task(taskId));
            if (!task.isRetryPending() || task.getStatus() != NodeStatus.PENDING) {
                return false;
            }
            task.setRetryPending(false);
            task.setUpdatedAt(store.clock().instant());
            return true;
        });
    }

    /**
     * Returns an escalated task to PENDING once its blocker was dealt with.
     *
     * @return false if the task was not BLOCKED
     */
    public boolean resolveBlocker(String taskId) {
        boolean resolved = store.mutate("resolve-blocker", state -> {
            HierarchyNode task = state.requireNode(NodeRef.task(taskId));
            if (task.getStatus() != NodeStatus.BLOCKED) {
                return false;
            }
            task.setStatus(NodeStatus.PENDING);
            task.setBlocker(null);
            task.setEscalated(false);
            task.setUpdatedAt(store.clock().instant());
            return true;
        });
        if (resolved) {
            log.info("Blocker on task {} resolved", taskId);
        }
        return resolved;
    }

    private Applied apply(HierarchyState state, String agentId, CompletionSignal signal, int maxRetries) {
        String taskId = signal.taskId() != null
                ? signal.taskId()
                : state.agent(agentId).map(Agent::getTaskRef).orElse(null);
        state.removeAgent(agentId);
        if (taskId == null) {
            return new Applied(RecoveryOutcome.ignored(null, agentId, "no task for agent " + agentId), null);
        }
        Optional<HierarchyNode> found = state.node(NodeRef.task(taskId));
        if (found.isEmpty()) {
            return new Applied(RecoveryOutcome.ignored(taskId, agentId, "unknown task " + taskId), null);
        }
        HierarchyNode task = found.get();
        if (task.getStatus().isTerminal()) {
            return new Applied(RecoveryOutcome.ignored(taskId, agentId, "task already " + task.getStatus()), null);
        }
        if (task.getStatus() == NodeStatus.BLOCKED && task.isEscalated()) {
            return new Applied(new RecoveryOutcome(taskId, agentId, RecoveryAction.ESCALATE, null,
                    task.getRetryCount(), false, "already escalated: " + task.getBlocker()), null);
        }
        if (!task.getAppliedSignals().add(signal.fingerprint(agentId))) {
            return new Applied(RecoveryOutcome.ignored(taskId, agentId, "signal already applied"), null);
        }
        Instant now = store.clock().instant();
        String visionId = visionOf(state, task);

        if (signal.kind() == SignalKind.BLOCKED) {
            return new Applied(escalate(task, agentId, null, task.getRetryCount(), signal.blocker(), now), visionId);
        }

        String error = signal.error();
        ErrorKind kind = classifier.classify(error);
        int attempt = task.getRetryCount() + 1;
        RecoveryAction action = RecoveryPolicy.decide(kind, attempt, maxRetries);
        task.setError(error);
        task.setUpdatedAt(now);
        return new Applied(switch (action) {
            case RETRY -> {
                task.setRetryCount(attempt);
                task.setStatus(NodeStatus.PENDING);
                task.setRetryPending(true);
                yield new RecoveryOutcome(taskId, agentId, action, kind, attempt, true, error);
            }
            case ABORT -> {
                task.setRetryCount(attempt);
                task.setStatus(NodeStatus.FAILED);
                task.setRetryPending(false);
                yield new RecoveryOutcome(taskId, agentId, action, kind, attempt, true, error);
            }
            case ESCALATE -> escalate(task, agentId, kind, attempt, error, now);
        }, visionId);
    }

    private static RecoveryOutcome escalate(HierarchyNode task, String agentId, ErrorKind kind, int attempt,
                                            String blocker, Instant now) {
        task.setStatus(NodeStatus.BLOCKED);
        task.setBlocker(blocker);
        task.setEscalated(true);
        task.setRetryPending(false);
        task.setUpdatedAt(now);
        return new RecoveryOutcome(task.getId(), agentId, RecoveryAction.ESCALATE, kind, attempt, true, blocker);
    }

    private static String visionOf(HierarchyState state, HierarchyNode node) {
        HierarchyNode root = state.root(node.ref());
        return root.getLevel() == NodeLevel.VISION ? root.getId() : null;
    }

    private void publish(RecoveryOutcome outcome, String visionId) {
        String type = switch (outcome.action()) {
            case RETRY -> HivemindEvent.TASK_RETRY;
            case ESCALATE -> HivemindEvent.TASK_ESCALATED;
            case ABORT -> HivemindEvent.TASK_ABORTED;
        };
        Map<String, Object> payload = new HashMap<>();
        payload.put("attempt", outcome.attempt());
        if (outcome.agentId() != null) {
            payload.put("agentId", outcome.agentId());
        }
        if (outcome.errorKind() != null) {
            payload.put("errorKind", outcome.errorKind().name());
        }
        if (outcome.detail() != null) {
            payload.put("detail", outcome.detail());
        }
        eventBus.publish(new HivemindEvent(type, visionId, NodeRef.task(outcome.taskId()), payload,
                store.clock().instant()));
    }

    private record Applied(RecoveryOutcome outcome, String visionId) {}
}
