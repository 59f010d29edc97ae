package com.hivemind.core.progress;

import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.ProgressUpdate;

import java.util.List;

/**
 * Everything one aggregation changed, for notification after the commit.
 *
 * @param taskId         the task the signal was applied to, null if it could not be resolved
 * @param agentId        the agent that emitted the signal
 * @param visionId       the Vision at the root of the task's tree, null for detached trees
 * @param applied        false when nothing changed (replay, terminal task, unknown task)
 * @param updates        one entry per node whose percentage or status changed, plus one per milestone
 * @param completedNodes nodes that became COMPLETED, bottom-up
 * @param advancedNodes  gated siblings moved to IN_PROGRESS because their dependencies completed
 * @param detail         why the signal was ignored, null when applied
 */
public record AggregationResult(
    String taskId,
    String agentId,
    String visionId,
    boolean applied,
    List<ProgressUpdate> updates,
    List<NodeRef> completedNodes,
    List<NodeRef> advancedNodes,
    String detail
) {

    public AggregationResult {
        updates = updates == null ? List.of() : List.copyOf(updates);
        completedNodes = completedNodes == null ? List.of() : List.copyOf(completedNodes);
        advancedNodes = advancedNodes == null ? List.of() : List.copyOf(advancedNodes);
    }

    static AggregationResult ignored(String taskId, String agentId, String reason) {
        return new AggregationResult(taskId, agentId, null, false, List.of(), List.of(), List.of(), reason);
    }

    public List<ProgressUpdate> milestones() {
        return updates.stream().filter(ProgressUpdate::hasMilestone).toList();
    }
}
