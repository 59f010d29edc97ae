package com.hivemind.core.progress;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.CompletionSignal;
import com.hivemind.core.model.HierarchyNode;
import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.NodeStatus;
import com.hivemind.core.model.ProgressUpdate;
import com.hivemind.core.model.SignalKind;
import com.hivemind.core.state.HierarchyState;
import com.hivemind.core.state.HierarchyStore;
import com.hivemind.core.sync.ProgressNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rolls task completion up the hierarchy.
 * <p>
 * A Task's status is the only primitive fact. Every node above it is recomputed from its
 * children on each change:
 * <ul>
 *   <li>percentage is the share of COMPLETED children, rounded; a Vision averages its Epics</li>
 *   <li>a node is COMPLETED when all of its children are</li>
 *   <li>a node whose sibling dependencies are not all COMPLETED stays PENDING</li>
 *   <li>otherwise a node with progress, or one already started, is IN_PROGRESS</li>
 * </ul>
 * Because the result only depends on the set of completed tasks, completions can be
 * applied in any order. Milestones are reported once per node and threshold; the
 * reported set is part of the committed state, so concurrent writers cannot both fire one.
 */
@Service
public class ProgressAggregator {

    private static final Logger log = LoggerFactory.getLogger(ProgressAggregator.class);

    private final HierarchyStore store;
    private final HivemindProperties properties;
    private final ProgressNotifier notifier;

    public ProgressAggregator(HierarchyStore store, HivemindProperties properties, ProgressNotifier notifier) {
        this.store = store;
        this.properties = properties;
        this.notifier = notifier;
    }

    /**
     * Applies a COMPLETED or PARTIAL_RESULT signal emitted by {@code agentId} and
     * recomputes everything above the task.
     */
    public AggregationResult apply(String agentId, CompletionSignal signal) {
        if (signal.kind() != SignalKind.COMPLETED && signal.kind() != SignalKind.PARTIAL_RESULT) {
            throw new IllegalArgumentException("Aggregation only handles completion signals, got " + signal.kind());
        }
        List<Integer> thresholds = properties.getMilestoneThresholds();
        AggregationResult result = store.mutate("aggregate",
                state -> applySignal(state, agentId, signal, thresholds));
        report(result);
        return result;
    }

    /**
     * Recomputes {@code ref} and its ancestors, e.g. after the tree was edited.
     */
    public AggregationResult recompute(NodeRef ref) {
        List<Integer> thresholds = properties.getMilestoneThresholds();
        AggregationResult result = store.mutate("recompute", state -> {
            HierarchyNode node = state.requireNode(ref);
            Changes changes = new Changes(store.clock().instant(), thresholds);
            propagate(state, node.isLeaf() ? node.getParentRef() : ref, changes);
            return changes.result(null, null, visionOf(state, node));
        });
        report(result);
        return result;
    }

    public Optional<NodeProgress> snapshot(NodeRef ref) {
        return store.read(state -> state.node(ref).map(node -> view(state, node)));
    }

    private AggregationResult applySignal(HierarchyState state, String agentId, CompletionSignal signal,
                                          List<Integer> thresholds) {
        String taskId = signal.taskId() != null
                ? signal.taskId()
                : state.agent(agentId).map(Agent::getTaskRef).orElse(null);
        state.removeAgent(agentId);
        if (taskId == null) {
            return AggregationResult.ignored(null, agentId, "no task for agent " + agentId);
        }
        Optional<HierarchyNode> found = state.node(NodeRef.task(taskId));
        if (found.isEmpty()) {
            return AggregationResult.ignored(taskId, agentId, "unknown task " + taskId);
        }
        HierarchyNode task = found.get();
        if (task.getStatus().isTerminal()) {
            return AggregationResult.ignored(taskId, agentId, "task already " + task.getStatus());
        }
        if (!task.getAppliedSignals().add(signal.fingerprint(agentId))) {
            return AggregationResult.ignored(taskId, agentId, "signal already applied");
        }

        Instant now = store.clock().instant();
        Changes changes = new Changes(now, thresholds);
        String visionId = visionOf(state, task);

        if (signal.kind() == SignalKind.PARTIAL_RESULT) {
            if (signal.detail() != null && !signal.detail().isEmpty()) {
                task.getPartialResults().add(signal.detail());
            }
            task.setUpdatedAt(now);
            return changes.result(taskId, agentId, visionId);
        }

        task.setStatus(NodeStatus.COMPLETED);
        task.setCompletionPercentage(100);
        task.setArtifacts(signal.artifacts());
        task.setSummary(signal.summary());
        task.setRetryPending(false);
        task.setBlocker(null);
        task.setEscalated(false);
        task.setUpdatedAt(now);
        changes.updated(task);
        changes.completed.add(task.ref());

        propagate(state, task.getParentRef(), changes);
        return changes.result(taskId, agentId, visionId);
    }

    private void propagate(HierarchyState state, NodeRef start, Changes changes) {
        NodeRef current = start;
        int guard = NodeLevel.values().length;
        while (current != null && guard-- > 0) {
            HierarchyNode node = state.requireNode(current);
            if (recomputeNode(state, node, changes)) {
                advanceDependents(state, node, changes, new HashSet<>());
            }
            current = node.getParentRef();
        }
    }

    /**
     * @return true if the node became COMPLETED
     */
    private boolean recomputeNode(HierarchyState state, HierarchyNode node, Changes changes) {
        List<HierarchyNode> children = state.children(node);
        int oldPercentage = node.getCompletionPercentage();
        NodeStatus oldStatus = node.getStatus();

        int percentage = percentage(node, children);
        boolean allDone = !children.isEmpty()
                && children.stream().allMatch(c -> c.getStatus() == NodeStatus.COMPLETED);

        NodeStatus status;
        if (!dependenciesMet(state, node)) {
            status = NodeStatus.PENDING;
        } else if (allDone) {
            status = NodeStatus.COMPLETED;
        } else if (percentage > 0 || oldStatus == NodeStatus.IN_PROGRESS || oldStatus == NodeStatus.COMPLETED) {
            status = NodeStatus.IN_PROGRESS;
        } else {
            status = NodeStatus.PENDING;
        }

        node.setCompletionPercentage(percentage);
        node.setStatus(status);
        if (percentage != oldPercentage || status != oldStatus) {
            node.setUpdatedAt(changes.now);
            changes.updated(node);
        }
        for (int threshold : changes.thresholds) {
            if (percentage >= threshold && state.markMilestoneReported(node.ref(), threshold)) {
                changes.updates.add(new ProgressUpdate(node.ref(), percentage, status, threshold));
            }
        }
        boolean completedNow = status == NodeStatus.COMPLETED && oldStatus != NodeStatus.COMPLETED;
        if (completedNow) {
            changes.completed.add(node.ref());
        }
        return completedNow;
    }

    private static int percentage(HierarchyNode node, List<HierarchyNode> children) {
        if (children.isEmpty()) {
            return 0;
        }
        if (node.getLevel() == NodeLevel.VISION) {
            double mean = children.stream().mapToInt(HierarchyNode::getCompletionPercentage).average().orElse(0);
            return (int) Math.round(mean);
        }
        long completed = children.stream().filter(c -> c.getStatus() == NodeStatus.COMPLETED).count();
        return (int) Math.round(100.0 * completed / children.size());
    }

    /**
     * Dependencies name siblings at the same level, e.g. Roadmaps of one Epic or Phases of one Roadmap.
     * A missing dependency counts as unmet.
     */
    static boolean dependenciesMet(HierarchyState state, HierarchyNode node) {
        if (node.getDependencies().isEmpty()) {
            return true;
        }
        for (String dependency : node.getDependencies()) {
            Optional<HierarchyNode> dep = state.node(NodeRef.of(node.getLevel(), dependency));
            if (dep.isEmpty() || dep.get().getStatus() != NodeStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private void advanceDependents(HierarchyState state, HierarchyNode node, Changes changes, Set<NodeRef> visited) {
        if (node.getParentRef() == null || !visited.add(node.ref())) {
            return;
        }
        HierarchyNode parent = state.requireNode(node.getParentRef());
        for (HierarchyNode sibling : state.children(parent)) {
            if (sibling.getLevel() != node.getLevel() || !sibling.getDependencies().contains(node.getId())
                    || !dependenciesMet(state, sibling)) {
                continue;
            }
            if (sibling.getStatus() == NodeStatus.PENDING) {
                sibling.setStatus(NodeStatus.IN_PROGRESS);
                sibling.setUpdatedAt(changes.now);
                changes.advanced.add(sibling.ref());
                changes.updated(sibling);
            }
            if (recomputeNode(state, sibling, changes)) {
                advanceDependents(state, sibling, changes, visited);
            }
        }
    }

    private NodeProgress view(HierarchyState state, HierarchyNode node) {
        List<NodeProgress> children = node.getChildren().stream()
                .map(state::node)
                .flatMap(Optional::stream)
                .map(child -> view(state, child))
                .toList();
        return new NodeProgress(node.ref(), node.getTitle(), node.getStatus(), node.getCompletionPercentage(),
                children);
    }

    private static String visionOf(HierarchyState state, HierarchyNode node) {
        HierarchyNode root = state.root(node.ref());
        return root.getLevel() == NodeLevel.VISION ? root.getId() : null;
    }

    private void report(AggregationResult result) {
        if (!result.applied()) {
            log.debug("Aggregation for task {} skipped: {}", result.taskId(), result.detail());
            return;
        }
        for (NodeRef advanced : result.advancedNodes()) {
            log.info("{} advanced to IN_PROGRESS", advanced);
        }
        for (ProgressUpdate milestone : result.milestones()) {
            log.info("{} reached {}% milestone", milestone.node(), milestone.milestone());
        }
        notifier.dispatch(result);
    }

    /** Collected within one mutation attempt; discarded if the attempt is retried. */
    private static final class Changes {
        final Instant now;
        final List<Integer> thresholds;
        final List<ProgressUpdate> updates = new ArrayList<>();
        final List<NodeRef> completed = new ArrayList<>();
        final List<NodeRef> advanced = new ArrayList<>();

        Changes(Instant now, List<Integer> thresholds) {
            this.now = now;
            this.thresholds = thresholds;
        }

        void updated(HierarchyNode node) {
            updates.removeIf(u -> !u.hasMilestone() && u.node().equals(node.ref()));
            updates.add(new ProgressUpdate(node.ref(), node.getCompletionPercentage(), node.getStatus(), null));
        }

        AggregationResult result(String taskId, String agentId, String visionId) {
            return new AggregationResult(taskId, agentId, visionId, true, updates, completed, advanced, null);
        }
    }
}
