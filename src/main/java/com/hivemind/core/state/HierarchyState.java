package com.hivemind.core.state;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AlignmentObservation;
import com.hivemind.core.model.HierarchyNode;
import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.ResourceWrite;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The whole shared state of a workspace as one versioned document:
 * <ul>
 *   <li>hierarchy nodes keyed by {@code LEVEL:id}</li>
 *   <li>the active agent set keyed by agent id</li>
 *   <li>one append-only observation log per Vision</li>
 *   <li>reported milestones keyed by {@code LEVEL:id@threshold}</li>
 *   <li>the collision window keyed by resource id</li>
 * </ul>
 * Only ever mutated inside {@link HierarchyStore#mutate}. The version is serialized first so
 * it can be read without parsing the rest.
 */
@JsonPropertyOrder({"version", "updatedAt"})
public class HierarchyState {

    private long version;
    private Instant updatedAt;
    private Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
    private Map<String, Agent> activeAgents = new LinkedHashMap<>();
    private Map<String, List<AlignmentObservation>> observations = new LinkedHashMap<>();
    private Set<String> reportedMilestones = new LinkedHashSet<>();
    private Map<String, List<ResourceWrite>> collisionIndex = new LinkedHashMap<>();
    private Instant lastCollisionSweep;

    // -- Nodes --

    public Optional<HierarchyNode> node(NodeRef ref) {
        return Optional.ofNullable(nodes.get(ref.key()));
    }

    public HierarchyNode requireNode(NodeRef ref) {
        HierarchyNode node = nodes.get(ref.key());
        if (node == null) {
            throw new IntegrityException("Unknown node " + ref.key());
        }
        return node;
    }

    public void putNode(HierarchyNode node) {
        nodes.put(node.ref().key(), node);
    }

    public List<HierarchyNode> children(HierarchyNode parent) {
        var result = new ArrayList<HierarchyNode>(parent.getChildren().size());
        for (NodeRef ref : parent.getChildren()) {
            HierarchyNode child = nodes.get(ref.key());
            if (child == null) {
                throw new IntegrityException("Node " + parent.ref() + " references missing child " + ref);
            }
            result.add(child);
        }
        return result;
    }

    public List<HierarchyNode> nodesAt(NodeLevel level) {
        return nodes.values().stream().filter(n -> n.getLevel() == level).toList();
    }

    /**
     * Walks parent references up to the root of {@code ref}'s tree.
     */
    public HierarchyNode root(NodeRef ref) {
        HierarchyNode current = requireNode(ref);
        int guard = NodeLevel.values().length;
        while (current.getParentRef() != null && guard-- > 0) {
            current = requireNode(current.getParentRef());
        }
        return current;
    }

    // -- Agents --

    public Optional<Agent> agent(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(activeAgents.get(agentId));
    }

    public void registerAgent(Agent agent) {
        activeAgents.put(agent.getAgentId(), agent);
    }

    public Optional<Agent> removeAgent(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(activeAgents.remove(agentId));
    }

    // -- Milestones --

    public static String milestoneKey(NodeRef ref, int threshold) {
        return ref.key() + "@" + threshold;
    }

    public boolean isMilestoneReported(NodeRef ref, int threshold) {
        return reportedMilestones.contains(milestoneKey(ref, threshold));
    }

    /**
     * @return true if the milestone was not reported before
     */
    public boolean markMilestoneReported(NodeRef ref, int threshold) {
        return reportedMilestones.add(milestoneKey(ref, threshold));
    }

    // -- Observations --

    public List<AlignmentObservation> observationsFor(String visionId) {
        return observations.getOrDefault(visionId, List.of());
    }

    /**
     * Appends to the Vision's history, evicting the oldest entries beyond {@code cap}.
     */
    public void appendObservation(String visionId, AlignmentObservation observation, int cap) {
        List<AlignmentObservation> history = observations.computeIfAbsent(visionId, k -> new ArrayList<>());
        history.add(observation);
        while (history.size() > cap) {
            history.remove(0);
        }
    }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Map<String, HierarchyNode> getNodes() { return nodes; }
    public void setNodes(Map<String, HierarchyNode> nodes) { this.nodes = nodes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(nodes); }
    public Map<String, Agent> getActiveAgents() { return activeAgents; }
    public void setActiveAgents(Map<String, Agent> activeAgents) { this.activeAgents = activeAgents == null ? new LinkedHashMap<>() : new LinkedHashMap<>(activeAgents); }
    public Map<String, List<AlignmentObservation>> getObservations() { return observations; }
    public void setObservations(Map<String, List<AlignmentObservation>> observations) {
        this.observations = new LinkedHashMap<>();
        if (observations != null) {
            observations.forEach((k, v) -> this.observations.put(k, new ArrayList<>(v)));
        }
    }
    public Set<String> getReportedMilestones() { return reportedMilestones; }
    public void setReportedMilestones(Set<String> reportedMilestones) { this.reportedMilestones = reportedMilestones == null ? new LinkedHashSet<>() : new LinkedHashSet<>(reportedMilestones); }
    public Map<String, List<ResourceWrite>> getCollisionIndex() { return collisionIndex; }
    public void setCollisionIndex(Map<String, List<ResourceWrite>> collisionIndex) {
        this.collisionIndex = new LinkedHashMap<>();
        if (collisionIndex != null) {
            collisionIndex.forEach((k, v) -> this.collisionIndex.put(k, new ArrayList<>(v)));
        }
    }
    public Instant getLastCollisionSweep() { return lastCollisionSweep; }
    public void setLastCollisionSweep(Instant lastCollisionSweep) { this.lastCollisionSweep = lastCollisionSweep; }
}
