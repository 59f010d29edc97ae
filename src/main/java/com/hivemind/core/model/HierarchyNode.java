package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of the work hierarchy (Vision, Epic, Roadmap, Plan, Phase or Task).
 * <p>
 * {@code completionPercentage} is derived from the children and is never authoritative;
 * a Task's status is the primitive fact everything above it is computed from.
 * Task-only and Vision-only attributes are left empty on other levels.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class HierarchyNode {

    private String id;
    private NodeLevel level;
    private String title;
    private NodeStatus status = NodeStatus.PENDING;
    private int completionPercentage;
    private List<String> dependencies = new ArrayList<>();
    private NodeRef parentRef;
    private List<NodeRef> children = new ArrayList<>();
    private Instant updatedAt;

    // -- Task attributes --
    private int retryCount;
    private boolean retryPending;
    private String assignedAgent;
    private String blocker;
    private boolean escalated;
    private String error;
    private List<String> artifacts = new ArrayList<>();
    private String summary;
    private List<String> partialResults = new ArrayList<>();
    private Set<String> appliedSignals = new LinkedHashSet<>();

    // -- Vision attributes --
    private VisionPlan plan;
    private List<String> criteriaMet = new ArrayList<>();

    public HierarchyNode() {
    }

    public HierarchyNode(NodeLevel level, String id, String title) {
        this.level = level;
        this.id = id;
        this.title = title;
    }

    public NodeRef ref() {
        return new NodeRef(level, id);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return level == NodeLevel.TASK;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public NodeLevel getLevel() { return level; }
    public void setLevel(NodeLevel level) { this.level = level; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public NodeStatus getStatus() { return status; }
    public void setStatus(NodeStatus status) { this.status = status; }
    public int getCompletionPercentage() { return completionPercentage; }
    public void setCompletionPercentage(int completionPercentage) { this.completionPercentage = completionPercentage; }
    public List<String> getDependencies() { return dependencies; }
    public void setDependencies(List<String> dependencies) { this.dependencies = dependencies == null ? new ArrayList<>() : new ArrayList<>(dependencies); }
    public NodeRef getParentRef() { return parentRef; }
    public void setParentRef(NodeRef parentRef) { this.parentRef = parentRef; }
    public List<NodeRef> getChildren() { return children; }
    public void setChildren(List<NodeRef> children) { this.children = children == null ? new ArrayList<>() : new ArrayList<>(children); }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public boolean isRetryPending() { return retryPending; }
    public void setRetryPending(boolean retryPending) { this.retryPending = retryPending; }
    public String getAssignedAgent() { return assignedAgent; }
    public void setAssignedAgent(String assignedAgent) { this.assignedAgent = assignedAgent; }
    public String getBlocker() { return blocker; }
    public void setBlocker(String blocker) { this.blocker = blocker; }
    public boolean isEscalated() { return escalated; }
    public void setEscalated(boolean escalated) { this.escalated = escalated; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public List<String> getArtifacts() { return artifacts; }
    public void setArtifacts(List<String> artifacts) { this.artifacts = artifacts == null ? new ArrayList<>() : new ArrayList<>(artifacts); }
    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }
    public List<String> getPartialResults() { return partialResults; }
    public void setPartialResults(List<String> partialResults) { this.partialResults = partialResults == null ? new ArrayList<>() : new ArrayList<>(partialResults); }
    public Set<String> getAppliedSignals() { return appliedSignals; }
    public void setAppliedSignals(Set<String> appliedSignals) { this.appliedSignals = appliedSignals == null ? new LinkedHashSet<>() : new LinkedHashSet<>(appliedSignals); }

    public VisionPlan getPlan() { return plan; }
    public void setPlan(VisionPlan plan) { this.plan = plan; }
    public List<String> getCriteriaMet() { return criteriaMet; }
    public void setCriteriaMet(List<String> criteriaMet) { this.criteriaMet = criteriaMet == null ? new ArrayList<>() : new ArrayList<>(criteriaMet); }
}
