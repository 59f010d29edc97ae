package com.hivemind.core.model;

import java.time.Instant;

/**
 * An agent process registered in the active set while it works a task.
 */
public class Agent {

    public static final String MAIN = "main";

    private String agentId;
    private AgentLevel level;
    private String domain = "general";
    private AgentStatus status = AgentStatus.RUNNING;
    private String taskRef;
    private String spawnedBy = MAIN;
    /** Retries of the task that preceded this agent. */
    private int retryCount;
    private Instant spawnedAt;

    public Agent() {
    }

    public Agent(String agentId, AgentLevel level, String domain, String taskRef,
                 String spawnedBy, Instant spawnedAt) {
        this.agentId = agentId;
        this.level = level;
        this.domain = domain == null || domain.isBlank() ? "general" : domain;
        this.taskRef = taskRef;
        this.spawnedBy = spawnedBy == null || spawnedBy.isBlank() ? MAIN : spawnedBy;
        this.spawnedAt = spawnedAt;
    }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }
    public AgentLevel getLevel() { return level; }
    public void setLevel(AgentLevel level) { this.level = level; }
    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }
    public AgentStatus getStatus() { return status; }
    public void setStatus(AgentStatus status) { this.status = status; }
    public String getTaskRef() { return taskRef; }
    public void setTaskRef(String taskRef) { this.taskRef = taskRef; }
    public String getSpawnedBy() { return spawnedBy; }
    public void setSpawnedBy(String spawnedBy) { this.spawnedBy = spawnedBy; }
    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public Instant getSpawnedAt() { return spawnedAt; }
    public void setSpawnedAt(Instant spawnedAt) { this.spawnedAt = spawnedAt; }
}
