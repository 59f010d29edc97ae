package com.hivemind.core.model;

/**
 * Status of an agent. Agents leave the active set when they terminate, so the set
 * itself only ever holds RUNNING agents; the other values describe how one ended.
 */
public enum AgentStatus {
    RUNNING,
    COMPLETED,
    BLOCKED,
    FAILED
}
