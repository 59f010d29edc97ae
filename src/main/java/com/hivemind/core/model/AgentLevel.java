package com.hivemind.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Agent hierarchy levels. {@link #MAIN} is the operator/top-level conversation;
 * it only ever appears as a spawner and is never registered as an agent.
 */
public enum AgentLevel {
    MAIN,
    L1,
    L2,
    L3;

    /**
     * Levels this level is allowed to spawn.
     */
    public Set<AgentLevel> allowedSpawns() {
        return switch (this) {
            case MAIN -> EnumSet.of(L1, L2, L3);
            case L1 -> EnumSet.of(L2, L3);
            case L2 -> EnumSet.of(L3);
            case L3 -> EnumSet.noneOf(AgentLevel.class);
        };
    }

    public boolean canSpawn(AgentLevel requested) {
        return allowedSpawns().contains(requested);
    }

    public String displayName() {
        return switch (this) {
            case MAIN -> "main";
            case L1 -> "L1 (Orchestrator)";
            case L2 -> "L2 (Specialist)";
            case L3 -> "L3 (Worker)";
        };
    }

    public static AgentLevel parse(String value) {
        return AgentLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
