package com.hivemind.core.model;

import java.util.Locale;

/**
 * Levels of the work hierarchy, ordered from the broadest (Vision) to the atomic (Task).
 */
public enum NodeLevel {
    VISION,
    EPIC,
    ROADMAP,
    PLAN,
    PHASE,
    TASK;

    /**
     * True when nodes at this level may own nodes at {@code other}.
     * Intermediate levels may be skipped (a Roadmap can own Phases directly).
     */
    public boolean canOwn(NodeLevel other) {
        return other.ordinal() > this.ordinal();
    }

    public static NodeLevel parse(String value) {
        return NodeLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
