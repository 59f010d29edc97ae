package com.hivemind.core.model;

/**
 * Severity band of an alignment score.
 */
public enum DriftSeverity {
    NONE(0.95),
    LOW(0.85),
    MEDIUM(0.70),
    HIGH(0.50),
    CRITICAL(0.0);

    private final double floor;

    DriftSeverity(double floor) {
        this.floor = floor;
    }

    public double floor() {
        return floor;
    }

    public static DriftSeverity forScore(double score) {
        for (DriftSeverity severity : values()) {
            if (score >= severity.floor) {
                return severity;
            }
        }
        return CRITICAL;
    }
}
