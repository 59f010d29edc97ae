package com.hivemind.core.model;

import java.io.Serializable;

/**
 * The three alignment factors, each in [0, 1].
 */
public record AlignmentFactors(double timeline, double scope, double quality) implements Serializable {

    public static final double TIMELINE_WEIGHT = 0.4;
    public static final double SCOPE_WEIGHT = 0.3;
    public static final double QUALITY_WEIGHT = 0.3;

    public double weightedScore() {
        return TIMELINE_WEIGHT * timeline + SCOPE_WEIGHT * scope + QUALITY_WEIGHT * quality;
    }
}
