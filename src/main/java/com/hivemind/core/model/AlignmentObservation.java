package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One point on a Vision's alignment trend line. Never edited after creation.
 *
 * @param timestamp            when the observation was taken
 * @param trigger              what caused it (manual, epic_update, roadmap_update, ...)
 * @param score                weighted alignment score in [0, 1]
 * @param factors              timeline/scope/quality factors
 * @param completionPercentage the Vision's aggregated completion at observation time
 * @param issues               human-readable findings
 * @param driftDetected        {@code score < driftThreshold}
 * @param severity             severity band of the score
 * @param adjustments          recommendations, empty when no drift
 */
public record AlignmentObservation(
    Instant timestamp,
    String trigger,
    double score,
    AlignmentFactors factors,
    int completionPercentage,
    List<String> issues,
    boolean driftDetected,
    DriftSeverity severity,
    List<Adjustment> adjustments
) implements Serializable {

    public AlignmentObservation {
        issues = issues == null ? List.of() : List.copyOf(issues);
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }
}
