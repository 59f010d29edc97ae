package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * The declared plan of a Vision, used as the baseline for drift scoring.
 *
 * @param estimatedDays   estimated duration of the whole Vision in days
 * @param plannedEpics    number of Epics the Vision was planned with
 * @param successCriteria criteria that define the Vision as achieved
 * @param startedAt       when execution started (elapsed time is measured from here)
 */
public record VisionPlan(
    double estimatedDays,
    int plannedEpics,
    List<String> successCriteria,
    Instant startedAt
) implements Serializable {

    public VisionPlan {
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
    }
}
