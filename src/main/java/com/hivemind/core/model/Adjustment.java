package com.hivemind.core.model;

import java.io.Serializable;

/**
 * A recommendation produced when drift is detected.
 *
 * @param area           timeline, scope, quality or replan
 * @param severity       "warning" or "critical"
 * @param recommendation what to do
 * @param impact         what doing it restores
 */
public record Adjustment(
    String area,
    String severity,
    String recommendation,
    String impact
) implements Serializable {

    public boolean critical() {
        return "critical".equals(severity);
    }
}
