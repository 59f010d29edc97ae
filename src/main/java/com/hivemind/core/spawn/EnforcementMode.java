package com.hivemind.core.spawn;

/**
 * How strictly hierarchy violations are handled. Level inference is heuristic and can be
 * wrong, so enforcement is a deployment choice.
 */
public enum EnforcementMode {
    /** Never blocks; illegal spawns are only annotated. */
    SUGGEST,
    /** Allows illegal spawns but returns an explanatory warning. */
    WARN,
    /** Denies illegal spawns. */
    ENFORCE
}
