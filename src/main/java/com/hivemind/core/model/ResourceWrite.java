package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A single write to a shared resource, kept in the collision window.
 */
public record ResourceWrite(String agentId, Instant timestamp) implements Serializable {
}
