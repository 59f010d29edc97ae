package com.hivemind.core.config;

import com.hivemind.core.spawn.EnforcementMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "hivemind")
public class HivemindProperties {

    private EnforcementMode enforcementMode = EnforcementMode.ENFORCE;
    private int maxRetries = 3;
    private double driftThreshold = 0.85;
    private double criticalThreshold = 0.60;
    private long collisionWindowMs = 20_000;
    private List<Integer> milestoneThresholds = new ArrayList<>(List.of(25, 50, 75, 100));
    private int observationHistorySize = 50;
    private Store store = new Store();
    private Collision collision = new Collision();

    public EnforcementMode getEnforcementMode() { return enforcementMode; }
    public void setEnforcementMode(EnforcementMode enforcementMode) { this.enforcementMode = enforcementMode; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public double getDriftThreshold() { return driftThreshold; }
    public void setDriftThreshold(double driftThreshold) { this.driftThreshold = driftThreshold; }
    public double getCriticalThreshold() { return criticalThreshold; }
    public void setCriticalThreshold(double criticalThreshold) { this.criticalThreshold = criticalThreshold; }
    public long getCollisionWindowMs() { return collisionWindowMs; }
    public void setCollisionWindowMs(long collisionWindowMs) { this.collisionWindowMs = collisionWindowMs; }

    /**
     * Thresholds in ascending order, duplicates and out-of-range values dropped.
     */
    public List<Integer> getMilestoneThresholds() {
        return milestoneThresholds.stream()
                .filter(t -> t != null && t > 0 && t <= 100)
                .distinct()
                .sorted()
                .toList();
    }
    public void setMilestoneThresholds(List<Integer> milestoneThresholds) {
        this.milestoneThresholds = milestoneThresholds == null ? new ArrayList<>() : new ArrayList<>(milestoneThresholds);
    }
    public int getObservationHistorySize() { return observationHistorySize; }
    public void setObservationHistorySize(int observationHistorySize) { this.observationHistorySize = observationHistorySize; }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Collision getCollision() { return collision; }
    public void setCollision(Collision collision) { this.collision = collision; }

    public static class Store {
        /** JSON state file shared by all agent processes; blank keeps state in memory. */
        private String stateFile = ".hivemind/state.json";
        private int conflictRetries = 5;
        private long conflictBackoffMs = 10;

        public String getStateFile() { return stateFile; }
        public void setStateFile(String stateFile) { this.stateFile = stateFile; }
        public int getConflictRetries() { return conflictRetries; }
        public void setConflictRetries(int conflictRetries) { this.conflictRetries = conflictRetries; }
        public long getConflictBackoffMs() { return conflictBackoffMs; }
        public void setConflictBackoffMs(long conflictBackoffMs) { this.conflictBackoffMs = conflictBackoffMs; }
    }

    public static class Collision {
        private long sweepIntervalMs = 60_000;
        private int maxTrackedResources = 200;

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
        public int getMaxTrackedResources() { return maxTrackedResources; }
        public void setMaxTrackedResources(int maxTrackedResources) { this.maxTrackedResources = maxTrackedResources; }
    }
}
