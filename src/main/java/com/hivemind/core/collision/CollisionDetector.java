package com.hivemind.core.collision;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.ResourceWrite;
import com.hivemind.core.state.HierarchyState;
import com.hivemind.core.state.HierarchyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Warns when two agents write the same resource within the collision window.
 * Advisory only: the write is always recorded and never blocked.
 * <p>
 * The write index is part of the shared state so agents in different processes see each
 * other's writes. It is swept periodically: entries older than three windows are dropped
 * and the number of tracked resources is capped, evicting the least recently written.
 */
@Service
public class CollisionDetector {

    private static final Logger log = LoggerFactory.getLogger(CollisionDetector.class);

    private final HierarchyStore store;
    private final HivemindProperties properties;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;

    public CollisionDetector(HierarchyStore store, HivemindProperties properties, EventBus eventBus,
                             HivemindMetrics metrics) {
        this.store = store;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Optional<CollisionWarning> recordWrite(String resourceId, String agentId, Instant timestamp) {
        String writer = agentId == null || agentId.isBlank() ? Agent.MAIN : agentId;
        Instant at = timestamp == null ? store.clock().instant() : timestamp;
        Duration window = Duration.ofMillis(properties.getCollisionWindowMs());
        Duration sweepInterval = Duration.ofMillis(properties.getCollision().getSweepIntervalMs());
        int maxTracked = properties.getCollision().getMaxTrackedResources();

        Optional<CollisionWarning> warning = store.mutate("record-write", state -> {
            Optional<CollisionWarning> found = check(state, resourceId, writer, at, window);
            state.getCollisionIndex().computeIfAbsent(resourceId, k -> new ArrayList<>())
                    .add(new ResourceWrite(writer, at));
            Instant lastSweep = state.getLastCollisionSweep();
            if (lastSweep == null) {
                state.setLastCollisionSweep(at);
            } else if (Duration.between(lastSweep, at).compareTo(sweepInterval) > 0) {
                sweep(state, at, window, maxTracked);
            }
            return found;
        });

        warning.ifPresent(w -> {
            log.warn("Possible write collision: {}", w.message());
            metrics.recordCollision();
            eventBus.publish(new HivemindEvent(HivemindEvent.RESOURCE_COLLISION, null, null,
                    Map.of("resourceId", resourceId, "agentId", writer,
                            "otherAgents", w.otherAgents(), "gapMs", w.smallestGap().toMillis()),
                    at));
        });
        return warning;
    }

    private static Optional<CollisionWarning> check(HierarchyState state, String resourceId, String writer,
                                                    Instant at, Duration window) {
        List<ResourceWrite> writes = state.getCollisionIndex().getOrDefault(resourceId, List.of());
        Set<String> others = new LinkedHashSet<>();
        Duration smallest = null;
        for (ResourceWrite write : writes) {
            if (writer.equals(write.agentId())) {
                continue;
            }
            Duration gap = Duration.between(write.timestamp(), at).abs();
            if (gap.compareTo(window) < 0) {
                others.add(write.agentId());
                if (smallest == null || gap.compareTo(smallest) < 0) {
                    smallest = gap;
                }
            }
        }
        if (others.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CollisionWarning(resourceId, writer, new ArrayList<>(others), smallest, at));
    }

    static void sweep(HierarchyState state, Instant now, Duration window, int maxTracked) {
        Instant cutoff = now.minus(window.multipliedBy(3));
        Map<String, List<ResourceWrite>> index = state.getCollisionIndex();
        index.values().forEach(writes -> writes.removeIf(w -> w.timestamp().isBefore(cutoff)));
        index.values().removeIf(List::isEmpty);

        if (index.size() > maxTracked) {
            List<String> oldestFirst = index.entrySet().stream()
                    .sorted(Comparator.comparing(e -> lastWrite(e.getValue())))
                    .map(Map.Entry::getKey)
                    .toList();
            int excess = index.size() - maxTracked;
            for (int i = 0; i < excess; i++) {
                index.remove(oldestFirst.get(i));
            }
        }
        state.setLastCollisionSweep(now);
    }

    private static Instant lastWrite(List<ResourceWrite> writes) {
        return writes.stream().map(ResourceWrite::timestamp).max(Comparator.naturalOrder()).orElse(Instant.MIN);
    }
}
