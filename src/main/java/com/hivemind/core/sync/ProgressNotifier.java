package com.hivemind.core.sync;

import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.ProgressUpdate;
import com.hivemind.core.progress.AggregationResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Delivers committed progress changes to the {@link ExternalSync} and the {@link EventBus}.
 * Fire-and-forget: delivery runs on its own thread so a slow tracker never holds up the
 * store, and a failing one is never retried here.
 */
@Service
public class ProgressNotifier {

    private static final Logger log = LoggerFactory.getLogger(ProgressNotifier.class);

    private final ExternalSync sync;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final Clock clock;
    private final Executor executor;

    @Autowired
    public ProgressNotifier(ExternalSync sync, EventBus eventBus, HivemindMetrics metrics, Clock clock) {
        this(sync, eventBus, metrics, clock, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hivemind-sync");
            t.setDaemon(true);
            return t;
        }));
    }

    public ProgressNotifier(ExternalSync sync, EventBus eventBus, HivemindMetrics metrics, Clock clock,
                            Executor executor) {
        this.sync = sync;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
    }

    public void dispatch(AggregationResult result) {
        if (!result.applied() || result.updates().isEmpty()) {
            return;
        }
        executor.execute(() -> deliver(result));
    }

    private void deliver(AggregationResult result) {
        for (ProgressUpdate update : result.updates()) {
            try {
                sync.publish(update);
            } catch (RuntimeException e) {
                metrics.recordSyncFailure();
                log.warn("External sync failed for {}: {}", update.node(), e.getMessage(), e);
            }
        }

        for (ProgressUpdate update : result.updates()) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("percentage", update.percentage());
            payload.put("status", update.status().name());
            if (update.hasMilestone()) {
                payload.put("threshold", update.milestone());
                metrics.recordMilestone(update.node().level().name(), update.milestone());
                publish(HivemindEvent.MILESTONE_REACHED, result, update.node(), payload);
            } else {
                publish(HivemindEvent.NODE_PROGRESS, result, update.node(), payload);
            }
        }
        for (NodeRef completed : result.completedNodes()) {
            publish(HivemindEvent.NODE_COMPLETED, result, completed, Map.of("percentage", 100));
        }
        for (NodeRef advanced : result.advancedNodes()) {
            publish(HivemindEvent.NODE_ADVANCED, result, advanced, Map.of());
        }
    }

    private void publish(String type, AggregationResult result, NodeRef node, Map<String, Object> payload) {
        eventBus.publish(new HivemindEvent(type, result.visionId(), node, payload, clock.instant()));
    }

    @PreDestroy
    public void close() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Pending sync notifications dropped on shutdown");
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                service.shutdownNow();
            }
        }
    }
}
