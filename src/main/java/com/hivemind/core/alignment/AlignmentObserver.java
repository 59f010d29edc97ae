package com.hivemind.core.alignment;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.Adjustment;
import com.hivemind.core.model.AlignmentFactors;
import com.hivemind.core.model.AlignmentObservation;
import com.hivemind.core.model.DriftSeverity;
import com.hivemind.core.model.HierarchyNode;
import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.VisionPlan;
import com.hivemind.core.state.HierarchyState;
import com.hivemind.core.state.HierarchyStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores how well a Vision's execution tracks its declared plan and keeps the trend.
 * <p>
 * Three factors in [0, 1], each neutral (1.0) when its input is missing:
 * <pre>
 *   timeline = 1 - max(0, elapsed/estimated - progress)
 *   scope    = 1 - |actualEpics - plannedEpics| / plannedEpics
 *   quality  = criteriaMetRatio / progress
 * </pre>
 * The score weighs them 0.4 / 0.3 / 0.3. Observations are appended to the Vision's
 * capped history and never edited afterwards.
 */
@Service
public class AlignmentObserver {

    private static final Logger log = LoggerFactory.getLogger(AlignmentObserver.class);

    static final double FACTOR_WARNING = 0.8;
    static final double TIMELINE_CRITICAL = 0.5;
    static final double SLIPPAGE_ISSUE = 0.2;

    private static final Set<NodeLevel> OBSERVED_LEVELS = EnumSet.of(NodeLevel.EPIC, NodeLevel.ROADMAP, NodeLevel.VISION);

    private final HierarchyStore store;
    private final HivemindProperties properties;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    public AlignmentObserver(HierarchyStore store, HivemindProperties properties, EventBus eventBus,
                             HivemindMetrics metrics) {
        this.store = store;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @PostConstruct
    public void start() {
        subscriptions.add(eventBus.subscribe(HivemindEvent.NODE_COMPLETED, this::onProgressEvent));
        subscriptions.add(eventBus.subscribe(HivemindEvent.MILESTONE_REACHED, this::onProgressEvent));
    }

    @PreDestroy
    public void stop() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    /**
     * Takes an observation of {@code visionId} now and appends it to the history.
     */
    public AlignmentObservation observe(String visionId, String trigger) {
        double driftThreshold = properties.getDriftThreshold();
        double criticalThreshold = properties.getCriticalThreshold();
        int cap = properties.getObservationHistorySize();

        AlignmentObservation observation = store.mutate("observe", state -> {
            HierarchyNode vision = state.requireNode(NodeRef.of(NodeLevel.VISION, visionId));
            AlignmentObservation taken = evaluate(state, vision, trigger, store.clock().instant(),
                    driftThreshold, criticalThreshold);
            state.appendObservation(visionId, taken, cap);
            return taken;
        });

        metrics.recordAlignment(observation.score(), observation.driftDetected());
        Map<String, Object> payload = new HashMap<>();
        payload.put("score", observation.score());
        payload.put("severity", observation.severity().name());
        payload.put("trigger", observation.trigger());
        NodeRef ref = NodeRef.of(NodeLevel.VISION, visionId);
        eventBus.publish(new HivemindEvent(HivemindEvent.VISION_OBSERVED, visionId, ref, payload,
                observation.timestamp()));
        if (observation.driftDetected()) {
            log.warn("Vision {} drifting: score {} ({}), issues {}", visionId,
                    String.format(Locale.ROOT, "%.3f", observation.score()), observation.severity(),
                    observation.issues());
            Map<String, Object> drift = new HashMap<>(payload);
            drift.put("issues", observation.issues());
            drift.put("adjustments", observation.adjustments().size());
            eventBus.publish(new HivemindEvent(HivemindEvent.VISION_DRIFT, visionId, ref, drift,
                    observation.timestamp()));
        } else {
            log.info("Vision {} aligned: score {}", visionId,
                    String.format(Locale.ROOT, "%.3f", observation.score()));
        }
        return observation;
    }

    /**
     * Records a success criterion as met.
     *
     * @return false if it was already met
     * @throws IllegalArgumentException if the Vision's plan does not list the criterion
     */
    public boolean markCriterionMet(String visionId, String criterion) {
        return store.mutate("criterion-met", state -> {
            HierarchyNode vision = state.requireNode(NodeRef.of(NodeLevel.VISION, visionId));
            VisionPlan plan = vision.getPlan();
            if (plan == null || !plan.successCriteria().contains(criterion)) {
                throw new IllegalArgumentException("Vision " + visionId + " has no success criterion '" + criterion + "'");
            }
            if (vision.getCriteriaMet().contains(criterion)) {
                return false;
            }
            vision.getCriteriaMet().add(criterion);
            vision.setUpdatedAt(store.clock().instant());
            return true;
        });
    }

    public List<AlignmentObservation> history(String visionId) {
        return store.read(state -> List.copyOf(state.observationsFor(visionId)));
    }

    private void onProgressEvent(HivemindEvent event) {
        NodeRef node = event.node();
        if (node == null || event.visionId() == null || !OBSERVED_LEVELS.contains(node.level())) {
            return;
        }
        observe(event.visionId(), node.level().name().toLowerCase(Locale.ROOT) + "_update");
    }

    static AlignmentObservation evaluate(HierarchyState state, HierarchyNode vision, String trigger, Instant now,
                                         double driftThreshold, double criticalThreshold) {
        VisionPlan plan = vision.getPlan();
        int percentage = vision.getCompletionPercentage();
        double progress = percentage / 100.0;
        int actualEpics = (int) state.children(vision).stream()
                .filter(n -> n.getLevel() == NodeLevel.EPIC)
                .count();

        double elapsedRatio = 0.0;
        boolean timelineKnown = plan != null && plan.estimatedDays() > 0 && plan.startedAt() != null;
        if (timelineKnown) {
            double elapsedDays = Duration.between(plan.startedAt(), now).toMillis() / 86_400_000.0;
            elapsedRatio = Math.max(0.0, elapsedDays) / plan.estimatedDays();
        }
        double criteriaRatio = criteriaRatio(plan, vision.getCriteriaMet());

        AlignmentFactors factors = new AlignmentFactors(
                timelineKnown ? timeline(elapsedRatio, progress) : 1.0,
                plan == null ? 1.0 : scope(actualEpics, plan.plannedEpics()),
                plan == null || plan.successCriteria().isEmpty() ? 1.0 : quality(criteriaRatio, progress));
        double score = factors.weightedScore();
        boolean drift = score < driftThreshold;

        List<String> issues = new ArrayList<>();
        if (timelineKnown && elapsedRatio - progress > SLIPPAGE_ISSUE) {
            issues.add(String.format(Locale.ROOT, "Behind schedule: %.0f%% of estimated time elapsed, %d%% complete",
                    elapsedRatio * 100, percentage));
        }
        if (plan != null && plan.plannedEpics() > 0 && actualEpics != plan.plannedEpics()) {
            issues.add(actualEpics > plan.plannedEpics()
                    ? "Scope creep: " + actualEpics + " Epics against " + plan.plannedEpics() + " planned"
                    : "Scope reduction: " + actualEpics + " Epics against " + plan.plannedEpics() + " planned");
        }
        if (factors.quality() < FACTOR_WARNING) {
            issues.add(String.format(Locale.ROOT, "Quality lag: %.0f%% of success criteria met at %d%% completion",
                    criteriaRatio * 100, percentage));
        }

        List<Adjustment> adjustments = new ArrayList<>();
        if (drift) {
            if (factors.timeline() < FACTOR_WARNING) {
                adjustments.add(new Adjustment("timeline",
                        factors.timeline() < TIMELINE_CRITICAL ? "critical" : "warning",
                        "Re-prioritize the remaining Epics or extend the estimate",
                        "Brings the schedule back in line with progress"));
            }
            if (factors.scope() < FACTOR_WARNING) {
                adjustments.add(new Adjustment("scope", "warning",
                        "Re-baseline the plan against the current Epic list",
                        "Restores a meaningful scope baseline"));
            }
            if (factors.quality() < FACTOR_WARNING) {
                adjustments.add(new Adjustment("quality", "warning",
                        "Verify success criteria before starting new work",
                        "Keeps completion backed by met criteria"));
            }
            if (score < criticalThreshold) {
                adjustments.add(new Adjustment("replan", "critical",
                        "Replan the Vision",
                        "Resets the plan the trend is measured against"));
            }
        }

        return new AlignmentObservation(now, trigger == null ? "manual" : trigger, score, factors, percentage,
                issues, drift, DriftSeverity.forScore(score), adjustments);
    }

    static double timeline(double elapsedRatio, double progress) {
        return Math.max(0.0, 1.0 - Math.max(0.0, elapsedRatio - progress));
    }

    static double scope(int actualEpics, int plannedEpics) {
        if (plannedEpics <= 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - Math.abs(actualEpics - plannedEpics) / (double) plannedEpics);
    }

    /**
     * Neutral until there is progress to compare against.
     */
    static double quality(double criteriaRatio, double progress) {
        if (progress <= 0.0) {
            return 1.0;
        }
        return Math.min(1.0, Math.max(0.0, criteriaRatio / progress));
    }

    private static double criteriaRatio(VisionPlan plan, List<String> met) {
        if (plan == null || plan.successCriteria().isEmpty()) {
            return 0.0;
        }
        long count = met.stream().filter(plan.successCriteria()::contains).distinct().count();
        return (double) count / plan.successCriteria().size();
    }
}
