package com.hivemind.core.spawn;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentLevel;
import com.hivemind.core.model.HierarchyNode;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.NodeStatus;
import com.hivemind.core.state.HierarchyState;
import com.hivemind.core.state.HierarchyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Admits new agents according to the L1 → L2 → L3 hierarchy:
 * <pre>
 *   main → L1, L2, L3
 *   L1   → L2, L3
 *   L2   → L3
 *   L3   → (none)
 * </pre>
 * The spawner's level comes from the active agent set; an unknown spawner is treated as
 * {@code main}. Validation and registration of the new agent happen in one store
 * transaction, so two concurrent spawns of the same agent id cannot both pass.
 */
@Service
public class SpawnValidator {

    private static final Logger log = LoggerFactory.getLogger(SpawnValidator.class);

    private final HierarchyStore store;
    private final AgentLevelDetector detector;
    private final HivemindProperties properties;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;

    public SpawnValidator(HierarchyStore store, AgentLevelDetector detector, HivemindProperties properties,
                          EventBus eventBus, HivemindMetrics metrics) {
        this.store = store;
        this.detector = detector;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public SpawnDecision validate(SpawnRequest request) {
        EnforcementMode mode = properties.getEnforcementMode();
        LevelInference inference = request.requestedLevel() != null
                ? LevelInference.declared(request.requestedLevel())
                : detector.detect(request.prompt(), request.description());

        SpawnDecision decision = store.mutate("spawn", state -> admit(state, request, inference, mode));

        metrics.recordSpawnDecision(decision.spawnerLevel().name(), decision.requestedLevel().name(),
                decision.allowed());
        if (decision.allowed()) {
            log.info("Admitted {} agent {} (spawner level {}, basis {})", decision.requestedLevel(),
                    decision.agentId(), decision.spawnerLevel(), inference.basis());
            if (decision.hierarchyViolation()) {
                log.warn("Hierarchy violation allowed in {} mode: {} spawned {}", mode,
                        decision.spawnerLevel(), decision.requestedLevel());
            }
        } else {
            log.warn("Denied spawn of {} by {}: {}", decision.requestedLevel(),
                    decision.spawnerLevel(), decision.message());
        }
        publish(decision, request);
        return decision;
    }

    /**
     * Level of {@code spawnerAgentId} in {@code state}; unknown or absent spawners are {@code main}.
     */
    public static AgentLevel resolveSpawnerLevel(HierarchyState state, String spawnerAgentId) {
        if (spawnerAgentId == null || spawnerAgentId.isBlank() || Agent.MAIN.equals(spawnerAgentId)) {
            return AgentLevel.MAIN;
        }
        return state.agent(spawnerAgentId)
                .map(Agent::getLevel)
                .orElse(AgentLevel.MAIN);
    }

    private SpawnDecision admit(HierarchyState state, SpawnRequest request, LevelInference inference,
                                EnforcementMode mode) {
        AgentLevel spawnerLevel = resolveSpawnerLevel(state, request.spawnerAgentId());
        AgentLevel requested = inference.level();
        boolean legal = spawnerLevel.canSpawn(requested);
        String agentId = request.agentId() != null && !request.agentId().isBlank()
                ? request.agentId()
                : generateAgentId(requested);
        List<String> annotations = new ArrayList<>();

        if (state.agent(agentId).isPresent()) {
            return new SpawnDecision(false, agentId, spawnerLevel, requested, inference, !legal,
                    "Agent " + agentId + " is already active", annotations);
        }

        String message = null;
        if (!legal) {
            String violation = formatViolation(spawnerLevel, requested);
            switch (mode) {
                case ENFORCE -> {
                    return new SpawnDecision(false, agentId, spawnerLevel, requested, inference, true,
                            violation, annotations);
                }
                case WARN -> message = "Warning: " + violation;
                case SUGGEST -> annotations.add("Suggestion: " + resolution(spawnerLevel));
            }
        }

        Instant now = store.clock().instant();
        Agent agent = new Agent(agentId, requested, request.domain(), request.taskId(),
                request.spawnerAgentId(), now);
        state.registerAgent(agent);

        if (request.taskId() != null) {
            Optional<HierarchyNode> task = state.node(NodeRef.task(request.taskId()));
            if (task.isEmpty()) {
                annotations.add("Task " + request.taskId() + " is not part of the hierarchy");
            } else {
                HierarchyNode node = task.get();
                agent.setRetryCount(node.getRetryCount());
                node.setAssignedAgent(agentId);
                if (node.getStatus() == NodeStatus.PENDING) {
                    node.setStatus(NodeStatus.IN_PROGRESS);
                    node.setRetryPending(false);
                    node.setUpdatedAt(now);
                }
            }
        }
        return new SpawnDecision(true, agentId, spawnerLevel, requested, inference, !legal, message, annotations);
    }

    private static String generateAgentId(AgentLevel level) {
        return level.name().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    static String formatViolation(AgentLevel spawner, AgentLevel requested) {
        return "Hierarchy violation: " + spawner.displayName() + " cannot spawn " + requested.displayName()
                + ". " + resolution(spawner);
    }

    private static String resolution(AgentLevel spawner) {
        if (spawner == AgentLevel.L3) {
            return "L3 workers should return results, not spawn agents; escalate to L2 if needed.";
        }
        String allowed = spawner.allowedSpawns().stream()
                .map(AgentLevel::name)
                .collect(Collectors.joining(" or "));
        return "Only spawn " + allowed + " level agents.";
    }

    private void publish(SpawnDecision decision, SpawnRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("agentId", decision.agentId());
        payload.put("spawnerLevel", decision.spawnerLevel().name());
        payload.put("requestedLevel", decision.requestedLevel().name());
        payload.put("violation", decision.hierarchyViolation());
        if (decision.message() != null) {
            payload.put("message", decision.message());
        }
        NodeRef task = request.taskId() == null ? null : NodeRef.task(request.taskId());
        eventBus.publish(new HivemindEvent(
                decision.allowed() ? HivemindEvent.AGENT_SPAWNED : HivemindEvent.AGENT_DENIED,
                null, task, payload, store.clock().instant()));
    }
}
