package com.hivemind.core.engine;

import com.hivemind.core.collision.CollisionDetector;
import com.hivemind.core.collision.CollisionWarning;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.CompletionSignal;
import com.hivemind.core.progress.AggregationResult;
import com.hivemind.core.progress.ProgressAggregator;
import com.hivemind.core.recovery.RecoveryOutcome;
import com.hivemind.core.recovery.RecoveryService;
import com.hivemind.core.signal.SignalParser;
import com.hivemind.core.spawn.SpawnDecision;
import com.hivemind.core.spawn.SpawnRequest;
import com.hivemind.core.spawn.SpawnValidator;
import com.hivemind.core.state.HierarchyStore;
import com.hivemind.core.state.IntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Entry point for the events the hosting environment reports: spawn requests, agent
 * terminations and resource writes.
 * <p>
 * Terminations are parsed into a signal and routed: failures and blockers to the
 * {@link RecoveryService}, completions and partial results to the {@link ProgressAggregator}.
 * A signal that does not fit the hierarchy is logged and dropped; store failures propagate.
 */
@Service
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);

    private final SpawnValidator spawnValidator;
    private final SignalParser signalParser;
    private final RecoveryService recoveryService;
    private final ProgressAggregator progressAggregator;
    private final CollisionDetector collisionDetector;
    private final HierarchyStore store;
    private final HivemindMetrics metrics;

    public OrchestrationEngine(SpawnValidator spawnValidator, SignalParser signalParser,
                               RecoveryService recoveryService, ProgressAggregator progressAggregator,
                               CollisionDetector collisionDetector, HierarchyStore store, HivemindMetrics metrics) {
        this.spawnValidator = spawnValidator;
        this.signalParser = signalParser;
        this.recoveryService = recoveryService;
        this.progressAggregator = progressAggregator;
        this.collisionDetector = collisionDetector;
        this.store = store;
        this.metrics = metrics;
    }

    public SpawnDecision onSpawnRequest(SpawnRequest request) {
        MdcContext.setAgent(request.agentId(),
                request.requestedLevel() == null ? null : request.requestedLevel().name());
        try {
            return spawnValidator.validate(request);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Handles the final output of an agent that exited.
     */
    public TerminationResult onAgentTerminated(String agentId, String output) {
        MdcContext.setAgent(agentId, null);
        try {
            Optional<CompletionSignal> parsed = signalParser.parse(output);
            if (parsed.isEmpty()) {
                metrics.recordParseMiss();
                boolean released = store.mutate("release-agent", state -> state.removeAgent(agentId).isPresent());
                log.info("Agent {} terminated without a completion signal{}", agentId,
                        released ? "; released from the active set" : "");
                return TerminationResult.noSignal(agentId);
            }

            CompletionSignal signal = parsed.get();
            MdcContext.setTask(agentId, signal.taskId());
            metrics.recordSignal(signal.kind().name());
            log.debug("Agent {} reported {} for task {}", agentId, signal.kind(), signal.taskId());

            try {
                if (signal.kind().isNegative()) {
                    RecoveryOutcome outcome = recoveryService.handle(agentId, signal);
                    return new TerminationResult(agentId, signal, null, outcome, null);
                }
                AggregationResult progress = progressAggregator.apply(agentId, signal);
                return new TerminationResult(agentId, signal, progress, null, null);
            } catch (IntegrityException e) {
                log.error("Signal {} from agent {} does not fit the hierarchy: {}",
                        signal.kind(), agentId, e.getMessage());
                return TerminationResult.rejected(agentId, signal, e.getMessage());
            }
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<CollisionWarning> onResourceWritten(String resourceId, String agentId, Instant timestamp) {
        MdcContext.setAgent(agentId, null);
        try {
            return collisionDetector.recordWrite(resourceId, agentId, timestamp);
        } finally {
            MdcContext.clear();
        }
    }
}
