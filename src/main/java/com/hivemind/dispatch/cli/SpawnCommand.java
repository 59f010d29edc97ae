package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.OrchestrationEngine;
import com.hivemind.core.model.AgentLevel;
import com.hivemind.core.spawn.SpawnDecision;
import com.hivemind.core.spawn.SpawnRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: hivemind spawn
 * <p>
 * Validates a spawn request before the host starts the agent. Exits with 2 when the
 * spawn is denied, so a pre-spawn hook can block it.
 */
@Command(name = "spawn", mixinStandardHelpOptions = true, description = "Validate and register a new agent")
@Component
public class SpawnCommand implements Callable<Integer> {

    static final int DENIED = 2;

    @Option(names = {"--spawner", "-s"}, description = "Id of the spawning agent (default: main)")
    private String spawner;

    @Option(names = {"--agent-id", "-a"}, description = "Id for the new agent (generated when absent)")
    private String agentId;

    @Option(names = {"--level", "-l"}, description = "Declared level: L1, L2 or L3 (inferred when absent)")
    private AgentLevel level;

    @Option(names = {"--prompt", "-p"}, description = "Prompt the agent starts with")
    private String prompt;

    @Option(names = {"--description", "-d"}, description = "Short description of the agent")
    private String description;

    @Option(names = {"--domain"}, description = "Domain tag")
    private String domain;

    @Option(names = {"--task", "-t"}, description = "Task the agent will work")
    private String taskId;

    private final OrchestrationEngine engine;

    public SpawnCommand(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        if (level == AgentLevel.MAIN) {
            ConsoleOutput.error("main is not a spawnable level");
            return 1;
        }
        SpawnDecision decision = engine.onSpawnRequest(
                new SpawnRequest(spawner, agentId, level, prompt, description, domain, taskId));
        if (decision.denied()) {
            ConsoleOutput.error(decision.message());
            return DENIED;
        }
        ConsoleOutput.agent(decision.requestedLevel().name(), "admitted " + decision.agentId()
                + " (spawned by " + decision.spawnerLevel().displayName() + ", " + decision.inference().basis() + ")");
        if (decision.message() != null) {
            ConsoleOutput.warn(decision.message());
        }
        decision.annotations().forEach(ConsoleOutput::info);
        return 0;
    }
}
