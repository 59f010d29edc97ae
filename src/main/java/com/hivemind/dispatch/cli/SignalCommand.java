package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.OrchestrationEngine;
import com.hivemind.core.engine.TerminationResult;
import com.hivemind.core.model.ProgressUpdate;
import com.hivemind.core.recovery.RecoveryOutcome;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: hivemind signal &lt;agent-id&gt; [--output file]
 * <p>
 * Reports an agent's termination. The agent's final output is read from the given
 * file, or from standard input.
 */
@Command(name = "signal", mixinStandardHelpOptions = true, description = "Report an agent's termination and output")
@Component
public class SignalCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Id of the agent that terminated")
    private String agentId;

    @Option(names = {"--output", "-o"}, description = "File holding the agent's output (default: stdin)")
    private Path outputFile;

    private final OrchestrationEngine engine;
    private final InputStream stdin;

    @Autowired
    public SignalCommand(OrchestrationEngine engine) {
        this(engine, System.in);
    }

    SignalCommand(OrchestrationEngine engine, InputStream stdin) {
        this.engine = engine;
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        String output;
        try {
            output = outputFile != null
                    ? Files.readString(outputFile, StandardCharsets.UTF_8)
                    : new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read agent output: " + e.getMessage());
            return 1;
        }

        TerminationResult result = engine.onAgentTerminated(agentId, output);
        if (!result.hasSignal()) {
            ConsoleOutput.info("No completion signal from " + agentId);
            return 0;
        }
        if (result.error() != null) {
            ConsoleOutput.error(result.error());
            return 1;
        }
        if (result.recovery() != null) {
            RecoveryOutcome outcome = result.recovery();
            if (!outcome.applied()) {
                ConsoleOutput.info("Ignored: " + outcome.detail());
            } else {
                ConsoleOutput.warn("Task " + outcome.taskId() + ": " + outcome.action()
                        + " (attempt " + outcome.attempt() + ") " + outcome.detail());
            }
            return 0;
        }
        if (!result.progress().applied()) {
            ConsoleOutput.info("Ignored: " + result.progress().detail());
            return 0;
        }
        ConsoleOutput.success(result.signal().kind() + " " + result.progress().taskId());
        for (ProgressUpdate milestone : result.progress().milestones()) {
            ConsoleOutput.success(milestone.node() + " reached " + milestone.milestone() + "%");
        }
        return 0;
    }
}
