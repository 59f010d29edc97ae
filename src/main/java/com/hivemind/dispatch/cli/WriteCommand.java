package com.hivemind.dispatch.cli;

import com.hivemind.core.collision.CollisionWarning;
import com.hivemind.core.engine.OrchestrationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: hivemind write &lt;resource&gt; --agent &lt;id&gt;
 * <p>
 * Records a resource write and prints a warning on collision. Never fails the write.
 */
@Command(name = "write", mixinStandardHelpOptions = true, description = "Record a resource write")
@Component
public class WriteCommand implements Runnable {

    @Parameters(index = "0", description = "Resource id, usually a file path")
    private String resourceId;

    @Option(names = {"--agent", "-a"}, description = "Id of the writing agent (default: main)")
    private String agentId;

    private final OrchestrationEngine engine;

    public WriteCommand(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        Optional<CollisionWarning> warning = engine.onResourceWritten(resourceId, agentId, null);
        warning.ifPresent(w -> ConsoleOutput.warn(w.message()));
    }
}
