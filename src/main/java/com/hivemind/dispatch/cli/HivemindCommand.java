package com.hivemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Hivemind. Hooks of the hosting environment call one
 * subcommand per event.
 */
@Command(
        name = "hivemind",
        mixinStandardHelpOptions = true,
        version = "Hivemind 0.1.0",
        description = "Multi-level agent orchestration with hierarchical progress tracking",
        subcommands = {
                LoadCommand.class,
                SpawnCommand.class,
                SignalCommand.class,
                WriteCommand.class,
                StatusCommand.class,
                ObserveCommand.class,
                ResolveCommand.class,
                AbortCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HivemindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
