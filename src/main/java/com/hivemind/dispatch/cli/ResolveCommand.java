package com.hivemind.dispatch.cli;

import com.hivemind.core.recovery.RecoveryService;
import com.hivemind.core.state.HivemindException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: hivemind resolve &lt;task-id&gt;
 * <p>
 * Clears the blocker of an escalated task so it can be dispatched again.
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve the blocker of an escalated task")
@Component
public class ResolveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task id")
    private String taskId;

    private final RecoveryService recoveryService;

    public ResolveCommand(RecoveryService recoveryService) {
        this.recoveryService = recoveryService;
    }

    @Override
    public Integer call() {
        try {
            if (recoveryService.resolveBlocker(taskId)) {
                ConsoleOutput.success("Task " + taskId + " is PENDING again");
            } else {
                ConsoleOutput.info("Task " + taskId + " is not blocked");
            }
            return 0;
        } catch (HivemindException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
