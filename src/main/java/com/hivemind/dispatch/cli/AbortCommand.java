package com.hivemind.dispatch.cli;

import com.hivemind.core.recovery.RecoveryService;
import com.hivemind.core.state.HivemindException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: hivemind abort &lt;task-id&gt; [--reason text]
 */
@Command(name = "abort", mixinStandardHelpOptions = true, description = "Mark a task FAILED, cancelling any pending retry")
@Component
public class AbortCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task id")
    private String taskId;

    @Option(names = {"--reason", "-r"}, description = "Reason recorded as the task error", defaultValue = "Aborted by operator")
    private String reason;

    private final RecoveryService recoveryService;

    public AbortCommand(RecoveryService recoveryService) {
        this.recoveryService = recoveryService;
    }

    @Override
    public Integer call() {
        try {
            if (recoveryService.abort(taskId, reason)) {
                ConsoleOutput.warn("Task " + taskId + " aborted: " + reason);
            } else {
                ConsoleOutput.info("Task " + taskId + " already finished");
            }
            return 0;
        } catch (HivemindException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
