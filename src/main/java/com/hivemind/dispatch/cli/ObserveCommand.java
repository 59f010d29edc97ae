package com.hivemind.dispatch.cli;

import com.hivemind.core.alignment.AlignmentObserver;
import com.hivemind.core.model.AlignmentObservation;
import com.hivemind.core.state.HivemindException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: hivemind observe &lt;vision-id&gt;
 * <p>
 * Takes an alignment observation of a Vision, optionally after recording met success
 * criteria, or prints its observation history.
 */
@Command(name = "observe", mixinStandardHelpOptions = true, description = "Score a Vision's alignment with its plan")
@Component
public class ObserveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Vision id")
    private String visionId;

    @Option(names = {"--criterion", "-c"}, description = "Success criterion now met (repeatable)")
    private List<String> criteria;

    @Option(names = {"--history"}, description = "Print past observations instead of taking a new one")
    private boolean history;

    private final AlignmentObserver observer;

    public ObserveCommand(AlignmentObserver observer) {
        this.observer = observer;
    }

    @Override
    public Integer call() {
        try {
            if (history) {
                List<AlignmentObservation> past = observer.history(visionId);
                if (past.isEmpty()) {
                    ConsoleOutput.info("No observations for " + visionId);
                }
                past.forEach(o -> ConsoleOutput.observation(visionId, o));
                return 0;
            }
            if (criteria != null) {
                for (String criterion : criteria) {
                    if (observer.markCriterionMet(visionId, criterion)) {
                        ConsoleOutput.success("Criterion met: " + criterion);
                    }
                }
            }
            ConsoleOutput.observation(visionId, observer.observe(visionId, "manual"));
            return 0;
        } catch (HivemindException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
