package com.hivemind.dispatch.cli;

import com.hivemind.core.model.NodeRef;
import com.hivemind.core.plan.HierarchyLoader;
import com.hivemind.core.state.HivemindException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: hivemind load &lt;file&gt;
 * <p>
 * Imports a hierarchy definition (JSON) as a new tree.
 */
@Command(name = "load", mixinStandardHelpOptions = true, description = "Import a hierarchy definition")
@Component
public class LoadCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Hierarchy definition file (JSON)")
    private Path file;

    private final HierarchyLoader loader;

    public LoadCommand(HierarchyLoader loader) {
        this.loader = loader;
    }

    @Override
    public Integer call() {
        try {
            NodeRef root = loader.load(file);
            ConsoleOutput.success("Loaded " + root + " from " + file);
            return 0;
        } catch (HivemindException e) {
            ConsoleOutput.error("Load failed: " + e.getMessage());
            return 1;
        }
    }
}
