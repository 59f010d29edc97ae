package com.hivemind.dispatch.cli;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.HierarchyNode;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.progress.NodeProgress;
import com.hivemind.core.progress.ProgressAggregator;
import com.hivemind.core.state.HierarchyStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: hivemind status [LEVEL:id]
 * <p>
 * Shows the progress tree of one node, or of every root, plus the active agents.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show hierarchy progress")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Node reference such as ROADMAP:r1 (default: all roots)")
    private String nodeRef;

    private final ProgressAggregator aggregator;
    private final HierarchyStore store;

    public StatusCommand(ProgressAggregator aggregator, HierarchyStore store) {
        this.aggregator = aggregator;
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<NodeRef> roots;
        if (nodeRef != null) {
            NodeRef ref;
            try {
                ref = NodeRef.parse(nodeRef);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return;
            }
            roots = List.of(ref);
        } else {
            roots = store.read(state -> state.getNodes().values().stream()
                    .filter(n -> n.getParentRef() == null)
                    .map(HierarchyNode::ref)
                    .toList());
        }
        if (roots.isEmpty()) {
            ConsoleOutput.info("No hierarchy loaded");
        }
        for (NodeRef root : roots) {
            Optional<NodeProgress> progress = aggregator.snapshot(root);
            if (progress.isEmpty()) {
                ConsoleOutput.error("Node not found: " + root);
                continue;
            }
            ConsoleOutput.tree(progress.get(), 0);
        }

        List<Agent> agents = store.read(state -> List.copyOf(state.getActiveAgents().values()));
        if (!agents.isEmpty()) {
            System.out.println();
            System.out.printf("  %-16s %-6s %-8s %-12s %-12s %s%n", "AGENT", "LEVEL", "STATUS", "TASK", "SPAWNED BY",
                    "DOMAIN");
            System.out.println("  " + "-".repeat(72));
            for (Agent a : agents) {
                System.out.printf("  %-16s %-6s %-8s %-12s %-12s %s%n", a.getAgentId(), a.getLevel(), a.getStatus(),
                        a.getTaskRef() == null ? "-" : a.getTaskRef(), a.getSpawnedBy(), a.getDomain());
            }
        }
    }
}
