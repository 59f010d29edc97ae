package com.hivemind.core.plan;

import com.hivemind.core.model.HierarchyNode;
import com.hivemind.core.model.NodeLevel;
import com.hivemind.core.model.NodeRef;
import com.hivemind.core.model.VisionPlan;
import com.hivemind.core.progress.ProgressAggregator;
import com.hivemind.core.state.HierarchyState;
import com.hivemind.core.state.HierarchyStore;
import com.hivemind.core.state.IntegrityException;
import com.hivemind.core.state.StateMapper;
import com.hivemind.core.state.StatePersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Imports hierarchy definitions into the store and applies structural edits.
 * <p>
 * A definition is validated as a whole before anything is written: every node needs a
 * level and an id that is unused at that level, children must sit at a lower level than
 * their parent, and dependencies must name siblings at the same level without forming a cycle.
 * Tasks take no dependencies; their status only comes from agent signals.
 */
@Service
public class HierarchyLoader {

    private static final Logger log = LoggerFactory.getLogger(HierarchyLoader.class);

    private final HierarchyStore store;
    private final StateMapper mapper;
    private final ProgressAggregator aggregator;

    public HierarchyLoader(HierarchyStore store, StateMapper mapper, ProgressAggregator aggregator) {
        this.store = store;
        this.mapper = mapper;
        this.aggregator = aggregator;
    }

    public NodeRef load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to read hierarchy definition " + file, e);
        }
    }

    public NodeRef load(InputStream in) {
        NodeDefinition root;
        try {
            root = mapper.objectMapper().readValue(in, NodeDefinition.class);
        } catch (IOException e) {
            throw new StatePersistenceException("Malformed hierarchy definition: " + e.getMessage(), e);
        }
        return load(root);
    }

    /**
     * Adds the subtree rooted at {@code root} as a new tree.
     *
     * @return reference to the imported root
     * @throws IntegrityException if the definition is invalid or collides with existing nodes
     */
    public NodeRef load(NodeDefinition root) {
        validate(root, null);
        int count = store.mutate("load", state -> {
            Instant now = store.clock().instant();
            List<HierarchyNode> created = new ArrayList<>();
            insert(state, root, null, now, created);
            return created.size();
        });
        NodeRef ref = NodeRef.of(root.level(), root.id());
        log.info("Loaded {} with {} nodes", ref, count);
        return ref;
    }

    /**
     * Changes a node's title and dependencies. Null leaves a field as is.
     * Progress above the node is recomputed, since gating may have changed.
     */
    public void editNode(NodeRef ref, String title, List<String> dependencies) {
        store.mutate("edit-node", state -> {
            HierarchyNode node = state.requireNode(ref);
            if (title != null) {
                node.setTitle(title);
            }
            if (dependencies != null) {
                if (!dependencies.isEmpty() && node.getLevel() == NodeLevel.TASK) {
                    throw new IntegrityException("Tasks have no dependencies: " + ref);
                }
                checkSiblingDependencies(state, node, dependencies);
                node.setDependencies(dependencies);
            }
            node.setUpdatedAt(store.clock().instant());
            return null;
        });
        log.info("Edited {}", ref);
        if (dependencies != null) {
            aggregator.recompute(ref);
        }
    }

    private void validate(NodeDefinition def, NodeDefinition parent) {
        Set<String> seen = new HashSet<>();
        validate(def, parent, seen);
    }

    private void validate(NodeDefinition def, NodeDefinition parent, Set<String> seen) {
        if (def.level() == null || def.id() == null || def.id().isBlank()) {
            throw new IntegrityException("Every node needs a level and an id" + (parent == null ? "" : " (under " + parent.id() + ")"));
        }
        if (!seen.add(def.level() + ":" + def.id())) {
            throw new IntegrityException("Duplicate node " + def.level() + ":" + def.id());
        }
        if (parent != null && !parent.level().canOwn(def.level())) {
            throw new IntegrityException(parent.level() + " " + parent.id() + " cannot own "
                    + def.level() + " " + def.id());
        }
        if (def.level() == NodeLevel.TASK && !def.children().isEmpty()) {
            throw new IntegrityException("Task " + def.id() + " cannot have children");
        }
        if (!def.dependencies().isEmpty()) {
            if (def.level() == NodeLevel.TASK) {
                throw new IntegrityException("Tasks have no dependencies: " + def.id());
            }
            Set<String> siblings = new HashSet<>();
            if (parent != null) {
                parent.children().stream()
                        .filter(c -> c.level() == def.level() && !def.id().equals(c.id()))
                        .forEach(c -> siblings.add(c.id()));
            }
            for (String dependency : def.dependencies()) {
                if (!siblings.contains(dependency)) {
                    throw new IntegrityException(def.level() + " " + def.id() + " depends on unknown sibling "
                            + def.level() + " " + dependency);
                }
            }
        }
        if (def.plan() != null && def.level() != NodeLevel.VISION) {
            throw new IntegrityException("Only a Vision carries a plan, not " + def.level() + " " + def.id());
        }
        for (NodeDefinition child : def.children()) {
            validate(child, def, seen);
        }
        checkAcyclic(def);
    }

    /**
     * Rejects dependency cycles among the children of {@code parent}; they would stay gated forever.
     * Each level among the children is its own graph.
     */
    private static void checkAcyclic(NodeDefinition parent) {
        Map<NodeLevel, Map<String, List<String>>> graphs = new EnumMap<>(NodeLevel.class);
        for (NodeDefinition child : parent.children()) {
            graphs.computeIfAbsent(child.level(), level -> new HashMap<>()).put(child.id(), child.dependencies());
        }
        graphs.forEach((level, graph) -> {
            Set<String> done = new HashSet<>();
            for (String id : graph.keySet()) {
                visit(level, id, graph, new HashSet<>(), done);
            }
        });
    }

    private static void visit(NodeLevel level, String id, Map<String, List<String>> graph, Set<String> path,
                              Set<String> done) {
        if (done.contains(id)) {
            return;
        }
        if (!path.add(id)) {
            throw new IntegrityException(level + " dependency cycle through " + id);
        }
        for (String dependency : graph.getOrDefault(id, List.of())) {
            visit(level, dependency, graph, path, done);
        }
        path.remove(id);
        done.add(id);
    }

    private void insert(HierarchyState state, NodeDefinition def, NodeRef parent, Instant now,
                        List<HierarchyNode> created) {
        NodeRef ref = NodeRef.of(def.level(), def.id());
        if (state.node(ref).isPresent()) {
            throw new IntegrityException("Node " + ref + " already exists");
        }
        HierarchyNode node = new HierarchyNode(def.level(), def.id(), def.title() == null ? def.id() : def.title());
        node.setParentRef(parent);
        node.setDependencies(def.dependencies());
        node.setChildren(def.children().stream().map(c -> NodeRef.of(c.level(), c.id())).toList());
        node.setUpdatedAt(now);
        if (def.plan() != null) {
            NodeDefinition.PlanDefinition plan = def.plan();
            node.setPlan(new VisionPlan(plan.estimatedDays(), plan.plannedEpics(), plan.successCriteria(),
                    plan.startedAt() == null ? now : plan.startedAt()));
        }
        state.putNode(node);
        created.add(node);
        for (NodeDefinition child : def.children()) {
            insert(state, child, ref, now, created);
        }
    }

    private static void checkSiblingDependencies(HierarchyState state, HierarchyNode node, List<String> dependencies) {
        if (dependencies.isEmpty()) {
            return;
        }
        if (node.getParentRef() == null) {
            throw new IntegrityException(node.ref() + " has no siblings to depend on");
        }
        Map<String, List<String>> graph = new HashMap<>();
        for (HierarchyNode sibling : state.children(state.requireNode(node.getParentRef()))) {
            if (sibling.getLevel() == node.getLevel() && !sibling.getId().equals(node.getId())) {
                graph.put(sibling.getId(), sibling.getDependencies());
            }
        }
        for (String dependency : dependencies) {
            if (!graph.containsKey(dependency)) {
                throw new IntegrityException(node.ref() + " depends on unknown sibling " + node.getLevel() + " "
                        + dependency);
            }
        }
        graph.put(node.getId(), dependencies);
        visit(node.getLevel(), node.getId(), graph, new HashSet<>(), new HashSet<>());
    }
}
