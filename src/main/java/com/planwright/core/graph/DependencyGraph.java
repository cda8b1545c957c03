package com.planwright.core.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Acyclic dependency relation of a plan. Only {@link DependencyGraphBuilder} creates
 * instances, so holding one means the plan passed validation and cycle detection.
 *
 * @param nodes             per-task adjacency, in declared task order
 * @param topologicalOrder  every task id, dependencies before dependents
 */
public record DependencyGraph(Map<String, Node> nodes, List<String> topologicalOrder) {

    /**
     * @param dependencies tasks this one waits for
     * @param dependents   tasks waiting for this one
     * @param inDegree     number of dependencies
     */
    public record Node(Set<String> dependencies, Set<String> dependents, int inDegree) {}

    public DependencyGraph {
        nodes = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        topologicalOrder = List.copyOf(topologicalOrder);
    }

    public Set<String> dependentsOf(String taskId) {
        var node = nodes.get(taskId);
        return node == null ? Set.of() : node.dependents();
    }

    public Set<String> dependenciesOf(String taskId) {
        var node = nodes.get(taskId);
        return node == null ? Set.of() : node.dependencies();
    }

    /** Forward adjacency (task id to its dependencies), as written to the status file. */
    public Map<String, List<String>> adjacency() {
        var out = new LinkedHashMap<String, List<String>>();
        nodes.forEach((id, node) -> out.put(id, List.copyOf(node.dependencies())));
        return out;
    }
}
