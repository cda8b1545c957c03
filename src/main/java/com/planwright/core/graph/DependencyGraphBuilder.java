package com.planwright.core.graph;

import com.planwright.core.model.ExecutionConstraint;
import com.planwright.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a task list and turns it into a {@link DependencyGraph}.
 * <p>
 * Structural problems are collected and reported together as a
 * {@link PlanValidationException} before any cycle search. Cycle search is a
 * depth-first walk in declared task order, visiting dependencies in declared order,
 * so the reported cycle is deterministic for a given plan. Nothing is written.
 */
@Component
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private enum Mark { VISITING, DONE }

    public DependencyGraph build(Collection<Task> tasks) {
        return build(tasks, List.of());
    }

    /**
     * Builds the graph, also checking that caller-supplied sequential constraints
     * only name known tasks.
     *
     * @throws PlanValidationException when the task list is malformed
     * @throws CycleException          when the dependencies contain a cycle
     */
    public DependencyGraph build(Collection<Task> tasks, List<ExecutionConstraint> constraints) {
        var byId = validate(tasks, constraints);

        var dependents = new LinkedHashMap<String, Set<String>>();
        byId.keySet().forEach(id -> dependents.put(id, new LinkedHashSet<>()));
        for (var task : byId.values()) {
            for (var dep : task.dependencies()) {
                dependents.get(dep).add(task.id());
            }
        }

        findCycle(byId);

        var nodes = new LinkedHashMap<String, DependencyGraph.Node>();
        for (var task : byId.values()) {
            nodes.put(task.id(), new DependencyGraph.Node(
                    Collections.unmodifiableSet(new LinkedHashSet<>(task.dependencies())),
                    Collections.unmodifiableSet(dependents.get(task.id())),
                    task.dependencies().size()));
        }
        var order = topologicalOrder(nodes);
        log.debug("Built dependency graph: {} tasks, order {}", nodes.size(), order);
        return new DependencyGraph(nodes, order);
    }

    private Map<String, Task> validate(Collection<Task> tasks, List<ExecutionConstraint> constraints) {
        var problems = new ArrayList<String>();
        var byId = new LinkedHashMap<String, Task>();
        for (var task : tasks) {
            if (task.id() == null || task.id().isBlank()) {
                problems.add("task with blank id");
                continue;
            }
            if (byId.putIfAbsent(task.id(), task) != null) {
                problems.add("duplicate task id " + task.id());
            }
        }
        for (var task : byId.values()) {
            for (var dep : task.dependencies()) {
                if (dep.equals(task.id())) {
                    problems.add("task " + task.id() + " depends on itself");
                } else if (!byId.containsKey(dep)) {
                    problems.add("task " + task.id() + " depends on unknown task " + dep);
                }
            }
            if (task.sequentialGroup() != null && task.sequentialGroup().isBlank()) {
                problems.add("task " + task.id() + " has a blank sequential group");
            }
        }
        for (var constraint : constraints == null ? List.<ExecutionConstraint>of() : constraints) {
            if (constraint.kind() != ExecutionConstraint.Kind.SEQUENTIAL) continue;
            if (constraint.groupId() == null || constraint.groupId().isBlank()) {
                problems.add("sequential constraint without group id");
            }
            for (var member : constraint.members()) {
                if (!byId.containsKey(member)) {
                    problems.add("sequential group " + constraint.groupId() + " names unknown task " + member);
                }
            }
        }
        if (!problems.isEmpty()) {
            log.warn("Plan rejected with {} problem(s): {}", problems.size(), problems);
            throw new PlanValidationException(problems);
        }
        return byId;
    }

    private void findCycle(Map<String, Task> byId) {
        var marks = new HashMap<String, Mark>();
        for (var id : byId.keySet()) {
            if (!marks.containsKey(id)) {
                visit(id, byId, marks, new ArrayList<>());
            }
        }
    }

    private void visit(String id, Map<String, Task> byId, Map<String, Mark> marks, List<String> stack) {
        marks.put(id, Mark.VISITING);
        stack.add(id);
        for (var dep : byId.get(id).dependencies()) {
            var mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                var path = new ArrayList<>(stack.subList(stack.indexOf(dep), stack.size()));
                path.add(dep);
                throw new CycleException(path);
            }
            if (mark == null) {
                visit(dep, byId, marks, stack);
            }
        }
        stack.remove(stack.size() - 1);
        marks.put(id, Mark.DONE);
    }

    /**
     * Kahn's algorithm; among tasks with no remaining dependencies the earliest
     * declared one goes first.
     */
    private List<String> topologicalOrder(Map<String, DependencyGraph.Node> nodes) {
        var declared = new ArrayList<>(nodes.keySet());
        var remaining = new HashMap<String, Integer>();
        nodes.forEach((id, node) -> remaining.put(id, node.inDegree()));
        var done = new HashSet<String>();
        var order = new ArrayList<String>(nodes.size());
        var queue = new ArrayDeque<String>();
        while (order.size() < nodes.size()) {
            for (var id : declared) {
                if (!done.contains(id) && remaining.get(id) == 0) {
                    queue.add(id);
                    break;
                }
            }
            var next = queue.poll();
            if (next == null) {
                // unreachable after cycle detection
                throw new IllegalStateException("No task without open dependencies");
            }
            done.add(next);
            order.add(next);
            for (var dependent : nodes.get(next).dependents()) {
                remaining.merge(dependent, -1, Integer::sum);
            }
        }
        return order;
    }
}
