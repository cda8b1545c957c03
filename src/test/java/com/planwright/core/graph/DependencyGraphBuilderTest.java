package com.planwright.core.graph;

import com.planwright.core.model.ExecutionConstraint;
import com.planwright.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    private static Task task(String id, String... deps) {
        return Task.of(id, "task " + id, List.of(deps), null, List.of());
    }

    // -- Valid graphs ----------------------------------------------------------

    @Nested
    @DisplayName("valid plans")
    class ValidPlans {

        @Test
        @DisplayName("diamond yields dependents and a topological order")
        void diamond() {
            var graph = builder.build(List.of(
                    task("1.1"), task("1.2", "1.1"), task("1.3", "1.1"), task("1.4", "1.2", "1.3")));

            assertEquals(List.of("1.1", "1.2", "1.3", "1.4"), graph.topologicalOrder());
            assertEquals(Set.of("1.2", "1.3"), graph.dependentsOf("1.1"));
            assertEquals(Set.of("1.4"), graph.dependentsOf("1.2"));
            assertEquals(Set.of("1.2", "1.3"), graph.dependenciesOf("1.4"));
            assertEquals(2, graph.nodes().get("1.4").inDegree());
        }

        @Test
        @DisplayName("topological order puts every dependency first for shuffled input")
        void topologicalOrderRespectsEdges() {
            var tasks = new ArrayList<Task>();
            for (int i = 1; i <= 12; i++) {
                var deps = new ArrayList<String>();
                for (int j = 1; j < i; j++) {
                    if ((i * 7 + j * 3) % 4 == 0) {
                        deps.add("1." + j);
                    }
                }
                tasks.add(task("1." + i, deps.toArray(String[]::new)));
            }
            Collections.shuffle(tasks, new Random(42));

            var graph = builder.build(tasks);
            var order = graph.topologicalOrder();
            assertEquals(12, order.size());
            for (var t : tasks) {
                for (var dep : t.dependencies()) {
                    assertTrue(order.indexOf(dep) < order.indexOf(t.id()), dep + " before " + t.id());
                }
            }
        }

        @Test
        @DisplayName("independent tasks keep declared order")
        void declaredOrderTieBreak() {
            var graph = builder.build(List.of(task("2.1"), task("1.1"), task("1.2")));
            assertEquals(List.of("2.1", "1.1", "1.2"), graph.topologicalOrder());
        }
    }

    // -- Cycles ------------------------------------------------------------------

    @Nested
    @DisplayName("cycles")
    class Cycles {

        @Test
        @DisplayName("three-task cycle reports its path")
        void threeTaskCycle() {
            var ex = assertThrows(CycleException.class, () -> builder.build(List.of(
                    task("1.1", "1.2"), task("1.2", "1.3"), task("1.3", "1.1"))));

            assertEquals(List.of("1.1", "1.2", "1.3", "1.1"), ex.path());
            assertTrue(ex.getMessage().contains("1.1 -> 1.2 -> 1.3 -> 1.1"));
        }

        @Test
        @DisplayName("every consecutive pair of the reported path is a dependency edge")
        void pathIsValid() {
            var tasks = List.of(task("1.1"), task("2.1", "1.1", "3.2"), task("3.1", "2.1"), task("3.2", "3.1"));
            var ex = assertThrows(CycleException.class, () -> builder.build(tasks));

            var path = ex.path();
            assertEquals(path.get(0), path.get(path.size() - 1));
            for (int i = 0; i < path.size() - 1; i++) {
                var from = path.get(i);
                var to = path.get(i + 1);
                var declared = tasks.stream().filter(t -> t.id().equals(from)).findFirst().orElseThrow();
                assertTrue(declared.dependencies().contains(to), from + " depends on " + to);
            }
        }
    }

    // -- Validation ----------------------------------------------------------------

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("unknown dependency and duplicate id are reported together")
        void collectsProblems() {
            var ex = assertThrows(PlanValidationException.class, () -> builder.build(List.of(
                    task("1.1"), task("1.1"), task("1.2", "9.9"))));

            assertEquals(2, ex.problems().size());
            assertTrue(ex.problems().stream().anyMatch(p -> p.contains("duplicate task id 1.1")));
            assertTrue(ex.problems().stream().anyMatch(p -> p.contains("unknown task 9.9")));
        }

        @Test
        @DisplayName("self-dependency is a validation error")
        void selfDependency() {
            var ex = assertThrows(PlanValidationException.class, () -> builder.build(List.of(task("1.1", "1.1"))));
            assertTrue(ex.problems().get(0).contains("depends on itself"));
        }

        @Test
        @DisplayName("sequential constraint naming an unknown task is rejected")
        void unknownConstraintMember() {
            var constraint = ExecutionConstraint.sequential("db", List.of("1.1", "4.4"), "migrations");
            var ex = assertThrows(PlanValidationException.class,
                    () -> builder.build(List.of(task("1.1")), List.of(constraint)));
            assertTrue(ex.problems().get(0).contains("4.4"));
        }
    }

    // -- Randomized plans ----------------------------------------------------------

    @Nested
    @DisplayName("randomized plans")
    class Randomized {

        private List<Task> randomPlan(Random random) {
            int count = 2 + random.nextInt(11);
            var ids = new ArrayList<String>();
            for (int i = 1; i <= count; i++) {
                ids.add("1." + i);
            }
            // sparse edges in any direction, so some plans are cyclic
            int density = 2 + random.nextInt(6);
            var tasks = new ArrayList<Task>();
            for (var id : ids) {
                var deps = new ArrayList<String>();
                for (var other : ids) {
                    if (!other.equals(id) && random.nextInt(count * density) < 2) {
                        deps.add(other);
                    }
                }
                tasks.add(task(id, deps.toArray(String[]::new)));
            }
            return tasks;
        }

        /** Repeatedly removes tasks whose dependencies are all removed; acyclic iff all go. */
        private static boolean acyclic(List<Task> tasks) {
            var removed = new HashSet<String>();
            boolean progress = true;
            while (progress) {
                progress = false;
                for (var task : tasks) {
                    if (!removed.contains(task.id()) && removed.containsAll(task.dependencies())) {
                        removed.add(task.id());
                        progress = true;
                    }
                }
            }
            return removed.size() == tasks.size();
        }

        @Test
        @DisplayName("building succeeds exactly when the plan has no cycle")
        void buildSucceedsIffAcyclic() {
            int cyclic = 0;
            for (long seed = 0; seed < 400; seed++) {
                var tasks = randomPlan(new Random(seed));
                var context = "seed " + seed + ": " + tasks.stream()
                        .map(t -> t.id() + "<-" + t.dependencies()).toList();

                if (acyclic(tasks)) {
                    var order = assertDoesNotThrow(() -> builder.build(tasks), context).topologicalOrder();
                    assertEquals(tasks.size(), order.size(), context);
                    for (var t : tasks) {
                        for (var dep : t.dependencies()) {
                            assertTrue(order.indexOf(dep) < order.indexOf(t.id()), context);
                        }
                    }
                } else {
                    cyclic++;
                    var ex = assertThrows(CycleException.class, () -> builder.build(tasks), context);
                    var path = ex.path();
                    assertTrue(path.size() >= 3, context);
                    assertEquals(path.get(0), path.get(path.size() - 1), context);
                    for (int i = 0; i < path.size() - 1; i++) {
                        var from = path.get(i);
                        var to = path.get(i + 1);
                        var declared = tasks.stream().filter(t -> t.id().equals(from)).findFirst().orElseThrow();
                        assertTrue(declared.dependencies().contains(to), context + ": " + from + " -> " + to);
                    }
                }
            }
            assertTrue(cyclic > 0, "generator produced no cyclic plans");
            assertTrue(cyclic < 400, "generator produced no acyclic plans");
        }
    }
}
