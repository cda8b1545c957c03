package com.planwright.core.scheduler;

import com.planwright.core.model.ExecutionConstraint;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.model.Task;
import com.planwright.core.model.TaskIds;
import com.planwright.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes which pending tasks may be dispatched next.
 * <p>
 * A task is a candidate when it is pending and all its dependencies are completed or
 * skipped. Candidates are then filtered by sequential groups (only the earliest
 * unfinished member of a group may run) and by file conflicts (two tasks touching
 * the same file never run together), and finally ordered by declared phase and task
 * id. Selection is pure: the snapshot is not modified and nothing is logged above
 * DEBUG.
 */
@Service
public class ReadyTaskSelector {

    private static final Logger log = LoggerFactory.getLogger(ReadyTaskSelector.class);

    public ReadySelection readyTasks(StatusSnapshot snapshot, List<ExecutionConstraint> constraints,
                                     int maxCount, SelectionOptions options) {
        var blocked = new LinkedHashMap<String, String>();
        var applied = new ArrayList<ExecutionConstraint>();
        var candidates = new ArrayList<Task>();

        for (var task : snapshot.tasks().values()) {
            if (task.status() != TaskStatus.PENDING || options.excludedTaskIds().contains(task.id())) {
                continue;
            }
            if (options.forcedTaskIds().contains(task.id())) {
                candidates.add(task);
                continue;
            }
            var unmet = firstUnmetDependency(snapshot, task);
            if (unmet == null) {
                candidates.add(task);
            } else {
                blocked.put(task.id(), "dependency:" + unmet);
            }
        }

        if (!options.ignoreSequential()) {
            candidates = filterSequential(snapshot, constraints, candidates, blocked, applied);
        }
        var kept = filterFileConflicts(snapshot, candidates, options, blocked, applied);

        var ready = kept.size() > maxCount ? kept.subList(0, Math.max(0, maxCount)) : kept;
        log.debug("readyTasks plan={}: ready={} blocked={}", snapshot.planId(),
                ready.stream().map(Task::id).toList(), blocked);
        return new ReadySelection(List.copyOf(ready), Map.copyOf(blocked), List.copyOf(applied));
    }

    public ReadySelection readyTasks(StatusSnapshot snapshot, int maxCount) {
        return readyTasks(snapshot, List.of(), maxCount, SelectionOptions.DEFAULT);
    }

    /**
     * Sequential constraints declared on the tasks themselves, one per group, members
     * in declared task order.
     */
    public static List<ExecutionConstraint> sequentialGroups(StatusSnapshot snapshot) {
        var groups = new LinkedHashMap<String, List<String>>();
        for (var task : snapshot.tasks().values()) {
            if (task.sequentialGroup() != null) {
                groups.computeIfAbsent(task.sequentialGroup(), k -> new ArrayList<>()).add(task.id());
            }
        }
        var out = new ArrayList<ExecutionConstraint>();
        groups.forEach((group, members) -> out.add(
                ExecutionConstraint.sequential(group, members, "tasks in group " + group + " run one at a time")));
        return out;
    }

    private static String firstUnmetDependency(StatusSnapshot snapshot, Task task) {
        for (var dep : task.dependencies()) {
            var depTask = snapshot.tasks().get(dep);
            if (depTask == null || !depTask.status().satisfiesDependency()) {
                return dep;
            }
        }
        return null;
    }

    private ArrayList<Task> filterSequential(StatusSnapshot snapshot, List<ExecutionConstraint> extra,
                                             List<Task> candidates, Map<String, String> blocked,
                                             List<ExecutionConstraint> applied) {
        var groups = new ArrayList<>(sequentialGroups(snapshot));
        if (extra != null) {
            extra.stream().filter(c -> c.kind() == ExecutionConstraint.Kind.SEQUENTIAL).forEach(groups::add);
        }
        var remaining = new ArrayList<>(candidates);
        for (var group : groups) {
            String eligible = null;
            for (var member : group.members()) {
                var task = snapshot.tasks().get(member);
                if (task != null && !task.status().satisfiesDependency()) {
                    eligible = member;
                    break;
                }
            }
            boolean heldBack = false;
            for (var it = remaining.iterator(); it.hasNext(); ) {
                var task = it.next();
                if (group.members().contains(task.id()) && !task.id().equals(eligible)) {
                    it.remove();
                    blocked.put(task.id(), "sequential:" + group.groupId());
                    heldBack = true;
                }
            }
            if (heldBack) {
                applied.add(group);
            }
        }
        return remaining;
    }

    private List<Task> filterFileConflicts(StatusSnapshot snapshot, List<Task> candidates,
                                           SelectionOptions options, Map<String, String> blocked,
                                           List<ExecutionConstraint> applied) {
        var holders = new ArrayList<Task>();
        for (var task : snapshot.tasks().values()) {
            if (task.status() == TaskStatus.IN_PROGRESS || options.excludedTaskIds().contains(task.id())) {
                holders.add(task);
            }
        }
        holders.sort(Comparator.comparing(Task::id, TaskIds.ORDER));
        var sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.<Task>comparingInt(t -> snapshot.phaseIndex(t.phase()))
                .thenComparing(Task::id, TaskIds.ORDER));

        var kept = new ArrayList<Task>();
        for (var task : sorted) {
            var conflict = findConflict(task, holders);
            if (conflict == null) {
                conflict = findConflict(task, kept);
            }
            if (conflict != null) {
                blocked.put(task.id(), "fileConflict:" + conflict.holder().id());
                applied.add(ExecutionConstraint.fileConflict(conflict.holder().id(),
                        List.of(conflict.holder().id(), task.id()), conflict.file()));
                log.debug("{} deferred: shares {} with {}", task.id(), conflict.file(), conflict.holder().id());
            } else {
                kept.add(task);
            }
        }
        return kept;
    }

    private record Conflict(Task holder, String file) {}

    private static Conflict findConflict(Task task, List<Task> others) {
        for (var other : others) {
            if (other.id().equals(task.id())) continue;
            for (var file : task.fileReferences()) {
                for (var otherFile : other.fileReferences()) {
                    if (filesMatch(file, otherFile)) {
                        return new Conflict(other, normalizePath(file));
                    }
                }
            }
        }
        return null;
    }

    /**
     * Two paths refer to the same file when equal after normalization, or when one
     * is a {@code /}-suffix of the other (relative vs. absolute).
     */
    static boolean filesMatch(String file1, String file2) {
        String n1 = normalizePath(file1);
        String n2 = normalizePath(file2);
        if (n1.equals(n2)) return true;
        return n1.endsWith("/" + n2) || n2.endsWith("/" + n1);
    }

    private static String normalizePath(String path) {
        return path.startsWith("./") ? path.substring(2) : path;
    }
}
