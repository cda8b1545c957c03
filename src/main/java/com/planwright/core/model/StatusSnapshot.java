package com.planwright.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Full persisted state of one plan. Immutable: every change produces a new snapshot,
 * and only the status store hands new snapshots out.
 *
 * @param schemaVersion persisted schema version
 * @param planId        plan identifier
 * @param tasks         tasks keyed by id, in declared order
 * @param phaseOrder    phase ids in declared order
 * @param runs          orchestration history, oldest first
 * @param updatedAt     time of the last persisted change
 */
public record StatusSnapshot(
    int schemaVersion,
    String planId,
    Map<String, Task> tasks,
    List<String> phaseOrder,
    List<RunRecord> runs,
    Instant updatedAt
) {

    public static final int SCHEMA_VERSION = 1;

    public StatusSnapshot {
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        phaseOrder = phaseOrder == null ? List.of() : List.copyOf(phaseOrder);
        runs = runs == null ? List.of() : List.copyOf(runs);
    }

    public Optional<Task> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public StatusSnapshot withTask(Task task) {
        if (!tasks.containsKey(task.id())) {
            throw new IllegalArgumentException("Unknown task " + task.id() + " in plan " + planId);
        }
        var copy = new LinkedHashMap<>(tasks);
        copy.put(task.id(), task);
        return new StatusSnapshot(schemaVersion, planId, copy, phaseOrder, runs, updatedAt);
    }

    public StatusSnapshot withTasks(Map<String, Task> newTasks) {
        return new StatusSnapshot(schemaVersion, planId, newTasks, phaseOrder, runs, updatedAt);
    }

    public StatusSnapshot withRun(RunRecord run) {
        var copy = new ArrayList<>(runs);
        boolean replaced = false;
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).runId().equals(run.runId())) {
                copy.set(i, run);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            copy.add(run);
        }
        return new StatusSnapshot(schemaVersion, planId, tasks, phaseOrder, copy, updatedAt);
    }

    public StatusSnapshot withUpdatedAt(Instant at) {
        return new StatusSnapshot(schemaVersion, planId, tasks, phaseOrder, runs, at);
    }

    public Optional<RunRecord> run(String runId) {
        return runs.stream().filter(r -> r.runId().equals(runId)).findFirst();
    }

    /**
     * Position of a phase in declared order; undeclared phases sort last.
     */
    public int phaseIndex(String phase) {
        int idx = phaseOrder.indexOf(phase);
        return idx >= 0 ? idx : Integer.MAX_VALUE;
    }

    public List<Task> tasksInPhase(String phase) {
        return tasks.values().stream().filter(t -> phase.equals(t.phase())).toList();
    }

    public boolean isPhaseTerminal(String phase) {
        var inPhase = tasksInPhase(phase);
        return !inPhase.isEmpty() && inPhase.stream().allMatch(t -> t.status().isTerminal());
    }

    public long count(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).count();
    }

    /** True while any task is pending or in progress. */
    public boolean hasOutstandingWork() {
        return count(TaskStatus.PENDING) > 0 || count(TaskStatus.IN_PROGRESS) > 0;
    }

    /**
     * Task counts per status plus a {@code total} entry.
     */
    public Map<String, Long> summary() {
        var counts = new EnumMap<TaskStatus, Long>(TaskStatus.class);
        for (var status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        for (var task : tasks.values()) {
            counts.merge(task.status(), 1L, Long::sum);
        }
        var summary = new LinkedHashMap<String, Long>();
        summary.put("total", (long) tasks.size());
        counts.forEach((status, n) -> summary.put(status.wireName(), n));
        return summary;
    }
}
