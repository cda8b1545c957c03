package com.planwright.core.store;

import com.planwright.core.model.RunOutcome;
import com.planwright.core.model.RunRecord;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.model.Task;
import com.planwright.core.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repairs parseable but inconsistent snapshots left by a crashed run. Never drops
 * tasks, runs or errors; every change is reported as a {@link Repair}.
 */
public class SnapshotHealer {

    public enum RepairKind {
        INTERRUPTED_TASK,
        DEPENDENTS_RECOMPUTED,
        NEGATIVE_RETRY_COUNT,
        OPEN_RUN_CLOSED
    }

    /**
     * @param kind   what was repaired
     * @param taskId the repaired task, or null for run repairs
     * @param runId  the closed run, or null for task repairs
     * @param detail human-readable description
     */
    public record Repair(RepairKind kind, String taskId, String runId, String detail) {}

    public record Healed(StatusSnapshot snapshot, List<Repair> repairs) {
        public boolean changed() {
            return !repairs.isEmpty();
        }
    }

    private final int defaultMaxRetries;

    /**
     * @param defaultMaxRetries retry limit for interrupted tasks when the open run
     *                          did not record its own
     */
    public SnapshotHealer(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Healed heal(StatusSnapshot snapshot, Instant now) {
        int maxRetries = retryLimit(snapshot);
        var repairs = new ArrayList<Repair>();
        var tasks = new LinkedHashMap<String, Task>(snapshot.tasks());

        for (var entry : tasks.entrySet()) {
            var task = entry.getValue();
            if (task.retryCount() < 0) {
                repairs.add(new Repair(RepairKind.NEGATIVE_RETRY_COUNT, task.id(), null,
                        "retryCount " + task.retryCount() + " clamped to 0"));
                task = task.withRetryCount(0);
            }
            if (task.status() == TaskStatus.IN_PROGRESS) {
                var next = task.retryCount() + 1 >= maxRetries ? TaskStatus.FAILED : TaskStatus.PENDING;
                task = task.withFailure(next, "interrupted: process exited while the task was running");
                repairs.add(new Repair(RepairKind.INTERRUPTED_TASK, task.id(), null,
                        "in_progress task from an interrupted run set to " + next.wireName()
                                + " (retryCount " + task.retryCount() + ")"));
            }
            entry.setValue(task);
        }

        Map<String, Set<String>> expected = new LinkedHashMap<>();
        tasks.keySet().forEach(id -> expected.put(id, new LinkedHashSet<>()));
        for (var task : tasks.values()) {
            for (var dep : task.dependencies()) {
                var set = expected.get(dep);
                if (set != null) {
                    set.add(task.id());
                }
            }
        }
        for (var entry : tasks.entrySet()) {
            var want = expected.get(entry.getKey());
            if (!want.equals(entry.getValue().dependents())) {
                repairs.add(new Repair(RepairKind.DEPENDENTS_RECOMPUTED, entry.getKey(), null,
                        "dependents " + entry.getValue().dependents() + " recomputed as " + want));
                entry.setValue(entry.getValue().withDependents(want));
            }
        }

        var healed = snapshot.withTasks(tasks);
        for (RunRecord run : snapshot.runs()) {
            if (run.isOpen()) {
                int failed = run.tasksFailed();
                healed = healed.withRun(run.close(now, run.tasksAttempted(), failed, RunOutcome.INTERRUPTED));
                repairs.add(new Repair(RepairKind.OPEN_RUN_CLOSED, null, run.runId(),
                        "run " + run.runId() + " closed as interrupted"));
            }
        }
        return new Healed(repairs.isEmpty() ? snapshot : healed, List.copyOf(repairs));
    }

    // the interrupted tasks belong to the most recent open run
    private int retryLimit(StatusSnapshot snapshot) {
        var runs = snapshot.runs();
        for (int i = runs.size() - 1; i >= 0; i--) {
            var run = runs.get(i);
            if (run.isOpen() && run.maxRetries() != null) {
                return run.maxRetries();
            }
        }
        return defaultMaxRetries;
    }
}
