package com.planwright.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwright.core.events.EventType;
import com.planwright.core.events.PlanEvent;
import com.planwright.core.model.ObjectMappers;
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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds a plan's snapshot from its event history. Task events carry the task's
 * resulting state, run events carry run bookkeeping, so replaying the log in id
 * order reproduces the tasks, phase order and runs the store persisted. A
 * {@code plan.restored} event replaces everything before it with the restored state.
 */
public class SnapshotReplayer {

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {};
    private static final TypeReference<List<RunRecord>> RUN_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper = ObjectMappers.create();

    /**
     * @return the rebuilt snapshot, or empty when the events hold no
     *         {@code plan.initialized} for the plan
     */
    public Optional<StatusSnapshot> replay(String planId, List<PlanEvent> events) {
        StatusSnapshot snapshot = null;
        for (var event : events) {
            if (!planId.equals(event.planId())) continue;
            var payload = event.payload();
            if (event.type() == EventType.PLAN_INITIALIZED || event.type() == EventType.PLAN_RESTORED) {
                snapshot = initial(planId, event);
                continue;
            }
            if (snapshot == null) continue;

            if (event.type().carriesTaskState() && event.taskId() != null) {
                var task = snapshot.tasks().get(event.taskId());
                if (task == null) continue;
                task = task.withStatus(TaskStatus.valueOf(((String) payload.get("status")).toUpperCase(Locale.ROOT)))
                        .withRetryCount(((Number) payload.get("retryCount")).intValue())
                        .withLastError((String) payload.get("lastError"));
                snapshot = snapshot.withTask(task);
                if ("DEPENDENTS_RECOMPUTED".equals(payload.get("repair"))) {
                    snapshot = recomputeDependents(snapshot);
                }
            } else if (event.type() == EventType.RUN_STARTED) {
                var runId = (String) payload.get("runId");
                var startedAt = instant(payload.get("startedAt"), event.timestamp());
                snapshot = snapshot.withRun(payload.get("maxRetries") instanceof Number limit
                        ? RunRecord.started(runId, startedAt, limit.intValue())
                        : RunRecord.started(runId, startedAt));
            } else if (event.type() == EventType.RUN_COMPLETED) {
                var runId = (String) payload.get("runId");
                var open = snapshot.run(runId);
                if (open.isPresent() && open.get().isOpen()) {
                    snapshot = snapshot.withRun(open.get().close(
                            instant(payload.get("completedAt"), event.timestamp()),
                            ((Number) payload.get("tasksAttempted")).intValue(),
                            ((Number) payload.get("tasksFailed")).intValue(),
                            RunOutcome.valueOf((String) payload.get("outcome"))));
                }
            }
        }
        return Optional.ofNullable(snapshot);
    }

    private StatusSnapshot initial(String planId, PlanEvent event) {
        List<Task> tasks = mapper.convertValue(event.payload().get("tasks"), TASK_LIST);
        @SuppressWarnings("unchecked")
        var phases = (List<String>) event.payload().get("phaseOrder");
        var byId = new LinkedHashMap<String, Task>();
        tasks.forEach(t -> byId.put(t.id(), t));
        var runs = event.payload().get("runs") == null
                ? List.<RunRecord>of() : mapper.convertValue(event.payload().get("runs"), RUN_LIST);
        return new StatusSnapshot(StatusSnapshot.SCHEMA_VERSION, planId, byId, phases, runs,
                event.timestamp());
    }

    private static StatusSnapshot recomputeDependents(StatusSnapshot snapshot) {
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        snapshot.tasks().keySet().forEach(id -> dependents.put(id, new LinkedHashSet<>()));
        for (var task : snapshot.tasks().values()) {
            for (var dep : task.dependencies()) {
                if (dependents.containsKey(dep)) {
                    dependents.get(dep).add(task.id());
                }
            }
        }
        var tasks = new ArrayList<Task>();
        snapshot.tasks().values().forEach(t -> tasks.add(t.withDependents(dependents.get(t.id()))));
        var byId = new LinkedHashMap<String, Task>();
        tasks.forEach(t -> byId.put(t.id(), t));
        return snapshot.withTasks(byId);
    }

    private static Instant instant(Object value, Instant fallback) {
        if (value instanceof Instant i) return i;
        if (value instanceof String s) return Instant.parse(s);
        return fallback;
    }
}
