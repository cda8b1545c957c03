package com.planwright.core.store;

import com.planwright.core.events.EventType;
import com.planwright.core.events.PlanEvent;
import com.planwright.core.model.ObjectMappers;
import com.planwright.core.model.RunOutcome;
import com.planwright.core.model.Task;
import com.planwright.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.planwright.TestPlans.task;
import static org.junit.jupiter.api.Assertions.*;

class SnapshotReplayerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private final SnapshotReplayer replayer = new SnapshotReplayer();
    private final List<PlanEvent> events = new ArrayList<>();

    private void add(EventType type, String planId, String taskId, Map<String, Object> payload) {
        events.add(new PlanEvent(events.size() + 1, type, planId, taskId, T0.plusSeconds(events.size()), payload));
    }

    private void initialized(String planId) {
        var tasks = List.of(task("1.1").withDependents(Set.of("1.2")), task("1.2", "1.1"));
        var payload = new LinkedHashMap<String, Object>();
        payload.put("phaseOrder", List.of("1"));
        payload.put("tasks", ObjectMappers.create().convertValue(tasks, List.class));
        add(EventType.PLAN_INITIALIZED, planId, null, payload);
    }

    private void taskState(String taskId, String status, int retryCount, String lastError) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", status);
        payload.put("retryCount", retryCount);
        payload.put("lastError", lastError);
        add(EventType.TASK_STARTED, "demo", taskId, payload);
    }

    @Test
    @DisplayName("no plan.initialized event means nothing to rebuild")
    void emptyWithoutInitialization() {
        taskState("1.1", "in_progress", 0, null);
        assertTrue(replayer.replay("demo", events).isEmpty());
    }

    @Test
    @DisplayName("task events carry the resulting task state")
    void taskStateApplied() {
        initialized("demo");
        taskState("1.1", "in_progress", 0, null);
        taskState("1.1", "pending", 1, "tests failed");
        taskState("1.1", "completed", 1, "tests failed");

        var snapshot = replayer.replay("demo", events).orElseThrow();
        Task task = snapshot.tasks().get("1.1");
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(1, task.retryCount());
        assertEquals("tests failed", task.lastError());
        assertEquals(Set.of("1.2"), task.dependents());
        assertEquals(List.of("1"), snapshot.phaseOrder());
    }

    @Test
    @DisplayName("events of other plans and unknown tasks are ignored")
    void foreignEventsIgnored() {
        initialized("demo");
        initialized("other");
        add(EventType.TASK_COMPLETED, "other", "1.1", Map.of("status", "completed", "retryCount", 0));
        taskState("9.9", "completed", 0, null);

        var snapshot = replayer.replay("demo", events).orElseThrow();
        assertEquals(TaskStatus.PENDING, snapshot.tasks().get("1.1").status());
        assertEquals(2, snapshot.tasks().size());
    }

    @Test
    @DisplayName("run events open and close run records")
    void runsReplayed() {
        initialized("demo");
        add(EventType.RUN_STARTED, "demo", null, Map.of("runId", "run-1", "startedAt", T0.toString(),
                "maxRetries", 5));
        add(EventType.RUN_COMPLETED, "demo", null, Map.of("runId", "run-1", "completedAt", T0.plusSeconds(30).toString(),
                "tasksAttempted", 2, "tasksFailed", 1, "outcome", "BLOCKED"));
        // a second close of the same run is ignored
        add(EventType.RUN_COMPLETED, "demo", null, Map.of("runId", "run-1", "completedAt", T0.plusSeconds(90).toString(),
                "tasksAttempted", 9, "tasksFailed", 9, "outcome", "INTERRUPTED"));

        var runs = replayer.replay("demo", events).orElseThrow().runs();
        assertEquals(1, runs.size());
        assertEquals(T0, runs.get(0).startedAt());
        assertEquals(T0.plusSeconds(30), runs.get(0).completedAt());
        assertEquals(RunOutcome.BLOCKED, runs.get(0).outcome());
        assertEquals(2, runs.get(0).tasksAttempted());
        assertEquals(5, runs.get(0).maxRetries());
    }

    @Test
    @DisplayName("status names are read the same under a Turkish default locale")
    void localeIndependentStatus() {
        var previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            initialized("demo");
            taskState("1.1", "in_progress", 0, null);

            var snapshot = replayer.replay("demo", events).orElseThrow();
            assertEquals(TaskStatus.IN_PROGRESS, snapshot.tasks().get("1.1").status());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("dependents repair recomputes reverse edges")
    void dependentsRepairReplayed() {
        var tasks = List.of(task("1.1"), task("1.2", "1.1"));
        var payload = new LinkedHashMap<String, Object>();
        payload.put("phaseOrder", List.of("1"));
        payload.put("tasks", ObjectMappers.create().convertValue(tasks, List.class));
        add(EventType.PLAN_INITIALIZED, "demo", null, payload);
        add(EventType.TASK_RECOVERED, "demo", "1.1", Map.of("status", "pending", "retryCount", 0,
                "repair", "DEPENDENTS_RECOMPUTED"));

        var snapshot = replayer.replay("demo", events).orElseThrow();
        assertEquals(Set.of("1.2"), snapshot.tasks().get("1.1").dependents());
    }
}
