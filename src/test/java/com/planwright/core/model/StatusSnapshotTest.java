package com.planwright.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

import static com.planwright.TestPlans.task;
import static org.junit.jupiter.api.Assertions.*;

class StatusSnapshotTest {

    private static StatusSnapshot snapshot(Task... tasks) {
        var byId = new LinkedHashMap<String, Task>();
        for (var t : tasks) {
            byId.put(t.id(), t);
        }
        return new StatusSnapshot(StatusSnapshot.SCHEMA_VERSION, "demo", byId, List.of("1", "2"),
                List.of(), Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void summaryCountsEveryStatusAndTotal() {
        var s = snapshot(task("1.1").withStatus(TaskStatus.COMPLETED), task("1.2"),
                task("2.1").withStatus(TaskStatus.FAILED));

        var summary = s.summary();
        assertEquals(3L, summary.get("total"));
        assertEquals(1L, summary.get("completed"));
        assertEquals(1L, summary.get("pending"));
        assertEquals(1L, summary.get("failed"));
        assertEquals(0L, summary.get("in_progress"));
        assertEquals(0L, summary.get("skipped"));
    }

    @Test
    void phaseIsTerminalOnlyWhenAllTasksAreTerminal() {
        var s = snapshot(task("1.1").withStatus(TaskStatus.COMPLETED), task("1.2").withStatus(TaskStatus.SKIPPED),
                task("2.1"));

        assertTrue(s.isPhaseTerminal("1"));
        assertFalse(s.isPhaseTerminal("2"));
        assertFalse(s.isPhaseTerminal("9"));
        assertTrue(s.hasOutstandingWork());
    }

    @Test
    void undeclaredPhaseSortsLast() {
        var s = snapshot(task("1.1"));
        assertEquals(0, s.phaseIndex("1"));
        assertEquals(Integer.MAX_VALUE, s.phaseIndex("7"));
    }

    @Test
    void withRunReplacesByRunId() {
        var started = RunRecord.started("run-1", Instant.EPOCH);
        var s = snapshot(task("1.1")).withRun(started);
        var closed = started.close(Instant.EPOCH.plusSeconds(5), 2, 1, RunOutcome.COMPLETED);

        var after = s.withRun(closed);
        assertEquals(1, after.runs().size());
        assertEquals(RunOutcome.COMPLETED, after.run("run-1").orElseThrow().outcome());
        assertThrows(IllegalStateException.class, () -> closed.close(Instant.now(), 0, 0, RunOutcome.CANCELLED));
    }

    @Test
    void withTaskRejectsUnknownTask() {
        var s = snapshot(task("1.1"));
        assertThrows(IllegalArgumentException.class, () -> s.withTask(task("3.3")));
    }

    @Test
    void failureOnlyGrowsRetryCount() {
        var t = task("1.1").withFailure(TaskStatus.PENDING, "boom").withFailure(TaskStatus.FAILED, "again");
        assertEquals(2, t.retryCount());
        assertEquals("again", t.lastError());
        assertEquals("1", t.phase());
    }
}
