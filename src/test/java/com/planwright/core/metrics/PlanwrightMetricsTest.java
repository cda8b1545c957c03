package com.planwright.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PlanwrightMetricsTest {

    private SimpleMeterRegistry registry;
    private PlanwrightMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PlanwrightMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskDuration records by outcome tag")
    void recordTaskDuration() {
        metrics.recordTaskDuration("completed", 200);
        metrics.recordTaskDuration("completed", 300);
        metrics.recordTaskDuration("failed", 50);

        var completed = registry.find("planwright.task.duration").tag("outcome", "completed").timer();
        var failed = registry.find("planwright.task.duration").tag("outcome", "failed").timer();

        assertNotNull(completed);
        assertNotNull(failed);
        assertEquals(2, completed.count());
        assertEquals(500.0, completed.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, failed.count());
    }

    @Test
    @DisplayName("recordTaskOutcome and recordRunOutcome count per tag")
    void outcomes() {
        metrics.recordTaskOutcome("completed");
        metrics.recordTaskOutcome("completed");
        metrics.recordTaskOutcome("failed");
        metrics.recordRunOutcome("BLOCKED");

        assertEquals(2.0, registry.find("planwright.tasks.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("planwright.tasks.total").tag("status", "failed").counter().count());
        assertEquals(1.0, registry.find("planwright.runs.total").tag("outcome", "BLOCKED").counter().count());
    }

    @Test
    @DisplayName("recordConstraintDeferral separates constraint kinds")
    void constraintDeferral() {
        metrics.recordConstraintDeferral("sequential");
        metrics.recordConstraintDeferral("fileConflict");
        metrics.recordConstraintDeferral("fileConflict");

        assertEquals(1.0, registry.find("planwright.scheduler.deferrals").tag("kind", "sequential").counter().count());
        assertEquals(2.0, registry.find("planwright.scheduler.deferrals").tag("kind", "fileConflict").counter().count());
    }

    @Test
    @DisplayName("recordLockWait tags whether the lock was acquired")
    void lockWait() {
        metrics.recordLockWait(10, true);
        metrics.recordLockWait(5000, false);

        var acquired = registry.find("planwright.store.lock_wait").tag("acquired", "true").timer();
        var timedOut = registry.find("planwright.store.lock_wait").tag("acquired", "false").timer();
        assertNotNull(acquired);
        assertNotNull(timedOut);
        assertEquals(1, timedOut.count());
    }

    @Test
    @DisplayName("recordIpcCommand tags command and success")
    void ipcCommand() {
        metrics.recordIpcCommand("pause", true);
        metrics.recordIpcCommand("pause", false);
        metrics.recordIpcCommand("ping", true);

        assertEquals(1.0, registry.find("planwright.ipc.commands")
                .tag("command", "pause").tag("success", "false").counter().count());
        assertEquals(2.0, registry.find("planwright.ipc.commands").tag("success", "true").counters()
                .stream().mapToDouble(c -> c.count()).sum());
    }

    @Test
    @DisplayName("untagged counters accumulate")
    void untaggedCounters() {
        metrics.recordDroppedEvent();
        metrics.recordDroppedEvent();
        metrics.recordEventPersistFailure();
        metrics.recordStuckTask("SKIP");
        metrics.recordCommit("retried");
        metrics.recordRecovery("backup_restored");

        assertEquals(2.0, registry.find("planwright.events.dropped").counter().count());
        assertEquals(1.0, registry.find("planwright.events.persist_failures").counter().count());
        assertEquals(1.0, registry.find("planwright.tasks.stuck").tag("action", "SKIP").counter().count());
        assertEquals(1.0, registry.find("planwright.commits.total").tag("result", "retried").counter().count());
        assertEquals(1.0, registry.find("planwright.store.recoveries").tag("kind", "backup_restored").counter().count());
    }
}
