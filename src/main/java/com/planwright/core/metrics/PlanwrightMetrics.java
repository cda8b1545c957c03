package com.planwright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for plan orchestration.
 */
@Service
public class PlanwrightMetrics {

    private final MeterRegistry registry;

    public PlanwrightMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskDuration(String outcome, long ms) {
        Timer.builder("planwright.task.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String status) {
        Counter.builder("planwright.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRunOutcome(String outcome) {
        Counter.builder("planwright.runs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a ready task held back by a constraint.
     *
     * @param kind "sequential" or "fileConflict"
     */
    public void recordConstraintDeferral(String kind) {
        Counter.builder("planwright.scheduler.deferrals")
                .description("Ready tasks deferred by sequential groups or file conflicts")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordStuckTask(String action) {
        Counter.builder("planwright.tasks.stuck")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    /**
     * @param result "committed", "empty", "retried" or "failed"
     */
    public void recordCommit(String result) {
        Counter.builder("planwright.commits.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordDroppedEvent() {
        Counter.builder("planwright.events.dropped")
                .description("Events discarded because a subscriber queue was full")
                .register(registry)
                .increment();
    }

    public void recordEventPersistFailure() {
        Counter.builder("planwright.events.persist_failures")
                .register(registry)
                .increment();
    }

    public void recordLockWait(long ms, boolean acquired) {
        Timer.builder("planwright.store.lock_wait")
                .tag("acquired", String.valueOf(acquired))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRecovery(String kind) {
        Counter.builder("planwright.store.recoveries")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordIpcCommand(String command, boolean success) {
        Counter.builder("planwright.ipc.commands")
                .tag("command", command)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
