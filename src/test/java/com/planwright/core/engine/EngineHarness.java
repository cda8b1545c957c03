package com.planwright.core.engine;

import com.planwright.TestPlans;
import com.planwright.config.PlanwrightProperties;
import com.planwright.core.commit.CommitQueue;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventFilter;
import com.planwright.core.events.EventType;
import com.planwright.core.events.PlanEvent;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.scheduler.ReadyTaskSelector;
import com.planwright.core.store.StatusStore;
import com.planwright.vcs.VersionControl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.Mockito.mock;

/**
 * Real store, bus and selector in a temp directory, with a scripted agent and mocked
 * version control and commit queue.
 */
class EngineHarness implements AutoCloseable {

    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final PlanwrightMetrics metrics = new PlanwrightMetrics(registry);
    final EventBus eventBus;
    final StatusStore store;
    final ScriptedAgent agent = new ScriptedAgent();
    final VersionControl versionControl = mock(VersionControl.class);
    final CommitQueue commitQueue = mock(CommitQueue.class);
    final OrchestrationService orchestration;

    EngineHarness(Path root) {
        eventBus = TestPlans.eventBus(root, metrics);
        store = TestPlans.store(root, eventBus, metrics);
        orchestration = new OrchestrationService(store, new ReadyTaskSelector(), eventBus, agent, commitQueue,
                versionControl, metrics, new PlanwrightProperties());
    }

    static RunOptions options(int batchSize, int maxRetries) {
        return new RunOptions(batchSize, maxRetries, Duration.ZERO, null, null, Duration.ofMillis(20),
                null, false, null, false);
    }

    List<PlanEvent> events(String planId) {
        return eventBus.history(EventFilter.forPlan(planId), 0);
    }

    List<PlanEvent> events(String planId, EventType type) {
        return events(planId).stream().filter(e -> e.type() == type).toList();
    }

    PlanEvent awaitEvent(String planId, EventType type, String taskId) {
        awaitCondition(() -> events(planId, type).stream().anyMatch(e -> taskId == null || taskId.equals(e.taskId())),
                "event " + type.wireName() + " for " + taskId);
        return events(planId, type).stream()
                .filter(e -> taskId == null || taskId.equals(e.taskId()))
                .findFirst().orElseThrow();
    }

    static void awaitCondition(BooleanSupplier condition, String what) {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + what);
            }
        }
    }

    @Override
    public void close() {
        for (var run : orchestration.activeRuns()) {
            run.submit(RunCommand.of(CommandType.CANCEL));
        }
        eventBus.shutdown();
    }
}
