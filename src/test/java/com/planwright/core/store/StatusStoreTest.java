package com.planwright.core.store;

import com.planwright.TestPlans;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventFilter;
import com.planwright.core.events.EventType;
import com.planwright.core.graph.CycleException;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.Result;
import com.planwright.core.model.RunOutcome;
import com.planwright.core.model.RunRecord;
import com.planwright.core.model.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.planwright.TestPlans.diamond;
import static com.planwright.TestPlans.task;
import static org.junit.jupiter.api.Assertions.*;

class StatusStoreTest {

    @TempDir
    Path root;

    private SimpleMeterRegistry registry;
    private PlanwrightMetrics metrics;
    private EventBus eventBus;
    private StatusStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PlanwrightMetrics(registry);
        eventBus = TestPlans.eventBus(root, metrics);
        store = TestPlans.store(root, eventBus, metrics);
    }

    @AfterEach
    void tearDown() {
        eventBus.shutdown();
    }

    // -- init tests --------------------------------------------------------------

    @Nested
    @DisplayName("init")
    class Init {

        @Test
        @DisplayName("writes the snapshot with reverse edges and emits plan.initialized")
        void writesSnapshot() {
            var snapshot = store.init("demo", diamond());

            assertTrue(Files.exists(store.statusFile("demo")));
            assertEquals(Set.of("1.2", "1.3"), snapshot.tasks().get("1.1").dependents());
            assertEquals(List.of("1"), snapshot.phaseOrder());
            var events = eventBus.history(EventFilter.forPlan("demo"), 0);
            assertEquals(1, events.size());
            assertEquals(EventType.PLAN_INITIALIZED, events.get(0).type());
        }

        @Test
        @DisplayName("is idempotent for an existing plan")
        void idempotent() {
            var first = store.init("demo", diamond());
            var second = store.init("demo", List.of(task("9.1")));

            assertEquals(first.tasks().keySet(), second.tasks().keySet());
            assertEquals(1, eventBus.history(EventFilter.forPlan("demo"), 0).size());
        }

        @Test
        @DisplayName("rejects a cycle without writing anything")
        void rejectsCycle() {
            assertThrows(CycleException.class,
                    () -> store.init("loop", List.of(task("1.1", "1.2"), task("1.2", "1.1"))));
            assertFalse(store.exists("loop"));
        }

        @Test
        @DisplayName("rejects an unsafe plan id")
        void rejectsBadPlanId() {
            assertThrows(IllegalArgumentException.class, () -> store.init("../escape", diamond()));
        }
    }

    // -- mutate tests ------------------------------------------------------------

    @Nested
    @DisplayName("mutate")
    class Mutate {

        @Test
        @DisplayName("persists changes visible to a fresh store")
        void persists() {
            store.init("demo", diamond());
            var result = store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withStatus(TaskStatus.COMPLETED)));

            assertTrue(result.isOk());
            var other = TestPlans.store(root, eventBus, metrics);
            assertEquals(TaskStatus.COMPLETED, other.load("demo").orElseThrow().tasks().get("1.1").status());
        }

        @Test
        @DisplayName("a rejected mutation writes nothing")
        void rejectedWritesNothing() throws Exception {
            store.init("demo", diamond());
            var before = Files.readString(store.statusFile("demo"));

            var result = store.tryMutate("demo", s -> Result.failure(ErrorKind.INVALID_TRANSITION, "no"));

            assertEquals(ErrorKind.INVALID_TRANSITION, result.error());
            assertEquals(before, Files.readString(store.statusFile("demo")));
        }

        @Test
        @DisplayName("unknown plan yields PLAN_NOT_FOUND")
        void unknownPlan() {
            assertEquals(ErrorKind.PLAN_NOT_FOUND, store.mutate("nope", s -> s).error());
            assertEquals(ErrorKind.PLAN_NOT_FOUND, store.load("nope").error());
        }

        @Test
        @DisplayName("a lower retry count is refused")
        void retryCountNeverDecreases() {
            store.init("demo", diamond());
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withFailure(TaskStatus.PENDING, "x")));

            assertThrows(IllegalArgumentException.class,
                    () -> store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withRetryCount(0))));
            assertEquals(1, store.load("demo").orElseThrow().tasks().get("1.1").retryCount());
        }

        @Test
        @DisplayName("a closed run cannot be rewritten")
        void closedRunIsFinal() {
            store.init("demo", diamond());
            var closed = RunRecord.started("run-1", Instant.EPOCH)
                    .close(Instant.EPOCH.plusSeconds(1), 1, 0, RunOutcome.COMPLETED);
            store.mutate("demo", s -> s.withRun(closed));

            var rewritten = new RunRecord("run-1", Instant.EPOCH, Instant.EPOCH.plusSeconds(2), 9, 9,
                    RunOutcome.CANCELLED, null);
            assertThrows(IllegalArgumentException.class, () -> store.mutate("demo", s -> s.withRun(rewritten)));
        }

        @Test
        @DisplayName("times out while another store holds the plan lock")
        void lockTimeout() {
            store.init("demo", diamond());
            var impatient = TestPlans.store(root, eventBus, metrics, Duration.ofMillis(200), 3);

            store.mutate("demo", s -> {
                assertThrows(LockTimeoutException.class, () -> impatient.mutate("demo", x -> x));
                return s;
            });
            assertEquals(1, registry.get("planwright.store.lock_wait").tag("acquired", "false").timer().count());
        }
    }

    // -- recovery tests ------------------------------------------------------------

    @Nested
    @DisplayName("recovery")
    class Recovery {

        @Test
        @DisplayName("a stale temp file from a crashed write is ignored and cleaned up")
        void staleTemp() throws Exception {
            store.init("demo", diamond());
            Path stale = store.statusFile("demo").resolveSibling("status.json.tmp-crashed");
            Files.writeString(stale, "{\"schemaVer", StandardCharsets.UTF_8);

            assertEquals(4, store.load("demo").orElseThrow().tasks().size());
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withStatus(TaskStatus.SKIPPED)));
            assertFalse(Files.exists(stale));
        }

        @Test
        @DisplayName("a corrupt status file is restored from its backup")
        void restoresBackup() throws Exception {
            store.init("demo", diamond());
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withStatus(TaskStatus.COMPLETED)));
            Files.writeString(store.statusFile("demo"), "{ not json", StandardCharsets.UTF_8);

            var loaded = store.load("demo").orElseThrow();

            assertEquals(TaskStatus.PENDING, loaded.tasks().get("1.1").status());
            assertEquals(1.0, registry.get("planwright.store.recoveries").tag("kind", "backup_restored")
                    .counter().count());
            assertTrue(Files.readString(store.statusFile("demo")).contains("\"1.1\""));
        }

        @Test
        @DisplayName("restoring from the backup is recorded so the log replays to the restored state")
        void restoreIsReplayable() throws Exception {
            store.init("demo", diamond());
            var run = RunRecord.started("run-1", Instant.EPOCH, 4)
                    .close(Instant.EPOCH.plusSeconds(5), 1, 0, RunOutcome.COMPLETED);
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withStatus(TaskStatus.COMPLETED)).withRun(run));
            eventBus.emit(EventType.TASK_COMPLETED, "demo", "1.1", Map.of("status", "completed", "retryCount", 0));
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.2").withStatus(TaskStatus.COMPLETED)));
            eventBus.emit(EventType.TASK_COMPLETED, "demo", "1.2", Map.of("status", "completed", "retryCount", 0));
            Files.writeString(store.statusFile("demo"), "{ not json", StandardCharsets.UTF_8);

            var loaded = store.load("demo").orElseThrow();

            assertEquals(TaskStatus.PENDING, loaded.tasks().get("1.2").status());
            var events = eventBus.readLog(EventFilter.forPlan("demo"), 0);
            var last = events.get(events.size() - 1);
            assertEquals(EventType.PLAN_RESTORED, last.type());
            var replayed = new SnapshotReplayer().replay("demo", events).orElseThrow();
            assertEquals(loaded.tasks(), replayed.tasks());
            assertEquals(loaded.phaseOrder(), replayed.phaseOrder());
            assertEquals(List.of(run), replayed.runs());
        }

        @Test
        @DisplayName("corruption without a usable backup is reported")
        void corruptWithoutBackup() throws Exception {
            store.init("demo", diamond());
            Files.writeString(store.statusFile("demo"), "garbage", StandardCharsets.UTF_8);

            assertThrows(SnapshotCorruptException.class, () -> store.load("demo"));
        }

        @Test
        @DisplayName("an interrupted run is healed on load")
        void healsInterruptedRun() {
            store.init("demo", diamond());
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withStatus(TaskStatus.IN_PROGRESS))
                    .withRun(RunRecord.started("run-1", Instant.EPOCH)));

            var healed = TestPlans.store(root, eventBus, metrics).load("demo").orElseThrow();

            var task = healed.tasks().get("1.1");
            assertEquals(TaskStatus.PENDING, task.status());
            assertEquals(1, task.retryCount());
            assertEquals(RunOutcome.INTERRUPTED, healed.run("run-1").orElseThrow().outcome());
            var types = eventBus.history(EventFilter.forPlan("demo"), 0).stream().map(e -> e.type()).toList();
            assertTrue(types.contains(EventType.TASK_RECOVERED));
            assertTrue(types.contains(EventType.RUN_COMPLETED));
        }

        @Test
        @DisplayName("healing keeps the retry limit of the interrupted run")
        void healsWithRunRetryLimit() {
            store.init("demo", diamond());
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withStatus(TaskStatus.IN_PROGRESS)
                            .withRetryCount(2))
                    .withRun(RunRecord.started("run-1", Instant.EPOCH, 5)));

            var healed = TestPlans.store(root, eventBus, metrics, Duration.ofSeconds(2), 3).load("demo").orElseThrow();

            var task = healed.tasks().get("1.1");
            assertEquals(TaskStatus.PENDING, task.status());
            assertEquals(3, task.retryCount());
        }

        @Test
        @DisplayName("a plan owned by a live run is not healed")
        void activePlanNotHealed() {
            store.init("demo", diamond());
            store.mutate("demo", s -> s.withTask(s.tasks().get("1.1").withStatus(TaskStatus.IN_PROGRESS)));
            assertTrue(store.activate("demo"));
            try {
                assertEquals(TaskStatus.IN_PROGRESS, store.load("demo").orElseThrow().tasks().get("1.1").status());
                var otherProcess = TestPlans.store(root, eventBus, metrics);
                assertEquals(TaskStatus.IN_PROGRESS,
                        otherProcess.load("demo").orElseThrow().tasks().get("1.1").status());
            } finally {
                store.deactivate("demo");
            }
        }
    }

    // -- run lock tests ------------------------------------------------------------

    @Test
    void runLockIsExclusiveAndVisibleToOtherStores() {
        store.init("demo", diamond());
        var other = TestPlans.store(root, eventBus, metrics);

        assertTrue(store.activate("demo"));
        assertFalse(store.activate("demo"));
        assertFalse(other.activate("demo"));
        assertTrue(other.isRunningElsewhere("demo"));
        assertFalse(store.isRunningElsewhere("demo"));

        store.deactivate("demo");
        assertFalse(other.isRunningElsewhere("demo"));
        assertTrue(other.activate("demo"));
        other.deactivate("demo");
    }

    @Test
    void listPlansReturnsInitializedPlansSorted() {
        store.init("zeta", diamond());
        store.init("alpha", diamond());

        assertEquals(List.of("alpha", "zeta"), store.listPlans());
    }
}
