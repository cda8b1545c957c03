package com.planwright.core.engine;

import com.planwright.agent.AgentRequest;
import com.planwright.agent.AgentResult;
import com.planwright.agent.AgentRunner;
import com.planwright.core.commit.CommitQueue;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventType;
import com.planwright.core.events.TaskPayloads;
import com.planwright.core.logging.MdcContext;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.ExecutionConstraint;
import com.planwright.core.model.Result;
import com.planwright.core.model.RunOutcome;
import com.planwright.core.model.RunRecord;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.model.Task;
import com.planwright.core.model.TaskStatus;
import com.planwright.core.scheduler.ReadySelection;
import com.planwright.core.scheduler.ReadyTaskSelector;
import com.planwright.core.scheduler.SelectionOptions;
import com.planwright.core.store.LockTimeoutException;
import com.planwright.core.store.StatusStore;
import com.planwright.core.store.StatusStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One active orchestration run over a plan.
 * <p>
 * A single coordinator thread makes every decision: it selects ready tasks, marks
 * them in progress, hands them to the worker pool and applies their results and all
 * operator commands. Worker completions and commands share one signal queue and are
 * processed in the order they arrive. Running tasks are never preempted: pausing and
 * cancelling only stop new dispatch, and an abandoned attempt keeps its worker slot
 * until it returns.
 */
public class PlanRun {

    private static final Logger log = LoggerFactory.getLogger(PlanRun.class);

    private static final int STORE_ATTEMPTS = 3;
    private static final long STORE_RETRY_MS = 100;

    private interface Signal {}

    private record Completion(long attemptId, String taskId, AgentResult result, long durationMs) implements Signal {}

    private record CommandSignal(PendingCommand pending) implements Signal {}

    private static final class Attempt {
        final long id;
        final Task task;
        final Instant startedAt;
        Instant stuckClock;
        Instant stuckAt;
        boolean actionApplied;

        Attempt(long id, Task task, Instant startedAt) {
            this.id = id;
            this.task = task;
            this.startedAt = startedAt;
            this.stuckClock = startedAt;
        }
    }

    private final String planId;
    private final String runId;
    private final RunOptions options;
    private final StatusStore store;
    private final ReadyTaskSelector selector;
    private final EventBus eventBus;
    private final AgentRunner agentRunner;
    private final CommitQueue commitQueue;
    private final PlanwrightMetrics metrics;
    private final Clock clock;
    private final Runnable onFinish;

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final CompletableFuture<RunRecord> completion = new CompletableFuture<>();
    private final ThreadPoolExecutor workers;

    // coordinator-only state
    private final Map<String, Attempt> inFlight = new LinkedHashMap<>();
    private final Map<Long, Attempt> abandoned = new LinkedHashMap<>();
    private final Set<String> forced = new LinkedHashSet<>();
    private final Set<String> completedPhases = new HashSet<>();
    private Map<String, String> lastBlocked = Map.of();
    private boolean nothingReady;
    private StatusSnapshot snapshot;
    private int attempted;
    private int failed;
    private long attemptSeq;

    private volatile RunState state = RunState.RUNNING;
    private volatile int batchSize;
    private Thread coordinator;

    PlanRun(String planId, String runId, StatusSnapshot snapshot, RunOptions options, StatusStore store,
            ReadyTaskSelector selector, EventBus eventBus, AgentRunner agentRunner, CommitQueue commitQueue,
            PlanwrightMetrics metrics, Clock clock, Runnable onFinish) {
        this.planId = planId;
        this.runId = runId;
        this.snapshot = snapshot;
        this.options = options;
        this.store = store;
        this.selector = selector;
        this.eventBus = eventBus;
        this.agentRunner = agentRunner;
        this.commitQueue = commitQueue;
        this.metrics = metrics;
        this.clock = clock;
        this.onFinish = onFinish;
        this.batchSize = options.batchSize();
        var threadCount = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(batchSize, batchSize, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    var t = new Thread(r, "planwright-worker-" + planId + "-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        for (var phase : snapshot.phaseOrder()) {
            if (snapshot.isPhaseTerminal(phase)) {
                completedPhases.add(phase);
            }
        }
    }

    void start() {
        coordinator = new Thread(this::coordinate, "planwright-run-" + planId);
        coordinator.setDaemon(true);
        coordinator.start();
    }

    public String planId() {
        return planId;
    }

    public String runId() {
        return runId;
    }

    public RunState state() {
        return state;
    }

    public int batchSize() {
        return batchSize;
    }

    public RunOptions options() {
        return options;
    }

    /** Completes with the closed run record when the run stops. */
    public CompletableFuture<RunRecord> completion() {
        return completion;
    }

    public Optional<RunRecord> awaitCompletion(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " of plan " + planId + " failed", e.getCause());
        }
    }

    /**
     * Queues a command for the coordinator. Commands sent after the run stopped
     * complete immediately with {@link ErrorKind#NO_ACTIVE_RUN}.
     */
    public PendingCommand submit(RunCommand command) {
        var pending = new PendingCommand(command);
        signals.add(new CommandSignal(pending));
        if (state == RunState.STOPPED) {
            rejectQueuedCommands();
        }
        return pending;
    }

    // -- coordinator ------------------------------------------------------------

    private void coordinate() {
        MdcContext.setRun(planId, runId);
        log.info("Run {} of plan {} started with batch size {}", runId, planId, batchSize);
        try {
            while (true) {
                if (state == RunState.RUNNING) {
                    dispatchReady();
                }
                var outcome = terminalOutcome();
                if (outcome != null) {
                    finish(outcome);
                    return;
                }
                if (state == RunState.PAUSING && inFlight.isEmpty()) {
                    enterPaused();
                }
                var signal = signals.poll(options.tickInterval().toMillis(), TimeUnit.MILLISECONDS);
                if (signal instanceof Completion c) {
                    handleCompletion(c);
                } else if (signal instanceof CommandSignal cmd) {
                    handleCommand(cmd.pending());
                }
                checkStuck();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run {} of plan {} interrupted", runId, planId);
            abort(e);
        } catch (RuntimeException e) {
            log.error("Run {} of plan {} failed: {}", runId, planId, e.getMessage(), e);
            abort(e);
        } finally {
            MdcContext.clear();
        }
    }

    private RunOutcome terminalOutcome() {
        if (!inFlight.isEmpty()) {
            return null;
        }
        if (state == RunState.CANCELLING) {
            return RunOutcome.CANCELLED;
        }
        if (state != RunState.RUNNING) {
            return null;
        }
        if (!snapshot.hasOutstandingWork()) {
            return RunOutcome.COMPLETED;
        }
        if (abandoned.isEmpty() && nothingReady) {
            return RunOutcome.BLOCKED;
        }
        return null;
    }

    private void dispatchReady() {
        nothingReady = false;
        int capacity = batchSize - inFlight.size() - abandoned.size();
        if (capacity <= 0) {
            return;
        }
        var excluded = new HashSet<String>();
        abandoned.values().forEach(a -> excluded.add(a.task.id()));
        var selection = selector.readyTasks(snapshot, options.constraints(), capacity,
                new SelectionOptions(options.ignoreSequential(), forced, excluded));
        reportConstraints(selection);
        nothingReady = selection.ready().isEmpty();
        for (var task : selection.ready()) {
            dispatch(task);
        }
    }

    private void dispatch(Task candidate) {
        var started = mutateTask(candidate.id(), t -> t.status() == TaskStatus.PENDING
                ? Result.ok(t.withStatus(TaskStatus.IN_PROGRESS))
                : Result.failure(ErrorKind.INVALID_TRANSITION, "task is " + t.status().wireName()));
        if (!started.isOk()) {
            log.warn("Could not start task {}: {}", candidate.id(), started.message());
            return;
        }
        var task = started.value();
        forced.remove(task.id());
        attempted++;
        var attempt = new Attempt(++attemptSeq, task, clock.instant());
        inFlight.put(task.id(), attempt);
        var payload = TaskPayloads.of(task, "runId", runId);
        payload.put("attempt", task.retryCount() + 1);
        eventBus.emit(EventType.TASK_STARTED, planId, task.id(), payload);
        log.info("Dispatched task {} (attempt {}): {}", task.id(), task.retryCount() + 1, task.description());
        workers.execute(() -> runAgent(attempt));
    }

    private void runAgent(Attempt attempt) {
        var task = attempt.task;
        MdcContext.setTask(planId, runId, task.id());
        long start = System.nanoTime();
        AgentResult result;
        try {
            result = agentRunner.run(new AgentRequest(planId, task.id(), task.description(),
                    task.fileReferences(), task.retryCount() + 1));
            if (result == null) {
                result = AgentResult.failure("Agent returned no result");
            }
        } catch (RuntimeException e) {
            log.warn("Agent threw for task {}: {}", task.id(), e.getMessage(), e);
            result = AgentResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        signals.add(new Completion(attempt.id, task.id(), result, durationMs));
    }

    private void handleCompletion(Completion c) {
        var attempt = inFlight.get(c.taskId());
        if (attempt == null || attempt.id != c.attemptId()) {
            var zombie = abandoned.remove(c.attemptId());
            if (zombie != null) {
                log.info("Discarding result of abandoned attempt of task {} (success={})",
                        c.taskId(), c.result().success());
            }
            return;
        }
        inFlight.remove(c.taskId());
        metrics.recordTaskDuration(c.result().success() ? "success" : "failure", c.durationMs());
        if (c.result().success()) {
            completeTask(c.taskId(), c.result(), c.durationMs());
        } else {
            failTask(c.taskId(), c.result().error() != null ? c.result().error() : "Agent reported failure");
        }
        checkPhase(attempt.task.phase());
    }

    private void completeTask(String taskId, AgentResult result, long durationMs) {
        var task = mutateTask(taskId, t -> Result.ok(t.withStatus(TaskStatus.COMPLETED))).orElseThrow();
        var payload = TaskPayloads.of(task, "durationMs", durationMs);
        if (!result.artifacts().isEmpty()) {
            payload.put("artifacts", result.artifacts());
        }
        eventBus.emit(EventType.TASK_COMPLETED, planId, taskId, payload);
        metrics.recordTaskOutcome("completed");
        log.info("Task {} completed in {}ms", taskId, durationMs);
        if (options.autoCommit() && commitQueue != null) {
            var files = new ArrayList<>(task.fileReferences());
            result.artifacts().stream().filter(a -> !files.contains(a)).forEach(files::add);
            commitQueue.enqueue("Complete task " + taskId + ": " + task.description(), files)
                    .whenComplete((res, err) -> {
                        if (err != null) {
                            log.warn("Auto-commit for task {} failed: {}", taskId, err.getMessage());
                        } else {
                            log.debug("Auto-commit for task {}: {}", taskId,
                                    res.isEmpty() ? "nothing to commit" : res.commitId());
                        }
                    });
        }
    }

    private void failTask(String taskId, String error) {
        failed++;
        var task = mutateTask(taskId, t -> Result.ok(TaskTransitions.fail(t, error, options.maxRetries())))
                .orElseThrow();
        boolean terminal = task.status() == TaskStatus.FAILED;
        eventBus.emit(EventType.TASK_FAILED, planId, taskId, TaskPayloads.of(task, "terminal", terminal));
        if (terminal) {
            metrics.recordTaskOutcome("failed");
            log.warn("Task {} failed permanently after {} attempt(s): {}", taskId, task.retryCount(), error);
        } else {
            metrics.recordTaskOutcome("retrying");
            eventBus.emit(EventType.TASK_RETRYING, planId, taskId,
                    TaskPayloads.of(task, "nextAttempt", task.retryCount() + 1));
            log.info("Task {} failed (attempt {}), will retry: {}", taskId, task.retryCount(), error);
        }
    }

    private void checkPhase(String phase) {
        if (phase == null || completedPhases.contains(phase) || !snapshot.isPhaseTerminal(phase)) {
            return;
        }
        completedPhases.add(phase);
        var tasks = snapshot.tasksInPhase(phase);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("phase", phase);
        for (var status : List.of(TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.SKIPPED)) {
            payload.put(status.wireName(), tasks.stream().filter(t -> t.status() == status).count());
        }
        eventBus.emit(EventType.PHASE_COMPLETED, planId, null, payload);
        log.info("Phase {} completed", phase);
    }

    private void reportConstraints(ReadySelection selection) {
        for (var entry : selection.blocked().entrySet()) {
            var reason = entry.getValue();
            if (reason.startsWith("dependency:") || reason.equals(lastBlocked.get(entry.getKey()))) {
                continue;
            }
            var kind = reason.substring(0, reason.indexOf(':'));
            var payload = new LinkedHashMap<String, Object>();
            payload.put("reason", reason);
            matchingConstraint(selection.applied(), entry.getKey(), reason).ifPresent(c -> {
                payload.put("kind", c.kind().name());
                payload.put("groupId", c.groupId());
                payload.put("members", c.members());
                payload.put("description", c.reason());
            });
            eventBus.emit(EventType.CONSTRAINT_APPLIED, planId, entry.getKey(), payload);
            metrics.recordConstraintDeferral(kind);
            log.debug("Task {} deferred: {}", entry.getKey(), reason);
        }
        lastBlocked = selection.blocked();
    }

    private static Optional<ExecutionConstraint> matchingConstraint(List<ExecutionConstraint> applied,
                                                                    String taskId, String reason) {
        var target = reason.substring(reason.indexOf(':') + 1);
        return applied.stream()
                .filter(c -> c.groupId().equals(target) && c.members().contains(taskId))
                .findFirst();
    }

    // -- stuck detection ----------------------------------------------------------

    private void checkStuck() {
        if (options.stuckThreshold() == null || options.stuckThreshold().isZero()) {
            return;
        }
        var now = clock.instant();
        for (var attempt : new ArrayList<>(inFlight.values())) {
            if (attempt.stuckAt == null) {
                var elapsed = Duration.between(attempt.stuckClock, now);
                if (elapsed.compareTo(options.stuckThreshold()) >= 0) {
                    attempt.stuckAt = now;
                    var payload = TaskPayloads.of(snapshot.tasks().get(attempt.task.id()));
                    payload.put("runningMs", Duration.between(attempt.startedAt, now).toMillis());
                    payload.put("autoAction", options.stuckAction().name());
                    payload.put("graceMs", options.stuckGrace().toMillis());
                    eventBus.emit(EventType.TASK_STUCK, planId, attempt.task.id(), payload);
                    metrics.recordStuckTask("reported");
                    log.warn("Task {} has been running for {}s", attempt.task.id(),
                            Duration.between(attempt.startedAt, now).toSeconds());
                }
            } else if (!attempt.actionApplied
                    && Duration.between(attempt.stuckAt, now).compareTo(options.stuckGrace()) >= 0) {
                applyStuckAction(attempt, now);
            }
        }
    }

    private void applyStuckAction(Attempt attempt, Instant now) {
        var taskId = attempt.task.id();
        metrics.recordStuckTask(options.stuckAction().name().toLowerCase(Locale.ROOT));
        switch (options.stuckAction()) {
            case NONE -> {
                attempt.actionApplied = true;
                log.warn("Task {} still stuck; no automatic action configured", taskId);
            }
            case EXTEND -> {
                attempt.stuckClock = now;
                attempt.stuckAt = null;
                log.info("Extended stuck timer of task {}", taskId);
            }
            case SKIP -> {
                abandon(attempt);
                skipTask(taskId, "stuck");
            }
            case RETRY -> {
                abandon(attempt);
                failTask(taskId, "stuck: no result after "
                        + Duration.between(attempt.startedAt, now).toSeconds() + "s; attempt abandoned");
                checkPhase(attempt.task.phase());
            }
        }
    }

    private void abandon(Attempt attempt) {
        inFlight.remove(attempt.task.id());
        abandoned.put(attempt.id, attempt);
        log.warn("Abandoned running attempt of task {}; its result will be discarded", attempt.task.id());
    }

    private Result<Task> skipTask(String taskId, String reason) {
        var skipped = mutateTask(taskId, TaskTransitions::skip);
        if (skipped.isOk()) {
            eventBus.emit(EventType.TASK_SKIPPED, planId, taskId, TaskPayloads.of(skipped.value(), "reason", reason));
            metrics.recordTaskOutcome("skipped");
            log.info("Task {} skipped ({})", taskId, reason);
            checkPhase(skipped.value().phase());
        }
        return skipped;
    }

    // -- commands -----------------------------------------------------------------

    private void handleCommand(PendingCommand pending) {
        if (!pending.claim()) {
            log.debug("Dropping expired command {}", pending.command().type().wireName());
            return;
        }
        Result<Map<String, Object>> result;
        try {
            result = apply(pending.command());
        } catch (RuntimeException e) {
            log.error("Command {} failed: {}", pending.command().type().wireName(), e.getMessage(), e);
            result = Result.failure(ErrorKind.INTERNAL, e.getMessage());
        }
        pending.result().complete(result);
    }

    private Result<Map<String, Object>> apply(RunCommand command) {
        if (command.type().needsTask() && !snapshot.tasks().containsKey(command.taskId())) {
            return Result.failure(ErrorKind.TASK_NOT_FOUND,
                    "No task " + command.taskId() + " in plan " + planId);
        }
        return switch (command.type()) {
            case STATUS -> Result.ok(statusView());
            case PAUSE -> pause();
            case RESUME -> resume();
            case CANCEL -> cancel();
            case SET_BATCH_SIZE -> resize(command.value());
            case RETRY_TASK -> retry(command.taskId());
            case SKIP_TASK -> skip(command.taskId());
            case EXTEND_TASK -> extend(command.taskId());
            case FORCE_TASK -> force(command.taskId());
        };
    }

    private Result<Map<String, Object>> pause() {
        switch (state) {
            case RUNNING -> {
                state = RunState.PAUSING;
                log.info("Pausing run {}; {} task(s) still in flight", runId, inFlight.size());
                if (inFlight.isEmpty()) {
                    enterPaused();
                }
            }
            case PAUSING, PAUSED -> log.debug("Run {} already pausing", runId);
            default -> {
                return Result.failure(ErrorKind.INVALID_TRANSITION, "Run is " + state);
            }
        }
        return Result.ok(stateView());
    }

    private void enterPaused() {
        state = RunState.PAUSED;
        eventBus.emit(EventType.RUN_PAUSED, planId, null, Map.of("runId", runId));
        log.info("Run {} paused", runId);
    }

    private Result<Map<String, Object>> resume() {
        switch (state) {
            case PAUSING, PAUSED -> {
                state = RunState.RUNNING;
                eventBus.emit(EventType.RUN_RESUMED, planId, null, Map.of("runId", runId));
                log.info("Run {} resumed", runId);
            }
            case RUNNING -> log.debug("Run {} is not paused", runId);
            default -> {
                return Result.failure(ErrorKind.INVALID_TRANSITION, "Run is " + state);
            }
        }
        return Result.ok(stateView());
    }

    private Result<Map<String, Object>> cancel() {
        if (state != RunState.CANCELLING) {
            state = RunState.CANCELLING;
            log.info("Cancelling run {}; waiting for {} in-flight task(s)", runId, inFlight.size());
        }
        return Result.ok(stateView());
    }

    private Result<Map<String, Object>> resize(int size) {
        if (size < 1) {
            return Result.failure(ErrorKind.INVALID_ARGUMENT, "Batch size must be at least 1, got " + size);
        }
        int previous = batchSize;
        if (size > workers.getMaximumPoolSize()) {
            workers.setMaximumPoolSize(size);
            workers.setCorePoolSize(size);
        } else {
            workers.setCorePoolSize(size);
            workers.setMaximumPoolSize(size);
        }
        batchSize = size;
        eventBus.emit(EventType.BATCH_RESIZED, planId, null, Map.of("runId", runId, "from", previous, "to", size));
        log.info("Batch size changed from {} to {}", previous, size);
        var view = stateView();
        view.put("batchSize", size);
        return Result.ok(view);
    }

    private Result<Map<String, Object>> retry(String taskId) {
        if (inFlight.containsKey(taskId)) {
            return Result.failure(ErrorKind.INVALID_TRANSITION, "Task " + taskId + " is running");
        }
        var reset = mutateTask(taskId, TaskTransitions::reset);
        if (!reset.isOk()) {
            return reset.propagate();
        }
        eventBus.emit(EventType.TASK_RESET, planId, taskId, TaskPayloads.of(reset.value(), "by", "operator"));
        completedPhases.remove(reset.value().phase());
        log.info("Task {} reset to pending by operator", taskId);
        return Result.ok(taskView(reset.value()));
    }

    private Result<Map<String, Object>> skip(String taskId) {
        var current = snapshot.tasks().get(taskId);
        var check = TaskTransitions.skip(current);
        if (!check.isOk()) {
            return check.propagate();
        }
        var attempt = inFlight.get(taskId);
        if (attempt != null) {
            abandon(attempt);
        }
        var skipped = skipTask(taskId, "operator");
        return skipped.isOk() ? Result.ok(taskView(skipped.value())) : skipped.propagate();
    }

    private Result<Map<String, Object>> extend(String taskId) {
        var attempt = inFlight.get(taskId);
        if (attempt == null) {
            return Result.failure(ErrorKind.INVALID_TRANSITION, "Task " + taskId + " is not running");
        }
        attempt.stuckClock = clock.instant();
        attempt.stuckAt = null;
        attempt.actionApplied = false;
        log.info("Operator extended stuck timer of task {}", taskId);
        var view = taskView(snapshot.tasks().get(taskId));
        view.put("extended", true);
        return Result.ok(view);
    }

    private Result<Map<String, Object>> force(String taskId) {
        var task = snapshot.tasks().get(taskId);
        if (task.status() != TaskStatus.PENDING) {
            return Result.failure(ErrorKind.INVALID_TRANSITION,
                    "Task " + taskId + " is " + task.status().wireName() + "; only pending tasks can be forced");
        }
        var unmet = task.dependencies().stream()
                .filter(d -> !snapshot.tasks().get(d).status().satisfiesDependency())
                .toList();
        forced.add(taskId);
        eventBus.emit(EventType.DEPENDENCY_OVERRIDDEN, planId, taskId,
                Map.of("runId", runId, "unmetDependencies", unmet));
        log.warn("Operator forced task {} past unmet dependencies {}", taskId, unmet);
        var view = taskView(task);
        view.put("unmetDependencies", unmet);
        return Result.ok(view);
    }

    private Map<String, Object> stateView() {
        var view = new LinkedHashMap<String, Object>();
        view.put("planId", planId);
        view.put("runId", runId);
        view.put("state", state.name());
        return view;
    }

    private static Map<String, Object> taskView(Task task) {
        var view = new LinkedHashMap<String, Object>();
        view.put("taskId", task.id());
        view.putAll(TaskPayloads.of(task));
        return view;
    }

    private Map<String, Object> statusView() {
        var now = clock.instant();
        var view = stateView();
        view.put("batchSize", batchSize);
        view.put("summary", snapshot.summary());
        var running = new ArrayList<Map<String, Object>>();
        for (var attempt : inFlight.values()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("taskId", attempt.task.id());
            entry.put("runningMs", Duration.between(attempt.startedAt, now).toMillis());
            entry.put("stuck", attempt.stuckAt != null);
            running.add(entry);
        }
        view.put("inFlight", running);
        view.put("abandoned", abandoned.values().stream().map(a -> a.task.id()).toList());
        view.put("blocked", new LinkedHashMap<>(lastBlocked));
        view.put("forced", List.copyOf(forced));
        view.put("tasksAttempted", attempted);
        view.put("tasksFailed", failed);
        return view;
    }

    // -- shutdown -----------------------------------------------------------------

    private void finish(RunOutcome outcome) {
        var now = clock.instant();
        var closed = withStoreRetry(() -> store.mutate(planId, s -> s.withRun(
                s.run(runId).orElseThrow().close(now, attempted, failed, outcome)))).orElseThrow();
        snapshot = closed;
        var record = closed.run(runId).orElseThrow();
        emitRunCompleted(record);
        metrics.recordRunOutcome(outcome.name().toLowerCase(Locale.ROOT));
        log.info("Run {} of plan {} finished: {} ({} attempted, {} failed)",
                runId, planId, outcome, attempted, failed);
        stop();
        completion.complete(record);
    }

    private void abort(Exception cause) {
        try {
            var closed = store.mutate(planId, s -> s.run(runId).filter(RunRecord::isOpen)
                    .map(r -> s.withRun(r.close(clock.instant(), attempted, failed, RunOutcome.INTERRUPTED)))
                    .orElse(s));
            if (closed.isOk()) {
                closed.value().run(runId).ifPresent(this::emitRunCompleted);
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Could not close run {} after failure: {}", runId, e.getMessage());
        }
        stop();
        completion.completeExceptionally(cause);
    }

    private void emitRunCompleted(RunRecord record) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("runId", record.runId());
        payload.put("outcome", record.outcome().name());
        payload.put("completedAt", record.completedAt().toString());
        payload.put("tasksAttempted", record.tasksAttempted());
        payload.put("tasksFailed", record.tasksFailed());
        eventBus.emit(EventType.RUN_COMPLETED, planId, null, payload);
    }

    private void stop() {
        state = RunState.STOPPED;
        if (abandoned.isEmpty()) {
            workers.shutdown();
        } else {
            workers.shutdownNow();
        }
        rejectQueuedCommands();
        onFinish.run();
    }

    private void rejectQueuedCommands() {
        var rest = new ArrayList<Signal>();
        signals.drainTo(rest);
        for (var signal : rest) {
            if (signal instanceof CommandSignal cmd && cmd.pending().claim()) {
                cmd.pending().result().complete(Result.failure(ErrorKind.NO_ACTIVE_RUN,
                        "Run " + runId + " of plan " + planId + " has stopped"));
            }
        }
    }

    // -- store access -------------------------------------------------------------

    private Result<Task> mutateTask(String taskId, Function<Task, Result<Task>> fn) {
        var result = withStoreRetry(() -> store.tryMutate(planId, s -> {
            var task = s.tasks().get(taskId);
            if (task == null) {
                return Result.failure(ErrorKind.TASK_NOT_FOUND, "No task " + taskId + " in plan " + planId);
            }
            var changed = fn.apply(task);
            return changed.isOk() ? Result.ok(s.withTask(changed.value())) : changed.propagate();
        }));
        if (!result.isOk()) {
            return result.propagate();
        }
        snapshot = result.value();
        return Result.ok(snapshot.tasks().get(taskId));
    }

    private <T> T withStoreRetry(Supplier<T> operation) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= STORE_ATTEMPTS; attempt++) {
            try {
                return operation.get();
            } catch (LockTimeoutException | StatusStoreException e) {
                last = e;
                log.warn("Store operation for plan {} failed (attempt {}/{}): {}",
                        planId, attempt, STORE_ATTEMPTS, e.getMessage());
                try {
                    Thread.sleep(STORE_RETRY_MS * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        throw last;
    }
}
