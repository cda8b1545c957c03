package com.planwright.core.engine;

import com.planwright.agent.AgentRunner;
import com.planwright.config.PlanwrightProperties;
import com.planwright.core.commit.CommitQueue;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventType;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.Result;
import com.planwright.core.model.RunRecord;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.scheduler.ReadyTaskSelector;
import com.planwright.core.store.StatusStore;
import com.planwright.vcs.VersionControl;
import com.planwright.vcs.VersionControlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Starts orchestration runs and keeps track of the ones active in this process.
 * At most one run per plan is active at a time.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    private final StatusStore store;
    private final ReadyTaskSelector selector;
    private final EventBus eventBus;
    private final AgentRunner agentRunner;
    private final CommitQueue commitQueue;
    private final VersionControl versionControl;
    private final PlanwrightMetrics metrics;
    private final PlanwrightProperties properties;
    private final Clock clock;
    private final Map<String, PlanRun> runs = new ConcurrentHashMap<>();

    @Autowired
    public OrchestrationService(StatusStore store, ReadyTaskSelector selector, EventBus eventBus,
                                AgentRunner agentRunner, CommitQueue commitQueue, VersionControl versionControl,
                                PlanwrightMetrics metrics, PlanwrightProperties properties) {
        this(store, selector, eventBus, agentRunner, commitQueue, versionControl, metrics, properties,
                Clock.systemUTC());
    }

    public OrchestrationService(StatusStore store, ReadyTaskSelector selector, EventBus eventBus,
                                AgentRunner agentRunner, CommitQueue commitQueue, VersionControl versionControl,
                                PlanwrightMetrics metrics, PlanwrightProperties properties, Clock clock) {
        this.store = store;
        this.selector = selector;
        this.eventBus = eventBus;
        this.agentRunner = agentRunner;
        this.commitQueue = commitQueue;
        this.versionControl = versionControl;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    public RunOptions defaultOptions() {
        return RunOptions.from(properties.getOrchestrator());
    }

    /**
     * Starts a run in the background.
     *
     * @return the active run, or {@code PLAN_NOT_FOUND}, {@code ALREADY_RUNNING} or
     *         {@code POLICY_ABORT}
     */
    public synchronized Result<PlanRun> start(String planId, RunOptions options) {
        if (runs.containsKey(planId)) {
            return Result.failure(ErrorKind.ALREADY_RUNNING,
                    "Plan " + planId + " already has active run " + runs.get(planId).runId());
        }
        if (store.isRunningElsewhere(planId)) {
            return Result.failure(ErrorKind.ALREADY_RUNNING, "Plan " + planId + " is being run by another process");
        }
        var loaded = store.load(planId);
        if (!loaded.isOk()) {
            return loaded.propagate();
        }
        var policy = applyUncommittedChangesPolicy(planId, options.onUncommittedChanges());
        if (!policy.isOk()) {
            return policy.propagate();
        }

        if (!store.activate(planId)) {
            return Result.failure(ErrorKind.ALREADY_RUNNING, "Plan " + planId + " is being run by another process");
        }
        var runId = newRunId();
        var now = clock.instant();
        StatusSnapshot snapshot;
        try {
            snapshot = store.mutate(planId, s -> s.withRun(RunRecord.started(runId, now, options.maxRetries()))).orElseThrow();
        } catch (RuntimeException e) {
            store.deactivate(planId);
            throw e;
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("runId", runId);
        payload.put("startedAt", now.toString());
        payload.put("batchSize", options.batchSize());
        payload.put("maxRetries", options.maxRetries());
        eventBus.emit(EventType.RUN_STARTED, planId, null, payload);
        metrics.recordRunOutcome("started");

        var run = new PlanRun(planId, runId, snapshot, options, store, selector, eventBus, agentRunner,
                commitQueue, metrics, clock, () -> finished(planId, runId));
        runs.put(planId, run);
        run.start();
        return Result.ok(run);
    }

    /**
     * Starts a run and blocks until it stops.
     */
    public Result<RunRecord> run(String planId, RunOptions options) throws InterruptedException {
        var started = start(planId, options);
        if (!started.isOk()) {
            return started.propagate();
        }
        try {
            return Result.ok(started.value().completion().get());
        } catch (ExecutionException e) {
            var cause = e.getCause();
            log.error("Run of plan {} ended abnormally: {}", planId, cause.getMessage(), cause);
            return Result.failure(ErrorKind.INTERNAL, cause.getMessage());
        }
    }

    public Optional<PlanRun> activeRun(String planId) {
        return Optional.ofNullable(runs.get(planId));
    }

    public List<PlanRun> activeRuns() {
        return new ArrayList<>(runs.values());
    }

    private Result<Boolean> applyUncommittedChangesPolicy(String planId, UncommittedChangesPolicy policy) {
        if (policy == UncommittedChangesPolicy.IGNORE) {
            return Result.ok(true);
        }
        boolean dirty;
        try {
            dirty = versionControl.hasUncommittedChanges();
        } catch (VersionControlException e) {
            log.warn("Could not inspect working tree for plan {}: {}", planId, e.getMessage());
            return Result.failure(ErrorKind.POLICY_ABORT, "Working tree state unknown: " + e.getMessage());
        }
        if (!dirty) {
            return Result.ok(true);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("policy", policy.name());
        if (policy == UncommittedChangesPolicy.ABORT) {
            payload.put("action", "aborted");
            eventBus.emit(EventType.POLICY_APPLIED, planId, null, payload);
            log.warn("Refusing to start plan {}: working tree has uncommitted changes", planId);
            return Result.failure(ErrorKind.POLICY_ABORT, "Working tree has uncommitted changes");
        }
        versionControl.stash("planwright: auto-stash before running " + planId);
        payload.put("action", "stashed");
        eventBus.emit(EventType.POLICY_APPLIED, planId, null, payload);
        log.info("Stashed uncommitted changes before running plan {}", planId);
        return Result.ok(true);
    }

    private void finished(String planId, String runId) {
        runs.remove(planId);
        store.deactivate(planId);
        log.debug("Run {} of plan {} released", runId, planId);
    }

    private static String newRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
