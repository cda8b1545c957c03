package com.planwright.core.engine;

import com.planwright.config.PlanwrightProperties;
import com.planwright.core.model.ExecutionConstraint;

import java.time.Duration;
import java.util.List;

/**
 * Settings for one orchestration run.
 *
 * @param batchSize            maximum tasks in flight, adjustable while running
 * @param maxRetries           failed attempts after which a task is terminally failed
 * @param stuckThreshold       in-flight time after which a task is reported stuck
 * @param stuckGrace           time after the stuck report before {@code stuckAction} applies
 * @param stuckAction          automatic response to a stuck task
 * @param tickInterval         how often the loop re-checks timers when idle
 * @param onUncommittedChanges dirty working tree policy at start
 * @param autoCommit           enqueue a commit after every completed task
 * @param constraints          extra sequential constraints on top of the plan's groups
 * @param ignoreSequential     disable sequential-group filtering
 */
public record RunOptions(
    int batchSize,
    int maxRetries,
    Duration stuckThreshold,
    Duration stuckGrace,
    StuckAction stuckAction,
    Duration tickInterval,
    UncommittedChangesPolicy onUncommittedChanges,
    boolean autoCommit,
    List<ExecutionConstraint> constraints,
    boolean ignoreSequential
) {

    public RunOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        stuckGrace = stuckGrace == null ? Duration.ZERO : stuckGrace;
        stuckAction = stuckAction == null ? StuckAction.NONE : stuckAction;
        tickInterval = tickInterval == null ? Duration.ofSeconds(1) : tickInterval;
        onUncommittedChanges = onUncommittedChanges == null ? UncommittedChangesPolicy.IGNORE : onUncommittedChanges;
    }

    public static RunOptions from(PlanwrightProperties.Orchestrator props) {
        return new RunOptions(props.getBatchSize(), props.getMaxRetries(), props.getStuckThreshold(),
                props.getStuckGrace(), props.getStuckAction(), props.getTickInterval(),
                props.getOnUncommittedChanges(), props.isAutoCommit(), List.of(), false);
    }

    public RunOptions withBatchSize(int size) {
        return new RunOptions(size, maxRetries, stuckThreshold, stuckGrace, stuckAction, tickInterval,
                onUncommittedChanges, autoCommit, constraints, ignoreSequential);
    }

    public RunOptions withMaxRetries(int retries) {
        return new RunOptions(batchSize, retries, stuckThreshold, stuckGrace, stuckAction, tickInterval,
                onUncommittedChanges, autoCommit, constraints, ignoreSequential);
    }

    public RunOptions withStuckHandling(Duration threshold, Duration grace, StuckAction action) {
        return new RunOptions(batchSize, maxRetries, threshold, grace, action, tickInterval,
                onUncommittedChanges, autoCommit, constraints, ignoreSequential);
    }

    public RunOptions withUncommittedChanges(UncommittedChangesPolicy policy) {
        return new RunOptions(batchSize, maxRetries, stuckThreshold, stuckGrace, stuckAction, tickInterval,
                policy, autoCommit, constraints, ignoreSequential);
    }

    public RunOptions withAutoCommit(boolean enabled) {
        return new RunOptions(batchSize, maxRetries, stuckThreshold, stuckGrace, stuckAction, tickInterval,
                onUncommittedChanges, enabled, constraints, ignoreSequential);
    }

    public RunOptions withIgnoreSequential(boolean ignore) {
        return new RunOptions(batchSize, maxRetries, stuckThreshold, stuckGrace, stuckAction, tickInterval,
                onUncommittedChanges, autoCommit, constraints, ignore);
    }
}
