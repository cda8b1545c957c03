package com.planwright.dispatch.cli;

import com.planwright.core.engine.OrchestrationService;
import com.planwright.core.engine.StuckAction;
import com.planwright.core.engine.UncommittedChangesPolicy;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventFilter;
import com.planwright.core.model.RunOutcome;
import com.planwright.dispatch.ipc.IpcServer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: planwright run &lt;plan-id&gt;
 * <p>
 * Runs the plan in the foreground until it completes, blocks or is cancelled,
 * printing events as they happen. While running, the plan accepts control commands
 * on the IPC port ({@code planwright ctl}).
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a plan until it completes or blocks")
@Component
public class RunPlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan id")
    private String planId;

    @Option(names = {"--batch-size", "-b"}, description = "Maximum tasks in flight")
    private Integer batchSize;

    @Option(names = {"--max-retries"}, description = "Failed attempts before a task is marked failed")
    private Integer maxRetries;

    @Option(names = {"--auto-commit"}, description = "Commit after every completed task")
    private Boolean autoCommit;

    @Option(names = {"--ignore-sequential"}, description = "Let members of sequential groups run concurrently")
    private boolean ignoreSequential;

    @Option(names = {"--stuck-minutes"}, description = "Minutes in flight before a task is reported stuck")
    private Integer stuckMinutes;

    @Option(names = {"--stuck-action"}, description = "Action after the stuck grace period: ${COMPLETION-CANDIDATES}")
    private StuckAction stuckAction;

    @Option(names = {"--on-uncommitted"}, description = "Dirty working tree policy: ${COMPLETION-CANDIDATES}")
    private UncommittedChangesPolicy onUncommitted;

    @Option(names = {"--no-ipc"}, description = "Do not listen for control commands")
    private boolean noIpc;

    @Option(names = {"--quiet", "-q"}, description = "Print only the final outcome")
    private boolean quiet;

    private final OrchestrationService orchestration;
    private final EventBus eventBus;
    private final IpcServer ipcServer;

    public RunPlanCommand(OrchestrationService orchestration, EventBus eventBus, IpcServer ipcServer) {
        this.orchestration = orchestration;
        this.eventBus = eventBus;
        this.ipcServer = ipcServer;
    }

    @Override
    public Integer call() throws InterruptedException {
        var options = orchestration.defaultOptions();
        try {
            if (batchSize != null) {
                options = options.withBatchSize(batchSize);
            }
            if (maxRetries != null) {
                options = options.withMaxRetries(maxRetries);
            }
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (autoCommit != null) {
            options = options.withAutoCommit(autoCommit);
        }
        if (ignoreSequential) {
            options = options.withIgnoreSequential(true);
        }
        if (stuckMinutes != null || stuckAction != null) {
            options = options.withStuckHandling(
                    stuckMinutes != null ? Duration.ofMinutes(stuckMinutes) : options.stuckThreshold(),
                    options.stuckGrace(),
                    stuckAction != null ? stuckAction : options.stuckAction());
        }
        if (onUncommitted != null) {
            options = options.withUncommittedChanges(onUncommitted);
        }

        if (!quiet) {
            ConsoleOutput.printBanner();
        }
        if (!noIpc) {
            ipcServer.start().ifPresent(address ->
                    ConsoleOutput.info("Control port " + address.getPort() + " (planwright ctl)"));
        }
        var subscription = quiet ? null : eventBus.subscribe(EventFilter.forPlan(planId), ConsoleOutput::event);
        try {
            var result = orchestration.run(planId, options);
            if (!result.isOk()) {
                ConsoleOutput.error(result.error() + ": " + result.message());
                return 1;
            }
            var record = result.value();
            long ms = Duration.between(record.startedAt(), record.completedAt()).toMillis();
            var message = "Run " + record.runId() + " " + record.outcome() + " after "
                    + ConsoleOutput.formatDuration(ms) + " (" + record.tasksAttempted() + " attempts, "
                    + record.tasksFailed() + " failed)";
            if (record.outcome() == RunOutcome.COMPLETED) {
                ConsoleOutput.success(message);
            } else {
                ConsoleOutput.warn(message);
            }
            return exitCode(record.outcome());
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
            ipcServer.stop();
        }
    }

    static int exitCode(RunOutcome outcome) {
        return switch (outcome) {
            case COMPLETED -> 0;
            case BLOCKED -> 2;
            case CANCELLED -> 3;
            case INTERRUPTED -> 4;
        };
    }
}
