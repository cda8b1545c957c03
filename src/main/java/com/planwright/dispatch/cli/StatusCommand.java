package com.planwright.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventFilter;
import com.planwright.core.model.ObjectMappers;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.store.SnapshotCorruptException;
import com.planwright.core.store.SnapshotReplayer;
import com.planwright.core.store.StatusDocument;
import com.planwright.core.store.StatusStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: planwright status [plan-id]
 * <p>
 * Without a plan id, lists every initialized plan. With one, prints its task table
 * and latest run, or the raw status document with {@code --json}.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show plan status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Plan id")
    private String planId;

    @Option(names = {"--json"}, description = "Print the status document as JSON")
    private boolean json;

    @Option(names = {"--verify"}, description = "Rebuild the plan from its event log and compare with the status file")
    private boolean verify;

    private final StatusStore store;
    private final EventBus eventBus;
    private final SnapshotReplayer replayer;

    public StatusCommand(StatusStore store, EventBus eventBus, SnapshotReplayer replayer) {
        this.store = store;
        this.eventBus = eventBus;
        this.replayer = replayer;
    }

    @Override
    public Integer call() {
        if (planId == null) {
            return listPlans();
        }
        StatusSnapshot snapshot;
        try {
            var loaded = store.load(planId);
            if (!loaded.isOk()) {
                ConsoleOutput.error(loaded.message());
                return 1;
            }
            snapshot = loaded.value();
        } catch (SnapshotCorruptException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (verify) {
            return verify(snapshot);
        }
        if (json) {
            try {
                var mapper = ObjectMappers.create().enable(SerializationFeature.INDENT_OUTPUT);
                System.out.println(mapper.writeValueAsString(StatusDocument.from(snapshot)));
                return 0;
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot render status: " + e.getMessage());
                return 1;
            }
        }

        ConsoleOutput.printBanner();
        System.out.println();
        System.out.println("PLAN " + snapshot.planId() + (store.isRunningElsewhere(planId) ? "  (running)" : ""));
        System.out.println("Phases: " + String.join(", ", snapshot.phaseOrder()));
        System.out.println();
        ConsoleOutput.taskTable(snapshot);
        System.out.println();
        ConsoleOutput.summary(snapshot.summary());
        if (!snapshot.runs().isEmpty()) {
            var last = snapshot.runs().get(snapshot.runs().size() - 1);
            ConsoleOutput.info("Last run " + last.runId() + ": "
                    + (last.isOpen() ? "running since " + last.startedAt() : last.outcome() + " at " + last.completedAt()));
        }
        return 0;
    }

    private int verify(StatusSnapshot stored) {
        var replayed = replayer.replay(planId, eventBus.readLog(EventFilter.forPlan(planId), 0));
        if (replayed.isEmpty()) {
            ConsoleOutput.error("Event log has no plan.initialized event for " + planId);
            return 1;
        }
        var rebuilt = replayed.get();
        boolean same = rebuilt.tasks().equals(stored.tasks())
                && rebuilt.phaseOrder().equals(stored.phaseOrder())
                && rebuilt.runs().equals(stored.runs());
        if (same) {
            ConsoleOutput.success("Event log replay matches the status file of " + planId);
            return 0;
        }
        ConsoleOutput.error("Event log replay differs from the status file of " + planId);
        for (var task : stored.tasks().values()) {
            var other = rebuilt.tasks().get(task.id());
            if (!task.equals(other)) {
                ConsoleOutput.error("  task " + task.id() + ": stored " + task.status().wireName() + "/" + task.retryCount()
                        + ", replayed " + (other == null ? "missing" : other.status().wireName() + "/" + other.retryCount()));
            }
        }
        if (!rebuilt.runs().equals(stored.runs())) {
            ConsoleOutput.error("  runs: stored " + stored.runs().size() + ", replayed " + rebuilt.runs().size());
        }
        return 1;
    }

    private int listPlans() {
        var plans = store.listPlans();
        if (plans.isEmpty()) {
            ConsoleOutput.info("No plans under " + store.root().toAbsolutePath());
            return 0;
        }
        System.out.printf("  %-28s %-8s %s%n", "PLAN", "STATE", "PROGRESS");
        for (var id : plans) {
            var loaded = store.load(id);
            if (!loaded.isOk()) {
                continue;
            }
            var summary = loaded.value().summary();
            System.out.printf("  %-28s %-8s %d/%d done%n", id,
                    store.isRunningElsewhere(id) ? "running" : "idle",
                    summary.get("completed") + summary.get("skipped"), summary.get("total"));
        }
        return 0;
    }
}
