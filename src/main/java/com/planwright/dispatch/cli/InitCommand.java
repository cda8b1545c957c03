package com.planwright.dispatch.cli;

import com.planwright.core.graph.CycleException;
import com.planwright.core.graph.PlanValidationException;
import com.planwright.core.store.StatusStore;
import com.planwright.plan.PlanDocumentParser;
import com.planwright.plan.PlanFormatException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: planwright init &lt;plan-file&gt;
 * <p>
 * Parses a plan definition, validates its dependency graph and writes the initial
 * status file. Re-initializing an existing plan leaves it unchanged.
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "Initialize a plan from a plan definition")
@Component
public class InitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan definition file (JSON)")
    private Path planFile;

    @Option(names = {"--plan-id"}, description = "Plan id (default: from the definition or file name)")
    private String planId;

    private final PlanDocumentParser parser;
    private final StatusStore store;

    public InitCommand(PlanDocumentParser parser, StatusStore store) {
        this.parser = parser;
        this.store = store;
    }

    @Override
    public Integer call() {
        try {
            var plan = parser.parse(planFile);
            var id = planId != null ? planId : plan.planId();
            boolean existed = store.exists(id);
            var snapshot = store.init(id, plan.tasks(), plan.phaseOrder());
            if (existed) {
                ConsoleOutput.warn("Plan " + id + " already exists; left unchanged");
            } else {
                ConsoleOutput.success("Initialized plan " + id + " with " + snapshot.tasks().size()
                        + " tasks in " + snapshot.phaseOrder().size() + " phases");
            }
            return 0;
        } catch (PlanFormatException e) {
            ConsoleOutput.error("Cannot read " + planFile + ": " + e.getMessage());
        } catch (CycleException e) {
            ConsoleOutput.error("Dependency cycle: " + String.join(" -> ", e.path()));
        } catch (PlanValidationException e) {
            ConsoleOutput.error("Invalid plan:");
            e.problems().forEach(p -> ConsoleOutput.error("  " + p));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
        }
        return 1;
    }
}
