package com.planwright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Planwright.
 */
@Command(
        name = "planwright",
        mixinStandardHelpOptions = true,
        version = "Planwright 0.1.0",
        description = "Runs multi-phase task plans through an execution agent",
        subcommands = {
                InitCommand.class,
                RunPlanCommand.class,
                StatusCommand.class,
                CtlCommand.class,
                EventsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlanwrightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
