package com.planwright.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventFilter;
import com.planwright.core.events.EventType;
import com.planwright.core.events.PlanEvent;
import com.planwright.core.model.ObjectMappers;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: planwright events &lt;plan-id&gt;
 * <p>
 * Prints the plan's events from the durable log, optionally following new ones as
 * the running process appends them.
 */
@Command(name = "events", mixinStandardHelpOptions = true, description = "Show a plan's event log")
@Component
public class EventsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan id")
    private String planId;

    @Option(names = {"--after"}, description = "Only events with a larger id", defaultValue = "0")
    private long after;

    @Option(names = {"--type"}, description = "Event type filter, e.g. task.failed (repeatable)")
    private List<String> types;

    @Option(names = {"--follow", "-f"}, description = "Keep printing new events")
    private boolean follow;

    @Option(names = {"--json"}, description = "Print events as NDJSON")
    private boolean json;

    @Option(names = {"--poll-ms"}, description = "Follow poll interval (default: ${DEFAULT-VALUE})", defaultValue = "500")
    private long pollMs;

    private final EventBus eventBus;
    private final ObjectMapper mapper = ObjectMappers.create();

    public EventsCommand(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        var filter = EventFilter.forPlan(planId);
        if (types != null && !types.isEmpty()) {
            var selected = EnumSet.noneOf(EventType.class);
            try {
                types.forEach(t -> selected.add(EventType.fromWireName(t)));
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return 1;
            }
            filter = filter.withTypes(selected);
        }
        long last = after;
        do {
            for (var event : eventBus.readLog(filter, last)) {
                print(event);
                last = event.id();
            }
            if (follow) {
                try {
                    Thread.sleep(pollMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return 0;
                }
            }
        } while (follow);
        return 0;
    }

    private void print(PlanEvent event) {
        if (!json) {
            ConsoleOutput.event(event);
            return;
        }
        try {
            System.out.println(mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Cannot render event " + event.id() + ": " + e.getMessage());
        }
    }
}
