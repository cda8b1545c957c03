package com.planwright.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.planwright.config.PlanwrightProperties;
import com.planwright.core.control.ControlDispatcher;
import com.planwright.core.control.ControlRequest;
import com.planwright.core.control.ControlResponse;
import com.planwright.core.engine.CommandType;
import com.planwright.core.model.ObjectMappers;
import com.planwright.dispatch.ipc.IpcClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: planwright ctl &lt;command&gt;
 * <p>
 * Sends a control command to the process running a plan. When nothing is listening,
 * {@code status}, {@code retryTask} and {@code skipTask} are applied to the stored
 * plan directly.
 */
@Command(name = "ctl", mixinStandardHelpOptions = true,
        description = "Control a running plan: status, pause, resume, cancel, setBatchSize, "
                + "retryTask, skipTask, extendTask, forceTask, ping")
@Component
public class CtlCommand implements Callable<Integer> {

    private static final Set<String> OFFLINE_COMMANDS = Set.of(
            CommandType.STATUS.wireName(), CommandType.RETRY_TASK.wireName(), CommandType.SKIP_TASK.wireName());

    @Parameters(index = "0", description = "Command name")
    private String command;

    @Option(names = {"--plan", "-p"}, description = "Plan id (optional while one run is active)")
    private String planId;

    @Option(names = {"--task", "-t"}, description = "Task id for task commands")
    private String taskId;

    @Option(names = {"--size"}, description = "New batch size for setBatchSize")
    private Integer size;

    @Option(names = {"--host"}, description = "Control host (default: configured)")
    private String host;

    @Option(names = {"--port"}, description = "Control port (default: configured)")
    private Integer port;

    private final PlanwrightProperties properties;
    private final ControlDispatcher dispatcher;

    public CtlCommand(PlanwrightProperties properties, ControlDispatcher dispatcher) {
        this.properties = properties;
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        var payload = new LinkedHashMap<String, Object>();
        if (taskId != null) {
            payload.put("taskId", taskId);
        }
        if (size != null) {
            payload.put("batchSize", size);
        }
        var request = ControlRequest.of(planId, command, payload);
        var ipc = properties.getIpc();
        var targetHost = host != null ? host : ipc.getHost();
        int targetPort = port != null ? port : ipc.getPort();
        // allow the server its own timeout before giving up client-side
        var client = new IpcClient(targetHost, targetPort, ipc.getRequestTimeout().plus(Duration.ofSeconds(2)));

        ControlResponse response;
        try {
            response = client.send(request);
        } catch (IOException e) {
            if (planId == null || !OFFLINE_COMMANDS.contains(command)) {
                ConsoleOutput.error("No orchestrator listening on " + targetHost + ":" + targetPort
                        + " (" + e.getMessage() + ")");
                return 1;
            }
            ConsoleOutput.info("No orchestrator listening; applying " + command + " to the stored plan");
            response = dispatcher.handle(request);
        }
        return print(response);
    }

    private static int print(ControlResponse response) {
        if (!response.success()) {
            ConsoleOutput.error(response.error().code() + ": " + response.error().message());
            return 1;
        }
        try {
            var mapper = ObjectMappers.create().enable(SerializationFeature.INDENT_OUTPUT);
            System.out.println(mapper.writeValueAsString(response.data()));
        } catch (JsonProcessingException e) {
            System.out.println(response.data());
        }
        return 0;
    }
}
