package com.planwright.core.control;

import com.planwright.config.PlanwrightProperties;
import com.planwright.core.engine.CommandType;
import com.planwright.core.engine.OrchestrationService;
import com.planwright.core.engine.PlanRun;
import com.planwright.core.engine.RunCommand;
import com.planwright.core.engine.TaskTransitions;
import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventType;
import com.planwright.core.events.TaskPayloads;
import com.planwright.core.logging.MdcContext;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.Result;
import com.planwright.core.model.RunRecord;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.model.Task;
import com.planwright.core.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Handles control requests from every transport (IPC socket, REST).
 * <p>
 * Requests are de-duplicated by id: a replayed id gets the cached response and
 * concurrent duplicates share one execution. Commands for an active run go through
 * its coordinator; a command that does not complete within the request timeout is
 * withdrawn so it cannot take effect later.
 */
@Service
public class ControlDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ControlDispatcher.class);

    public static final int PROTOCOL_VERSION = 1;
    public static final String PING = "ping";

    private final OrchestrationService orchestration;
    private final StatusStore store;
    private final EventBus eventBus;
    private final PlanwrightMetrics metrics;
    private final Duration requestTimeout;
    private final Map<String, CompletableFuture<ControlResponse>> responses;

    @Autowired
    public ControlDispatcher(OrchestrationService orchestration, StatusStore store, EventBus eventBus,
                             PlanwrightMetrics metrics, PlanwrightProperties properties) {
        this(orchestration, store, eventBus, metrics, properties.getIpc().getRequestTimeout(),
                properties.getIpc().getDedupeCacheSize());
    }

    public ControlDispatcher(OrchestrationService orchestration, StatusStore store, EventBus eventBus,
                             PlanwrightMetrics metrics, Duration requestTimeout, int dedupeCacheSize) {
        this.orchestration = orchestration;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.requestTimeout = requestTimeout;
        this.responses = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CompletableFuture<ControlResponse>> eldest) {
                return size() > dedupeCacheSize;
            }
        };
    }

    public ControlResponse handle(ControlRequest request) {
        var id = request.id() == null || request.id().isBlank() ? UUID.randomUUID().toString() : request.id();
        CompletableFuture<ControlResponse> future;
        boolean owner = false;
        synchronized (responses) {
            future = responses.get(id);
            if (future == null) {
                future = new CompletableFuture<>();
                responses.put(id, future);
                owner = true;
            }
        }
        if (!owner) {
            log.debug("Request {} already seen; returning its response", id);
            return future.join();
        }
        ControlResponse response;
        try {
            response = execute(id, request);
        } catch (RuntimeException e) {
            log.error("Control request {} ({}) failed: {}", id, request.command(), e.getMessage(), e);
            response = ControlResponse.failure(id, ErrorKind.INTERNAL, e.getMessage());
        } finally {
            MdcContext.clear();
        }
        metrics.recordIpcCommand(String.valueOf(request.command()), response.success());
        future.complete(response);
        return response;
    }

    private ControlResponse execute(String id, ControlRequest request) {
        if (request.protocolVersion() != null && request.protocolVersion() != PROTOCOL_VERSION) {
            return ControlResponse.failure(id, ErrorKind.PROTOCOL_MISMATCH,
                    "Protocol version " + request.protocolVersion() + " not supported; expected " + PROTOCOL_VERSION);
        }
        if (PING.equals(request.command())) {
            var data = new LinkedHashMap<String, Object>();
            data.put("pong", true);
            data.put("protocolVersion", PROTOCOL_VERSION);
            data.put("activeRuns", orchestration.activeRuns().stream().map(PlanRun::planId).toList());
            return ControlResponse.ok(id, data);
        }
        var type = CommandType.fromWireName(request.command()).orElse(null);
        if (type == null) {
            return ControlResponse.failure(id, ErrorKind.UNKNOWN_COMMAND, "Unknown command: " + request.command());
        }
        var planId = resolvePlanId(request.planId());
        if (!planId.isOk()) {
            return ControlResponse.failure(id, planId.error(), planId.message());
        }
        MdcContext.setPlan(planId.value());
        var command = toCommand(type, request.payload());
        if (!command.isOk()) {
            return ControlResponse.failure(id, command.error(), command.message());
        }
        log.info("Control command {} for plan {}", type.wireName(), planId.value());
        var run = orchestration.activeRun(planId.value());
        var result = run.isPresent()
                ? sendToRun(run.get(), command.value())
                : applyWithoutRun(planId.value(), command.value());
        return result.isOk()
                ? ControlResponse.ok(id, result.value())
                : ControlResponse.failure(id, result.error(), result.message());
    }

    private Result<String> resolvePlanId(String planId) {
        if (planId != null && !planId.isBlank()) {
            return Result.ok(planId);
        }
        var active = orchestration.activeRuns();
        if (active.size() == 1) {
            return Result.ok(active.get(0).planId());
        }
        return Result.failure(ErrorKind.INVALID_ARGUMENT, active.isEmpty()
                ? "planId is required when no run is active"
                : "planId is required when several runs are active");
    }

    private static Result<RunCommand> toCommand(CommandType type, Map<String, Object> payload) {
        if (type.needsTask()) {
            var taskId = payload.get("taskId");
            if (!(taskId instanceof String s) || s.isBlank()) {
                return Result.failure(ErrorKind.INVALID_ARGUMENT, type.wireName() + " requires payload.taskId");
            }
            return Result.ok(RunCommand.forTask(type, s));
        }
        if (type == CommandType.SET_BATCH_SIZE) {
            var size = payload.get("batchSize");
            if (size instanceof Number n) {
                return Result.ok(RunCommand.setBatchSize(n.intValue()));
            }
            if (size instanceof String s) {
                try {
                    return Result.ok(RunCommand.setBatchSize(Integer.parseInt(s.trim())));
                } catch (NumberFormatException e) {
                    return Result.failure(ErrorKind.INVALID_ARGUMENT, "batchSize is not a number: " + s);
                }
            }
            return Result.failure(ErrorKind.INVALID_ARGUMENT, "setBatchSize requires payload.batchSize");
        }
        return Result.ok(RunCommand.of(type));
    }

    private Result<Map<String, Object>> sendToRun(PlanRun run, RunCommand command) {
        var pending = run.submit(command);
        try {
            return pending.result().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (pending.expire()) {
                log.warn("Command {} for plan {} timed out after {}ms and was withdrawn",
                        command.type().wireName(), run.planId(), requestTimeout.toMillis());
                return Result.failure(ErrorKind.IPC_TIMEOUT,
                        "No response within " + requestTimeout.toMillis() + "ms; command was not applied");
            }
            // already claimed by the coordinator, so it is about to complete
            return pending.result().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.expire();
            return Result.failure(ErrorKind.INTERNAL, "Interrupted while waiting for the run");
        } catch (ExecutionException e) {
            return Result.failure(ErrorKind.INTERNAL, e.getCause().getMessage());
        }
    }

    private Result<Map<String, Object>> applyWithoutRun(String planId, RunCommand command) {
        if (command.type() != CommandType.STATUS && store.isRunningElsewhere(planId)) {
            return Result.failure(ErrorKind.NO_ACTIVE_RUN,
                    "Plan " + planId + " is run by another process; send the command to its control port");
        }
        return switch (command.type()) {
            case STATUS -> store.load(planId).map(ControlDispatcher::idleStatus);
            case RETRY_TASK -> changeTask(planId, command.taskId(), TaskTransitions::reset, EventType.TASK_RESET,
                    "by", "operator");
            case SKIP_TASK -> changeTask(planId, command.taskId(), TaskTransitions::skip, EventType.TASK_SKIPPED,
                    "reason", "operator");
            default -> Result.failure(ErrorKind.NO_ACTIVE_RUN,
                    command.type().wireName() + " needs an active run of plan " + planId);
        };
    }

    private Result<Map<String, Object>> changeTask(String planId, String taskId, Function<Task, Result<Task>> transition,
                                                   EventType eventType, String key, String value) {
        var changed = store.tryMutate(planId, s -> {
            var task = s.tasks().get(taskId);
            if (task == null) {
                return Result.failure(ErrorKind.TASK_NOT_FOUND, "No task " + taskId + " in plan " + planId);
            }
            var next = transition.apply(task);
            return next.isOk() ? Result.ok(s.withTask(next.value())) : next.propagate();
        });
        if (!changed.isOk()) {
            return changed.propagate();
        }
        var task = changed.value().tasks().get(taskId);
        eventBus.emit(eventType, planId, taskId, TaskPayloads.of(task, key, value));
        log.info("Task {} of plan {} is now {}", taskId, planId, task.status().wireName());
        var data = new LinkedHashMap<String, Object>();
        data.put("taskId", taskId);
        data.putAll(TaskPayloads.of(task));
        return Result.ok(data);
    }

    private static Map<String, Object> idleStatus(StatusSnapshot snapshot) {
        var data = new LinkedHashMap<String, Object>();
        data.put("planId", snapshot.planId());
        data.put("state", "IDLE");
        data.put("summary", snapshot.summary());
        List<RunRecord> runs = snapshot.runs();
        if (!runs.isEmpty()) {
            var last = runs.get(runs.size() - 1);
            var lastRun = new LinkedHashMap<String, Object>();
            lastRun.put("runId", last.runId());
            lastRun.put("outcome", last.outcome() == null ? null : last.outcome().name());
            lastRun.put("startedAt", String.valueOf(last.startedAt()));
            lastRun.put("completedAt", String.valueOf(last.completedAt()));
            data.put("lastRun", lastRun);
        }
        return data;
    }
}
