package com.planwright.dispatch.api;

import com.planwright.core.control.ControlDispatcher;
import com.planwright.core.control.ControlRequest;
import com.planwright.core.control.ControlResponse;
import com.planwright.core.engine.OrchestrationService;
import com.planwright.core.engine.PlanRun;
import com.planwright.core.model.ErrorKind;
import com.planwright.core.store.StatusDocument;
import com.planwright.core.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST surface for plans: listing, status documents, control commands and the
 * live event stream.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final StatusStore store;
    private final OrchestrationService orchestration;
    private final ControlDispatcher dispatcher;
    private final SseStreamingService sseStreamingService;

    public PlanController(StatusStore store, OrchestrationService orchestration,
                          ControlDispatcher dispatcher, SseStreamingService sseStreamingService) {
        this.store = store;
        this.orchestration = orchestration;
        this.dispatcher = dispatcher;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/plans: every initialized plan with its task summary.
     */
    @GetMapping
    public List<Map<String, Object>> listPlans() {
        var plans = new ArrayList<Map<String, Object>>();
        for (var planId : store.listPlans()) {
            var loaded = store.load(planId);
            if (!loaded.isOk()) {
                continue;
            }
            var entry = new LinkedHashMap<String, Object>();
            entry.put("planId", planId);
            entry.put("active", orchestration.activeRun(planId).isPresent());
            orchestration.activeRun(planId).map(PlanRun::runId).ifPresent(id -> entry.put("runId", id));
            entry.put("summary", loaded.value().summary());
            entry.put("updatedAt", loaded.value().updatedAt());
            plans.add(entry);
        }
        return plans;
    }

    /**
     * GET /api/v1/plans/{planId}: the full status document.
     */
    @GetMapping("/{planId}")
    public ResponseEntity<StatusDocument> getPlan(@PathVariable String planId) {
        var loaded = store.load(planId);
        if (!loaded.isOk()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(StatusDocument.from(loaded.value()));
    }

    /**
     * POST /api/v1/plans/{planId}/runs: starts a run in this server process.
     */
    @PostMapping("/{planId}/runs")
    public ResponseEntity<Map<String, Object>> startRun(@PathVariable String planId,
                                                        @RequestBody(required = false) StartRunRequest request) {
        var options = orchestration.defaultOptions();
        if (request != null) {
            if (request.batchSize() != null) {
                if (request.batchSize() < 1) {
                    return ResponseEntity.badRequest().body(Map.of("error", "batchSize must be at least 1"));
                }
                options = options.withBatchSize(request.batchSize());
            }
            if (request.autoCommit() != null) {
                options = options.withAutoCommit(request.autoCommit());
            }
            if (request.ignoreSequential() != null) {
                options = options.withIgnoreSequential(request.ignoreSequential());
            }
        }
        var started = orchestration.start(planId, options);
        if (!started.isOk()) {
            return ResponseEntity.status(statusFor(started.error()))
                    .body(Map.of("error", started.error().name(), "message", started.message()));
        }
        log.info("Started run {} of plan {} over REST", started.value().runId(), planId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("planId", planId, "runId", started.value().runId()));
    }

    /**
     * POST /api/v1/plans/{planId}/control: same handling as the IPC socket.
     */
    @PostMapping("/{planId}/control")
    public ResponseEntity<ControlResponse> control(@PathVariable String planId,
                                                   @RequestBody ControlRequest request) {
        var addressed = new ControlRequest(request.protocolVersion(), request.id(), planId,
                request.command(), request.payload(), request.timestamp());
        var response = dispatcher.handle(addressed);
        if (response.success()) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.status(statusFor(ErrorKind.valueOf(response.error().code()))).body(response);
    }

    /**
     * GET /api/v1/plans/{planId}/events: SSE stream; {@code after} (or the
     * {@code Last-Event-ID} header) replays retained events with a larger id first.
     */
    @GetMapping(value = "/{planId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String planId,
                                                   @RequestParam(name = "after", required = false) Long after,
                                                   @RequestHeader(name = "Last-Event-ID", required = false) String lastEventId) {
        if (!store.exists(planId)) {
            return ResponseEntity.notFound().build();
        }
        long afterId = -1;
        if (after != null) {
            afterId = after;
        } else if (lastEventId != null && !lastEventId.isBlank()) {
            try {
                afterId = Long.parseLong(lastEventId.trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed Last-Event-ID {}", lastEventId);
            }
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(planId, afterId));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case PLAN_NOT_FOUND, TASK_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT, UNKNOWN_COMMAND, PROTOCOL_MISMATCH -> HttpStatus.BAD_REQUEST;
            case INVALID_TRANSITION, ALREADY_RUNNING, NO_ACTIVE_RUN, POLICY_ABORT -> HttpStatus.CONFLICT;
            case IPC_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
