package com.planwright.dispatch.api;

import com.planwright.core.events.EventBus;
import com.planwright.core.events.EventFilter;
import com.planwright.core.events.PlanEvent;
import com.planwright.core.events.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each emitter gets its own bus subscription, so a slow browser only loses its own
 * oldest events. The event id is sent as the SSE id, letting a reconnecting client
 * resume with {@code ?after=} or {@code Last-Event-ID}. Idle connections are kept
 * open with periodic comment heartbeats.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for plan {}: {}", registration.planId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for plan {} (emitter not active)", registration.planId);
            }
        }
    }

    /**
     * Creates an emitter streaming the plan's events.
     *
     * @param afterId replay retained events with a larger id first; negative for live only
     */
    public SseEmitter createEmitter(String planId, long afterId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        // the connection comment must go out before any replayed event
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for plan {}: {}", planId, e.getMessage());
        }

        Subscription subscription = eventBus.subscribe(EventFilter.forPlan(planId),
                event -> sendEvent(emitter, event), afterId);
        var registration = new EmitterRegistration(planId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for plan {}", planId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for plan {}: {}", planId, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE emitter created for plan {} (after={}, timeout={}ms)", planId, afterId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, PlanEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .id(Long.toString(event.id()))
                    .name(event.type().wireName())
                    .data(event));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for plan {}: {}", event.id(), event.planId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.subscription.unsubscribe();
            log.debug("Cleaned up SSE registration for plan {}", registration.planId);
        }
    }

    private record EmitterRegistration(String planId, SseEmitter emitter, Subscription subscription) {}
}
