package com.planwright.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted during plan execution, delivered to subscribers and appended to
 * the durable event log.
 *
 * @param id        monotonic id, unique across restarts
 * @param type      event type
 * @param planId    the plan this event belongs to
 * @param taskId    the task this event relates to (null for plan- and run-level events)
 * @param timestamp when the event occurred
 * @param payload   type-specific data
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanEvent(
    long id,
    EventType type,
    String planId,
    String taskId,
    Instant timestamp,
    Map<String, Object> payload
) {

    public PlanEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
