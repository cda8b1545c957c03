package com.planwright.core.events;

import java.util.EnumSet;
import java.util.Set;

/**
 * Selects events by plan, type and task. Null or empty fields match everything.
 */
public record EventFilter(String planId, Set<EventType> types, String taskId) {

    public EventFilter {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(types));
    }

    public static EventFilter all() {
        return new EventFilter(null, null, null);
    }

    public static EventFilter forPlan(String planId) {
        return new EventFilter(planId, null, null);
    }

    public EventFilter withTypes(Set<EventType> eventTypes) {
        return new EventFilter(planId, eventTypes, taskId);
    }

    public boolean matches(PlanEvent event) {
        if (planId != null && !planId.equals(event.planId())) return false;
        if (!types.isEmpty() && !types.contains(event.type())) return false;
        return taskId == null || taskId.equals(event.taskId());
    }
}
