package com.planwright.core.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed set of event types. The wire name is the dotted lowercase form.
 */
public enum EventType {
    PLAN_INITIALIZED("plan.initialized"),
    PLAN_RESTORED("plan.restored"),
    RUN_STARTED("run.started"),
    RUN_PAUSED("run.paused"),
    RUN_RESUMED("run.resumed"),
    RUN_COMPLETED("run.completed"),
    TASK_STARTED("task.started"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    TASK_RETRYING("task.retrying"),
    TASK_STUCK("task.stuck"),
    TASK_SKIPPED("task.skipped"),
    TASK_RESET("task.reset"),
    TASK_RECOVERED("task.recovered"),
    PHASE_COMPLETED("phase.completed"),
    CONSTRAINT_APPLIED("constraint.applied"),
    DEPENDENCY_OVERRIDDEN("dependency.overridden"),
    POLICY_APPLIED("policy.applied"),
    BATCH_RESIZED("batch.resized");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventType fromWireName(String value) {
        for (var type : values()) {
            if (type.wireName.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }

    /** Task events whose payload carries the resulting task status. */
    public boolean carriesTaskState() {
        return switch (this) {
            case TASK_STARTED, TASK_COMPLETED, TASK_FAILED, TASK_RETRYING,
                 TASK_SKIPPED, TASK_RESET, TASK_RECOVERED -> true;
            default -> false;
        };
    }
}
