package com.planwright.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Status of an individual task within a plan.
 */
public enum TaskStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("in_progress") IN_PROGRESS,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED,
    @JsonProperty("skipped") SKIPPED;

    /** Completed, failed and skipped tasks never run again without operator action. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /** A dependency in one of these states no longer blocks its dependents. */
    public boolean satisfiesDependency() {
        return this == COMPLETED || this == SKIPPED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
