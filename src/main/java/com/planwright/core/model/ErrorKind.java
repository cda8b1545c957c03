package com.planwright.core.model;

/**
 * Expected, non-exceptional failure kinds returned inside a {@link Result}.
 */
public enum ErrorKind {
    PLAN_NOT_FOUND,
    TASK_NOT_FOUND,
    INVALID_TRANSITION,
    INVALID_ARGUMENT,
    ALREADY_RUNNING,
    NO_ACTIVE_RUN,
    POLICY_ABORT,
    UNKNOWN_COMMAND,
    PROTOCOL_MISMATCH,
    IPC_TIMEOUT,
    INTERNAL
}
