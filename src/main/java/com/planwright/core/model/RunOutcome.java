package com.planwright.core.model;

/**
 * How an orchestration run ended.
 */
public enum RunOutcome {
    COMPLETED,   // no task left pending or in progress
    BLOCKED,     // pending tasks remain but none can become ready
    CANCELLED,
    INTERRUPTED  // process died mid-run; closed by recovery on the next load
}
