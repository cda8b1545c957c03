package com.planwright.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One orchestration session over a plan. Appended when a run starts and closed
 * exactly once; a closed record is never modified again.
 *
 * @param runId          unique run id
 * @param startedAt      when the run started
 * @param completedAt    when the run ended, null while running
 * @param tasksAttempted agent dispatches during this run
 * @param tasksFailed    attempts that ended in failure
 * @param outcome        how the run ended, null while running
 * @param maxRetries     the retry limit the run was started with, null for runs
 *                       recorded before the limit was kept
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunRecord(
    String runId,
    Instant startedAt,
    Instant completedAt,
    int tasksAttempted,
    int tasksFailed,
    RunOutcome outcome,
    Integer maxRetries
) {

    public static RunRecord started(String runId, Instant startedAt) {
        return new RunRecord(runId, startedAt, null, 0, 0, null, null);
    }

    public static RunRecord started(String runId, Instant startedAt, int maxRetries) {
        return new RunRecord(runId, startedAt, null, 0, 0, null, maxRetries);
    }

    public boolean isOpen() {
        return completedAt == null;
    }

    public RunRecord close(Instant at, int attempted, int failed, RunOutcome runOutcome) {
        if (!isOpen()) {
            throw new IllegalStateException("Run " + runId + " is already closed");
        }
        return new RunRecord(runId, startedAt, at, attempted, failed, runOutcome, maxRetries);
    }
}
