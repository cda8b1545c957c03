package com.planwright.core.commit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Persisted commit queue state, also returned by {@link CommitQueue#status()}.
 *
 * @param pending         entries not yet confirmed, in submission order
 * @param lastProcessedId last entry that left the queue
 * @param totalCommits    entries committed (including empty commits)
 * @param failedCommits   entries that failed terminally
 * @param lastCommitId    most recent commit created by the queue
 * @param lastCommitAt    time of that commit
 * @param lastError       most recent failure
 * @param recentFailures  most recent terminal failures, oldest first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueStatus(
    List<CommitQueueEntry> pending,
    String lastProcessedId,
    long totalCommits,
    long failedCommits,
    String lastCommitId,
    Instant lastCommitAt,
    String lastError,
    List<CommitQueueEntry> recentFailures
) {

    public static final QueueStatus EMPTY = new QueueStatus(List.of(), null, 0, 0, null, null, null, List.of());

    public QueueStatus {
        pending = pending == null ? List.of() : List.copyOf(pending);
        recentFailures = recentFailures == null ? List.of() : List.copyOf(recentFailures);
    }
}
