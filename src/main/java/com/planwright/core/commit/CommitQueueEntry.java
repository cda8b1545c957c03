package com.planwright.core.commit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * One commit request as persisted in the queue file.
 *
 * @param id         queue entry id, also written into the commit message trailer
 * @param message    commit message without the trailer
 * @param files      files to stage; empty means everything
 * @param enqueuedAt submission time
 * @param status     processing state
 * @param attempts   commit attempts made so far
 * @param commitId   resulting commit, when done and not empty
 * @param error      last failure message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommitQueueEntry(
    String id,
    String message,
    List<String> files,
    Instant enqueuedAt,
    Status status,
    int attempts,
    String commitId,
    String error
) {

    public enum Status { PENDING, COMMITTING, DONE, FAILED }

    public CommitQueueEntry {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public CommitQueueEntry withStatus(Status newStatus) {
        return new CommitQueueEntry(id, message, files, enqueuedAt, newStatus, attempts, commitId, error);
    }

    public CommitQueueEntry withAttempt(String failure) {
        return new CommitQueueEntry(id, message, files, enqueuedAt, status, attempts + 1, commitId, failure);
    }

    public CommitQueueEntry done(String newCommitId) {
        return new CommitQueueEntry(id, message, files, enqueuedAt, Status.DONE, attempts, newCommitId, error);
    }
}
