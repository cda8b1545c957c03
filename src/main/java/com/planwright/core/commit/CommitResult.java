package com.planwright.core.commit;

/**
 * @param entryId  queue entry id
 * @param commitId created commit, null when there was nothing to commit
 * @param attempts attempts it took
 */
public record CommitResult(String entryId, String commitId, int attempts) {

    public boolean isEmpty() {
        return commitId == null;
    }
}
