package com.planwright.vcs;

/**
 * @param commitId id of the created commit, null when there was nothing to commit
 */
public record CommitOutcome(String commitId) {

    public static CommitOutcome nothingToCommit() {
        return new CommitOutcome(null);
    }

    public boolean isEmpty() {
        return commitId == null;
    }
}
