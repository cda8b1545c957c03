package com.planwright.vcs;

import java.util.List;
import java.util.Optional;

/**
 * Version control collaborator used by the commit queue and the orchestration loop.
 * Implementations are not required to be thread-safe; the commit queue calls
 * {@link #commit} from a single thread.
 */
public interface VersionControl {

    /**
     * Stages {@code files} (everything when empty) and commits them.
     *
     * @return the new commit, or {@link CommitOutcome#nothingToCommit()} when the
     *         working tree had no staged change
     * @throws VersionControlException when the commit fails
     */
    CommitOutcome commit(String message, List<String> files);

    /**
     * Looks up a commit whose message contains {@code marker}.
     */
    Optional<String> findCommit(String marker);

    boolean hasUncommittedChanges();

    /**
     * Stashes all local changes, including untracked files.
     */
    void stash(String message);
}
