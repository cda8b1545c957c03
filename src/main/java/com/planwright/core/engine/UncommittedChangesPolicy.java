package com.planwright.core.engine;

/**
 * How a run treats a dirty working tree at start.
 */
public enum UncommittedChangesPolicy {
    IGNORE,
    AUTO_STASH,
    ABORT
}
