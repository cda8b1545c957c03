package com.planwright.core.engine;

/**
 * What the loop does with a stuck task once the grace period passes without an
 * operator response.
 */
public enum StuckAction {
    NONE,   // keep waiting, warning only
    EXTEND, // restart the stuck timer
    SKIP,   // abandon the attempt and mark the task skipped
    RETRY   // abandon the attempt and count it as failed
}
