package com.planwright.core.store;

import java.time.Duration;

/**
 * Thrown when the per-plan write lock could not be acquired within the configured
 * timeout, typically because another process is mutating the same plan.
 */
public class LockTimeoutException extends RuntimeException {

    private final String planId;

    public LockTimeoutException(String planId, Duration waited) {
        super("Timed out after " + waited.toMillis() + "ms waiting for the lock on plan " + planId);
        this.planId = planId;
    }

    public String planId() {
        return planId;
    }
}
