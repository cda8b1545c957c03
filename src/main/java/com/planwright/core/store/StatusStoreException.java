package com.planwright.core.store;

/**
 * I/O failure while persisting a snapshot, after local retries were exhausted.
 */
public class StatusStoreException extends RuntimeException {

    public StatusStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
