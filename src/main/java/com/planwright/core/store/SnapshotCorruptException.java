package com.planwright.core.store;

import java.nio.file.Path;

/**
 * Thrown when neither the status file nor its backup can be parsed.
 */
public class SnapshotCorruptException extends RuntimeException {

    public SnapshotCorruptException(Path file, Throwable cause) {
        super("Status file " + file + " is unreadable and no usable backup exists", cause);
    }
}
