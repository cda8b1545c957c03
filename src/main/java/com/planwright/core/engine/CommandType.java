package com.planwright.core.engine;

import java.util.Optional;

/**
 * Operator commands an active run accepts.
 */
public enum CommandType {
    STATUS("status", false),
    PAUSE("pause", false),
    RESUME("resume", false),
    CANCEL("cancel", false),
    SET_BATCH_SIZE("setBatchSize", false),
    RETRY_TASK("retryTask", true),
    SKIP_TASK("skipTask", true),
    EXTEND_TASK("extendTask", true),
    FORCE_TASK("forceTask", true);

    private final String wireName;
    private final boolean needsTask;

    CommandType(String wireName, boolean needsTask) {
        this.wireName = wireName;
        this.needsTask = needsTask;
    }

    public String wireName() {
        return wireName;
    }

    public boolean needsTask() {
        return needsTask;
    }

    public static Optional<CommandType> fromWireName(String name) {
        for (var type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
