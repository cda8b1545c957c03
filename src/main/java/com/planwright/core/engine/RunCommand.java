package com.planwright.core.engine;

/**
 * A command addressed to an active run.
 *
 * @param type   command
 * @param taskId target task for task commands, otherwise null
 * @param value  numeric argument ({@code setBatchSize}), otherwise 0
 */
public record RunCommand(CommandType type, String taskId, int value) {

    public static RunCommand of(CommandType type) {
        return new RunCommand(type, null, 0);
    }

    public static RunCommand forTask(CommandType type, String taskId) {
        return new RunCommand(type, taskId, 0);
    }

    public static RunCommand setBatchSize(int size) {
        return new RunCommand(CommandType.SET_BATCH_SIZE, null, size);
    }
}
