package com.planwright.core.engine;

import com.planwright.core.model.ErrorKind;
import com.planwright.core.model.Result;
import com.planwright.core.model.Task;
import com.planwright.core.model.TaskStatus;

/**
 * Operator-initiated task transitions, shared by active runs and by commands handled
 * directly against the store.
 */
public final class TaskTransitions {

    private TaskTransitions() {}

    /**
     * Failed or skipped back to pending. The retry count is kept, so a task already at
     * the retry limit gets exactly one more attempt.
     */
    public static Result<Task> reset(Task task) {
        if (task.status() != TaskStatus.FAILED && task.status() != TaskStatus.SKIPPED) {
            return Result.failure(ErrorKind.INVALID_TRANSITION,
                    "Task " + task.id() + " is " + task.status().wireName() + "; only failed or skipped tasks can be retried");
        }
        return Result.ok(task.withStatus(TaskStatus.PENDING));
    }

    /**
     * Pending, failed or in-progress to skipped. An in-progress attempt must be
     * abandoned by the caller.
     */
    public static Result<Task> skip(Task task) {
        if (task.status() == TaskStatus.COMPLETED || task.status() == TaskStatus.SKIPPED) {
            return Result.failure(ErrorKind.INVALID_TRANSITION,
                    "Task " + task.id() + " is already " + task.status().wireName());
        }
        return Result.ok(task.withStatus(TaskStatus.SKIPPED));
    }

    /**
     * Applies a failed attempt: the retry count grows and the task becomes failed once
     * it reaches {@code maxRetries}, pending otherwise.
     */
    public static Task fail(Task task, String error, int maxRetries) {
        var next = task.retryCount() + 1 >= maxRetries ? TaskStatus.FAILED : TaskStatus.PENDING;
        return task.withFailure(next, error);
    }
}
