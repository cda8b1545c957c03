package com.planwright.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single unit of work within a plan, executed by the agent runner.
 * <p>
 * Tasks are created once from parser output and never deleted. Only {@code status},
 * {@code retryCount} and {@code lastError} change during execution, and only through
 * the status store.
 *
 * @param id              dotted {@code phase.index} id, unique within the plan (e.g. "3.1")
 * @param description     what the agent should do
 * @param phase           id of the declaring phase
 * @param status          current execution status
 * @param dependencies    ids of tasks that must be completed or skipped first
 * @param dependents      ids of tasks that depend on this one (reverse edges)
 * @param sequentialGroup group id when the task belongs to a one-at-a-time group, else null
 * @param fileReferences  files this task is expected to touch (used for conflict detection)
 * @param retryCount      failed attempts so far; never decreases
 * @param lastError       message of the most recent failure, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
    String id,
    String description,
    String phase,
    TaskStatus status,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> dependencies,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> dependents,
    String sequentialGroup,
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> fileReferences,
    int retryCount,
    String lastError
) {

    public Task {
        if (phase == null || phase.isBlank()) {
            phase = id != null ? TaskIds.phaseOf(id) : null;
        }
        if (status == null) {
            status = TaskStatus.PENDING;
        }
        dependencies = frozen(dependencies);
        dependents = frozen(dependents);
        fileReferences = frozen(fileReferences);
    }

    /**
     * Creates a pending task as produced by the plan document parser.
     */
    public static Task of(String id, String description, Collection<String> dependencies,
                          String sequentialGroup, Collection<String> fileReferences) {
        return new Task(id, description, null, TaskStatus.PENDING,
                dependencies == null ? Set.of() : new LinkedHashSet<>(dependencies),
                Set.of(), sequentialGroup,
                fileReferences == null ? Set.of() : new LinkedHashSet<>(fileReferences),
                0, null);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, description, phase, newStatus, dependencies, dependents,
                sequentialGroup, fileReferences, retryCount, lastError);
    }

    public Task withDependents(Set<String> newDependents) {
        return new Task(id, description, phase, status, dependencies, newDependents,
                sequentialGroup, fileReferences, retryCount, lastError);
    }

    /**
     * Records a failed attempt. The retry count only ever grows.
     */
    public Task withFailure(TaskStatus newStatus, String error) {
        return new Task(id, description, phase, newStatus, dependencies, dependents,
                sequentialGroup, fileReferences, retryCount + 1, error);
    }

    public Task withRetryCount(int newRetryCount) {
        return new Task(id, description, phase, status, dependencies, dependents,
                sequentialGroup, fileReferences, newRetryCount, lastError);
    }

    public Task withLastError(String error) {
        return new Task(id, description, phase, status, dependencies, dependents,
                sequentialGroup, fileReferences, retryCount, error);
    }

    private static Set<String> frozen(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
