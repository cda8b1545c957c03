package com.planwright.core.scheduler;

import com.planwright.core.model.ExecutionConstraint;
import com.planwright.core.model.Task;

import java.util.List;
import java.util.Map;

/**
 * Result of one ready-task selection.
 *
 * @param ready   tasks to dispatch now, highest priority first
 * @param blocked pending tasks held back, with reasons such as {@code dependency:1.2},
 *                {@code sequential:db} or {@code fileConflict:5.1}
 * @param applied constraints that held back at least one task
 */
public record ReadySelection(List<Task> ready, Map<String, String> blocked, List<ExecutionConstraint> applied) {

    public List<String> readyIds() {
        return ready.stream().map(Task::id).toList();
    }
}
