package com.planwright.plan;

import com.planwright.core.model.Task;

import java.util.List;

/**
 * Parser output: tasks in declared order, ready for the status store.
 *
 * @param planId     plan identifier
 * @param title      human-readable title, may be null
 * @param tasks      tasks with dependencies resolved to ids
 * @param phaseOrder declared phase ids
 */
public record ParsedPlan(String planId, String title, List<Task> tasks, List<String> phaseOrder) {

    public ParsedPlan {
        tasks = List.copyOf(tasks);
        phaseOrder = List.copyOf(phaseOrder);
    }
}
