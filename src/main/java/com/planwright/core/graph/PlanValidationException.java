package com.planwright.core.graph;

import java.util.List;

/**
 * Thrown when a task list is structurally invalid: blank or duplicate ids,
 * self-references, references to unknown tasks, or malformed sequential groups.
 * All problems found are reported together.
 */
public class PlanValidationException extends RuntimeException {

    private final List<String> problems;

    public PlanValidationException(List<String> problems) {
        super("Plan validation failed: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
