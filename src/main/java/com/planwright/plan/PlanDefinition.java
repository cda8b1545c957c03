package com.planwright.plan;

import java.util.List;

/**
 * JSON plan definition as read by {@link JsonPlanDefinitionReader}.
 * <pre>
 * {
 *   "planId": "api-rewrite",
 *   "title": "API rewrite",
 *   "phases": [
 *     {"id": "1", "name": "Setup", "tasks": [
 *       {"id": "1.1", "description": "...", "dependsOn": [], "files": ["src/api.ts"]}
 *     ]}
 *   ],
 *   "sequentialGroups": [{"taskRange": "3.1-3.4", "reason": "shared schema"}]
 * }
 * </pre>
 */
public record PlanDefinition(
    String planId,
    String title,
    List<PhaseDefinition> phases,
    List<SequentialGroupDefinition> sequentialGroups
) {

    public record PhaseDefinition(String id, String name, List<TaskDefinition> tasks) {}

    /**
     * @param sequentialGroup explicit group id; tasks may also join a group through
     *                        {@link SequentialGroupDefinition#taskRange()}
     */
    public record TaskDefinition(
        String id,
        String description,
        List<String> dependsOn,
        String sequentialGroup,
        List<String> files
    ) {}

    /**
     * @param id        group id, defaults to the range string
     * @param taskRange inclusive range within one phase, e.g. "3.1-3.4"
     * @param tasks     explicit member ids, alternative to a range
     * @param reason    why the members must not run in parallel
     */
    public record SequentialGroupDefinition(String id, String taskRange, List<String> tasks, String reason) {}
}
