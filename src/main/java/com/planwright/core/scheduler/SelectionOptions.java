package com.planwright.core.scheduler;

import java.util.Set;

/**
 * Per-call adjustments to ready-task selection.
 *
 * @param ignoreSequential skip sequential-group filtering
 * @param forcedTaskIds    pending tasks eligible even with unmet dependencies (operator override)
 * @param excludedTaskIds  tasks never selected; their files still count as held
 */
public record SelectionOptions(boolean ignoreSequential, Set<String> forcedTaskIds, Set<String> excludedTaskIds) {

    public static final SelectionOptions DEFAULT = new SelectionOptions(false, Set.of(), Set.of());

    public SelectionOptions {
        forcedTaskIds = forcedTaskIds == null ? Set.of() : Set.copyOf(forcedTaskIds);
        excludedTaskIds = excludedTaskIds == null ? Set.of() : Set.copyOf(excludedTaskIds);
    }
}
