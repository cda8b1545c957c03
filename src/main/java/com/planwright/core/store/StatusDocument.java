package com.planwright.core.store;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.planwright.core.model.RunRecord;
import com.planwright.core.model.StatusSnapshot;
import com.planwright.core.model.Task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk form of a {@link StatusSnapshot}. {@code summary} and
 * {@code dependencyGraph} are derived on write and ignored on read.
 */
@JsonPropertyOrder({"schemaVersion", "planId", "updatedAt", "summary", "phaseOrder", "tasks", "runs", "dependencyGraph"})
public record StatusDocument(
    int schemaVersion,
    String planId,
    Instant updatedAt,
    Map<String, Long> summary,
    List<String> phaseOrder,
    LinkedHashMap<String, Task> tasks,
    List<RunRecord> runs,
    Map<String, List<String>> dependencyGraph
) {

    public static StatusDocument from(StatusSnapshot snapshot) {
        var graph = new LinkedHashMap<String, List<String>>();
        snapshot.tasks().forEach((id, task) -> graph.put(id, new ArrayList<>(task.dependencies())));
        return new StatusDocument(snapshot.schemaVersion(), snapshot.planId(), snapshot.updatedAt(),
                snapshot.summary(), snapshot.phaseOrder(), new LinkedHashMap<>(snapshot.tasks()),
                snapshot.runs(), graph);
    }

    StatusSnapshot toSnapshot() {
        return new StatusSnapshot(schemaVersion, planId, tasks, phaseOrder, runs, updatedAt);
    }
}
