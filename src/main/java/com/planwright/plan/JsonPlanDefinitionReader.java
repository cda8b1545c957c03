package com.planwright.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwright.core.model.ObjectMappers;
import com.planwright.core.model.Task;
import com.planwright.core.model.TaskIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link PlanDefinition} JSON document. The plan id defaults to the file name
 * without extension.
 */
@Component
public class JsonPlanDefinitionReader implements PlanDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(JsonPlanDefinitionReader.class);

    private final ObjectMapper mapper = ObjectMappers.create();

    @Override
    public ParsedPlan parse(Path document) {
        PlanDefinition definition;
        try {
            definition = mapper.readValue(Files.readAllBytes(document), PlanDefinition.class);
        } catch (IOException e) {
            throw new PlanFormatException("Cannot read plan definition " + document + ": " + e.getMessage(), e);
        }
        if (definition == null || definition.phases() == null || definition.phases().isEmpty()) {
            throw new PlanFormatException("Plan definition " + document + " declares no phases");
        }
        var planId = definition.planId();
        if (planId == null || planId.isBlank()) {
            var name = document.getFileName().toString();
            int dot = name.lastIndexOf('.');
            planId = dot > 0 ? name.substring(0, dot) : name;
        }

        var groupOf = groupAssignments(definition);
        var tasks = new ArrayList<Task>();
        var phaseOrder = new ArrayList<String>();
        for (var phase : definition.phases()) {
            if (phase.id() == null || phase.id().isBlank()) {
                throw new PlanFormatException("Phase without id in " + document);
            }
            phaseOrder.add(phase.id());
            for (var def : phase.tasks() == null ? List.<PlanDefinition.TaskDefinition>of() : phase.tasks()) {
                var group = def.sequentialGroup() != null ? def.sequentialGroup() : groupOf.get(def.id());
                var task = Task.of(def.id(), def.description(), def.dependsOn(), group, def.files());
                tasks.add(new Task(task.id(), task.description(), phase.id(), task.status(),
                        task.dependencies(), task.dependents(), task.sequentialGroup(),
                        task.fileReferences(), 0, null));
            }
        }
        log.info("Parsed plan {} from {}: {} phases, {} tasks", planId, document, phaseOrder.size(), tasks.size());
        return new ParsedPlan(planId, definition.title(), tasks, phaseOrder);
    }

    private static Map<String, String> groupAssignments(PlanDefinition definition) {
        var allIds = new ArrayList<String>();
        for (var phase : definition.phases()) {
            if (phase.tasks() != null) {
                phase.tasks().stream().filter(t -> t.id() != null).forEach(t -> allIds.add(t.id()));
            }
        }
        var groupOf = new HashMap<String, String>();
        if (definition.sequentialGroups() == null) {
            return groupOf;
        }
        for (var group : definition.sequentialGroups()) {
            var members = group.tasks() != null && !group.tasks().isEmpty()
                    ? group.tasks()
                    : expandRange(group.taskRange(), allIds);
            var id = group.id() != null ? group.id() : group.taskRange();
            if (id == null) {
                throw new PlanFormatException("Sequential group needs an id or a taskRange");
            }
            members.forEach(m -> groupOf.put(m, id));
        }
        return groupOf;
    }

    /**
     * Expands {@code "3.1-3.4"} to the declared ids of that phase within the range.
     */
    static List<String> expandRange(String range, List<String> declaredIds) {
        if (range == null) {
            throw new PlanFormatException("Sequential group without taskRange or tasks");
        }
        var bounds = range.split("-");
        if (bounds.length != 2) {
            throw new PlanFormatException("Malformed task range: " + range);
        }
        var from = bounds[0].trim();
        var to = bounds[1].trim();
        if (!TaskIds.phaseOf(from).equals(TaskIds.phaseOf(to))) {
            throw new PlanFormatException("Task range " + range + " spans phases");
        }
        return declaredIds.stream()
                .filter(id -> TaskIds.phaseOf(id).equals(TaskIds.phaseOf(from)))
                .filter(id -> TaskIds.compare(id, from) >= 0 && TaskIds.compare(id, to) <= 0)
                .toList();
    }
}
