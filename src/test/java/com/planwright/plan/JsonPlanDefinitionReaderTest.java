package com.planwright.plan;

import com.planwright.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsonPlanDefinitionReaderTest {

    @TempDir
    Path dir;

    private final JsonPlanDefinitionReader reader = new JsonPlanDefinitionReader();

    private Path write(String name, String json) throws IOException {
        var file = dir.resolve(name);
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("reads phases and tasks in declared order")
    void readsPlan() throws IOException {
        var plan = reader.parse(write("plan.json", """
                {
                  "planId": "api-rewrite",
                  "title": "API rewrite",
                  "phases": [
                    {"id": "1", "name": "Setup", "tasks": [
                      {"id": "1.1", "description": "Schema", "files": ["db/schema.sql"]},
                      {"id": "1.2", "description": "Seed", "dependsOn": ["1.1"]}
                    ]},
                    {"id": "2", "name": "Build", "tasks": [
                      {"id": "2.1", "description": "Routes", "dependsOn": ["1.2"], "unknownField": true}
                    ]}
                  ]
                }
                """));

        assertEquals("api-rewrite", plan.planId());
        assertEquals("API rewrite", plan.title());
        assertEquals(List.of("1", "2"), plan.phaseOrder());
        assertEquals(List.of("1.1", "1.2", "2.1"), plan.tasks().stream().map(t -> t.id()).toList());

        var routes = plan.tasks().get(2);
        assertEquals("2", routes.phase());
        assertEquals(Set.of("1.2"), routes.dependencies());
        assertEquals(TaskStatus.PENDING, routes.status());
        assertEquals(0, routes.retryCount());
        assertEquals(Set.of("db/schema.sql"), plan.tasks().get(0).fileReferences());
    }

    @Test
    @DisplayName("plan id defaults to the file name")
    void planIdFromFileName() throws IOException {
        var plan = reader.parse(write("billing.json", """
                {"phases": [{"id": "1", "tasks": [{"id": "1.1", "description": "x"}]}]}
                """));
        assertEquals("billing", plan.planId());
    }

    @Test
    @DisplayName("sequential groups assign members by range or explicit id")
    void sequentialGroups() throws IOException {
        var plan = reader.parse(write("plan.json", """
                {
                  "phases": [
                    {"id": "3", "tasks": [
                      {"id": "3.1", "description": "a"},
                      {"id": "3.2", "description": "b"},
                      {"id": "3.3", "description": "c"},
                      {"id": "3.4", "description": "d", "sequentialGroup": "solo"}
                    ]}
                  ],
                  "sequentialGroups": [{"taskRange": "3.1-3.2", "reason": "shared schema"}]
                }
                """));
        assertEquals("3.1-3.2", plan.tasks().get(0).sequentialGroup());
        assertEquals("3.1-3.2", plan.tasks().get(1).sequentialGroup());
        assertNull(plan.tasks().get(2).sequentialGroup());
        assertEquals("solo", plan.tasks().get(3).sequentialGroup());
    }

    @Test
    @DisplayName("a plan without phases is rejected")
    void noPhases() throws IOException {
        var file = write("empty.json", "{\"planId\": \"empty\", \"phases\": []}");
        assertThrows(PlanFormatException.class, () -> reader.parse(file));
    }

    @Test
    @DisplayName("malformed JSON is rejected")
    void malformedJson() throws IOException {
        var file = write("broken.json", "{\"phases\": [");
        var e = assertThrows(PlanFormatException.class, () -> reader.parse(file));
        assertTrue(e.getMessage().contains("broken.json"));
    }

    @Test
    @DisplayName("missing file is rejected")
    void missingFile() {
        assertThrows(PlanFormatException.class, () -> reader.parse(dir.resolve("nope.json")));
    }

    @Test
    @DisplayName("task ranges stay within one phase")
    void expandRange() {
        var ids = List.of("3.1", "3.2", "3.3", "3.10", "4.1");
        assertEquals(List.of("3.2", "3.3", "3.10"), JsonPlanDefinitionReader.expandRange("3.2-3.10", ids));
        assertThrows(PlanFormatException.class, () -> JsonPlanDefinitionReader.expandRange("3.1-4.1", ids));
        assertThrows(PlanFormatException.class, () -> JsonPlanDefinitionReader.expandRange("3.1", ids));
    }
}
