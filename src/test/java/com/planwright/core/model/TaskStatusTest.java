package com.planwright.core.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    private Locale previous;

    @BeforeEach
    void turkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    void wireNamesMatchTheJsonFormInAnyLocale() throws Exception {
        var mapper = ObjectMappers.create();
        for (var status : TaskStatus.values()) {
            assertEquals("\"" + status.wireName() + "\"", mapper.writeValueAsString(status));
        }
        assertEquals("in_progress", TaskStatus.IN_PROGRESS.wireName());
    }
}
