package com.planwright.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setPlan puts planId in MDC")
    void setPlan() {
        MdcContext.setPlan("api-rewrite");
        assertEquals("api-rewrite", MDC.get("planId"));
    }

    @Test
    @DisplayName("setRun puts planId and runId in MDC")
    void setRun() {
        MdcContext.setRun("api-rewrite", "run-7");
        assertEquals("api-rewrite", MDC.get("planId"));
        assertEquals("run-7", MDC.get("runId"));
    }

    @Test
    @DisplayName("setTask without a run leaves runId untouched")
    void setTaskWithoutRun() {
        MdcContext.setTask("api-rewrite", null, "2.3");
        assertEquals("api-rewrite", MDC.get("planId"));
        assertEquals("2.3", MDC.get("taskId"));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("clearTask keeps plan and run keys")
    void clearTask() {
        MdcContext.setTask("api-rewrite", "run-7", "2.3");
        MdcContext.clearTask();
        assertNull(MDC.get("taskId"));
        assertEquals("run-7", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes all planwright MDC keys")
    void clear() {
        MdcContext.setTask("api-rewrite", "run-7", "2.3");
        MdcContext.clear();
        assertNull(MDC.get("planId"));
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("taskId"));
    }
}
