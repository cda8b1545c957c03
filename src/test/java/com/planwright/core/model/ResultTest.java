package com.planwright.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void okCarriesValueAndMaps() {
        var result = Result.ok(21).map(n -> n * 2);
        assertTrue(result.isOk());
        assertEquals(42, result.orElseThrow());
    }

    @Test
    void failureSkipsMapAndPropagates() {
        Result<Integer> failed = Result.failure(ErrorKind.TASK_NOT_FOUND, "no task 9.9");
        var mapped = failed.map(n -> "x" + n);

        assertFalse(mapped.isOk());
        assertEquals(ErrorKind.TASK_NOT_FOUND, mapped.error());
        Result<String> propagated = failed.propagate();
        assertEquals("no task 9.9", propagated.message());
        var ex = assertThrows(IllegalStateException.class, failed::orElseThrow);
        assertTrue(ex.getMessage().contains("TASK_NOT_FOUND"));
    }

    @Test
    void propagateOnSuccessIsAnError() {
        assertThrows(IllegalStateException.class, () -> Result.ok("x").propagate());
        assertThrows(NullPointerException.class, () -> Result.ok(null));
    }
}
