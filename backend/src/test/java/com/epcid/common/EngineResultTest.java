package com.epcid.common;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EngineResult Tests")
class EngineResultTest {

    @Test
    @DisplayName("Should expose value of a successful result")
    void shouldExposeValueOfSuccessfulResult() {
        EngineResult<Integer> result = EngineResult.ok(42);

        assertTrue(result.isOk());
        assertEquals(42, result.getValue().orElseThrow());
        assertTrue(result.getError().isEmpty());
        assertEquals(42, result.orElseThrow());
    }

    @Test
    @DisplayName("Should carry error and message of a failure")
    void shouldCarryErrorAndMessageOfFailure() {
        EngineResult<Integer> result = EngineResult.failure(EngineError.WEIGHT_MISSING, "no weight");

        assertFalse(result.isOk());
        assertTrue(result.hasError(EngineError.WEIGHT_MISSING));
        assertEquals("no weight", result.getMessage());
        assertTrue(result.getValue().isEmpty());
        IllegalStateException ex = assertThrows(IllegalStateException.class, result::orElseThrow);
        assertTrue(ex.getMessage().contains("WEIGHT_MISSING"));
    }

    @Test
    @DisplayName("Should map values and pass failures through untouched")
    void shouldMapValuesAndPassFailuresThrough() {
        assertEquals(EngineResult.ok(3), EngineResult.ok(36).map(m -> m / 12));

        EngineResult<Integer> failure = EngineResult.failure(EngineError.AGE_UNKNOWN, "missing");
        EngineResult<Integer> mapped = failure.map(m -> m / 12);
        assertTrue(mapped.hasError(EngineError.AGE_UNKNOWN));
        assertEquals("missing", mapped.getMessage());
    }

    @Test
    @DisplayName("Should reject a null success value")
    void shouldRejectNullSuccessValue() {
        assertThrows(NullPointerException.class, () -> EngineResult.ok(null));
    }
}
