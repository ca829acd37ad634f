package com.epcid.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Symptom model Tests")
class SymptomObservationTest {

    @Test
    @DisplayName("Should normalize loosely typed ids to the catalog form")
    void shouldNormalizeIds() {
        assertEquals("wheezing", SymptomObservation.normalizeId(" Wheezing "));
        assertEquals("rapid_breathing", SymptomObservation.normalizeId("rapid-breathing"));
        assertEquals("sore_throat", SymptomObservation.normalizeId("Sore  Throat"));
    }

    @Test
    @DisplayName("Should normalize ids set through the builder and toBuilder copies")
    void shouldNormalizeBuilderIds() {
        SymptomObservation built = SymptomObservation.builder()
            .symptomId("Wheezing")
            .severity(Severity.MODERATE)
            .build();
        SymptomObservation copied = built.toBuilder().symptomId("Rapid Breathing").build();

        assertEquals("wheezing", built.getSymptomId());
        assertEquals("rapid_breathing", copied.getSymptomId());
        assertEquals("wheezing", built.toBuilder().build().getSymptomId());
    }

    @Test
    @DisplayName("Should reject blank or missing ids")
    void shouldRejectBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> SymptomObservation.normalizeId("   "));
        assertThrows(IllegalArgumentException.class, () -> SymptomObservation.normalizeId(null));
    }

    @Test
    @DisplayName("Should group observations of one check into an entry")
    void shouldGroupObservationsIntoEntry() {
        SymptomEntry entry = SymptomEntry.builder()
            .childId(UUID.randomUUID())
            .timestamp(Instant.parse("2024-06-15T10:00:00Z"))
            .observation(SymptomObservation.of("Cough", Severity.MILD))
            .observation(SymptomObservation.builder()
                .symptomId("fever")
                .severity(Severity.MODERATE)
                .duration(DurationBucket.values()[0])
                .build())
            .build();

        assertEquals(2, entry.getObservations().size());
        assertEquals("cough", entry.getObservations().get(0).getSymptomId());
        assertThrows(UnsupportedOperationException.class,
            () -> entry.getObservations().add(SymptomObservation.of("rash", Severity.MILD)));
    }

    @Test
    @DisplayName("Should expose personalized baselines per vital")
    void shouldExposeBaselines() {
        Child child = Child.builder().id(UUID.randomUUID()).build();
        child.getBaselines().put(VitalType.HEART_RATE,
            Child.Baseline.builder().value(95).unit("bpm").learned(true).build());

        assertTrue(child.baselineFor(VitalType.HEART_RATE).orElseThrow().isLearned());
        assertTrue(child.baselineFor(VitalType.OXYGEN).isEmpty());
    }
}
