package com.epcid.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * One symptom as observed by the caregiver. Every ingestion path (picker, free
 * text, voice) produces this single shape.
 */
@Value
@Builder(toBuilder = true)
public class SymptomObservation {

    @NonNull
    String symptomId;

    @NonNull
    Severity severity;

    DurationBucket duration;

    String notes;

    Instant timestamp;

    /**
     * Normalizes a loosely typed symptom id ("Wheezing ", "rapid-breathing")
     * to the catalog's snake_case form.
     */
    public static String normalizeId(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("symptom id is required");
        }
        String id = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("symptom id is blank");
        }
        return id;
    }

    public static SymptomObservation of(String symptomId, Severity severity) {
        return SymptomObservation.builder()
            .symptomId(symptomId)
            .severity(severity)
            .build();
    }

    /**
     * Every build, including {@code toBuilder()} copies, stores the normalized id.
     */
    public static class SymptomObservationBuilder {

        public SymptomObservationBuilder symptomId(String symptomId) {
            this.symptomId = normalizeId(symptomId);
            return this;
        }
    }
}
