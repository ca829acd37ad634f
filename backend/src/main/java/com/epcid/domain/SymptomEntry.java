package com.epcid.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The observations captured during a single symptom check.
 */
@Value
@Builder
public class SymptomEntry {
    UUID childId;
    Instant timestamp;
    @Singular
    List<SymptomObservation> observations;
}
