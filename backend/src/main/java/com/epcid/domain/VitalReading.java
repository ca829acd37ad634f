package com.epcid.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;

/**
 * One immutable vital sign measurement. Readings of the same child ordered by
 * timestamp form the time series consumed by the risk score and trend logic.
 */
@Value
@Builder
public class VitalReading {

    public static final Comparator<VitalReading> BY_TIMESTAMP =
        Comparator.comparing(VitalReading::getTimestamp);

    @NonNull
    VitalType type;

    double value;

    String unit;

    @NonNull
    Instant timestamp;

    @Builder.Default
    Source source = Source.MANUAL;

    public enum Source {
        MANUAL,
        DEVICE,
        AI_INFERRED
    }
}
