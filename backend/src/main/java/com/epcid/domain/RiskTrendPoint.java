package com.epcid.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

@Value
public class RiskTrendPoint {
    int score;
    @NonNull
    Instant timestamp;
}
