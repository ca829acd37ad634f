package com.epcid.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

public class RiskDTO {

    public enum Level {
        LOW,
        MODERATE,
        HIGH,
        CRITICAL
    }

    public enum Direction {
        RISING,
        FALLING,
        STABLE
    }

    /**
     * 0-100 aggregate score. Not the PEWS total.
     */
    @Value
    @Builder
    public static class Score {
        int score;
        Level level;
        @Singular
        List<Factor> factors;
    }

    @Value
    public static class Factor {
        String name;
        int points;
        String explanation;
    }
}
