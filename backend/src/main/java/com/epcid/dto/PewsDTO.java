package com.epcid.dto;

import lombok.*;

import java.util.List;

public class PewsDTO {

    /**
     * Observations for one PEWS assessment. Rebuilt on every field edit, never stored.
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Request {
        private Integer ageMonths;

        // Cardiovascular
        private Integer heartRate;
        private Integer systolicBp;
        private Double capillaryRefillSeconds;
        @Builder.Default
        private SkinColor skinColor = SkinColor.NORMAL;

        // Respiratory
        private Integer respiratoryRate;
        private Double oxygenSaturation;
        @Builder.Default
        private Double oxygenRequirement = ROOM_AIR_FIO2;
        @Builder.Default
        private WorkOfBreathing workOfBreathing = WorkOfBreathing.NORMAL;
        private boolean grunting;
        private boolean stridor;
        private boolean retractions;

        // Behavior
        @Builder.Default
        private Avpu avpu = Avpu.ALERT;
        @Builder.Default
        private Behavior behavior = Behavior.APPROPRIATE;
        private boolean parentConcern;
    }

    @Value
    @Builder
    public static class Score {
        SubScore cardiovascular;
        SubScore respiratory;
        SubScore behavioral;
        int total;
        int maxPossible;
        RiskBand riskBand;
        boolean escalationRecommended;
        boolean rapidResponse;
        String interpretation;
        @Singular
        List<String> findings;
        @Singular
        List<String> recommendedActions;
    }

    /**
     * One 0-3 component together with the signals that set it.
     */
    @Value
    public static class SubScore {
        int score;
        List<String> signals;
    }

    public static final double ROOM_AIR_FIO2 = 0.21;

    public enum SkinColor {
        NORMAL,
        PALE,
        MOTTLED,
        GREY
    }

    public enum WorkOfBreathing {
        NORMAL,
        MILD,
        MODERATE,
        SEVERE
    }

    public enum Avpu {
        ALERT,
        VOICE,
        PAIN,
        UNRESPONSIVE
    }

    public enum Behavior {
        APPROPRIATE,
        IRRITABLE,
        LETHARGIC
    }

    public enum RiskBand {
        LOW,
        MODERATE,
        HIGH,
        CRITICAL
    }
}
