package com.epcid.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;

public class DosageDTO {

    public enum Drug {
        ACETAMINOPHEN,
        IBUPROFEN
    }

    /**
     * A per-dose range. Always shown together with {@link #maxDailyMg}.
     */
    @Value
    @Builder
    public static class DoseRange {
        Drug drug;
        double weightKg;
        long minMg;
        long maxMg;
        @Builder.Default
        String unit = "mg";
        String frequencyLabel;
        int maxDosesPerDay;
        long maxDailyMg;
        @Singular
        List<String> warnings;
        @Singular
        List<FormulationAmount> formulationAmounts;
        boolean contraindicated;
        String contraindicationReason;

        public String toDisplay() {
            return minMg + "-" + maxMg + " " + unit + " " + frequencyLabel.toLowerCase(Locale.ROOT)
                + " (max " + maxDailyMg + " " + unit + " per day)";
        }
    }

    /**
     * The per-dose range translated into one over-the-counter product:
     * millilitres for drops and liquids, whole or half tablets for chewables.
     */
    @Value
    public static class FormulationAmount {
        String name;
        double minAmount;
        double maxAmount;
        String unit;
    }
}
