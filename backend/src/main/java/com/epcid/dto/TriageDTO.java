package com.epcid.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

public class TriageDTO {

    public enum Level {
        HOME_CARE("Home Care Appropriate", "Monitor and care at home"),
        CALL_24HR("Call Within 24 Hours", "Should be seen soon"),
        CALL_NOW("Call Your Doctor Now", "Needs prompt medical attention"),
        CALL_911("Call 911 Now", "This may be a medical emergency");

        private final String title;
        private final String subtitle;

        Level(String title, String subtitle) {
            this.title = title;
            this.subtitle = subtitle;
        }

        public String getTitle() {
            return title;
        }

        public String getSubtitle() {
            return subtitle;
        }

        public boolean isMoreUrgentThan(Level other) {
            return ordinal() > other.ordinal();
        }
    }

    /**
     * Triage outcome. Recomputed whenever the inputs change and replaced
     * wholesale, never patched.
     */
    @Value
    @Builder
    public static class Result {
        Level level;
        String rule; // name of the rule that fired
        @Singular
        List<String> reasons;
        @Singular
        List<String> nextSteps;
    }
}
