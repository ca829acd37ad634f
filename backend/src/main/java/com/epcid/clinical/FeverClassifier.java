package com.epcid.clinical;

import org.springframework.stereotype.Component;

/**
 * Age-aware fever severity used for display framing next to the triage result.
 */
@Component
public class FeverClassifier {

    public enum FeverSeverity {
        NORMAL,
        LOW_GRADE,
        HIGH,
        CRITICAL
    }

    public FeverSeverity classify(double temperatureF, Integer ageMonths) {
        if (temperatureF < TriageEngine.INFANT_FEVER_F) {
            return FeverSeverity.NORMAL;
        }
        if (ageMonths != null && ageMonths < TriageEngine.INFANT_FEVER_AGE_MONTHS) {
            return FeverSeverity.CRITICAL;
        }
        if (temperatureF >= TriageEngine.HIGH_FEVER_F) {
            return FeverSeverity.CRITICAL;
        }
        if (temperatureF >= TriageEngine.MODERATE_FEVER_F) {
            return FeverSeverity.HIGH;
        }
        return FeverSeverity.LOW_GRADE;
    }

    public String describe(double temperatureF, Integer ageMonths) {
        return switch (classify(temperatureF, ageMonths)) {
            case NORMAL -> "Temperature is within normal range";
            case LOW_GRADE -> "Low-grade fever - monitor symptoms";
            case HIGH -> "Moderate-high fever - monitor closely";
            case CRITICAL -> ageMonths != null && ageMonths < TriageEngine.INFANT_FEVER_AGE_MONTHS
                ? "Fever in infant under 3 months requires immediate medical attention"
                : "High fever - seek medical care";
        };
    }
}
