package com.epcid.clinical;

import com.epcid.domain.Severity;
import com.epcid.domain.SymptomObservation;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Facts the triage rules look at, derived once per evaluation.
 */
public final class TriageContext {

    static final Set<String> BREATHING_SYMPTOMS = Set.of("breathing_difficulty", "rapid_breathing", "wheezing");
    static final String UNRESPONSIVE = "unresponsive";

    private final List<SymptomObservation> symptoms;
    private final Double temperatureF;
    private final Integer ageMonths;
    private final Predicate<String> redFlagLookup;

    TriageContext(List<SymptomObservation> symptoms, Double temperatureF, Integer ageMonths,
                  Predicate<String> redFlagLookup) {
        this.symptoms = List.copyOf(symptoms);
        this.temperatureF = temperatureF;
        this.ageMonths = ageMonths;
        this.redFlagLookup = redFlagLookup;
    }

    public List<SymptomObservation> getSymptoms() {
        return symptoms;
    }

    public boolean isAgeKnown() {
        return ageMonths != null;
    }

    public boolean isAgeUnder(int months) {
        return ageMonths != null && ageMonths < months;
    }

    public boolean isTemperatureAtLeast(double thresholdF) {
        return temperatureF != null && temperatureF >= thresholdF;
    }

    public boolean hasUnresponsive() {
        return symptoms.stream().anyMatch(s -> UNRESPONSIVE.equals(s.getSymptomId()));
    }

    public boolean hasSignificantBreathingIssue() {
        return symptoms.stream()
            .anyMatch(s -> BREATHING_SYMPTOMS.contains(s.getSymptomId()) && s.getSeverity() != Severity.MILD);
    }

    public boolean hasRedFlag() {
        return symptoms.stream().anyMatch(s -> redFlagLookup.test(s.getSymptomId()));
    }

    public boolean hasSevereSymptom() {
        return symptoms.stream().anyMatch(s -> s.getSeverity() == Severity.SEVERE);
    }
}
