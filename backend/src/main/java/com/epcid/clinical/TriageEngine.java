package com.epcid.clinical;

import com.epcid.catalog.SymptomCatalog;
import com.epcid.domain.SymptomEntry;
import com.epcid.domain.SymptomObservation;
import com.epcid.dto.TriageDTO;
import com.epcid.dto.TriageDTO.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Triage Decision Engine
 *
 * Maps selected symptoms, temperature and age to one of four triage levels.
 * The rules form an ordered list, highest urgency first, and the first match
 * wins. There is no scoring or blending between rules.
 *
 * Deterministic: no clock, no randomness, nothing retained between calls.
 * Unknown age skips the age-gated infant fever rule.
 */
@Service
public class TriageEngine {

    private static final Logger log = LoggerFactory.getLogger(TriageEngine.class);

    public static final double INFANT_FEVER_F = 100.4;
    public static final double HIGH_FEVER_F = 104.0;
    public static final double MODERATE_FEVER_F = 102.0;
    public static final int INFANT_FEVER_AGE_MONTHS = 3;

    private final SymptomCatalog symptomCatalog;
    private final List<TriageRule> rules;

    public TriageEngine(SymptomCatalog symptomCatalog) {
        this.symptomCatalog = symptomCatalog;
        this.rules = buildRules();
    }

    /**
     * The cascade in evaluation order.
     */
    public List<TriageRule> getRules() {
        return rules;
    }

    public TriageDTO.Result evaluate(List<SymptomObservation> symptoms, Double temperatureF, Integer ageMonths) {
        List<SymptomObservation> selected = symptoms != null ? symptoms : List.of();
        selected.stream()
            .map(SymptomObservation::getSymptomId)
            .filter(id -> symptomCatalog.findById(id).isEmpty())
            .forEach(id -> log.warn("Symptom '{}' is not in the catalog, treated as non red-flag", id));

        TriageContext context = new TriageContext(selected, temperatureF, ageMonths, symptomCatalog::isRedFlag);
        for (TriageRule rule : rules) {
            if (rule.matches(context)) {
                TriageDTO.Result result = rule.apply(context);
                log.debug("Triage rule '{}' fired: {} (symptoms={}, tempF={}, ageMonths={})",
                    rule.getName(), result.getLevel(), selected.size(), temperatureF, ageMonths);
                return result;
            }
        }
        // Unreachable, the last rule always matches
        throw new IllegalStateException("Triage cascade has no default rule");
    }

    public TriageDTO.Result evaluate(SymptomEntry entry, Double temperatureF, Integer ageMonths) {
        return evaluate(entry != null ? entry.getObservations() : List.<SymptomObservation>of(), temperatureF, ageMonths);
    }

    private List<TriageRule> buildRules() {
        List<TriageRule> cascade = new ArrayList<>();

        cascade.add(new TriageRule("emergency-signs", Level.CALL_911,
            ctx -> ctx.hasUnresponsive()
                || ctx.hasSignificantBreathingIssue()
                || (ctx.hasRedFlag() && ctx.hasSevereSymptom()),
            ctx -> {
                List<String> reasons = new ArrayList<>();
                reasons.add("Symptoms indicate a potential emergency");
                if (ctx.hasUnresponsive()) {
                    reasons.add("Child is unresponsive or difficult to wake");
                }
                if (ctx.hasSignificantBreathingIssue()) {
                    reasons.add("Significant breathing difficulty");
                }
                if (ctx.hasRedFlag() && ctx.hasSevereSymptom()) {
                    reasons.add("Warning sign present with severe symptoms");
                }
                return reasons;
            },
            List.of("Call 911 immediately", "Do not give food or drink", "Keep child calm and still")));

        cascade.add(new TriageRule("infant-fever", Level.CALL_911,
            ctx -> ctx.isAgeUnder(INFANT_FEVER_AGE_MONTHS) && ctx.isTemperatureAtLeast(INFANT_FEVER_F),
            ctx -> List.of("Any fever in a baby under 3 months requires immediate evaluation"),
            List.of("Call 911 or go to emergency room immediately",
                "Do not give fever medication without doctor guidance")));

        cascade.add(new TriageRule("high-fever-or-red-flag", Level.CALL_NOW,
            ctx -> ctx.isTemperatureAtLeast(HIGH_FEVER_F) || ctx.hasRedFlag(),
            ctx -> {
                List<String> reasons = new ArrayList<>();
                if (ctx.isTemperatureAtLeast(HIGH_FEVER_F)) {
                    reasons.add("Temperature is 104°F or higher");
                }
                if (ctx.hasRedFlag()) {
                    reasons.add("Symptom combination needs prompt evaluation");
                }
                return reasons;
            },
            List.of("Call your pediatrician now", "If unable to reach, go to urgent care")));

        cascade.add(new TriageRule("severe-or-fever", Level.CALL_24HR,
            ctx -> ctx.hasSevereSymptom() || ctx.isTemperatureAtLeast(MODERATE_FEVER_F),
            ctx -> List.of("Symptoms should be evaluated within 24 hours"),
            List.of("Schedule appointment within 24 hours", "Monitor for worsening symptoms",
                "Give age-appropriate fever medication if needed")));

        cascade.add(new TriageRule("home-care", Level.HOME_CARE,
            ctx -> true,
            ctx -> List.of("Symptoms can be safely managed at home"),
            List.of("Rest and adequate fluids", "Monitor symptoms for changes",
                "Use the care guides for specific advice")));

        return List.copyOf(cascade);
    }
}
