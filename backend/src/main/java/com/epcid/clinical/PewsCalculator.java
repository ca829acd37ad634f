package com.epcid.clinical;

import com.epcid.dto.PewsDTO;
import com.epcid.dto.PewsDTO.Avpu;
import com.epcid.dto.PewsDTO.Behavior;
import com.epcid.dto.PewsDTO.RiskBand;
import com.epcid.dto.PewsDTO.SubScore;
import com.epcid.domain.VitalType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Pediatric Early Warning Score.
 *
 * Three components, each 0-3, summed to a 0-9 total. Within a component the
 * signals combine by running maximum, so one severe sign dominates instead of
 * several mild ones adding up.
 *
 * Score bands:
 * - 0-2: low, routine monitoring
 * - 3-4: moderate, increased monitoring
 * - 5-6: high, escalate to a clinician
 * - 7+: critical, immediate review
 *
 * Pure and total: safe to call on every field edit for the live preview.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PewsCalculator {

    public static final int MAX_COMPONENT = 3;
    public static final int MAX_TOTAL = 3 * MAX_COMPONENT;

    private final VitalRangeTable vitalRangeTable;

    public PewsDTO.Score calculate(PewsDTO.Request request) {
        if (request == null) {
            throw new IllegalArgumentException("PEWS request is required");
        }

        SubScore cardiovascular = cardiovascular(request);
        SubScore respiratory = respiratory(request);
        SubScore behavioral = behavioral(request);

        int total = cardiovascular.getScore() + respiratory.getScore() + behavioral.getScore();
        RiskBand band = bandFor(total);

        PewsDTO.Score.ScoreBuilder score = PewsDTO.Score.builder()
            .cardiovascular(cardiovascular)
            .respiratory(respiratory)
            .behavioral(behavioral)
            .total(total)
            .maxPossible(MAX_TOTAL)
            .riskBand(band)
            .escalationRecommended(total >= 5)
            .rapidResponse(total >= 7)
            .interpretation(interpretation(total, band))
            .findings(findings(request))
            .recommendedActions(recommendations(total, cardiovascular, respiratory, behavioral));

        log.debug("PEWS cv={} resp={} behav={} total={}",
            cardiovascular.getScore(), respiratory.getScore(), behavioral.getScore(), total);
        return score.build();
    }

    SubScore cardiovascular(PewsDTO.Request request) {
        int score = 0;
        List<String> signals = new ArrayList<>();

        PewsDTO.SkinColor skin = request.getSkinColor() != null ? request.getSkinColor() : PewsDTO.SkinColor.NORMAL;
        switch (skin) {
            case PALE -> {
                score = 1;
                signals.add("Pale skin color");
            }
            case MOTTLED -> {
                score = 2;
                signals.add("Mottled skin");
            }
            case GREY -> {
                score = 3;
                signals.add("Grey/blue skin color");
            }
            default -> { }
        }

        Double refill = request.getCapillaryRefillSeconds();
        if (refill != null) {
            if (refill > 3) {
                score = Math.max(score, 2);
                signals.add("Prolonged capillary refill (>3s)");
            } else if (refill >= 2) {
                score = Math.max(score, 1);
                signals.add("Slightly prolonged capillary refill (2-3s)");
            }
        }

        return new SubScore(Math.min(MAX_COMPONENT, score), List.copyOf(signals));
    }

    SubScore respiratory(PewsDTO.Request request) {
        int score = 0;
        List<String> signals = new ArrayList<>();

        PewsDTO.WorkOfBreathing wob = request.getWorkOfBreathing() != null
            ? request.getWorkOfBreathing() : PewsDTO.WorkOfBreathing.NORMAL;
        switch (wob) {
            case MILD -> {
                score = 1;
                signals.add("Mild increased work of breathing");
            }
            case MODERATE -> {
                score = 2;
                signals.add("Moderate work of breathing");
            }
            case SEVERE -> {
                score = 3;
                signals.add("Severe work of breathing");
            }
            default -> { }
        }

        // Grunting alone is a severe sign
        if (request.isGrunting()) {
            score = Math.max(score, 3);
            signals.add("Grunting");
        }
        if (request.isStridor()) {
            score = Math.max(score, 2);
            signals.add("Stridor");
        }
        if (request.isRetractions()) {
            score = Math.max(score, 2);
            signals.add("Retractions");
        }

        Double spo2 = request.getOxygenSaturation();
        if (spo2 != null) {
            if (spo2 < 92) {
                score = Math.max(score, 3);
                signals.add("Severe hypoxia (SpO2 " + format(spo2) + "%)");
            } else if (spo2 < 95) {
                score = Math.max(score, 2);
                signals.add("Low oxygen saturation (SpO2 " + format(spo2) + "%)");
            }
        }

        return new SubScore(Math.min(MAX_COMPONENT, score), List.copyOf(signals));
    }

    SubScore behavioral(PewsDTO.Request request) {
        int score = 0;
        List<String> signals = new ArrayList<>();

        Avpu avpu = request.getAvpu() != null ? request.getAvpu() : Avpu.ALERT;
        switch (avpu) {
            case VOICE -> {
                score = 1;
                signals.add("Responds to voice (AVPU: V)");
            }
            case PAIN -> {
                score = 2;
                signals.add("Responds to pain only (AVPU: P)");
            }
            case UNRESPONSIVE -> {
                score = 3;
                signals.add("Unresponsive (AVPU: U)");
            }
            default -> { }
        }

        Behavior behavior = request.getBehavior() != null ? request.getBehavior() : Behavior.APPROPRIATE;
        if (behavior == Behavior.IRRITABLE) {
            score = Math.max(score, 1);
            signals.add("Irritable");
        } else if (behavior == Behavior.LETHARGIC) {
            score = Math.max(score, 2);
            signals.add("Lethargic");
        }

        // Parent concern counts as a clinical sign on its own
        if (request.isParentConcern()) {
            score = Math.max(score, 1);
            signals.add("Parent concern noted");
        }

        return new SubScore(Math.min(MAX_COMPONENT, score), List.copyOf(signals));
    }

    public static RiskBand bandFor(int total) {
        if (total >= 7) return RiskBand.CRITICAL;
        if (total >= 5) return RiskBand.HIGH;
        if (total >= 3) return RiskBand.MODERATE;
        return RiskBand.LOW;
    }

    /**
     * Age-adjusted vital findings. Reported alongside the score, they do not
     * change the component values.
     */
    private List<String> findings(PewsDTO.Request request) {
        List<String> findings = new ArrayList<>();
        Integer age = request.getAgeMonths();
        if (age != null && age >= 0) {
            addRangeFinding(findings, VitalType.HEART_RATE, request.getHeartRate(), age, "Heart rate", "bpm");
            addRangeFinding(findings, VitalType.RESPIRATORY_RATE, request.getRespiratoryRate(), age,
                "Respiratory rate", "breaths/min");
            addRangeFinding(findings, VitalType.SYSTOLIC_BP, request.getSystolicBp(), age, "Systolic BP", "mmHg");
        } else if (request.getHeartRate() != null || request.getRespiratoryRate() != null
            || request.getSystolicBp() != null) {
            findings.add("Age unknown: vital signs not compared against age ranges");
        }
        Double fio2 = request.getOxygenRequirement();
        if (fio2 != null && fio2 > PewsDTO.ROOM_AIR_FIO2) {
            findings.add("Supplemental oxygen (FiO2 " + Math.round(fio2 * 100) + "%)");
        }
        return findings;
    }

    private void addRangeFinding(List<String> findings, VitalType type, Integer value, int ageMonths,
                                 String label, String unit) {
        if (value == null) {
            return;
        }
        VitalRangeTable.Status status = vitalRangeTable.classify(type, value, ageMonths);
        if (status == VitalRangeTable.Status.NORMAL) {
            return;
        }
        VitalRangeTable.Range range = vitalRangeTable.rangeFor(type, ageMonths);
        findings.add(String.format("%s %d %s is %s for age (normal %s-%s)", label, value, unit,
            status == VitalRangeTable.Status.HIGH ? "above normal" : "below normal",
            format(range.getMin()), format(range.getMax())));
    }

    private String interpretation(int total, RiskBand band) {
        return switch (band) {
            case CRITICAL -> "PEWS Score " + total + "/9: CRITICAL - Immediate senior review required.";
            case HIGH -> "PEWS Score " + total + "/9: HIGH RISK - Escalate to a clinician. Increase monitoring.";
            case MODERATE -> "PEWS Score " + total + "/9: MODERATE RISK - Increase monitoring. Consider clinical review.";
            case LOW -> "PEWS Score " + total + "/9: LOW RISK - Continue routine monitoring.";
        };
    }

    private List<String> recommendations(int total, SubScore cv, SubScore resp, SubScore behav) {
        List<String> actions = new ArrayList<>();
        if (total >= 7) {
            actions.add("Seek emergency care immediately");
            actions.add("Continuous monitoring required");
        } else if (total >= 5) {
            actions.add("Contact your pediatrician within 30 minutes");
            actions.add("Recheck every 15-30 minutes");
        } else if (total >= 3) {
            actions.add("Increase monitoring to hourly");
            actions.add("Arrange a clinical review within 2 hours");
        } else {
            actions.add("Continue routine monitoring");
        }
        if (resp.getScore() >= 2) {
            actions.add("Respiratory assessment: watch breathing effort and color");
        }
        if (cv.getScore() >= 2) {
            actions.add("Cardiovascular assessment: check perfusion and fluid intake");
        }
        if (behav.getScore() >= 2) {
            actions.add("Neurological assessment: evaluate the cause of altered behavior");
        }
        return actions;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
