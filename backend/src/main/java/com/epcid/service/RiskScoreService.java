package com.epcid.service;

import com.epcid.clinical.AgeWeightNormalizer;
import com.epcid.domain.SymptomObservation;
import com.epcid.domain.VitalReading;
import com.epcid.domain.VitalType;
import com.epcid.dto.RiskDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Additive 0-100 risk score shown on the dashboard and used to trigger the
 * escalation cascade. Separate from, and not comparable to, the PEWS total.
 */
@Service
@Slf4j
public class RiskScoreService {

    public static final int BASE_SCORE = 15;
    public static final int POINTS_PER_SEVERITY = 8;
    public static final int FEVER_POINTS = 15;
    public static final int TACHYCARDIA_POINTS = 10;
    public static final int LOW_OXYGEN_POINTS = 20;

    static final double FEVER_THRESHOLD_F = 100.4;
    static final double HEART_RATE_THRESHOLD = 120;
    static final double OXYGEN_THRESHOLD = 95;

    public static final int DEFAULT_CRITICAL_THRESHOLD = 80;

    // also decides when the escalation cascade starts
    @Value("${epcid.risk.critical-threshold:80}")
    private int criticalThreshold = DEFAULT_CRITICAL_THRESHOLD;

    public RiskDTO.Score aggregateRiskScore(List<SymptomObservation> symptoms, List<VitalReading> vitals) {
        RiskDTO.Score.ScoreBuilder result = RiskDTO.Score.builder();
        int score = BASE_SCORE;

        if (symptoms != null) {
            for (SymptomObservation symptom : symptoms) {
                int points = symptom.getSeverity().getWeight() * POINTS_PER_SEVERITY;
                score += points;
                result.factor(new RiskDTO.Factor(symptom.getSymptomId(), points,
                    symptom.getSeverity().name().toLowerCase(Locale.ROOT) + " symptom"));
            }
        }

        // A breach counts once per vital type, judged on that type's latest reading
        Map<VitalType, VitalReading> latest = latestByType(vitals);

        VitalReading temperature = latest.get(VitalType.TEMPERATURE);
        if (temperature != null) {
            double tempF = AgeWeightNormalizer.toFahrenheit(temperature.getValue(), temperature.getUnit());
            if (tempF > FEVER_THRESHOLD_F) {
                score += FEVER_POINTS;
                result.factor(new RiskDTO.Factor("Elevated Temperature", FEVER_POINTS,
                    "Temperature of " + formatTemperature(tempF) + "°F is above normal range"));
            }
        }
        VitalReading heartRate = latest.get(VitalType.HEART_RATE);
        if (heartRate != null && heartRate.getValue() > HEART_RATE_THRESHOLD) {
            score += TACHYCARDIA_POINTS;
            result.factor(new RiskDTO.Factor("Elevated Heart Rate", TACHYCARDIA_POINTS,
                "Heart rate of " + Math.round(heartRate.getValue()) + " bpm"));
        }
        VitalReading oxygen = latest.get(VitalType.OXYGEN);
        if (oxygen != null && oxygen.getValue() < OXYGEN_THRESHOLD) {
            score += LOW_OXYGEN_POINTS;
            result.factor(new RiskDTO.Factor("Low Oxygen Saturation", LOW_OXYGEN_POINTS,
                "SpO2 of " + Math.round(oxygen.getValue()) + "%"));
        }

        int clamped = Math.min(100, Math.max(0, score));
        log.debug("Aggregate risk score raw={} clamped={}", score, clamped);
        return result.score(clamped).level(levelFor(clamped)).build();
    }

    public RiskDTO.Level levelFor(int score) {
        return riskLevelFor(score, criticalThreshold);
    }

    public boolean isCritical(int score) {
        return score >= criticalThreshold;
    }

    public int getCriticalThreshold() {
        return criticalThreshold;
    }

    public static RiskDTO.Level riskLevelFor(int score, int criticalThreshold) {
        if (score >= criticalThreshold) return RiskDTO.Level.CRITICAL;
        if (score >= 60) return RiskDTO.Level.HIGH;
        if (score >= 40) return RiskDTO.Level.MODERATE;
        return RiskDTO.Level.LOW;
    }

    static String formatTemperature(double tempF) {
        double rounded = Math.round(tempF * 10) / 10.0;
        return rounded == Math.rint(rounded) ? String.valueOf((long) rounded) : String.valueOf(rounded);
    }

    private static Map<VitalType, VitalReading> latestByType(List<VitalReading> vitals) {
        Map<VitalType, VitalReading> latest = new EnumMap<>(VitalType.class);
        if (vitals == null) {
            return latest;
        }
        for (VitalReading reading : vitals) {
            latest.merge(reading.getType(), reading,
                (current, candidate) -> candidate.getTimestamp().isBefore(current.getTimestamp()) ? current : candidate);
        }
        return latest;
    }
}
