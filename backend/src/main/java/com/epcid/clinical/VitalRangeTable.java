package com.epcid.clinical;

import com.epcid.domain.VitalType;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Age-bucketed normal ranges for pediatric vital signs.
 *
 * No interpolation between buckets. Oxygen saturation and temperature share
 * one range across all ages.
 */
@Component
public class VitalRangeTable {

    private static final Range OXYGEN_RANGE = new Range(95, 100);
    private static final Range TEMPERATURE_RANGE = new Range(97.0, 100.3); // °F, fever starts at 100.4

    private final Map<AgeGroup, Map<VitalType, Range>> ranges = new EnumMap<>(AgeGroup.class);

    public VitalRangeTable() {
        put(AgeGroup.INFANT, new Range(100, 160), new Range(30, 60), new Range(70, 90));
        put(AgeGroup.TODDLER, new Range(90, 150), new Range(24, 40), new Range(80, 100));
        put(AgeGroup.PRESCHOOL, new Range(80, 120), new Range(22, 34), new Range(85, 110));
        put(AgeGroup.SCHOOL, new Range(70, 110), new Range(18, 30), new Range(90, 115));
        put(AgeGroup.ADOLESCENT, new Range(60, 100), new Range(12, 20), new Range(100, 120));
    }

    private void put(AgeGroup group, Range heartRate, Range respiratoryRate, Range systolicBp) {
        Map<VitalType, Range> byType = new EnumMap<>(VitalType.class);
        byType.put(VitalType.HEART_RATE, heartRate);
        byType.put(VitalType.RESPIRATORY_RATE, respiratoryRate);
        byType.put(VitalType.SYSTOLIC_BP, systolicBp);
        byType.put(VitalType.OXYGEN, OXYGEN_RANGE);
        byType.put(VitalType.TEMPERATURE, TEMPERATURE_RANGE);
        ranges.put(group, byType);
    }

    public Range rangeFor(VitalType type, int ageMonths) {
        if (type == null) {
            throw new IllegalArgumentException("vital type is required");
        }
        return ranges.get(AgeGroup.forAgeMonths(ageMonths)).get(type);
    }

    public AgeGroup ageGroupFor(int ageMonths) {
        return AgeGroup.forAgeMonths(ageMonths);
    }

    public Status classify(VitalType type, double value, int ageMonths) {
        Range range = rangeFor(type, ageMonths);
        if (value < range.getMin()) {
            return Status.LOW;
        }
        if (value > range.getMax()) {
            return Status.HIGH;
        }
        return Status.NORMAL;
    }

    @Value
    public static class Range {
        double min;
        double max;

        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }

    public enum Status {
        LOW,
        NORMAL,
        HIGH
    }
}
