package com.epcid.domain;

import lombok.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Child profile as handed to the engine by the profile store. The engine only
 * reads it; baselines are edited by the surrounding application.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Child {

    private UUID id;

    private String name;

    private LocalDate dateOfBirth;

    private Double weightLbs;

    private Gender gender;

    @Builder.Default
    private List<String> medicalConditions = new ArrayList<>();

    @Builder.Default
    private List<String> allergies = new ArrayList<>();

    @Builder.Default
    private Map<VitalType, Baseline> baselines = new EnumMap<>(VitalType.class);

    public enum Gender {
        MALE,
        FEMALE,
        OTHER,
        UNKNOWN
    }

    public Optional<Baseline> baselineFor(VitalType type) {
        return Optional.ofNullable(baselines.get(type));
    }

    /**
     * Personalized reference value for one vital.
     */
    @Value
    @Builder
    public static class Baseline {
        double value;
        String unit;
        boolean learned; // false = population default
    }
}
