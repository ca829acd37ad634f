package com.epcid.catalog;

import com.epcid.domain.Child;
import lombok.*;

import java.util.List;

/**
 * Static catalog entry. Only red-flag definitions may force an escalation on
 * their own, whatever severity the caregiver picked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymptomDefinition {

    private String id;

    private String displayName;

    private BodyRegion bodyRegion;

    private boolean redFlag;

    private Integer minAgeMonths; // inclusive

    private Integer maxAgeMonths; // inclusive

    private Child.Gender applicableGender; // null applies to everyone

    private List<String> aliasPhrases;

    public List<String> getAliasPhrases() {
        return aliasPhrases != null ? aliasPhrases : List.of();
    }

    public boolean appliesToAge(int ageMonths) {
        if (minAgeMonths != null && ageMonths < minAgeMonths) {
            return false;
        }
        return maxAgeMonths == null || ageMonths <= maxAgeMonths;
    }

    public boolean appliesToGender(Child.Gender gender) {
        if (applicableGender == null || gender == null || gender == Child.Gender.UNKNOWN) {
            return true;
        }
        return applicableGender == gender;
    }
}
