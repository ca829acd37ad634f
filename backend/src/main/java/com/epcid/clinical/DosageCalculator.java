package com.epcid.clinical;

import com.epcid.common.EngineError;
import com.epcid.common.EngineResult;
import com.epcid.domain.Child;
import com.epcid.dto.DosageDTO;
import com.epcid.dto.DosageDTO.Drug;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Weight-based dose ranges for the two common pediatric fever reducers.
 *
 * A dose is always a min-max range in mg plus a hard daily cap. Missing weight
 * or age is reported, never defaulted; ibuprofen under 6 months is refused.
 * A matching medical condition still yields the range but flags it as
 * contraindicated.
 */
@Service
@Slf4j
public class DosageCalculator {

    public static final int IBUPROFEN_MIN_AGE_MONTHS = 6;
    static final int ACETAMINOPHEN_CONSULT_AGE_MONTHS = 3;

    private final Map<Drug, Protocol> protocols = new EnumMap<>(Drug.class);

    public DosageCalculator() {
        protocols.put(Drug.ACETAMINOPHEN, new Protocol(10, 15, 5, 4000, "Every 4-6 hours", null,
            List.of("Do not exceed 5 doses in 24 hours",
                "Check other medicines for hidden acetaminophen"),
            List.of("Liver disease", "Alcohol use"),
            List.of(Formulation.liquid("Infant Drops (80mg/0.8mL)", 100),
                Formulation.liquid("Children's Liquid (160mg/5mL)", 32),
                Formulation.tablet("Children's Chewables (160mg)", 160),
                Formulation.tablet("Junior Strength (325mg)", 325))));
        protocols.put(Drug.IBUPROFEN, new Protocol(5, 10, 4, 2400, "Every 6-8 hours", IBUPROFEN_MIN_AGE_MONTHS,
            List.of("Give with food or milk",
                "Avoid if the child is dehydrated or vomiting"),
            List.of("Kidney disease", "Bleeding disorders", "Aspirin allergy", "Dehydration",
                "Chickenpox", "Flu"),
            List.of(Formulation.liquid("Infant Drops (50mg/1.25mL)", 40),
                Formulation.liquid("Children's Liquid (100mg/5mL)", 20),
                Formulation.tablet("Children's Chewables (100mg)", 100),
                Formulation.tablet("Junior Strength (100mg)", 100))));
    }

    /**
     * Doses from the child's recorded weight and checks the child's medical
     * conditions against the drug's contraindications.
     */
    public EngineResult<DosageDTO.DoseRange> doseRange(Drug drug, Child child, Integer ageMonths) {
        if (child == null) {
            throw new IllegalArgumentException("child is required");
        }
        return doseRange(drug, child.getWeightLbs(), ageMonths, child.getMedicalConditions());
    }

    public EngineResult<DosageDTO.DoseRange> doseRange(Drug drug, Double weightLbs, Integer ageMonths) {
        return doseRange(drug, weightLbs, ageMonths, List.of());
    }

    public EngineResult<DosageDTO.DoseRange> doseRange(Drug drug, Double weightLbs, Integer ageMonths,
                                                       List<String> medicalConditions) {
        if (drug == null) {
            throw new IllegalArgumentException("drug is required");
        }
        Protocol protocol = protocols.get(drug);

        if (protocol.minAgeMonths != null) {
            if (ageMonths == null) {
                return EngineResult.failure(EngineError.AGE_UNKNOWN,
                    "Age is required before dosing " + displayName(drug));
            }
            if (ageMonths < protocol.minAgeMonths) {
                log.info("Refused {} for age {} months", drug, ageMonths);
                return EngineResult.failure(EngineError.DRUG_AGE_RESTRICTED,
                    displayName(drug) + " is not recommended for children under "
                        + protocol.minAgeMonths + " months. Please consult your pediatrician for alternatives.");
            }
        }

        if (weightLbs == null || weightLbs.isNaN() || weightLbs <= 0) {
            return EngineResult.failure(EngineError.WEIGHT_MISSING,
                "A current weight is required to calculate a " + displayName(drug) + " dose");
        }

        double kg = AgeWeightNormalizer.toKg(weightLbs);
        long min = Math.round(protocol.minMgPerKg * kg);
        long max = Math.round(protocol.maxMgPerKg * kg);
        long maxDaily = Math.min(protocol.absoluteDailyCapMg, max * protocol.maxDosesPerDay);

        DosageDTO.DoseRange.DoseRangeBuilder range = DosageDTO.DoseRange.builder()
            .drug(drug)
            .weightKg(kg)
            .minMg(min)
            .maxMg(max)
            .frequencyLabel(protocol.frequencyLabel)
            .maxDosesPerDay(protocol.maxDosesPerDay)
            .maxDailyMg(maxDaily)
            .warnings(protocol.warnings);
        for (Formulation formulation : protocol.formulations) {
            range.formulationAmount(formulation.amountFor(min, max));
        }

        Optional<String> conflict = protocol.contraindicationFor(medicalConditions);
        if (conflict.isPresent()) {
            log.info("{} flagged as contraindicated with {}", drug, conflict.get());
            range.contraindicated(true)
                .contraindicationReason(displayName(drug) + " may not be safe with " + conflict.get()
                    + ". Please consult your pediatrician.");
        }

        if (drug == Drug.ACETAMINOPHEN && ageMonths != null && ageMonths < ACETAMINOPHEN_CONSULT_AGE_MONTHS) {
            range.warning("Consult your doctor before giving to infants under 3 months");
        }
        return EngineResult.ok(range.build());
    }

    private static String displayName(Drug drug) {
        return drug == Drug.ACETAMINOPHEN ? "Acetaminophen" : "Ibuprofen";
    }

    private static final class Protocol {
        final int minMgPerKg;
        final int maxMgPerKg;
        final int maxDosesPerDay;
        final long absoluteDailyCapMg;
        final String frequencyLabel;
        final Integer minAgeMonths;
        final List<String> warnings;
        final List<String> contraindications;
        final List<Formulation> formulations;

        Protocol(int minMgPerKg, int maxMgPerKg, int maxDosesPerDay, long absoluteDailyCapMg,
                 String frequencyLabel, Integer minAgeMonths, List<String> warnings,
                 List<String> contraindications, List<Formulation> formulations) {
            this.minMgPerKg = minMgPerKg;
            this.maxMgPerKg = maxMgPerKg;
            this.maxDosesPerDay = maxDosesPerDay;
            this.absoluteDailyCapMg = absoluteDailyCapMg;
            this.frequencyLabel = frequencyLabel;
            this.minAgeMonths = minAgeMonths;
            this.warnings = warnings;
            this.contraindications = contraindications;
            this.formulations = formulations;
        }

        // Case-insensitive containment either way, so "Chronic kidney disease"
        // and "kidney" both match "Kidney disease". Returns the child's wording.
        Optional<String> contraindicationFor(List<String> medicalConditions) {
            if (medicalConditions == null) {
                return Optional.empty();
            }
            for (String condition : medicalConditions) {
                if (condition == null || condition.isBlank()) {
                    continue;
                }
                String normalized = condition.trim().toLowerCase(Locale.ROOT);
                for (String contraindication : contraindications) {
                    String known = contraindication.toLowerCase(Locale.ROOT);
                    if (normalized.contains(known) || known.contains(normalized)) {
                        return Optional.of(condition.trim());
                    }
                }
            }
            return Optional.empty();
        }
    }

    private static final class Formulation {
        final String name;
        final double mgPerUnit;
        final boolean liquid;

        private Formulation(String name, double mgPerUnit, boolean liquid) {
            this.name = name;
            this.mgPerUnit = mgPerUnit;
            this.liquid = liquid;
        }

        static Formulation liquid(String name, double mgPerMl) {
            return new Formulation(name, mgPerMl, true);
        }

        static Formulation tablet(String name, double mgPerTablet) {
            return new Formulation(name, mgPerTablet, false);
        }

        DosageDTO.FormulationAmount amountFor(long minMg, long maxMg) {
            return new DosageDTO.FormulationAmount(name, units(minMg), units(maxMg), liquid ? "mL" : "tablet");
        }

        // mL to one decimal; tablets whole, or halves below one tablet
        private double units(long mg) {
            double amount = mg / mgPerUnit;
            if (liquid) {
                return Math.round(amount * 10) / 10.0;
            }
            return amount >= 1 ? Math.round(amount) : Math.round(amount * 2) / 2.0;
        }
    }
}
