package com.epcid.clinical;

import com.epcid.common.EngineError;
import com.epcid.common.EngineResult;
import com.epcid.domain.Child;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Converts date of birth and weight into the units every other component uses.
 *
 * Unknown or future birth dates are reported as {@link EngineError#AGE_UNKNOWN};
 * this class never substitutes a default age.
 */
@Component
public class AgeWeightNormalizer {

    public static final double LBS_PER_KG = 2.205;

    private final Clock clock;

    public AgeWeightNormalizer(Clock clock) {
        this.clock = clock;
    }

    public EngineResult<Integer> ageInMonths(LocalDate dateOfBirth) {
        return ageInMonths(dateOfBirth, LocalDate.now(clock));
    }

    public EngineResult<Integer> ageInMonths(LocalDate dateOfBirth, LocalDate asOf) {
        if (dateOfBirth == null) {
            return EngineResult.failure(EngineError.AGE_UNKNOWN, "Date of birth is missing");
        }
        if (asOf == null) {
            asOf = LocalDate.now(clock);
        }
        if (dateOfBirth.isAfter(asOf)) {
            return EngineResult.failure(EngineError.AGE_UNKNOWN,
                "Date of birth " + dateOfBirth + " is in the future");
        }
        // Whole calendar months, a month only counts once its day-of-month is reached
        long months = ChronoUnit.MONTHS.between(dateOfBirth, asOf);
        return EngineResult.ok((int) Math.max(0, months));
    }

    public EngineResult<Integer> ageInMonths(Child child) {
        return ageInMonths(child != null ? child.getDateOfBirth() : null);
    }

    public EngineResult<Integer> ageInYears(LocalDate dateOfBirth, LocalDate asOf) {
        return ageInMonths(dateOfBirth, asOf).map(months -> months / 12);
    }

    public EngineResult<Integer> ageInYears(LocalDate dateOfBirth) {
        return ageInMonths(dateOfBirth).map(months -> months / 12);
    }

    public static double toKg(double weightLbs) {
        return weightLbs / LBS_PER_KG;
    }

    /**
     * Converts a temperature to Fahrenheit. Units starting with "C" are treated
     * as Celsius, anything else (including a missing unit) as Fahrenheit.
     */
    public static double toFahrenheit(double value, String unit) {
        if (unit != null) {
            String u = unit.replace("°", "").trim().toUpperCase(Locale.ROOT);
            if (u.startsWith("C")) {
                return value * 9.0 / 5.0 + 32.0;
            }
        }
        return value;
    }
}
