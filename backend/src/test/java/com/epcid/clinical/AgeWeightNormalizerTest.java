package com.epcid.clinical;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.epcid.common.EngineError;
import com.epcid.common.EngineResult;
import com.epcid.domain.Child;

@DisplayName("AgeWeightNormalizer Tests")
class AgeWeightNormalizerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    private AgeWeightNormalizer normalizer;

    @BeforeEach
    void setUp() {
        Clock fixed = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
        normalizer = new AgeWeightNormalizer(fixed);
    }

    @Nested
    @DisplayName("ageInMonths()")
    class AgeInMonthsTests {

        @Test
        @DisplayName("Should count whole calendar months")
        void shouldCountWholeCalendarMonths() {
            assertEquals(24, normalizer.ageInMonths(LocalDate.of(2022, 6, 15), TODAY).orElseThrow());
            assertEquals(23, normalizer.ageInMonths(LocalDate.of(2022, 6, 16), TODAY).orElseThrow());
            assertEquals(0, normalizer.ageInMonths(TODAY, TODAY).orElseThrow());
        }

        @Test
        @DisplayName("Should use the injected clock when asOf is omitted")
        void shouldUseInjectedClock() {
            assertEquals(6, normalizer.ageInMonths(LocalDate.of(2023, 12, 1)).orElseThrow());
        }

        @Test
        @DisplayName("Should report AGE_UNKNOWN for a missing date of birth")
        void shouldReportAgeUnknownForMissingDob() {
            EngineResult<Integer> result = normalizer.ageInMonths((LocalDate) null, TODAY);

            assertTrue(result.hasError(EngineError.AGE_UNKNOWN));
        }

        @Test
        @DisplayName("Should report AGE_UNKNOWN for a future date of birth instead of defaulting")
        void shouldReportAgeUnknownForFutureDob() {
            EngineResult<Integer> result = normalizer.ageInMonths(TODAY.plusDays(1), TODAY);

            assertTrue(result.hasError(EngineError.AGE_UNKNOWN));
            assertTrue(result.getValue().isEmpty());
        }

        @Test
        @DisplayName("Should read the date of birth from a child profile")
        void shouldReadChildProfile() {
            Child child = Child.builder().dateOfBirth(LocalDate.of(2020, 6, 15)).build();

            assertEquals(48, normalizer.ageInMonths(child).orElseThrow());
            assertTrue(normalizer.ageInMonths((Child) null).hasError(EngineError.AGE_UNKNOWN));
        }
    }

    @Test
    @DisplayName("ageInYears() should floor months to years")
    void ageInYearsShouldFloor() {
        assertEquals(3, normalizer.ageInYears(LocalDate.of(2020, 12, 1), TODAY).orElseThrow());
        assertEquals(4, normalizer.ageInYears(LocalDate.of(2020, 6, 15), TODAY).orElseThrow());
    }

    @Test
    @DisplayName("toKg() should divide by 2.205")
    void toKgShouldDivide() {
        assertEquals(10.0, AgeWeightNormalizer.toKg(22.05), 1e-9);
    }

    @Test
    @DisplayName("toFahrenheit() should convert Celsius and pass Fahrenheit through")
    void toFahrenheitShouldConvertCelsius() {
        assertEquals(100.4, AgeWeightNormalizer.toFahrenheit(38.0, "°C"), 1e-9);
        assertEquals(212.0, AgeWeightNormalizer.toFahrenheit(100.0, "celsius"), 1e-9);
        assertEquals(101.0, AgeWeightNormalizer.toFahrenheit(101.0, "F"), 1e-9);
        assertEquals(99.0, AgeWeightNormalizer.toFahrenheit(99.0, null), 1e-9);
    }
}
