package com.epcid.clinical;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.epcid.clinical.VitalRangeTable.Status;
import com.epcid.domain.VitalType;

@DisplayName("VitalRangeTable Tests")
class VitalRangeTableTest {

    private final VitalRangeTable table = new VitalRangeTable();

    @Nested
    @DisplayName("Age buckets")
    class AgeBucketTests {

        @Test
        @DisplayName("Should put boundary ages in the older bucket")
        void shouldPutBoundaryInOlderBucket() {
            assertEquals(AgeGroup.INFANT, table.ageGroupFor(11));
            assertEquals(AgeGroup.TODDLER, table.ageGroupFor(12));
            assertEquals(AgeGroup.PRESCHOOL, table.ageGroupFor(36));
            assertEquals(AgeGroup.SCHOOL, table.ageGroupFor(72));
            assertEquals(AgeGroup.ADOLESCENT, table.ageGroupFor(144));
            assertEquals(AgeGroup.ADOLESCENT, table.ageGroupFor(216));
        }

        @Test
        @DisplayName("Should reject negative ages")
        void shouldRejectNegativeAges() {
            assertThrows(IllegalArgumentException.class, () -> table.ageGroupFor(-1));
        }
    }

    @Test
    @DisplayName("Should return bucketed heart rate ranges without interpolation")
    void shouldReturnBucketedHeartRate() {
        VitalRangeTable.Range infant = table.rangeFor(VitalType.HEART_RATE, 6);
        VitalRangeTable.Range toddler = table.rangeFor(VitalType.HEART_RATE, 12);

        assertEquals(100, infant.getMin());
        assertEquals(160, infant.getMax());
        assertEquals(90, toddler.getMin());
        assertEquals(150, toddler.getMax());
    }

    @Test
    @DisplayName("Should share oxygen range across ages")
    void shouldShareOxygenRange() {
        assertEquals(table.rangeFor(VitalType.OXYGEN, 1), table.rangeFor(VitalType.OXYGEN, 200));
        assertEquals(95, table.rangeFor(VitalType.OXYGEN, 50).getMin());
    }

    @Test
    @DisplayName("Should classify values against the age range")
    void shouldClassifyValues() {
        assertEquals(Status.HIGH, table.classify(VitalType.RESPIRATORY_RATE, 40, 60));
        assertEquals(Status.NORMAL, table.classify(VitalType.RESPIRATORY_RATE, 34, 60));
        assertEquals(Status.LOW, table.classify(VitalType.SYSTOLIC_BP, 80, 160));
        assertEquals(Status.HIGH, table.classify(VitalType.TEMPERATURE, 100.4, 24));
    }
}
