package com.epcid.clinical;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.epcid.clinical.FeverClassifier.FeverSeverity;

@DisplayName("FeverClassifier Tests")
class FeverClassifierTest {

    private final FeverClassifier classifier = new FeverClassifier();

    @Test
    @DisplayName("Should classify by temperature for older children")
    void shouldClassifyByTemperature() {
        assertEquals(FeverSeverity.NORMAL, classifier.classify(100.3, 24));
        assertEquals(FeverSeverity.LOW_GRADE, classifier.classify(100.4, 24));
        assertEquals(FeverSeverity.HIGH, classifier.classify(102.0, 24));
        assertEquals(FeverSeverity.CRITICAL, classifier.classify(104.0, 24));
    }

    @Test
    @DisplayName("Any fever under 3 months should be critical")
    void infantFeverShouldBeCritical() {
        assertEquals(FeverSeverity.CRITICAL, classifier.classify(100.4, 2));
        assertTrue(classifier.describe(100.4, 2).contains("under 3 months"));
    }

    @Test
    @DisplayName("Unknown age should not trigger the infant rule")
    void unknownAgeShouldSkipInfantRule() {
        assertEquals(FeverSeverity.LOW_GRADE, classifier.classify(100.8, null));
        assertEquals("High fever - seek medical care", classifier.describe(104.5, null));
    }
}
