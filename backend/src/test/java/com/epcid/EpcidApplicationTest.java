package com.epcid;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.epcid.clinical.DosageCalculator;
import com.epcid.domain.Child;
import com.epcid.domain.EscalationContact;
import com.epcid.domain.Severity;
import com.epcid.domain.SymptomObservation;
import com.epcid.dto.AssessmentDTO;
import com.epcid.dto.DosageDTO;
import com.epcid.dto.EscalationDTO;
import com.epcid.dto.PewsDTO;
import com.epcid.dto.RiskDTO;
import com.epcid.dto.TriageDTO;
import com.epcid.service.AssessmentService;
import com.epcid.service.EscalationCoordinator;

/**
 * Boots the full context with application.yml and runs an assessment end to end.
 */
@SpringBootTest
@DisplayName("EPCID Application Context Tests")
class EpcidApplicationTest {

    @Autowired
    private AssessmentService assessmentService;

    @Autowired
    private EscalationCoordinator escalationCoordinator;

    @Autowired
    private DosageCalculator dosageCalculator;

    @Test
    @DisplayName("Should escalate a critical submitted assessment")
    void shouldEscalateCriticalAssessment() {
        // Arrange
        Child child = Child.builder()
            .id(UUID.randomUUID())
            .name("Ava")
            .dateOfBirth(LocalDate.now().minusYears(4))
            .weightLbs(36.0)
            .gender(Child.Gender.FEMALE)
            .build();
        AssessmentDTO.Request request = AssessmentDTO.Request.builder()
            .child(child)
            .symptoms(List.of(
                SymptomObservation.of("breathing_difficulty", Severity.SEVERE),
                SymptomObservation.of("seizure", Severity.SEVERE),
                SymptomObservation.of("fever", Severity.SEVERE)))
            .temperatureF(103.0)
            .pews(PewsDTO.Request.builder().workOfBreathing(PewsDTO.WorkOfBreathing.SEVERE).build())
            .contacts(List.of(
                EscalationContact.builder().memberId("mom").contactMethod(EscalationContact.ContactMethod.PUSH).build(),
                EscalationContact.builder().memberId("dad").contactMethod(EscalationContact.ContactMethod.SMS).build()))
            .build();

        // Act
        AssessmentDTO.Result result = assessmentService.submit(request);

        // Assert
        assertEquals(48, result.getAgeMonths());
        assertEquals(TriageDTO.Level.CALL_911, result.getTriage().getLevel());
        assertEquals(3, result.getPews().getRespiratory().getScore());
        assertEquals(87, result.getRisk().getScore());
        assertEquals(RiskDTO.Level.CRITICAL, result.getRisk().getLevel());
        assertEquals(EscalationDTO.State.NOTIFYING, result.getEscalationState());
        assertTrue(escalationCoordinator.acknowledge(result.getEscalationId(), "mom"));

        // Staying critical after the cascade is resolved must not page the family again
        escalationCoordinator.resolve(result.getEscalationId());
        AssessmentDTO.Result again = assessmentService.submit(request);
        assertEquals(RiskDTO.Level.CRITICAL, again.getRisk().getLevel());
        assertNull(again.getEscalationId());
        assertEquals(EscalationDTO.State.RESOLVED,
            escalationCoordinator.latestFor(child.getId()).orElseThrow().getState());
    }

    @Test
    @DisplayName("Should wire the dosage calculator")
    void shouldWireDosageCalculator() {
        DosageDTO.DoseRange range = dosageCalculator.doseRange(DosageDTO.Drug.ACETAMINOPHEN, 20.0, 24).orElseThrow();

        assertTrue(range.toDisplay().startsWith("91-136 mg every 4-6 hours"));
    }
}
