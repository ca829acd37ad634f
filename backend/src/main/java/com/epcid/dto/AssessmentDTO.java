package com.epcid.dto;

import com.epcid.domain.Child;
import com.epcid.domain.EscalationContact;
import com.epcid.domain.SymptomObservation;
import com.epcid.domain.VitalReading;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class AssessmentDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Request {
        private Child child;
        private Integer ageMonths; // overrides the age derived from the child's date of birth
        @Builder.Default
        private List<SymptomObservation> symptoms = new ArrayList<>();
        @Builder.Default
        private List<VitalReading> vitals = new ArrayList<>();
        private Double temperatureF; // falls back to the latest temperature reading
        private PewsDTO.Request pews;
        @Builder.Default
        private List<EscalationContact> contacts = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Result {
        private UUID childId;
        private Integer ageMonths;
        private Double temperatureF;
        private PewsDTO.Score pews;
        private TriageDTO.Result triage;
        private RiskDTO.Score risk;
        private RiskDTO.Direction direction;
        private boolean submitted;
        private Instant assessedAt;
        private UUID escalationId;
        private EscalationDTO.State escalationState;
        @Builder.Default
        private List<String> warnings = new ArrayList<>();
    }
}
