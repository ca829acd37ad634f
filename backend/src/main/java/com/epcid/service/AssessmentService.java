package com.epcid.service;

import com.epcid.clinical.AgeWeightNormalizer;
import com.epcid.clinical.PewsCalculator;
import com.epcid.clinical.TriageEngine;
import com.epcid.common.EngineResult;
import com.epcid.domain.RiskTrendPoint;
import com.epcid.domain.VitalReading;
import com.epcid.domain.VitalType;
import com.epcid.dto.AssessmentDTO;
import com.epcid.dto.PewsDTO;
import com.epcid.dto.RiskDTO;
import com.epcid.dto.TriageDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs a full assessment for one child.
 *
 * {@link #preview} is side-effect free and meant for live recomputation while
 * the caregiver edits the form. {@link #submit} commits the assessment: it
 * appends to the risk trend and starts the escalation cascade on a critical score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssessmentService {

    private final AgeWeightNormalizer ageWeightNormalizer;
    private final PewsCalculator pewsCalculator;
    private final TriageEngine triageEngine;
    private final RiskScoreService riskScoreService;
    private final RiskTrendService riskTrendService;
    private final EscalationCoordinator escalationCoordinator;
    private final Clock clock;

    public AssessmentDTO.Result preview(AssessmentDTO.Request request) {
        return evaluate(request).toBuilder().submitted(false).build();
    }

    public AssessmentDTO.Result submit(AssessmentDTO.Request request) {
        Evaluation evaluation = evaluate(request);
        AssessmentDTO.Result.ResultBuilder result = evaluation.toBuilder().submitted(true);

        UUID childId = evaluation.childId;
        if (childId == null) {
            throw new IllegalArgumentException("A child with an id is required to submit an assessment");
        }

        // predecessor comes from the same atomic append
        List<RiskTrendPoint> history = riskTrendService.append(childId,
            new RiskTrendPoint(evaluation.risk.getScore(), evaluation.assessedAt));
        Integer previousScore = history.size() >= 2 ? history.get(history.size() - 2).getScore() : null;
        result.direction(riskTrendService.direction(childId));

        Optional<EscalationSession> escalation = escalationCoordinator
            .escalateIfCrossed(childId, previousScore, evaluation.risk, request.getContacts())
            .or(() -> escalationCoordinator.activeFor(childId));
        escalation.ifPresent(session -> {
            result.escalationId(session.getId());
            result.escalationState(session.getState());
        });

        log.info("Assessment submitted for child {}: triage={} risk={} ({})",
            childId, evaluation.triage.getLevel(), evaluation.risk.getScore(), evaluation.risk.getLevel());
        return result.build();
    }

    private Evaluation evaluate(AssessmentDTO.Request request) {
        if (request == null) {
            throw new IllegalArgumentException("assessment request is required");
        }
        List<String> warnings = new ArrayList<>();

        Integer ageMonths = resolveAge(request, warnings);
        Double temperatureF = resolveTemperature(request);

        PewsDTO.Score pews = null;
        if (request.getPews() != null) {
            PewsDTO.Request pewsRequest = request.getPews().getAgeMonths() == null
                ? request.getPews().toBuilder().ageMonths(ageMonths).build()
                : request.getPews();
            pews = pewsCalculator.calculate(pewsRequest);
        }

        TriageDTO.Result triage = triageEngine.evaluate(request.getSymptoms(), temperatureF, ageMonths);
        RiskDTO.Score risk = riskScoreService.aggregateRiskScore(request.getSymptoms(), request.getVitals());

        Evaluation evaluation = new Evaluation();
        evaluation.childId = request.getChild() != null ? request.getChild().getId() : null;
        evaluation.ageMonths = ageMonths;
        evaluation.temperatureF = temperatureF;
        evaluation.pews = pews;
        evaluation.triage = triage;
        evaluation.risk = risk;
        evaluation.assessedAt = clock.instant();
        evaluation.warnings = warnings;
        return evaluation;
    }

    private Integer resolveAge(AssessmentDTO.Request request, List<String> warnings) {
        if (request.getAgeMonths() != null) {
            return request.getAgeMonths();
        }
        EngineResult<Integer> age = ageWeightNormalizer.ageInMonths(request.getChild());
        if (!age.isOk()) {
            warnings.add("Age unknown: age-based rules were skipped (" + age.getMessage() + ")");
            return null;
        }
        return age.getValue().orElse(null);
    }

    private Double resolveTemperature(AssessmentDTO.Request request) {
        if (request.getTemperatureF() != null) {
            return request.getTemperatureF();
        }
        Optional<VitalReading> latest = Optional.ofNullable(request.getVitals()).orElse(List.of()).stream()
            .filter(v -> v.getType() == VitalType.TEMPERATURE)
            .max(VitalReading.BY_TIMESTAMP);
        return latest.map(v -> AgeWeightNormalizer.toFahrenheit(v.getValue(), v.getUnit())).orElse(null);
    }

    private static final class Evaluation {
        UUID childId;
        Integer ageMonths;
        Double temperatureF;
        PewsDTO.Score pews;
        TriageDTO.Result triage;
        RiskDTO.Score risk;
        Instant assessedAt;
        List<String> warnings;

        AssessmentDTO.Result.ResultBuilder toBuilder() {
            return AssessmentDTO.Result.builder()
                .childId(childId)
                .ageMonths(ageMonths)
                .temperatureF(temperatureF)
                .pews(pews)
                .triage(triage)
                .risk(risk)
                .assessedAt(assessedAt)
                .warnings(warnings);
        }
    }
}
