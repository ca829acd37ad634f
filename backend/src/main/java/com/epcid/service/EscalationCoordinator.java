package com.epcid.service;

import com.epcid.domain.EscalationContact;
import com.epcid.dto.EscalationDTO;
import com.epcid.dto.RiskDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Builds escalation plans and runs the timed notification cascade when a
 * child's aggregate risk score crosses into critical.
 *
 * Only the latest cascade of each child is retained. Starting a new one
 * replaces a finished predecessor.
 */
@Service
@Slf4j
public class EscalationCoordinator {

    private final TaskScheduler taskScheduler;
    private final NotificationDispatcher dispatcher;
    private final RiskScoreService riskScoreService;
    private final Clock clock;

    private final ConcurrentMap<UUID, EscalationSession> latestByChild = new ConcurrentHashMap<>();

    @Value("${epcid.escalation.timeout-seconds:300}")
    private long defaultTimeoutSeconds = 300;

    public EscalationCoordinator(@Qualifier("escalationTaskScheduler") TaskScheduler taskScheduler,
                                 NotificationDispatcher dispatcher,
                                 RiskScoreService riskScoreService,
                                 Clock clock) {
        this.taskScheduler = taskScheduler;
        this.dispatcher = dispatcher;
        this.riskScoreService = riskScoreService;
        this.clock = clock;
    }

    public EscalationDTO.Plan planEscalation(List<EscalationContact> contacts) {
        return planEscalation(contacts, defaultTimeoutSeconds);
    }

    /**
     * Pure: orders the contacts by list position and pairs them with the
     * per-contact timeout.
     */
    public EscalationDTO.Plan planEscalation(List<EscalationContact> contacts, long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive, got " + timeoutSeconds);
        }
        return EscalationDTO.Plan.builder()
            .orderedContacts(EscalationContacts.withDerivedPriorities(contacts))
            .timeoutSeconds(timeoutSeconds)
            .build();
    }

    public boolean isCritical(int aggregateRiskScore) {
        return riskScoreService.isCritical(aggregateRiskScore);
    }

    /**
     * Starts an escalation when the score crosses into critical: the new score
     * is critical and the previous one was absent or below the threshold. A
     * score that stays critical never restarts the cascade, and a child with a
     * cascade still running keeps that one.
     *
     * @param previousScore the child's preceding trend score, null for the first assessment
     */
    public Optional<EscalationSession> escalateIfCrossed(UUID childId, Integer previousScore, RiskDTO.Score score,
                                                         List<EscalationContact> contacts) {
        if (score == null || !isCritical(score.getScore())) {
            return Optional.empty();
        }
        if (previousScore != null && isCritical(previousScore)) {
            log.debug("Child {} stays critical ({} -> {}), no new escalation", childId, previousScore, score.getScore());
            return Optional.empty();
        }
        return Optional.of(startEscalation(childId, contacts));
    }

    public synchronized EscalationSession startEscalation(UUID childId, List<EscalationContact> contacts) {
        if (childId == null) {
            throw new IllegalArgumentException("childId is required");
        }
        Optional<EscalationSession> running = activeFor(childId);
        if (running.isPresent()) {
            log.info("Escalation {} already running for child {}", running.get().getId(), childId);
            return running.get();
        }

        EscalationDTO.Plan plan = planEscalation(contacts);
        EscalationSession session = new EscalationSession(UUID.randomUUID(), childId, plan,
            taskScheduler, dispatcher, clock);
        EscalationSession replaced = latestByChild.put(childId, session);
        if (replaced != null) {
            log.debug("Evicting finished escalation {} ({}) for child {}",
                replaced.getId(), replaced.getState(), childId);
        }
        log.info("Starting escalation {} for child {} with {} contacts",
            session.getId(), childId, plan.getOrderedContacts().size());
        session.start();
        return session;
    }

    public boolean acknowledge(UUID escalationId, String memberId) {
        return find(escalationId).map(s -> s.acknowledge(memberId)).orElse(false);
    }

    public void resolve(UUID escalationId) {
        EscalationSession session = find(escalationId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown escalation " + escalationId));
        session.resolve();
    }

    public Optional<EscalationSession> find(UUID escalationId) {
        if (escalationId == null) {
            return Optional.empty();
        }
        return latestByChild.values().stream()
            .filter(s -> s.getId().equals(escalationId))
            .findFirst();
    }

    public Optional<EscalationSession> latestFor(UUID childId) {
        return Optional.ofNullable(childId).map(latestByChild::get);
    }

    public Optional<EscalationSession> activeFor(UUID childId) {
        return latestFor(childId).filter(s -> s.getState() == EscalationDTO.State.NOTIFYING);
    }

    int retainedSessionCount() {
        return latestByChild.size();
    }
}
