package com.epcid.service;

import com.epcid.common.EngineError;
import com.epcid.common.EngineResult;
import com.epcid.domain.EscalationContact;
import com.epcid.dto.EscalationDTO;
import com.epcid.dto.EscalationDTO.State;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * One running escalation cascade.
 *
 * <pre>
 * IDLE -> NOTIFYING(1) -> ACKNOWLEDGED -> RESOLVED
 *              |
 *              +-- timeout -> NOTIFYING(k+1) ... -> EXHAUSTED
 * </pre>
 *
 * Each NOTIFYING step owns exactly one cancellable timeout. Acknowledgment
 * cancels it; expiry advances to the next contact. Transitions are
 * synchronized because timeouts fire on the scheduler thread.
 */
@Slf4j
public class EscalationSession {

    private final UUID id;
    private final UUID childId;
    private final EscalationDTO.Plan plan;
    private final TaskScheduler scheduler;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    private State state = State.IDLE;
    private int currentIndex = -1;
    private ScheduledFuture<?> pendingTimeout;
    private String acknowledgedBy;
    private Instant startedAt;
    private Instant finishedAt;

    EscalationSession(UUID id, UUID childId, EscalationDTO.Plan plan, TaskScheduler scheduler,
                      NotificationDispatcher dispatcher, Clock clock) {
        this.id = id;
        this.childId = childId;
        this.plan = plan;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public synchronized void start() {
        if (state != State.IDLE) {
            throw new IllegalStateException("Escalation " + id + " already started (" + state + ")");
        }
        startedAt = clock.instant();
        safely(() -> dispatcher.dispatchPlan(id, childId, plan), "dispatch plan");
        advance();
    }

    /**
     * Records an acknowledgment from a contact that has already been notified.
     *
     * @return true when this call moved the session to ACKNOWLEDGED
     */
    public synchronized boolean acknowledge(String memberId) {
        if (state != State.NOTIFYING) {
            log.debug("Ignoring acknowledgment from {} on escalation {} in state {}", memberId, id, state);
            return false;
        }
        for (int i = 0; i <= currentIndex; i++) {
            if (plan.getOrderedContacts().get(i).getMemberId().equals(memberId)) {
                cancelTimeout();
                state = State.ACKNOWLEDGED;
                acknowledgedBy = memberId;
                log.info("Escalation {} acknowledged by {} (priority {})", id, memberId, i + 1);
                return true;
            }
        }
        log.warn("Acknowledgment from {} rejected: not yet notified on escalation {}", memberId, id);
        return false;
    }

    public synchronized void resolve() {
        if (state != State.ACKNOWLEDGED) {
            throw new IllegalStateException("Only an acknowledged escalation can be resolved, was " + state);
        }
        state = State.RESOLVED;
        finishedAt = clock.instant();
        log.info("Escalation {} resolved", id);
    }

    // Runs on the scheduler thread. A stale timer (already acknowledged or
    // advanced past its step) is a no-op.
    synchronized void onTimeout(int expectedIndex) {
        if (state != State.NOTIFYING || currentIndex != expectedIndex) {
            return;
        }
        log.info("Escalation {}: priority {} did not acknowledge within {}s",
            id, currentIndex + 1, plan.getTimeoutSeconds());
        pendingTimeout = null;
        advance();
    }

    private void advance() {
        currentIndex++;
        if (currentIndex >= plan.getOrderedContacts().size()) {
            state = State.EXHAUSTED;
            finishedAt = clock.instant();
            log.warn("Escalation {} for child {} exhausted after {} contacts",
                id, childId, plan.getOrderedContacts().size());
            safely(() -> dispatcher.reportExhausted(id, childId), "report exhaustion");
            return;
        }
        state = State.NOTIFYING;
        EscalationContact contact = plan.getOrderedContacts().get(currentIndex);
        final int step = currentIndex;
        pendingTimeout = scheduler.schedule(() -> onTimeout(step), clock.instant().plus(plan.getTimeout()));
        safely(() -> dispatcher.notifyContact(id, childId, contact), "notify " + contact.getMemberId());
    }

    private void cancelTimeout() {
        if (pendingTimeout != null) {
            pendingTimeout.cancel(false);
            pendingTimeout = null;
        }
    }

    private void safely(Runnable call, String what) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("Notification dispatcher failed to {} for escalation {}: {}", what, id, e.getMessage(), e);
        }
    }

    /**
     * Current state as a tagged result: EXHAUSTED surfaces as
     * {@link EngineError#ESCALATION_EXHAUSTED} so it cannot be mistaken for a
     * finished escalation.
     */
    public synchronized EngineResult<State> outcome() {
        if (state == State.EXHAUSTED) {
            return EngineResult.failure(EngineError.ESCALATION_EXHAUSTED,
                "No contact acknowledged the alert for child " + childId);
        }
        return EngineResult.ok(state);
    }

    public UUID getId() {
        return id;
    }

    public UUID getChildId() {
        return childId;
    }

    public EscalationDTO.Plan getPlan() {
        return plan;
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * Contact currently waiting to acknowledge, empty outside NOTIFYING.
     */
    public synchronized Optional<EscalationContact> getCurrentContact() {
        if (state != State.NOTIFYING) {
            return Optional.empty();
        }
        return Optional.of(plan.getOrderedContacts().get(currentIndex));
    }

    public synchronized Optional<String> getAcknowledgedBy() {
        return Optional.ofNullable(acknowledgedBy);
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }
}
