package com.epcid.service;

import com.epcid.domain.EscalationContact;
import com.epcid.dto.EscalationDTO;

import java.util.UUID;

/**
 * Delivery side of an escalation. Implementations own transport, delivery
 * receipts and retries; the engine only tells them what to send and when.
 * Calls are fire-and-forget from the engine's point of view.
 */
public interface NotificationDispatcher {

    /**
     * The full ordered plan, emitted once when an escalation starts.
     */
    void dispatchPlan(UUID escalationId, UUID childId, EscalationDTO.Plan plan);

    /**
     * Sent each time the cascade moves on to the next contact.
     */
    void notifyContact(UUID escalationId, UUID childId, EscalationContact contact);

    /**
     * Nobody acknowledged before the list ran out.
     */
    void reportExhausted(UUID escalationId, UUID childId);
}
