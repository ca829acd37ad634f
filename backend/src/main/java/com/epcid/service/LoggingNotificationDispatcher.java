package com.epcid.service;

import com.epcid.domain.EscalationContact;
import com.epcid.dto.EscalationDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Default dispatcher that only records what would be sent. A host application
 * supplies its SMS/push/email dispatcher as a {@code @Primary} bean.
 */
@Component
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void dispatchPlan(UUID escalationId, UUID childId, EscalationDTO.Plan plan) {
        log.info("Escalation {} for child {}: {} contacts, {}s per contact",
            escalationId, childId, plan.getOrderedContacts().size(), plan.getTimeoutSeconds());
    }

    @Override
    public void notifyContact(UUID escalationId, UUID childId, EscalationContact contact) {
        log.info("Escalation {}: notifying priority {} ({}) via {}",
            escalationId, contact.getPriority(), contact.getMemberId(), contact.getContactMethod());
    }

    @Override
    public void reportExhausted(UUID escalationId, UUID childId) {
        log.warn("Escalation {} for child {} exhausted with no acknowledgment", escalationId, childId);
    }
}
