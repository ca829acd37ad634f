package com.epcid.dto;

import com.epcid.domain.EscalationContact;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

public class EscalationDTO {

    /**
     * What the notification dispatcher receives: contacts in priority order and
     * how long each one gets to acknowledge before the next is notified.
     */
    @Value
    @Builder
    public static class Plan {
        @Singular
        List<EscalationContact> orderedContacts;
        long timeoutSeconds;

        public Duration getTimeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }

        public boolean isEmpty() {
            return orderedContacts.isEmpty();
        }
    }

    public enum State {
        IDLE,
        NOTIFYING,
        ACKNOWLEDGED,
        RESOLVED,
        EXHAUSTED;

        public boolean isTerminal() {
            return this == RESOLVED || this == EXHAUSTED;
        }
    }
}
