package com.epcid.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * A family member or provider in the emergency notification order.
 * Priority 1 is notified first and always equals list position + 1.
 */
@Value
@Builder
public class EscalationContact {

    @NonNull
    String memberId;

    String displayName;

    @With
    int priority;

    @NonNull
    ContactMethod contactMethod;

    public enum ContactMethod {
        SMS,
        PHONE,
        EMAIL,
        PUSH
    }
}
