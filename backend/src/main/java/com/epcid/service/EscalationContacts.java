package com.epcid.service;

import com.epcid.domain.EscalationContact;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for the emergency contact order. Priority is always derived from list
 * position, so two contacts can never share a rank.
 */
public final class EscalationContacts {

    private EscalationContacts() {
    }

    /**
     * Returns a copy with priorities rewritten to position + 1.
     *
     * @throws IllegalArgumentException on null entries or duplicate member ids
     */
    public static List<EscalationContact> withDerivedPriorities(List<EscalationContact> contacts) {
        if (contacts == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<EscalationContact> ordered = new ArrayList<>(contacts.size());
        for (int i = 0; i < contacts.size(); i++) {
            EscalationContact contact = contacts.get(i);
            if (contact == null) {
                throw new IllegalArgumentException("Contact list contains a null entry at index " + i);
            }
            if (!seen.add(contact.getMemberId())) {
                throw new IllegalArgumentException("Duplicate contact: " + contact.getMemberId());
            }
            ordered.add(contact.getPriority() == i + 1 ? contact : contact.withPriority(i + 1));
        }
        return List.copyOf(ordered);
    }

    /**
     * Moves the contact at {@code fromIndex} to {@code toIndex}, the way a drag
     * and drop does, and re-derives every priority.
     */
    public static List<EscalationContact> reorder(List<EscalationContact> contacts, int fromIndex, int toIndex) {
        if (contacts == null || contacts.isEmpty()) {
            throw new IllegalArgumentException("No contacts to reorder");
        }
        checkIndex(fromIndex, contacts.size());
        checkIndex(toIndex, contacts.size());
        List<EscalationContact> working = new ArrayList<>(contacts);
        EscalationContact moved = working.remove(fromIndex);
        working.add(toIndex, moved);
        return withDerivedPriorities(working);
    }

    /**
     * Orders contacts by their stored priority (unranked last), then re-derives
     * ranks. Used for lists that come from storage with gaps or ties.
     */
    public static List<EscalationContact> normalize(List<EscalationContact> contacts) {
        if (contacts == null) {
            return List.of();
        }
        List<EscalationContact> sorted = new ArrayList<>(contacts);
        sorted.sort((a, b) -> Integer.compare(rank(a), rank(b))); // stable, ties keep list order
        return withDerivedPriorities(sorted);
    }

    private static int rank(EscalationContact contact) {
        return contact.getPriority() > 0 ? contact.getPriority() : Integer.MAX_VALUE;
    }

    private static void checkIndex(int index, int size) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException("Index " + index + " out of range for " + size + " contacts");
        }
    }
}
