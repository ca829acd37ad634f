package com.epcid.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.epcid.domain.EscalationContact;
import com.epcid.domain.EscalationContact.ContactMethod;

@DisplayName("EscalationContacts Tests")
class EscalationContactsTest {

    private static EscalationContact contact(String memberId, int priority) {
        return EscalationContact.builder()
            .memberId(memberId)
            .displayName(memberId)
            .priority(priority)
            .contactMethod(ContactMethod.SMS)
            .build();
    }

    private static List<String> order(List<EscalationContact> contacts) {
        return contacts.stream().map(EscalationContact::getMemberId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should derive priorities from list position")
    void shouldDerivePriorities() {
        List<EscalationContact> result = EscalationContacts.withDerivedPriorities(
            List.of(contact("mom", 0), contact("dad", 7)));

        assertEquals(1, result.get(0).getPriority());
        assertEquals(2, result.get(1).getPriority());
    }

    @Test
    @DisplayName("Should reject duplicate member ids")
    void shouldRejectDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> EscalationContacts.withDerivedPriorities(
            List.of(contact("mom", 1), contact("mom", 2))));
    }

    @Nested
    @DisplayName("reorder()")
    class ReorderTests {

        private final List<EscalationContact> contacts = List.of(
            contact("mom", 1), contact("dad", 2), contact("grandma", 3), contact("pediatrician", 4));

        @Test
        @DisplayName("Should move a contact down like a drag and drop")
        void shouldMoveDown() {
            List<EscalationContact> result = EscalationContacts.reorder(contacts, 0, 2);

            assertEquals(List.of("dad", "grandma", "mom", "pediatrician"), order(result));
            assertEquals(3, result.get(2).getPriority());
        }

        @Test
        @DisplayName("Should move a contact up and keep priorities a strict order")
        void shouldMoveUp() {
            List<EscalationContact> result = EscalationContacts.reorder(contacts, 3, 0);

            assertEquals(List.of("pediatrician", "mom", "dad", "grandma"), order(result));
            for (int i = 0; i < result.size(); i++) {
                assertEquals(i + 1, result.get(i).getPriority());
            }
        }

        @Test
        @DisplayName("Should reject out-of-range indices")
        void shouldRejectBadIndex() {
            assertThrows(IllegalArgumentException.class, () -> EscalationContacts.reorder(contacts, 0, 4));
            assertThrows(IllegalArgumentException.class, () -> EscalationContacts.reorder(contacts, -1, 0));
            assertThrows(IllegalArgumentException.class, () -> EscalationContacts.reorder(List.of(), 0, 0));
        }
    }

    @Test
    @DisplayName("normalize() should sort by stored priority with unranked contacts last")
    void normalizeShouldSortByPriority() {
        List<EscalationContact> result = EscalationContacts.normalize(
            List.of(contact("aunt", 0), contact("dad", 5), contact("mom", 2)));

        assertEquals(List.of("mom", "dad", "aunt"), order(result));
        assertEquals(List.of(1, 2, 3),
            result.stream().map(EscalationContact::getPriority).collect(Collectors.toList()));
    }
}
