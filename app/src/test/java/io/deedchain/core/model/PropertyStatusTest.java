package io.deedchain.core.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PropertyStatusTest {

    @Test
    void codesAreStable() {
        assertEquals(1, PropertyStatus.ACTIVE.code());
        assertEquals(2, PropertyStatus.PENDING.code());
        assertEquals(3, PropertyStatus.SUSPENDED.code());
        assertEquals(4, PropertyStatus.ARCHIVED.code());
        assertEquals(Optional.of(PropertyStatus.SUSPENDED), PropertyStatus.fromCode(3));
        assertTrue(PropertyStatus.fromCode(0).isEmpty());
        assertTrue(PropertyStatus.fromCode(5).isEmpty());
    }

    @Test
    void transitionTableMatchesLifecycle() {
        assertEquals(EnumSet.allOf(PropertyStatus.class), PropertyStatus.ACTIVE.allowedTransitions());
        assertEquals(EnumSet.of(PropertyStatus.ACTIVE, PropertyStatus.SUSPENDED), PropertyStatus.PENDING.allowedTransitions());
        assertEquals(EnumSet.of(PropertyStatus.ACTIVE, PropertyStatus.ARCHIVED), PropertyStatus.SUSPENDED.allowedTransitions());
        assertTrue(PropertyStatus.ARCHIVED.allowedTransitions().isEmpty());
    }

    @Test
    void archivedIsTheOnlyTerminalStatus() {
        for (PropertyStatus status : PropertyStatus.values()) {
            assertEquals(status == PropertyStatus.ARCHIVED, status.isTerminal(), status.name());
        }
        assertFalse(PropertyStatus.PENDING.canTransitionTo(PropertyStatus.ARCHIVED));
        assertFalse(PropertyStatus.ACTIVE.canTransitionTo(null));
    }
}
