package io.slot4j.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotStatusTest {

    @Test
    void transitionGraphShouldMatchSlotLifecycle() {
        assertTrue(SlotStatus.PENDING.canTransitionTo(SlotStatus.SCHEDULED));
        assertTrue(SlotStatus.PENDING.canTransitionTo(SlotStatus.SKIPPED));
        assertFalse(SlotStatus.PENDING.canTransitionTo(SlotStatus.COMPLETED));

        assertTrue(SlotStatus.SCHEDULED.canTransitionTo(SlotStatus.COMPLETED));
        assertTrue(SlotStatus.SCHEDULED.canTransitionTo(SlotStatus.FAILED));
        assertTrue(SlotStatus.SCHEDULED.canTransitionTo(SlotStatus.SKIPPED));
        assertFalse(SlotStatus.SCHEDULED.canTransitionTo(SlotStatus.PENDING));

        assertTrue(SlotStatus.FAILED.canTransitionTo(SlotStatus.SCHEDULED));
        assertFalse(SlotStatus.FAILED.canTransitionTo(SlotStatus.COMPLETED));

        for (SlotStatus next : SlotStatus.values()) {
            if (next != SlotStatus.COMPLETED) {
                assertFalse(SlotStatus.COMPLETED.canTransitionTo(next), "COMPLETED -> " + next);
            }
            if (next != SlotStatus.SKIPPED) {
                assertFalse(SlotStatus.SKIPPED.canTransitionTo(next), "SKIPPED -> " + next);
            }
        }
    }

    @Test
    void sameStatusShouldAlwaysBeAllowed() {
        for (SlotStatus s : SlotStatus.values()) {
            assertTrue(s.canTransitionTo(s), s.name());
        }
    }

    @Test
    void onlyFinishedStatusesArePurgeable() {
        assertFalse(SlotStatus.PENDING.isPurgeable());
        assertFalse(SlotStatus.SCHEDULED.isPurgeable());
        assertTrue(SlotStatus.COMPLETED.isPurgeable());
        assertTrue(SlotStatus.FAILED.isPurgeable());
        assertTrue(SlotStatus.SKIPPED.isPurgeable());
    }

    @Test
    void wireValuesShouldBeLowerCase() {
        assertEquals("scheduled", SlotStatus.SCHEDULED.value());
        assertEquals(RecurrenceKind.CRON, RecurrenceKind.fromValue(" Cron "));
        assertEquals(SlotStrategy.EVEN, SlotStrategy.fromValue(null));
        assertThrows(ValidationException.class, () -> RecurrenceKind.fromValue("hourly"));
        assertThrows(ValidationException.class, () -> SlotStrategy.fromValue("zigzag"));
    }
}
