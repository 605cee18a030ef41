package io.slot4j.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a {@link TimeSlot}.
 *
 * <pre>
 * PENDING   -> SCHEDULED | SKIPPED
 * SCHEDULED -> COMPLETED | FAILED | SKIPPED
 * FAILED    -> SCHEDULED   (a retried publish re-arms its slot)
 * COMPLETED, SKIPPED: terminal
 * </pre>
 */
public enum SlotStatus {
    PENDING {
        @Override
        Set<SlotStatus> successors() {
            return EnumSet.of(SCHEDULED, SKIPPED);
        }
    },
    SCHEDULED {
        @Override
        Set<SlotStatus> successors() {
            return EnumSet.of(COMPLETED, FAILED, SKIPPED);
        }
    },
    COMPLETED {
        @Override
        Set<SlotStatus> successors() {
            return EnumSet.noneOf(SlotStatus.class);
        }
    },
    FAILED {
        @Override
        Set<SlotStatus> successors() {
            return EnumSet.of(SCHEDULED);
        }
    },
    SKIPPED {
        @Override
        Set<SlotStatus> successors() {
            return EnumSet.noneOf(SlotStatus.class);
        }
    };

    abstract Set<SlotStatus> successors();

    /**
     * Same-status updates are accepted as a no-op.
     */
    public boolean canTransitionTo(SlotStatus next) {
        return next == this || successors().contains(next);
    }

    /**
     * Statuses eligible for retention cleanup.
     */
    public boolean isPurgeable() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
