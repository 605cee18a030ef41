package io.slot4j.internal;

import io.slot4j.SlotAllocator.AllocatorOptions;
import io.slot4j.core.NotFoundException;
import io.slot4j.core.SlotStatus;
import io.slot4j.core.SlotStrategy;
import io.slot4j.core.TimeSlot;
import io.slot4j.core.ValidationException;
import io.slot4j.internal.memory.InMemorySlotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSlotAllocatorTest {

    private static final LocalDate DAY = LocalDate.of(2026, 1, 1);

    private MutableClock clock;
    private InMemorySlotStore store;
    private DefaultSlotAllocator allocator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(DAY.atTime(0, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        store = new InMemorySlotStore(clock);
        allocator = new DefaultSlotAllocator(store, AllocatorOptions.defaults().withZone(ZoneOffset.UTC),
                clock, new Random(11));
    }

    @Test
    void threeAccountsShouldBeSpreadAcrossTheDay() {
        List<TimeSlot> slots = allocator.generateSlots("cfg", List.of("A", "B", "C"), DAY, 6, 24, SlotStrategy.EVEN);

        assertEquals(3, slots.size());
        assertWithinMinutes(DAY.atTime(6, 0), slots.get(0).localDateTime(), 5);
        assertWithinMinutes(DAY.atTime(12, 0), slots.get(1).localDateTime(), 5);
        assertWithinMinutes(DAY.atTime(18, 0), slots.get(2).localDateTime(), 5);
        for (TimeSlot s : slots) {
            assertNotNull(s.getSlotId());
            assertEquals(SlotStatus.PENDING, s.getStatus());
            assertEquals("even", s.getMetadata().get("strategy"));
        }
    }

    @Test
    void nullHoursShouldFallBackToConfiguredWindow() {
        List<TimeSlot> slots = allocator.generateSlots("cfg", List.of("A"), DAY, null, null, null);
        assertThat(slots.get(0).getSlotHour()).isEqualTo(6);
    }

    @Test
    void intervalSlotsShouldBeOffsetPerConfig() {
        LocalDateTime anchor = DAY.atTime(0, 0);

        List<TimeSlot> first = allocator.generateIntervalSlots("cfg-1", "acc", 6, 0, 2, 1, anchor);
        List<TimeSlot> second = allocator.generateIntervalSlots("cfg-2", "acc", 6, 1, 2, 1, anchor);

        assertEquals(DAY.atTime(0, 0), first.get(0).localDateTime());
        assertEquals(DAY.atTime(3, 0), second.get(0).localDateTime());
    }

    @Test
    void intervalSlotsWithoutAnchorShouldStartAtCurrentHour() {
        clock.set(DAY.atTime(9, 42).toInstant(ZoneOffset.UTC));
        List<TimeSlot> slots = allocator.generateIntervalSlots("cfg", "acc", 4, 0, 1, 1);
        assertEquals(DAY.atTime(9, 0), slots.get(0).localDateTime());
    }

    @Test
    void regeneratingShouldKeepClaimedSlots() {
        AllocatorOptions noJitter = AllocatorOptions.defaults().withZone(ZoneOffset.UTC).withJitter(Duration.ZERO);
        allocator = new DefaultSlotAllocator(store, noJitter, clock, new Random(1));

        List<TimeSlot> first = allocator.generateSlots("cfg", List.of("A", "B"), DAY, 6, 24, SlotStrategy.EVEN);
        allocator.updateSlotStatus(first.get(0).getSlotId(), SlotStatus.SCHEDULED, "task_0000beef");

        List<TimeSlot> again = allocator.generateSlots("cfg", List.of("A", "B"), DAY, 6, 24, SlotStrategy.EVEN);

        assertEquals(first.get(0).getSlotId(), again.get(0).getSlotId());
        assertEquals(SlotStatus.SCHEDULED, again.get(0).getStatus());
        assertEquals("task_0000beef", again.get(0).getTaskId());
        assertEquals(2, allocator.getSlotsByDate("cfg", DAY, null).size());
    }

    @Test
    void getNextSlotShouldReturnEarliestPendingFromTime() {
        List<TimeSlot> slots = allocator.generateIntervalSlots("cfg", "acc", 6, 0, 1, 1, DAY.atTime(0, 0));

        Optional<TimeSlot> next = allocator.getNextSlot("cfg", DAY.atTime(7, 30).toInstant(ZoneOffset.UTC));
        assertTrue(next.isPresent());
        assertEquals(DAY.atTime(12, 0), next.get().localDateTime());

        allocator.updateSlotStatus(slots.get(2).getSlotId(), SlotStatus.SCHEDULED, "task_00000001");
        next = allocator.getNextSlot("cfg", DAY.atTime(7, 30).toInstant(ZoneOffset.UTC));
        assertEquals(DAY.atTime(18, 0), next.get().localDateTime());

        assertFalse(allocator.getNextSlot("cfg", DAY.atTime(18, 1).toInstant(ZoneOffset.UTC)).isPresent());
    }

    @Test
    void getNextSlotShouldIncludeTheCurrentMinute() {
        allocator.generateIntervalSlots("cfg", "acc", 6, 0, 1, 1, DAY.atTime(0, 0));
        Instant withSeconds = DAY.atTime(6, 0, 45).toInstant(ZoneOffset.UTC);
        assertEquals(DAY.atTime(6, 0), allocator.getNextSlot("cfg", withSeconds).get().localDateTime());
    }

    @Test
    void validTransitionsShouldBeApplied() {
        TimeSlot slot = allocator.generateSlots("cfg", List.of("A"), DAY, 6, 24, SlotStrategy.EVEN).get(0);

        TimeSlot scheduled = allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.SCHEDULED, "task_00000002");
        assertEquals(SlotStatus.SCHEDULED, scheduled.getStatus());
        assertEquals("task_00000002", scheduled.getTaskId());

        TimeSlot failed = allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.FAILED, null);
        assertEquals(SlotStatus.FAILED, failed.getStatus());
        assertEquals("task_00000002", failed.getTaskId());

        assertEquals(SlotStatus.SCHEDULED,
                allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.SCHEDULED, null).getStatus());
    }

    @Test
    void completedSlotShouldRejectFurtherTransitions() {
        TimeSlot slot = allocator.generateSlots("cfg", List.of("A"), DAY, 6, 24, SlotStrategy.EVEN).get(0);
        allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.SCHEDULED, "task_00000003");
        allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.COMPLETED, null);

        assertThrows(ValidationException.class,
                () -> allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.PENDING, null));

        TimeSlot overridden = allocator.overrideSlotStatus(slot.getSlotId(), SlotStatus.PENDING, null);
        assertEquals(SlotStatus.PENDING, overridden.getStatus());
    }

    @Test
    void sameStatusUpdateShouldBeNoOp() {
        TimeSlot slot = allocator.generateSlots("cfg", List.of("A"), DAY, 6, 24, SlotStrategy.EVEN).get(0);
        TimeSlot same = allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.PENDING, null);
        assertEquals(SlotStatus.PENDING, same.getStatus());
    }

    @Test
    void transitionValidationCanBeDisabled() {
        AllocatorOptions lax = new AllocatorOptions(ZoneOffset.UTC, 6, 24, Duration.ofMinutes(30),
                Duration.ZERO, false, 2);
        allocator = new DefaultSlotAllocator(store, lax, clock, new Random(1));
        TimeSlot slot = allocator.generateSlots("cfg", List.of("A"), DAY, 6, 24, SlotStrategy.EVEN).get(0);

        assertEquals(SlotStatus.COMPLETED,
                allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.COMPLETED, null).getStatus());
    }

    @Test
    void unknownSlotShouldThrowNotFound() {
        assertThrows(NotFoundException.class,
                () -> allocator.updateSlotStatus("missing", SlotStatus.SCHEDULED, null));
        assertThrows(NotFoundException.class,
                () -> allocator.overrideSlotStatus("missing", SlotStatus.SCHEDULED, null));
    }

    @Test
    void allocateAccountShouldPickNearestPendingSlot() {
        AllocatorOptions noJitter = AllocatorOptions.defaults().withZone(ZoneOffset.UTC).withJitter(Duration.ZERO);
        allocator = new DefaultSlotAllocator(store, noJitter, clock, new Random(1));
        // A 06:00, B 12:00, C 18:00
        List<TimeSlot> slots = allocator.generateSlots("cfg", List.of("A", "B", "C"), DAY, 6, 24, SlotStrategy.EVEN);
        assertEquals("B", slots.get(1).getAccountId());

        assertEquals(Optional.of("B"), allocator.allocateAccount("cfg", DAY.atTime(13, 0).toInstant(ZoneOffset.UTC)));

        allocator.updateSlotStatus(slots.get(1).getSlotId(), SlotStatus.SKIPPED, null);
        assertEquals(Optional.of("C"), allocator.allocateAccount("cfg", DAY.atTime(16, 0).toInstant(ZoneOffset.UTC)));

        assertTrue(allocator.allocateAccount("cfg", DAY.plusDays(1).atTime(12, 0).toInstant(ZoneOffset.UTC)).isEmpty());
    }

    @Test
    void rebalanceShouldRegeneratePendingAndKeepClaimed() {
        AllocatorOptions noJitter = AllocatorOptions.defaults().withZone(ZoneOffset.UTC).withJitter(Duration.ZERO);
        allocator = new DefaultSlotAllocator(store, noJitter, clock, new Random(1));
        List<TimeSlot> slots = allocator.generateSlots("cfg", List.of("A", "B", "C"), DAY, 6, 24, SlotStrategy.EVEN);
        allocator.updateSlotStatus(slots.get(0).getSlotId(), SlotStatus.SCHEDULED, "task_00000004");

        // A keeps 06:00, which is already claimed
        List<TimeSlot> rebalanced = allocator.rebalanceSlots("cfg", DAY, List.of("A", "B", "C", "D"));

        assertEquals(4, rebalanced.size());
        assertEquals(slots.get(0).getSlotId(), rebalanced.get(0).getSlotId());
        assertEquals(SlotStatus.SCHEDULED, rebalanced.get(0).getStatus());
        assertThat(rebalanced.subList(1, 4)).extracting(TimeSlot::localDateTime)
                .containsExactly(DAY.atTime(10, 30), DAY.atTime(15, 0), DAY.atTime(19, 30));
        assertEquals(3, allocator.getSlotsByDate("cfg", DAY, SlotStatus.PENDING).size());
        assertEquals(4, allocator.getSlotsByDate("cfg", DAY, null).size());
    }

    @Test
    void rebalanceShouldRejectEmptyAccounts() {
        assertThrows(ValidationException.class, () -> allocator.rebalanceSlots("cfg", DAY, List.of()));
    }

    @Test
    void cleanupShouldDeleteOnlyOldFinishedSlots() {
        TimeSlot old = allocator.generateSlots("cfg", List.of("A"), DAY, 6, 24, SlotStrategy.EVEN).get(0);
        TimeSlot oldPending = allocator.generateSlots("cfg", List.of("B"), DAY.plusDays(1), 6, 24, SlotStrategy.EVEN).get(0);
        TimeSlot recent = allocator.generateSlots("cfg", List.of("C"), DAY.plusDays(9), 6, 24, SlotStrategy.EVEN).get(0);
        allocator.updateSlotStatus(old.getSlotId(), SlotStatus.SKIPPED, null);
        allocator.updateSlotStatus(recent.getSlotId(), SlotStatus.SKIPPED, null);

        clock.set(DAY.plusDays(10).atTime(1, 0).toInstant(ZoneOffset.UTC));
        long deleted = allocator.cleanup(7);

        assertEquals(1, deleted);
        assertTrue(allocator.findSlot(old.getSlotId()).isEmpty());
        assertTrue(allocator.findSlot(oldPending.getSlotId()).isPresent());
        assertTrue(allocator.findSlot(recent.getSlotId()).isPresent());
        assertThrows(ValidationException.class, () -> allocator.cleanup(-1));
    }

    @Test
    void missedPendingSlotsShouldBeSkipped() {
        List<TimeSlot> slots = allocator.generateIntervalSlots("cfg", "A", 1, 0, 1, 1, DAY.atTime(8, 0));
        allocator.updateSlotStatus(slots.get(1).getSlotId(), SlotStatus.SCHEDULED, "task_00000001");

        int skipped = allocator.skipMissedSlots("cfg", DAY.atTime(11, 0).toInstant(ZoneOffset.UTC));

        // 08:00 and 10:00 were missed; 09:00 is claimed and 11:00 is still due
        assertEquals(2, skipped);
        assertEquals(SlotStatus.SKIPPED, allocator.findSlot(slots.get(0).getSlotId()).get().getStatus());
        assertEquals(SlotStatus.SCHEDULED, allocator.findSlot(slots.get(1).getSlotId()).get().getStatus());
        assertEquals(SlotStatus.SKIPPED, allocator.findSlot(slots.get(2).getSlotId()).get().getStatus());
        assertEquals(SlotStatus.PENDING, allocator.findSlot(slots.get(3).getSlotId()).get().getStatus());
        assertEquals(0, allocator.skipMissedSlots("cfg", DAY.atTime(11, 0).toInstant(ZoneOffset.UTC)));
    }

    @Test
    void accountScheduleShouldSpanDates() {
        allocator.generateSlots("cfg-1", List.of("A", "B"), DAY, 6, 24, SlotStrategy.EVEN);
        allocator.generateSlots("cfg-2", List.of("A"), DAY.plusDays(1), 6, 24, SlotStrategy.EVEN);
        allocator.generateSlots("cfg-2", List.of("A"), DAY.plusDays(5), 6, 24, SlotStrategy.EVEN);

        List<TimeSlot> schedule = allocator.getAccountSchedule("A", DAY, DAY.plusDays(1));
        assertEquals(2, schedule.size());
        assertThat(schedule).allMatch(s -> "A".equals(s.getAccountId()));
    }

    private static void assertWithinMinutes(LocalDateTime expected, LocalDateTime actual, long minutes) {
        long diff = Math.abs(ChronoUnit.MINUTES.between(expected, actual));
        assertTrue(diff <= minutes, () -> "expected " + actual + " within " + minutes + "m of " + expected);
    }
}
