package io.slot4j;

import io.slot4j.core.SlotStatus;
import io.slot4j.core.SlotStrategy;
import io.slot4j.core.TimeSlot;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Ring slot allocation over time and accounts.
 *
 * <p>Generated slots are persisted before they are returned; the returned instances carry their
 * store-assigned {@code slotId}.
 */
public interface SlotAllocator {

    /**
     * Allocation tuning.
     * <ul>
     *   <li>zone: wall-clock zone slot dates/hours are expressed in</li>
     *   <li>defaultStartHour/defaultEndHour: window used when callers pass null hours</li>
     *   <li>minInterval: floor between consecutive even slots, spacing of random candidates</li>
     *   <li>jitter: bound of the random offset applied to even slots</li>
     *   <li>validateTransitions: reject illegal {@link SlotStatus} transitions in {@link #updateSlotStatus}</li>
     *   <li>lookAheadDays: horizon of batches generated ahead of need</li>
     * </ul>
     */
    record AllocatorOptions(
            ZoneId zone,
            int defaultStartHour,
            int defaultEndHour,
            Duration minInterval,
            Duration jitter,
            boolean validateTransitions,
            int lookAheadDays
    ) {
        public static AllocatorOptions defaults() {
            return new AllocatorOptions(ZoneId.systemDefault(), 6, 24,
                    Duration.ofMinutes(30), Duration.ofMinutes(5), true, 2);
        }

        public AllocatorOptions withZone(ZoneId zone) {
            return new AllocatorOptions(zone, defaultStartHour, defaultEndHour, minInterval, jitter,
                    validateTransitions, lookAheadDays);
        }

        public AllocatorOptions withJitter(Duration jitter) {
            return new AllocatorOptions(zone, defaultStartHour, defaultEndHour, minInterval, jitter,
                    validateTransitions, lookAheadDays);
        }
    }

    /**
     * One slot per account for a single day, sorted ascending by time.
     *
     * @param startHour window start; null means the configured default
     * @param endHour   exclusive window end; null means the configured default
     * @throws io.slot4j.core.ValidationException if {@code accounts} is empty
     */
    List<TimeSlot> generateSlots(String configId, List<String> accounts, LocalDate targetDate,
                                 Integer startHour, Integer endHour, SlotStrategy strategy);

    /**
     * Fixed-cadence slots for one account over {@code daysAhead} days, anchored at the start of the current hour
     * and phase-shifted by {@code configIndex * intervalHours / totalConfigs}.
     */
    List<TimeSlot> generateIntervalSlots(String configId, String accountId, double intervalHours,
                                         int configIndex, int totalConfigs, int daysAhead);

    List<TimeSlot> generateIntervalSlots(String configId, String accountId, double intervalHours,
                                         int configIndex, int totalConfigs, int daysAhead, LocalDateTime anchor);

    /**
     * Earliest pending slot at or after {@code fromTime} (minute precision).
     */
    Optional<TimeSlot> getNextSlot(String configId, Instant fromTime);

    /**
     * Check-and-set status update.
     *
     * @throws io.slot4j.core.NotFoundException   if the slot does not exist
     * @throws io.slot4j.core.ValidationException if the transition is illegal and validation is enabled
     */
    TimeSlot updateSlotStatus(String slotId, SlotStatus status, String taskId);

    /**
     * Status update that never validates the transition graph; for administrative overrides.
     */
    TimeSlot overrideSlotStatus(String slotId, SlotStatus status, String taskId);

    /**
     * Account of the same-day pending slot nearest to {@code targetTime}.
     */
    Optional<String> allocateAccount(String configId, Instant targetTime);

    /**
     * Drop the date's pending slots and regenerate them from {@code accounts}. Claimed slots are untouched.
     */
    List<TimeSlot> rebalanceSlots(String configId, LocalDate targetDate, List<String> accounts);

    /**
     * Mark pending slots that fell before {@code before} as SKIPPED; they can no longer be claimed.
     *
     * @return number of slots skipped
     */
    int skipMissedSlots(String configId, Instant before);

    /**
     * Delete completed/failed/skipped slots dated before today minus {@code daysToKeep}.
     */
    long cleanup(int daysToKeep);

    List<TimeSlot> getSlotsByDate(String configId, LocalDate date, SlotStatus status);

    List<TimeSlot> getAccountSchedule(String accountId, LocalDate fromDate, LocalDate toDate);

    Optional<TimeSlot> findSlot(String slotId);

    ZoneId zone();
}
