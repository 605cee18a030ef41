package io.slot4j.core.spi;

import io.slot4j.core.SlotStatus;
import io.slot4j.core.TimeSlot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable row store for {@link TimeSlot}s.
 *
 * <p>Slots are unique on (configId, accountId, slotDate, slotHour, slotMinute).
 */
public interface SlotStore {

    /**
     * Upsert by slot key. New rows get a generated {@code slotId}; existing rows keep theirs and take the
     * incoming index, status and metadata.
     *
     * @return the persisted slots, in input order
     */
    List<TimeSlot> saveAll(List<TimeSlot> slots);

    Optional<TimeSlot> findById(String slotId);

    /**
     * Earliest pending slot of the config at or after {@code from}, ordered by (date, hour, minute).
     */
    Optional<TimeSlot> findFirstPending(String configId, LocalDateTime from);

    /**
     * Pending slots of the config strictly before {@code before}, ordered by time.
     */
    List<TimeSlot> findPendingBefore(String configId, LocalDateTime before);

    /**
     * Slots of a config on one date ordered by time; {@code status} null matches all.
     */
    List<TimeSlot> findByConfigAndDate(String configId, LocalDate date, SlotStatus status);

    List<TimeSlot> findByAccountBetween(String accountId, LocalDate fromDate, LocalDate toDate);

    /**
     * Latest slot of the config by time, any status.
     */
    Optional<TimeSlot> findLatest(String configId);

    /**
     * Atomically set {@code next} if the current status equals {@code expected}.
     *
     * @param expected required current status; null skips the check
     * @param taskId   task to record; null keeps the stored value
     * @return the updated slot, or empty if the slot is missing or its status no longer matches
     */
    Optional<TimeSlot> compareAndSetStatus(String slotId, SlotStatus expected, SlotStatus next, String taskId);

    long deleteByConfigDateAndStatus(String configId, LocalDate date, SlotStatus status);

    long deleteBefore(LocalDate cutoff, Collection<SlotStatus> statuses);

    long countPendingFrom(String configId, LocalDateTime from);
}
