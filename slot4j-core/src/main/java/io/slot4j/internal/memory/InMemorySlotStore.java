package io.slot4j.internal.memory;

import io.slot4j.core.SlotStatus;
import io.slot4j.core.TimeSlot;
import io.slot4j.core.spi.SlotStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Heap-backed {@link SlotStore}. All operations are serialized on the instance monitor, and reads return copies.
 */
public class InMemorySlotStore implements SlotStore {

    private final Map<String, TimeSlot> slotsById = new LinkedHashMap<>();
    private final Clock clock;

    public InMemorySlotStore() {
        this(Clock.systemUTC());
    }

    public InMemorySlotStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized List<TimeSlot> saveAll(List<TimeSlot> slots) {
        Instant now = clock.instant();
        List<TimeSlot> saved = new ArrayList<>(slots.size());
        for (TimeSlot incoming : slots) {
            TimeSlot existing = slotsById.values().stream()
                    .filter(s -> s.sameKey(incoming))
                    .findFirst()
                    .orElse(null);

            TimeSlot row = incoming.copy();
            if (existing != null) {
                row.setSlotId(existing.getSlotId());
                row.setCreatedAt(existing.getCreatedAt());
            } else {
                if (row.getSlotId() == null) {
                    row.setSlotId(UUID.randomUUID().toString());
                }
                row.setCreatedAt(row.getCreatedAt() == null ? now : row.getCreatedAt());
            }
            row.setUpdatedAt(now);
            slotsById.put(row.getSlotId(), row);
            saved.add(row.copy());
        }
        return saved;
    }

    @Override
    public synchronized Optional<TimeSlot> findById(String slotId) {
        TimeSlot s = slotsById.get(slotId);
        return s == null ? Optional.empty() : Optional.of(s.copy());
    }

    @Override
    public synchronized Optional<TimeSlot> findFirstPending(String configId, LocalDateTime from) {
        return slotsById.values().stream()
                .filter(s -> s.getConfigId().equals(configId))
                .filter(s -> s.getStatus() == SlotStatus.PENDING)
                .filter(s -> !s.localDateTime().isBefore(from))
                .min(TimeSlot.BY_TIME)
                .map(TimeSlot::copy);
    }

    @Override
    public synchronized List<TimeSlot> findPendingBefore(String configId, LocalDateTime before) {
        return select(s -> s.getConfigId().equals(configId)
                && s.getStatus() == SlotStatus.PENDING
                && s.localDateTime().isBefore(before));
    }

    @Override
    public synchronized List<TimeSlot> findByConfigAndDate(String configId, LocalDate date, SlotStatus status) {
        return select(s -> s.getConfigId().equals(configId)
                && s.getSlotDate().equals(date)
                && (status == null || s.getStatus() == status));
    }

    @Override
    public synchronized List<TimeSlot> findByAccountBetween(String accountId, LocalDate fromDate, LocalDate toDate) {
        return select(s -> s.getAccountId().equals(accountId)
                && !s.getSlotDate().isBefore(fromDate)
                && !s.getSlotDate().isAfter(toDate));
    }

    @Override
    public synchronized Optional<TimeSlot> findLatest(String configId) {
        return slotsById.values().stream()
                .filter(s -> s.getConfigId().equals(configId))
                .max(TimeSlot.BY_TIME)
                .map(TimeSlot::copy);
    }

    @Override
    public synchronized Optional<TimeSlot> compareAndSetStatus(String slotId, SlotStatus expected, SlotStatus next, String taskId) {
        TimeSlot s = slotsById.get(slotId);
        if (s == null || (expected != null && s.getStatus() != expected)) {
            return Optional.empty();
        }
        s.setStatus(next);
        if (taskId != null) {
            s.setTaskId(taskId);
        }
        s.setUpdatedAt(clock.instant());
        return Optional.of(s.copy());
    }

    @Override
    public synchronized long deleteByConfigDateAndStatus(String configId, LocalDate date, SlotStatus status) {
        return removeIf(s -> s.getConfigId().equals(configId)
                && s.getSlotDate().equals(date)
                && s.getStatus() == status);
    }

    @Override
    public synchronized long deleteBefore(LocalDate cutoff, Collection<SlotStatus> statuses) {
        return removeIf(s -> s.getSlotDate().isBefore(cutoff) && statuses.contains(s.getStatus()));
    }

    @Override
    public synchronized long countPendingFrom(String configId, LocalDateTime from) {
        return slotsById.values().stream()
                .filter(s -> s.getConfigId().equals(configId))
                .filter(s -> s.getStatus() == SlotStatus.PENDING)
                .filter(s -> !s.localDateTime().isBefore(from))
                .count();
    }

    private List<TimeSlot> select(Predicate<TimeSlot> filter) {
        return slotsById.values().stream()
                .filter(filter)
                .sorted(TimeSlot.BY_TIME)
                .map(TimeSlot::copy)
                .toList();
    }

    private long removeIf(Predicate<TimeSlot> filter) {
        int before = slotsById.size();
        slotsById.values().removeIf(filter);
        return before - slotsById.size();
    }
}
