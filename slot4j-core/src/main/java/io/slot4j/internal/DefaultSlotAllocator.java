package io.slot4j.internal;

import io.slot4j.SlotAllocator;
import io.slot4j.core.NotFoundException;
import io.slot4j.core.SlotStatus;
import io.slot4j.core.SlotStrategy;
import io.slot4j.core.TimeSlot;
import io.slot4j.core.ValidationException;
import io.slot4j.core.spi.SlotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

public class DefaultSlotAllocator implements SlotAllocator {
    private static final Logger log = LoggerFactory.getLogger(DefaultSlotAllocator.class);

    private static final Set<SlotStatus> PURGEABLE = Arrays.stream(SlotStatus.values())
            .filter(SlotStatus::isPurgeable)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(SlotStatus.class)));
    private static final int MAX_CAS_ATTEMPTS = 3;

    private final SlotStore store;
    private final AllocatorOptions options;
    private final Clock clock;
    private final RingSlotPlanner planner;

    public DefaultSlotAllocator(SlotStore store, AllocatorOptions options) {
        this(store, options, Clock.system(options.zone()), new Random());
    }

    public DefaultSlotAllocator(SlotStore store, AllocatorOptions options, Clock clock, Random random) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(options.zone(), "options.zone must not be null");
        this.planner = new RingSlotPlanner(options.minInterval(), options.jitter(), random);
    }

    @Override
    public List<TimeSlot> generateSlots(String configId, List<String> accounts, LocalDate targetDate,
                                        Integer startHour, Integer endHour, SlotStrategy strategy) {
        Objects.requireNonNull(configId, "configId must not be null");
        Objects.requireNonNull(targetDate, "targetDate must not be null");

        int start = startHour == null ? options.defaultStartHour() : startHour;
        int end = endHour == null ? options.defaultEndHour() : endHour;
        SlotStrategy s = strategy == null ? SlotStrategy.EVEN : strategy;

        List<TimeSlot> planned = planner.planDay(configId, accounts, targetDate, start, end, s);
        List<TimeSlot> saved = persist(planned);

        log.info("Slots generated configId={} date={} accounts={} window={}-{} strategy={}",
                configId, targetDate, accounts.size(), start, end, s);
        return saved;
    }

    @Override
    public List<TimeSlot> generateIntervalSlots(String configId, String accountId, double intervalHours,
                                                int configIndex, int totalConfigs, int daysAhead) {
        LocalDateTime anchor = LocalDateTime.ofInstant(clock.instant(), options.zone()).truncatedTo(ChronoUnit.HOURS);
        return generateIntervalSlots(configId, accountId, intervalHours, configIndex, totalConfigs, daysAhead, anchor);
    }

    @Override
    public List<TimeSlot> generateIntervalSlots(String configId, String accountId, double intervalHours,
                                                int configIndex, int totalConfigs, int daysAhead, LocalDateTime anchor) {
        Objects.requireNonNull(configId, "configId must not be null");
        if (accountId == null || accountId.isBlank()) {
            throw new ValidationException("accountId must not be blank");
        }
        Objects.requireNonNull(anchor, "anchor must not be null");

        List<TimeSlot> planned = planner.planInterval(configId, accountId, intervalHours,
                configIndex, totalConfigs, daysAhead, anchor);
        List<TimeSlot> saved = persist(planned);

        log.info("Interval slots generated configId={} accountId={} intervalHours={} index={}/{} count={} anchor={}",
                configId, accountId, intervalHours, configIndex, totalConfigs, saved.size(), anchor);
        return saved;
    }

    @Override
    public Optional<TimeSlot> getNextSlot(String configId, Instant fromTime) {
        LocalDateTime from = LocalDateTime.ofInstant(fromTime, options.zone()).truncatedTo(ChronoUnit.MINUTES);
        return store.findFirstPending(configId, from);
    }

    @Override
    public TimeSlot updateSlotStatus(String slotId, SlotStatus status, String taskId) {
        Objects.requireNonNull(status, "status must not be null");

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            TimeSlot current = store.findById(slotId).orElseThrow(() -> new NotFoundException("slot", slotId));
            SlotStatus from = current.getStatus();

            if (options.validateTransitions() && !from.canTransitionTo(status)) {
                throw new ValidationException("Illegal slot transition " + from + " -> " + status + " slotId=" + slotId);
            }
            if (from == status && (taskId == null || taskId.equals(current.getTaskId()))) {
                return current;
            }

            Optional<TimeSlot> updated = store.compareAndSetStatus(slotId, from, status, taskId);
            if (updated.isPresent()) {
                log.debug("Slot status updated slotId={} {} -> {} taskId={}", slotId, from, status, taskId);
                return updated.get();
            }
            log.debug("Slot status changed concurrently slotId={} attempt={}", slotId, attempt);
        }
        throw new ValidationException("Slot status kept changing concurrently slotId=" + slotId);
    }

    @Override
    public TimeSlot overrideSlotStatus(String slotId, SlotStatus status, String taskId) {
        Objects.requireNonNull(status, "status must not be null");
        TimeSlot updated = store.compareAndSetStatus(slotId, null, status, taskId)
                .orElseThrow(() -> new NotFoundException("slot", slotId));
        log.info("Slot status overridden slotId={} status={} taskId={}", slotId, status, taskId);
        return updated;
    }

    @Override
    public Optional<String> allocateAccount(String configId, Instant targetTime) {
        LocalDateTime target = LocalDateTime.ofInstant(targetTime, options.zone());
        int targetMinute = target.getHour() * 60 + target.getMinute();

        return store.findByConfigAndDate(configId, target.toLocalDate(), SlotStatus.PENDING).stream()
                .min(Comparator.comparingInt(s -> Math.abs(s.minuteOfDay() - targetMinute)))
                .map(TimeSlot::getAccountId);
    }

    @Override
    public List<TimeSlot> rebalanceSlots(String configId, LocalDate targetDate, List<String> accounts) {
        if (accounts == null || accounts.isEmpty()) {
            throw new ValidationException("accounts must not be empty");
        }
        long removed = store.deleteByConfigDateAndStatus(configId, targetDate, SlotStatus.PENDING);
        log.info("Rebalancing slots configId={} date={} removedPending={} accounts={}",
                configId, targetDate, removed, accounts.size());
        return generateSlots(configId, accounts, targetDate, null, null, SlotStrategy.EVEN);
    }

    @Override
    public int skipMissedSlots(String configId, Instant before) {
        LocalDateTime cutoff = LocalDateTime.ofInstant(before, options.zone()).truncatedTo(ChronoUnit.MINUTES);
        int skipped = 0;
        for (TimeSlot slot : store.findPendingBefore(configId, cutoff)) {
            // a concurrent claim wins; the slot is then no longer pending
            if (store.compareAndSetStatus(slot.getSlotId(), SlotStatus.PENDING, SlotStatus.SKIPPED, null).isPresent()) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Missed slots skipped configId={} before={} count={}", configId, cutoff, skipped);
        }
        return skipped;
    }

    @Override
    public long cleanup(int daysToKeep) {
        if (daysToKeep < 0) {
            throw new ValidationException("daysToKeep must not be negative: " + daysToKeep);
        }
        LocalDate cutoff = LocalDate.now(clock.withZone(options.zone())).minusDays(daysToKeep);
        long deleted = store.deleteBefore(cutoff, PURGEABLE);
        log.info("Slot cleanup cutoff={} deleted={}", cutoff, deleted);
        return deleted;
    }

    @Override
    public List<TimeSlot> getSlotsByDate(String configId, LocalDate date, SlotStatus status) {
        return store.findByConfigAndDate(configId, date, status);
    }

    @Override
    public List<TimeSlot> getAccountSchedule(String accountId, LocalDate fromDate, LocalDate toDate) {
        return store.findByAccountBetween(accountId, fromDate, toDate);
    }

    @Override
    public Optional<TimeSlot> findSlot(String slotId) {
        return store.findById(slotId);
    }

    @Override
    public ZoneId zone() {
        return options.zone();
    }

    // A key already claimed by a task keeps its row; the planned slot is replaced by the claimed one.
    private List<TimeSlot> persist(List<TimeSlot> planned) {
        Map<LocalDate, List<TimeSlot>> existingByDate = new HashMap<>();
        List<TimeSlot> toSave = new ArrayList<>(planned.size());
        Map<Integer, TimeSlot> claimed = new HashMap<>();

        for (int i = 0; i < planned.size(); i++) {
            TimeSlot p = planned.get(i);
            List<TimeSlot> existing = existingByDate.computeIfAbsent(p.getSlotDate(),
                    d -> store.findByConfigAndDate(p.getConfigId(), d, null));
            Optional<TimeSlot> match = existing.stream()
                    .filter(e -> e.sameKey(p) && e.getStatus() != SlotStatus.PENDING)
                    .findFirst();
            if (match.isPresent()) {
                claimed.put(i, match.get());
            } else {
                toSave.add(p);
            }
        }

        List<TimeSlot> saved = store.saveAll(toSave);
        List<TimeSlot> out = new ArrayList<>(planned.size());
        int next = 0;
        for (int i = 0; i < planned.size(); i++) {
            TimeSlot c = claimed.get(i);
            out.add(c != null ? c : saved.get(next++));
        }
        return out;
    }
}
