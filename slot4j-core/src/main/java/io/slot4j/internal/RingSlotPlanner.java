package io.slot4j.internal;

import io.slot4j.core.SlotStrategy;
import io.slot4j.core.TimeSlot;
import io.slot4j.core.ValidationException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Pure slot arithmetic; nothing here touches a store or the clock.
 */
final class RingSlotPlanner {

    static final String META_STRATEGY = "strategy";
    static final String META_KIND = "kind";

    private final int minIntervalMinutes;
    private final int jitterMinutes;
    private final Random random;

    RingSlotPlanner(Duration minInterval, Duration jitter, Random random) {
        this.minIntervalMinutes = (int) Math.max(1, minInterval.toMinutes());
        this.jitterMinutes = (int) Math.max(0, jitter.toMinutes());
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * One slot per account inside {@code [startHour, endHour)} of {@code date}, sorted by time with
     * {@code slotIndex} numbered in that order.
     */
    List<TimeSlot> planDay(String configId, List<String> accounts, LocalDate date,
                           int startHour, int endHour, SlotStrategy strategy) {
        if (accounts == null || accounts.isEmpty()) {
            throw new ValidationException("accounts must not be empty");
        }
        if (startHour < 0 || startHour > 23) {
            throw new ValidationException("startHour must be within 0..23: " + startHour);
        }
        if (endHour <= startHour || endHour > 24) {
            endHour = 24;
        }

        int totalMinutes = (endHour - startHour) * 60;
        List<Integer> offsets = strategy == SlotStrategy.RANDOM
                ? randomOffsets(accounts.size(), totalMinutes)
                : evenOffsets(accounts.size(), totalMinutes);

        LocalDateTime windowStart = date.atTime(startHour, 0);
        List<TimeSlot> slots = new ArrayList<>(accounts.size());
        for (int i = 0; i < accounts.size(); i++) {
            TimeSlot slot = new TimeSlot(configId, accounts.get(i), windowStart.plusMinutes(offsets.get(i)), i);
            slot.setMetadata(metadata(META_STRATEGY, strategy.name().toLowerCase(Locale.ROOT)));
            slots.add(slot);
        }
        return renumber(slots);
    }

    /**
     * Slots every {@code intervalHours} for {@code daysAhead} days after {@code anchor}, shifted by
     * {@code configIndex / totalConfigs} of an interval. Slots landing on the same minute collapse into one.
     */
    List<TimeSlot> planInterval(String configId, String accountId, double intervalHours,
                                int configIndex, int totalConfigs, int daysAhead, LocalDateTime anchor) {
        if (!(intervalHours > 0) || Double.isInfinite(intervalHours)) {
            throw new ValidationException("intervalHours must be positive: " + intervalHours);
        }
        if (totalConfigs < 1 || configIndex < 0 || configIndex >= totalConfigs) {
            throw new ValidationException("configIndex must be within 0.." + (totalConfigs - 1) + ": " + configIndex);
        }
        if (daysAhead < 1) {
            throw new ValidationException("daysAhead must be at least 1: " + daysAhead);
        }

        long intervalSeconds = Math.round(intervalHours * 3600);
        if (intervalSeconds < 60) {
            throw new ValidationException("interval must be at least one minute: " + intervalHours + "h");
        }
        long phaseSeconds = intervalSeconds * configIndex / totalConfigs;
        LocalDateTime end = anchor.plusDays(daysAhead);

        Set<LocalDateTime> minutes = new LinkedHashSet<>();
        for (LocalDateTime t = anchor.plusSeconds(phaseSeconds); t.isBefore(end); t = t.plusSeconds(intervalSeconds)) {
            minutes.add(t.truncatedTo(ChronoUnit.MINUTES));
        }

        List<TimeSlot> slots = new ArrayList<>(minutes.size());
        int index = 0;
        for (LocalDateTime at : minutes) {
            TimeSlot slot = new TimeSlot(configId, accountId, at, index++);
            slot.setMetadata(metadata(META_KIND, "interval"));
            slots.add(slot);
        }
        return slots;
    }

    List<Integer> evenOffsets(int n, int totalMinutes) {
        int interval = n == 1 ? 0 : Math.max(totalMinutes / n, minIntervalMinutes);
        // jitter never eats into the minimum spacing of neighbours
        int jitter = n == 1 ? jitterMinutes : Math.max(0, Math.min(jitterMinutes, (interval - minIntervalMinutes) / 2));

        List<Integer> offsets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int offset = i * interval + (jitter == 0 ? 0 : random.nextInt(2 * jitter + 1) - jitter);
            offsets.add(clamp(offset, totalMinutes));
        }
        return offsets;
    }

    List<Integer> randomOffsets(int n, int totalMinutes) {
        List<Integer> candidates = new ArrayList<>();
        for (int m = 0; m < totalMinutes; m += minIntervalMinutes) {
            candidates.add(m);
        }
        Collections.shuffle(candidates, random);

        List<Integer> offsets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            offsets.add(i < candidates.size() ? candidates.get(i) : clamp(totalMinutes * i / n, totalMinutes));
        }
        return offsets;
    }

    // Below the window -> first minute; at or past the end -> last minute.
    private static int clamp(int offset, int totalMinutes) {
        if (offset < 0) {
            return 0;
        }
        return Math.min(offset, totalMinutes - 1);
    }

    private static List<TimeSlot> renumber(List<TimeSlot> slots) {
        List<TimeSlot> sorted = new ArrayList<>(slots);
        sorted.sort(TimeSlot.BY_TIME);
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setSlotIndex(i);
        }
        return sorted;
    }

    private static Map<String, Object> metadata(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(key, value);
        return m;
    }
}
