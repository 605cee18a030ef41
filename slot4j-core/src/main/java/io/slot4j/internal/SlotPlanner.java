package io.slot4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.AccountDirectory;
import io.slot4j.SlotAllocator;
import io.slot4j.core.RecurrenceKind;
import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.SlotStrategy;
import io.slot4j.core.TimeSlot;
import io.slot4j.core.ValidationException;
import io.slot4j.core.spi.ScheduleConfigStore;
import io.slot4j.core.spi.SlotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns one recurrence occurrence into concrete slots.
 * <ul>
 *   <li>INTERVAL: a look-ahead batch on the pinned account, phase-shifted against sibling configs</li>
 *   <li>configs with a ring window: one slot per group account inside the window</li>
 *   <li>everything else: one slot at the occurrence minute, rotating through the group</li>
 * </ul>
 */
public class SlotPlanner {
    private static final Logger log = LoggerFactory.getLogger(SlotPlanner.class);

    private final SlotAllocator allocator;
    private final SlotStore slotStore;
    private final ScheduleConfigStore configStore;
    private final AccountDirectory accounts;
    private final ObjectMapper objectMapper;
    private final int lookAheadDays;

    public SlotPlanner(SlotAllocator allocator,
                       SlotStore slotStore,
                       ScheduleConfigStore configStore,
                       AccountDirectory accounts,
                       ObjectMapper objectMapper,
                       int lookAheadDays) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.slotStore = Objects.requireNonNull(slotStore, "slotStore must not be null");
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.accounts = Objects.requireNonNull(accounts, "accounts must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.lookAheadDays = Math.max(1, lookAheadDays);
    }

    /**
     * @return newly generated slots; empty when enough slots already exist
     */
    public List<TimeSlot> plan(ScheduleConfig config, Instant occurrence) {
        RecurrenceParams params = RecurrenceParams.from(config.getRecurrenceParams(), objectMapper);

        if (config.getRecurrenceKind() == RecurrenceKind.INTERVAL) {
            return planInterval(config, params, occurrence);
        }
        if (params.hasWindow()) {
            return planWindow(config, params, occurrence);
        }
        return planRotation(config, occurrence);
    }

    private List<TimeSlot> planInterval(ScheduleConfig config, RecurrenceParams params, Instant occurrence) {
        LocalDateTime at = LocalDateTime.ofInstant(occurrence, allocator.zone()).truncatedTo(ChronoUnit.MINUTES);
        long pending = slotStore.countPendingFrom(config.getConfigId(), at);
        if (pending > 0) {
            log.debug("Interval slots still pending configId={} count={}", config.getConfigId(), pending);
            return List.of();
        }

        String account = pinnedAccount(config, params);
        Duration interval = params.intervalDuration();

        // siblings share the account and cadence; their order fixes each config's phase
        List<String> siblings = new ArrayList<>();
        for (ScheduleConfig other : configStore.findActive()) {
            if (other.getRecurrenceKind() != RecurrenceKind.INTERVAL || other.getConfigId().equals(config.getConfigId())) {
                continue;
            }
            try {
                RecurrenceParams p = RecurrenceParams.from(other.getRecurrenceParams(), objectMapper);
                if (account.equals(pinnedAccount(other, p)) && interval.equals(p.intervalDuration())) {
                    siblings.add(other.getConfigId());
                }
            } catch (ValidationException e) {
                log.warn("Ignoring malformed interval config configId={} msg={}", other.getConfigId(), e.getMessage());
            }
        }
        siblings.add(config.getConfigId());
        siblings.sort(Comparator.naturalOrder());

        int index = siblings.indexOf(config.getConfigId());
        long intervalSeconds = interval.toSeconds();
        LocalDateTime anchor = gridAnchor(at, intervalSeconds, intervalSeconds * index / siblings.size());
        return allocator.generateIntervalSlots(config.getConfigId(), account, intervalSeconds / 3600.0,
                index, siblings.size(), lookAheadDays, anchor);
    }

    /**
     * Start of the interval grid shared by all siblings: multiples of the interval counted from the local epoch.
     * The returned anchor is the first grid point whose phase-shifted slot is not before {@code at}.
     */
    static LocalDateTime gridAnchor(LocalDateTime at, long intervalSeconds, long phaseSeconds) {
        long t = at.toEpochSecond(ZoneOffset.UTC);
        long anchor = t - Math.floorMod(t, intervalSeconds);
        if (anchor + phaseSeconds < t) {
            anchor += intervalSeconds;
        }
        return LocalDateTime.ofEpochSecond(anchor, 0, ZoneOffset.UTC);
    }

    private List<TimeSlot> planWindow(ScheduleConfig config, RecurrenceParams params, Instant occurrence) {
        LocalDate date = LocalDate.ofInstant(occurrence, allocator.zone());
        if (!allocator.getSlotsByDate(config.getConfigId(), date, null).isEmpty()) {
            log.debug("Window slots already exist configId={} date={}", config.getConfigId(), date);
            return List.of();
        }
        return allocator.generateSlots(config.getConfigId(), groupAccounts(config), date,
                params.windowStartHour(), params.windowEndHour(), SlotStrategy.fromValue(params.strategy()));
    }

    private List<TimeSlot> planRotation(ScheduleConfig config, Instant occurrence) {
        List<String> group = groupAccounts(config);
        int next = slotStore.findLatest(config.getConfigId())
                .map(latest -> (group.indexOf(latest.getAccountId()) + 1) % group.size())
                .orElse(0);

        LocalDateTime at = LocalDateTime.ofInstant(occurrence, allocator.zone()).truncatedTo(ChronoUnit.MINUTES);
        TimeSlot slot = new TimeSlot(config.getConfigId(), group.get(next), at, 0);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(RingSlotPlanner.META_KIND, config.getRecurrenceKind().value());
        slot.setMetadata(meta);

        List<TimeSlot> saved = slotStore.saveAll(List.of(slot));
        log.info("Rotation slot generated configId={} accountId={} at={}", config.getConfigId(), slot.getAccountId(), at);
        return saved;
    }

    private String pinnedAccount(ScheduleConfig config, RecurrenceParams params) {
        if (params.accountId() != null && !params.accountId().isBlank()) {
            return params.accountId();
        }
        return groupAccounts(config).get(0);
    }

    private List<String> groupAccounts(ScheduleConfig config) {
        List<String> group = Optional.ofNullable(accounts.listActiveAccounts(config.getGroupId())).orElse(List.of());
        if (group.isEmpty()) {
            throw new ValidationException("No active accounts in groupId=" + config.getGroupId()
                    + " for configId=" + config.getConfigId());
        }
        return group;
    }
}
