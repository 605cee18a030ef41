package io.slot4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.core.RecurrenceKind;
import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.SchedulingException;
import io.slot4j.core.ValidationException;
import io.slot4j.utils.ScheduleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Next-run computation for the six recurrence kinds. Wall-clock kinds are evaluated in {@link #zone()}.
 */
public class RecurrenceCalculator {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceCalculator.class);

    private final ZoneId zone;
    private final ObjectMapper objectMapper;

    public RecurrenceCalculator(ZoneId zone, ObjectMapper objectMapper) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Malformed or out-of-range params yield empty and a WARN log instead of an exception.
     */
    public Optional<Instant> calculateNextRun(ScheduleConfig config, Instant fromTime) {
        try {
            return compute(config, fromTime);
        } catch (RuntimeException ex) {
            log.warn("Cannot compute next run configId={} kind={} msg={}",
                    config.getConfigId(), config.getRecurrenceKind(), ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws SchedulingException if no next run exists or the params are malformed
     */
    public Instant requireNextRun(ScheduleConfig config, Instant fromTime) {
        try {
            return compute(config, fromTime).orElseThrow(() -> new SchedulingException(
                    "No next run for configId=" + config.getConfigId() + " after " + fromTime));
        } catch (ValidationException | ArithmeticException | DateTimeException ex) {
            throw new SchedulingException("Invalid recurrence for configId=" + config.getConfigId() + ": " + ex.getMessage(), ex);
        }
    }

    public ZoneId zone() {
        return zone;
    }

    Optional<Instant> compute(ScheduleConfig config, Instant fromTime) {
        Objects.requireNonNull(fromTime, "fromTime must not be null");
        RecurrenceKind kind = config.getRecurrenceKind();
        if (kind == null) {
            throw new ValidationException("recurrence kind is missing");
        }
        RecurrenceParams params = RecurrenceParams.from(config.getRecurrenceParams(), objectMapper);

        return switch (kind) {
            case DAILY -> Optional.of(nextDaily(params.time(), fromTime));
            case WEEKLY -> nextWeekly(params.time(), params.days(), fromTime);
            case MONTHLY -> nextMonthly(params.time(), params.dates(), fromTime);
            case INTERVAL -> Optional.of(config.getLastRunAt() == null
                    ? fromTime.plusSeconds(1)
                    : config.getLastRunAt().plus(params.intervalDuration()));
            case CRON -> ScheduleParser.nextCronOccurrence(params.cron(), zone, fromTime);
            case ONCE -> config.getLastRunAt() == null
                    ? Optional.of(params.scheduledInstant(zone))
                    : Optional.empty();
        };
    }

    private Instant nextDaily(LocalTime time, Instant fromTime) {
        ZonedDateTime from = fromTime.atZone(zone);
        ZonedDateTime candidate = from.toLocalDate().atTime(time).atZone(zone);
        if (!candidate.toInstant().isAfter(fromTime)) {
            candidate = from.toLocalDate().plusDays(1).atTime(time).atZone(zone);
        }
        return candidate.toInstant();
    }

    private Optional<Instant> nextWeekly(LocalTime time, List<Integer> days, Instant fromTime) {
        LocalDate start = fromTime.atZone(zone).toLocalDate();
        // today's slot may already have passed, so look one day past a full week
        for (int d = 0; d <= 7; d++) {
            LocalDate date = start.plusDays(d);
            if (!days.contains(date.getDayOfWeek().getValue() - 1)) {
                continue;
            }
            Instant candidate = date.atTime(time).atZone(zone).toInstant();
            if (candidate.isAfter(fromTime)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<Instant> nextMonthly(LocalTime time, List<Integer> dates, Instant fromTime) {
        YearMonth month = YearMonth.from(fromTime.atZone(zone));
        for (int day : dates) {
            if (!month.isValidDay(day)) {
                continue;
            }
            Instant candidate = month.atDay(day).atTime(time).atZone(zone).toInstant();
            if (candidate.isAfter(fromTime)) {
                return Optional.of(candidate);
            }
        }

        YearMonth next = month.plusMonths(1);
        for (int day : dates) {
            if (next.isValidDay(day)) {
                return Optional.of(next.atDay(day).atTime(time).atZone(zone).toInstant());
            }
        }
        return Optional.empty();
    }
}
