package io.slot4j.internal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.core.ValidationException;
import io.slot4j.utils.ScheduleParser;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Typed view over a config's {@code recurrenceParams} map.
 * Accessors apply the defaults of each recurrence kind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecurrenceParams(
        @JsonProperty("schedule_time") String scheduleTime,
        @JsonProperty("schedule_days") List<Integer> scheduleDays,
        @JsonProperty("schedule_dates") List<Integer> scheduleDates,
        @JsonProperty("schedule_interval") Double scheduleInterval,
        @JsonProperty("schedule_interval_unit") String scheduleIntervalUnit,
        @JsonProperty("interval") String interval,
        @JsonProperty("schedule_cron") String scheduleCron,
        @JsonProperty("scheduled_time") String scheduledTime,
        @JsonProperty("window_start_hour") Integer windowStartHour,
        @JsonProperty("window_end_hour") Integer windowEndHour,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("account_id") String accountId
) {
    static final LocalTime DEFAULT_TIME = LocalTime.of(10, 0);
    static final String DEFAULT_CRON = "0 10 * * *";

    public static RecurrenceParams from(Map<String, Object> params, ObjectMapper mapper) {
        try {
            return mapper.convertValue(params == null ? Map.of() : params, RecurrenceParams.class);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Malformed recurrence params: " + ex.getMessage(), ex);
        }
    }

    public LocalTime time() {
        return scheduleTime == null ? DEFAULT_TIME : ScheduleParser.parseTimeOfDay(scheduleTime);
    }

    /**
     * Weekday indices, 0 = Monday.
     */
    public List<Integer> days() {
        List<Integer> days = scheduleDays == null || scheduleDays.isEmpty() ? List.of(0) : scheduleDays;
        for (Integer d : days) {
            if (d == null || d < 0 || d > 6) {
                throw new ValidationException("schedule_days entries must be within 0..6: " + days);
            }
        }
        return days;
    }

    public List<Integer> dates() {
        List<Integer> dates = scheduleDates == null || scheduleDates.isEmpty() ? List.of(1) : scheduleDates;
        for (Integer d : dates) {
            if (d == null || d < 1 || d > 31) {
                throw new ValidationException("schedule_dates entries must be within 1..31: " + dates);
            }
        }
        return dates.stream().distinct().sorted().toList();
    }

    public Duration intervalDuration() {
        if (interval != null && !interval.isBlank()) {
            return ScheduleParser.parseDuration(interval);
        }
        return ScheduleParser.toDuration(scheduleInterval == null ? 60 : scheduleInterval, scheduleIntervalUnit);
    }

    public String cron() {
        return scheduleCron == null || scheduleCron.isBlank() ? DEFAULT_CRON : scheduleCron;
    }

    /**
     * {@code scheduled_time} as an instant. Values without offset are read in {@code zone}.
     */
    public Instant scheduledInstant(ZoneId zone) {
        if (scheduledTime == null || scheduledTime.isBlank()) {
            throw new ValidationException("scheduled_time is required for once recurrence");
        }
        String s = scheduledTime.trim();
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset; fall through to local date-time
        }
        try {
            return LocalDateTime.parse(s).atZone(zone).toInstant();
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid scheduled_time: " + scheduledTime, ex);
        }
    }

    public boolean hasWindow() {
        return windowStartHour != null;
    }
}
