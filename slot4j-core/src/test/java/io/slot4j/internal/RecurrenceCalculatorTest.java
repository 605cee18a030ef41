package io.slot4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.core.RecurrenceKind;
import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.SchedulingException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurrenceCalculatorTest {

    private final RecurrenceCalculator calculator = new RecurrenceCalculator(ZoneOffset.UTC, new ObjectMapper());

    // 2026-03-10 is a Tuesday
    private static final Instant TUE_NOON = Instant.parse("2026-03-10T12:00:00Z");

    @Test
    void dailyShouldBeStrictlyAfterFromTime() {
        ScheduleConfig daily = config(RecurrenceKind.DAILY, Map.of("schedule_time", "09:00"));

        assertEquals(Instant.parse("2026-03-10T09:00:00Z"), next(daily, Instant.parse("2026-03-10T08:59:00Z")));
        assertEquals(Instant.parse("2026-03-11T09:00:00Z"), next(daily, Instant.parse("2026-03-10T09:00:00Z")));
        assertEquals(Instant.parse("2026-03-11T09:00:00Z"), next(daily, TUE_NOON));
    }

    @Test
    void dailyWithoutTimeShouldDefaultToTenOClock() {
        assertEquals(Instant.parse("2026-03-11T10:00:00Z"),
                next(config(RecurrenceKind.DAILY, Map.of()), TUE_NOON));
    }

    @Test
    void dailyShouldUseTheCalculatorZone() {
        RecurrenceCalculator tokyo = new RecurrenceCalculator(ZoneId.of("Asia/Tokyo"), new ObjectMapper());
        ScheduleConfig daily = config(RecurrenceKind.DAILY, Map.of("schedule_time", "09:00"));

        // 12:00Z is 21:00 in Tokyo, next 09:00 JST is 00:00Z the following day
        assertEquals(Instant.parse("2026-03-11T00:00:00Z"), tokyo.calculateNextRun(daily, TUE_NOON).get());
    }

    @Test
    void weeklyShouldPickNextMatchingWeekday() {
        ScheduleConfig monWed = config(RecurrenceKind.WEEKLY, Map.of("schedule_days", List.of(0, 2), "schedule_time", "10:00"));

        assertEquals(Instant.parse("2026-03-11T10:00:00Z"), next(monWed, TUE_NOON));
        assertEquals(Instant.parse("2026-03-16T10:00:00Z"), next(monWed, Instant.parse("2026-03-11T10:00:00Z")));
    }

    @Test
    void weeklyOnTodayAfterTheTimeShouldWrapAFullWeek() {
        ScheduleConfig tuesday = config(RecurrenceKind.WEEKLY, Map.of("schedule_days", List.of(1), "schedule_time", "10:00"));
        assertEquals(Instant.parse("2026-03-17T10:00:00Z"), next(tuesday, TUE_NOON));
    }

    @Test
    void monthlyShouldSkipMonthsWithoutTheDate() {
        ScheduleConfig thirtieth = config(RecurrenceKind.MONTHLY, Map.of("schedule_dates", List.of(30)));
        assertEquals(Instant.parse("2026-03-30T10:00:00Z"), next(thirtieth, Instant.parse("2026-02-10T00:00:00Z")));
    }

    @Test
    void monthlyShouldRollToNextMonthsFirstDate() {
        ScheduleConfig config = config(RecurrenceKind.MONTHLY, Map.of("schedule_dates", List.of(31, 15), "schedule_time", "08:30"));

        assertEquals(Instant.parse("2026-01-31T08:30:00Z"), next(config, Instant.parse("2026-01-20T00:00:00Z")));
        assertEquals(Instant.parse("2026-02-15T08:30:00Z"), next(config, Instant.parse("2026-01-31T12:00:00Z")));
    }

    @Test
    void monthlyWithNoValidDateInNextMonthShouldBeEmpty() {
        ScheduleConfig config = config(RecurrenceKind.MONTHLY, Map.of("schedule_dates", List.of(31)));
        // January's 31st has passed and February has none
        assertTrue(calculator.calculateNextRun(config, Instant.parse("2026-01-31T12:00:00Z")).isEmpty());
    }

    @Test
    void intervalShouldRunSoonOnFirstCallThenFollowLastRun() {
        ScheduleConfig config = config(RecurrenceKind.INTERVAL, Map.of("schedule_interval", 2, "schedule_interval_unit", "hours"));
        assertEquals(TUE_NOON.plusSeconds(1), next(config, TUE_NOON));

        config.setLastRunAt(TUE_NOON);
        assertEquals(TUE_NOON.plus(Duration.ofHours(2)), next(config, TUE_NOON.plusSeconds(5)));
    }

    @Test
    void intervalShouldAcceptHumanDurations() {
        ScheduleConfig config = config(RecurrenceKind.INTERVAL, Map.of("interval", "1h 30m"));
        config.setLastRunAt(TUE_NOON);
        assertEquals(TUE_NOON.plus(Duration.ofMinutes(90)), next(config, TUE_NOON));
    }

    @Test
    void intervalUnitShouldDefaultToMinutes() {
        ScheduleConfig config = config(RecurrenceKind.INTERVAL, Map.of("schedule_interval", 45));
        config.setLastRunAt(TUE_NOON);
        assertEquals(TUE_NOON.plus(Duration.ofMinutes(45)), next(config, TUE_NOON));
    }

    @Test
    void cronShouldUseFiveFieldExpressions() {
        ScheduleConfig everyDay = config(RecurrenceKind.CRON, Map.of("schedule_cron", "30 9 * * *"));
        assertEquals(Instant.parse("2026-03-11T09:30:00Z"), next(everyDay, TUE_NOON));

        // 1 = Monday in five-field cron
        ScheduleConfig mondays = config(RecurrenceKind.CRON, Map.of("schedule_cron", "0 9 * * 1"));
        assertEquals(Instant.parse("2026-03-16T09:00:00Z"), next(mondays, TUE_NOON));
    }

    @Test
    void cronWithoutExpressionShouldDefaultToTenOClockDaily() {
        assertEquals(Instant.parse("2026-03-11T10:00:00Z"), next(config(RecurrenceKind.CRON, Map.of()), TUE_NOON));
    }

    @Test
    void onceShouldReturnScheduledTimeUntilItHasRun() {
        ScheduleConfig once = config(RecurrenceKind.ONCE, Map.of("scheduled_time", "2026-03-01T08:00:00"));

        // a past time is returned as is; the scheduler fires it on the next tick
        assertEquals(Instant.parse("2026-03-01T08:00:00Z"), next(once, TUE_NOON));

        once.setLastRunAt(TUE_NOON);
        assertTrue(calculator.calculateNextRun(once, TUE_NOON).isEmpty());
    }

    @Test
    void onceShouldHonourExplicitOffsets() {
        ScheduleConfig once = config(RecurrenceKind.ONCE, Map.of("scheduled_time", "2026-04-01T09:00:00+09:00"));
        assertEquals(Instant.parse("2026-04-01T00:00:00Z"), next(once, TUE_NOON));
    }

    @Test
    void malformedParamsShouldYieldEmpty() {
        assertTrue(calculator.calculateNextRun(config(RecurrenceKind.DAILY, Map.of("schedule_time", "25:99")), TUE_NOON).isEmpty());
        assertTrue(calculator.calculateNextRun(config(RecurrenceKind.WEEKLY, Map.of("schedule_days", List.of(9))), TUE_NOON).isEmpty());
        assertTrue(calculator.calculateNextRun(config(RecurrenceKind.MONTHLY, Map.of("schedule_dates", List.of(0))), TUE_NOON).isEmpty());
        assertTrue(calculator.calculateNextRun(config(RecurrenceKind.CRON, Map.of("schedule_cron", "not a cron")), TUE_NOON).isEmpty());
        assertTrue(calculator.calculateNextRun(config(RecurrenceKind.ONCE, Map.of()), TUE_NOON).isEmpty());
        assertTrue(calculator.calculateNextRun(config(RecurrenceKind.WEEKLY, Map.of("schedule_days", "monday")), TUE_NOON).isEmpty());
    }

    @Test
    void outOfRangeIntervalShouldYieldEmpty() {
        ScheduleConfig text = config(RecurrenceKind.INTERVAL, Map.of("interval", "99999999999999999999 hours"));
        text.setLastRunAt(TUE_NOON);
        assertTrue(calculator.calculateNextRun(text, TUE_NOON).isEmpty());

        ScheduleConfig numeric = config(RecurrenceKind.INTERVAL,
                Map.of("schedule_interval", 1e300, "schedule_interval_unit", "hours"));
        numeric.setLastRunAt(TUE_NOON);
        assertTrue(calculator.calculateNextRun(numeric, TUE_NOON).isEmpty());
        assertThrows(SchedulingException.class, () -> calculator.requireNextRun(numeric, TUE_NOON));
    }

    @Test
    void requireNextRunShouldThrowWhenNothingIsDue() {
        ScheduleConfig once = config(RecurrenceKind.ONCE, Map.of("scheduled_time", "2026-03-01T08:00:00"));
        once.setLastRunAt(TUE_NOON);

        assertThrows(SchedulingException.class, () -> calculator.requireNextRun(once, TUE_NOON));
        assertThrows(SchedulingException.class,
                () -> calculator.requireNextRun(config(RecurrenceKind.DAILY, Map.of("schedule_time", "nope")), TUE_NOON));
    }

    private Instant next(ScheduleConfig config, Instant from) {
        Optional<Instant> next = calculator.calculateNextRun(config, from);
        assertTrue(next.isPresent(), () -> "expected a next run for " + config);
        return next.get();
    }

    private static ScheduleConfig config(RecurrenceKind kind, Map<String, Object> params) {
        return new ScheduleConfig("cfg-" + kind.value(), kind, params);
    }
}
