package io.slot4j.utils;

import io.slot4j.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScheduleParserTest {

    @Test
    void parseDurationShouldSupportHumanUnits() {
        assertEquals(Duration.ofMinutes(5), ScheduleParser.parseDuration("5 minutes"));
        assertEquals(Duration.ofHours(6), ScheduleParser.parseDuration("6 hours"));
        assertEquals(Duration.ofMinutes(90), ScheduleParser.parseDuration("1h30m"));
        assertEquals(Duration.ofHours(27), ScheduleParser.parseDuration("1 day 3 hours"));
        assertEquals(Duration.ofSeconds(90), ScheduleParser.parseDuration("90"));
    }

    @Test
    void parseDurationShouldRejectGarbage() {
        assertThrows(ValidationException.class, () -> ScheduleParser.parseDuration("soon"));
        assertThrows(ValidationException.class, () -> ScheduleParser.parseDuration("5 minutes 2 minutes"));
        assertThrows(ValidationException.class, () -> ScheduleParser.parseDuration("5 fortnights"));
        assertThrows(ValidationException.class, () -> ScheduleParser.parseDuration("0 minutes"));
    }

    @Test
    void parseDurationShouldRejectOutOfRangeAmounts() {
        assertThrows(ValidationException.class, () -> ScheduleParser.parseDuration("99999999999999999999 hours"));
        assertThrows(ValidationException.class, () -> ScheduleParser.parseDuration("999999999999999999 hours"));
        assertThrows(ValidationException.class, () -> ScheduleParser.parseDuration("9999999999999999 weeks"));
    }

    @Test
    void toDurationShouldConvertIntervalUnits() {
        assertEquals(Duration.ofMinutes(60), ScheduleParser.toDuration(60, null));
        assertEquals(Duration.ofSeconds(45), ScheduleParser.toDuration(45, "seconds"));
        assertEquals(Duration.ofMinutes(90), ScheduleParser.toDuration(1.5, "hours"));
        assertEquals(Duration.ofDays(2), ScheduleParser.toDuration(2, "days"));
        assertThrows(ValidationException.class, () -> ScheduleParser.toDuration(-1, "minutes"));
        assertThrows(ValidationException.class, () -> ScheduleParser.toDuration(1, "weeks"));
    }

    @Test
    void parseTimeOfDayShouldAcceptSingleDigitHour() {
        assertEquals(LocalTime.of(9, 5), ScheduleParser.parseTimeOfDay("9:05"));
        assertEquals(LocalTime.of(21, 30, 15), ScheduleParser.parseTimeOfDay("21:30:15"));
        assertThrows(ValidationException.class, () -> ScheduleParser.parseTimeOfDay("25:00"));
    }

    @Test
    void nextCronOccurrenceShouldSupportFiveFieldCron() {
        Instant next = ScheduleParser.nextCronOccurrence("*/5 * * * *", ZoneOffset.UTC, Instant.parse("2026-01-01T00:01:00Z"))
                .orElseThrow();
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), next);
    }

    @Test
    void nextCronOccurrenceShouldBeStrictlyAfterFrom() {
        Instant next = ScheduleParser.nextCronOccurrence("0 10 * * *", ZoneOffset.UTC, Instant.parse("2026-01-01T10:00:00Z"))
                .orElseThrow();
        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), next);
    }

    @Test
    void nextCronOccurrenceShouldMapStandardWeekdays() {
        // 2026-01-03 is a Saturday; 1-5 is Monday..Friday in standard cron
        Instant next = ScheduleParser.nextCronOccurrence("0 9 * * 1-5", ZoneOffset.UTC, Instant.parse("2026-01-03T12:00:00Z"))
                .orElseThrow();
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), next);

        // 0 and 7 both mean Sunday
        Instant sunday = ScheduleParser.nextCronOccurrence("30 8 * * 7", ZoneOffset.UTC, Instant.parse("2026-01-01T00:00:00Z"))
                .orElseThrow();
        assertEquals(Instant.parse("2026-01-04T08:30:00Z"), sunday);
    }

    @Test
    void nextCronOccurrenceShouldHonourZone() {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        Instant next = ScheduleParser.nextCronOccurrence("0 9 * * *", tokyo, Instant.parse("2026-01-01T00:30:00Z"))
                .orElseThrow();
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), next);
    }

    @Test
    void normalizeCronShouldPickQuestionMarkField() {
        assertEquals("0 0 10 * * ?", ScheduleParser.normalizeCron("0 10 * * *"));
        assertEquals("0 0 10 1 * ?", ScheduleParser.normalizeCron("0 10 1 * *"));
        assertEquals("0 0 9 ? * 2,4", ScheduleParser.normalizeCron("0 9 * * 1,3"));
        assertThrows(ValidationException.class, () -> ScheduleParser.normalizeCron("0 9 1 * 1"));
    }
}
