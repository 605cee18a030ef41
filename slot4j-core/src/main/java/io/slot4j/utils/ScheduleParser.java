package io.slot4j.utils;

import io.slot4j.core.ValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing helpers for recurrence parameters.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Time of day: "HH:mm" or "HH:mm:ss"</li>
 *   <li>Five-field cron ("minute hour day-of-month month day-of-week", Sunday = 0 or 7), evaluated with Quartz</li>
 *   <li>Durations: "90" (seconds), "5 minutes", "2 hours", "1 day 3 hours", "1h30m"</li>
 * </ul>
 */
public final class ScheduleParser {

    private static final Pattern DURATION_TOKEN = Pattern.compile("(\\d+)\\s*([a-z]+)");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");

    private ScheduleParser() {
    }

    public static LocalTime parseTimeOfDay(String timeOfDay) {
        if (timeOfDay == null || timeOfDay.isBlank()) {
            throw new ValidationException("time of day must not be blank");
        }
        String s = timeOfDay.trim();
        // accept "9:05" as well as "09:05"
        if (s.indexOf(':') == 1) {
            s = "0" + s;
        }
        try {
            return LocalTime.parse(s);
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid time of day. Expected HH:mm or HH:mm:ss: " + timeOfDay, ex);
        }
    }

    /**
     * Next occurrence of a cron expression strictly after {@code from}.
     *
     * @param spec five-field (standard) or six-field (with seconds) cron
     * @return empty if the expression has no future occurrence
     */
    public static Optional<Instant> nextCronOccurrence(String spec, ZoneId zone, Instant from) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(from, "from must not be null");

        CronExpression exp = compileCron(spec);
        exp.setTimeZone(TimeZone.getTimeZone(zone));
        Date next = exp.getNextValidTimeAfter(Date.from(from));
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    static CronExpression compileCron(String spec) {
        String quartz = normalizeCron(spec);
        try {
            return new CronExpression(quartz);
        } catch (ParseException ex) {
            throw new ValidationException("Invalid cron expression: " + spec, ex);
        }
    }

    /**
     * Translate a standard cron into Quartz syntax.
     * <ul>
     *   <li>5 fields: seconds "0" is prepended</li>
     *   <li>day-of-week numbers move from 0-6 (Sunday = 0 or 7) to Quartz 1-7 (Sunday = 1)</li>
     *   <li>exactly one of day-of-month / day-of-week becomes "?"</li>
     * </ul>
     */
    public static String normalizeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ValidationException("cron expression must not be blank");
        }
        String[] parts = spec.trim().split("\\s+");
        String sec;
        int offset;
        if (parts.length == 5) {
            sec = "0";
            offset = 0;
        } else if (parts.length == 6) {
            sec = parts[0];
            offset = 1;
        } else {
            throw new ValidationException("cron expression must have 5 or 6 fields: " + spec);
        }

        String min = parts[offset];
        String hour = parts[offset + 1];
        String dom = parts[offset + 2];
        String month = parts[offset + 3];
        String dow = toQuartzDayOfWeek(parts[offset + 4]);

        boolean anyDom = "*".equals(dom) || "?".equals(dom);
        boolean anyDow = "*".equals(dow) || "?".equals(dow);
        if (anyDow) {
            dow = "?";
        } else if (anyDom) {
            dom = "?";
        } else {
            throw new ValidationException("cron expressions restricting both day-of-month and day-of-week are not supported: " + spec);
        }
        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String toQuartzDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }
        if (!field.matches("[0-9,*/-]+")) {
            // names (MON-FRI), L and # are passed through unchanged
            return field.toUpperCase(Locale.ROOT);
        }

        Set<Integer> days = new LinkedHashSet<>();
        for (String part : field.split(",")) {
            int step = 1;
            String base = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                step = parseBounded(part.substring(slash + 1), 1, 7, field);
                base = part.substring(0, slash);
            }
            int from;
            int to;
            if ("*".equals(base)) {
                from = 0;
                to = 6;
            } else if (base.contains("-")) {
                String[] range = base.split("-", 2);
                from = parseBounded(range[0], 0, 7, field);
                to = parseBounded(range[1], 0, 7, field);
            } else {
                from = parseBounded(base, 0, 7, field);
                to = slash >= 0 ? 6 : from;
            }
            if (to < from) {
                throw new ValidationException("Invalid day-of-week range: " + field);
            }
            for (int d = from; d <= to; d += step) {
                days.add(d % 7 + 1);
            }
        }

        List<String> out = new ArrayList<>(days.size());
        days.stream().sorted().forEach(d -> out.add(String.valueOf(d)));
        return String.join(",", out);
    }

    private static int parseBounded(String s, int min, int max, String field) {
        try {
            int v = Integer.parseInt(s);
            if (v < min || v > max) {
                throw new ValidationException("Value out of range in cron field: " + field);
            }
            return v;
        } catch (NumberFormatException ex) {
            throw new ValidationException("Invalid number in cron field: " + field, ex);
        }
    }

    /**
     * Amount + unit as found in interval recurrence params.
     *
     * @param unit seconds, minutes, hours or days (singular accepted); null means minutes
     */
    public static Duration toDuration(Number amount, String unit) {
        if (amount == null) {
            throw new ValidationException("interval amount must not be null");
        }
        double value = amount.doubleValue();
        if (value <= 0 || Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValidationException("interval must be positive: " + amount);
        }
        String u = unit == null ? "minutes" : unit.trim().toLowerCase(Locale.ROOT);
        long seconds = switch (u) {
            case "second", "seconds", "s" -> Math.round(value);
            case "minute", "minutes", "m" -> Math.round(value * 60);
            case "hour", "hours", "h" -> Math.round(value * 3600);
            case "day", "days", "d" -> Math.round(value * 86400);
            default -> throw new ValidationException("Unsupported interval unit: " + unit);
        };
        if (seconds <= 0) {
            throw new ValidationException("interval rounds to zero seconds: " + amount + " " + unit);
        }
        return Duration.ofSeconds(seconds);
    }

    /**
     * Parse a human-readable duration.
     * A bare number is read as seconds; otherwise amount/unit pairs are summed, each unit at most once.
     */
    public static Duration parseDuration(String input) {
        if (input == null || input.isBlank()) {
            throw new ValidationException("duration must not be blank");
        }
        String s = input.trim().toLowerCase(Locale.ROOT);

        if (NUMERIC.matcher(s).matches()) {
            try {
                return toDuration(Long.parseLong(s), "seconds");
            } catch (NumberFormatException ex) {
                throw new ValidationException("duration out of range: " + input, ex);
            }
        }

        Matcher m = DURATION_TOKEN.matcher(s);
        Set<String> seen = new LinkedHashSet<>();
        Duration total = Duration.ZERO;
        int consumed = 0;
        try {
            while (m.find()) {
                if (!s.substring(consumed, m.start()).isBlank()) {
                    throw new ValidationException("Invalid duration: " + input);
                }
                consumed = m.end();

                long n = Long.parseLong(m.group(1));
                String unit = canonicalUnit(m.group(2), input);
                if (!seen.add(unit)) {
                    throw new ValidationException("Duplicate unit in duration: " + unit);
                }
                total = total.plus(switch (unit) {
                    case "week" -> Duration.ofDays(Math.multiplyExact(7L, n));
                    case "day" -> Duration.ofDays(n);
                    case "hour" -> Duration.ofHours(n);
                    case "minute" -> Duration.ofMinutes(n);
                    default -> Duration.ofSeconds(n);
                });
            }
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new ValidationException("duration out of range: " + input, ex);
        }
        if (seen.isEmpty() || !s.substring(consumed).isBlank()) {
            throw new ValidationException("Invalid duration: " + input);
        }
        if (total.isZero()) {
            throw new ValidationException("duration must be positive: " + input);
        }
        return total;
    }

    private static String canonicalUnit(String raw, String input) {
        return switch (raw) {
            case "w", "week", "weeks" -> "week";
            case "d", "day", "days" -> "day";
            case "h", "hr", "hrs", "hour", "hours" -> "hour";
            case "m", "min", "mins", "minute", "minutes" -> "minute";
            case "s", "sec", "secs", "second", "seconds" -> "second";
            default -> throw new ValidationException("Unsupported duration unit '" + raw + "' in: " + input);
        };
    }
}
