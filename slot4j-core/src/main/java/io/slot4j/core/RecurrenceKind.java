package io.slot4j.core;

import java.util.Locale;

/**
 * Recurrence semantics used to compute a config's next run time.
 */
public enum RecurrenceKind {
    DAILY,
    WEEKLY,
    MONTHLY,
    INTERVAL,
    CRON,
    ONCE;

    /**
     * Lower-case wire value ("daily", "cron", ...).
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RecurrenceKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("recurrence kind must not be blank");
        }
        try {
            return RecurrenceKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Unsupported recurrence kind: " + value);
        }
    }
}
