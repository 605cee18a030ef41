package io.slot4j.core;

import java.util.Locale;

/**
 * How a day's window is divided among accounts.
 */
public enum SlotStrategy {
    /** Equal-width intervals with bounded jitter. */
    EVEN,
    /** Shuffled candidates spaced by the minimum interval. */
    RANDOM;

    public static SlotStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return EVEN;
        }
        try {
            return SlotStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Unsupported slot strategy: " + value);
        }
    }
}
