package io.slot4j.core;

/**
 * No next run time can be computed, e.g. monthly dates exhausted.
 */
public class SchedulingException extends Slot4jException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
