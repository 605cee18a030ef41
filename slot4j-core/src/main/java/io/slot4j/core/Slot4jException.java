package io.slot4j.core;

/**
 * Base type of all errors raised by the scheduling core.
 */
public class Slot4jException extends RuntimeException {

    public Slot4jException(String message) {
        super(message);
    }

    public Slot4jException(String message, Throwable cause) {
        super(message, cause);
    }
}
