package io.slot4j.core;

/**
 * Invalid input: empty account lists, malformed recurrence parameters, illegal slot transitions.
 */
public class ValidationException extends Slot4jException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
