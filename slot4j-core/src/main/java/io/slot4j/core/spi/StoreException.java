package io.slot4j.core.spi;

import io.slot4j.core.Slot4jException;

/**
 * Persistence failure raised by a store implementation.
 */
public class StoreException extends Slot4jException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
