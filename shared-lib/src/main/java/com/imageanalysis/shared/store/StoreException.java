package com.imageanalysis.shared.store;

/**
 * A state or result store could not confirm a read or write. Retryable.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
