package com.pubsubrelay.broker.store;

/**
 * Storage failure, including use of a closed store.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
