package io.tapdb.domain.error;

/**
 * Storage failure that has no more specific translation.
 */
public class PersistenceException extends TapdbException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
