package io.tapdb.domain.error;

/**
 * Base class of every failure raised by the object-model engine.
 */
public class TapdbException extends RuntimeException {

    public TapdbException(String message) {
        super(message);
    }

    public TapdbException(String message, Throwable cause) {
        super(message, cause);
    }
}
