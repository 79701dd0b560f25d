package io.tapdb.domain.error;

/**
 * Thrown when a prefix has no registered counter, the counter is missing in the
 * store, or the prefix registry would become inconsistent.
 */
public class IdentifierIntegrityException extends TapdbException {

    private final String prefix;

    public IdentifierIntegrityException(String prefix, String message) {
        super(String.format("[%s] %s", prefix, message));
        this.prefix = prefix;
    }

    public IdentifierIntegrityException(String prefix, String message, Throwable cause) {
        super(String.format("[%s] %s", prefix, message), cause);
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
