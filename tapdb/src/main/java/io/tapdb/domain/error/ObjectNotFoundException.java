package io.tapdb.domain.error;

/**
 * Thrown when no object with the given EUID exists.
 */
public class ObjectNotFoundException extends TapdbException {

    private final String euid;

    public ObjectNotFoundException(String euid) {
        super(String.format("[%s] object not found", euid));
        this.euid = euid;
    }

    public String getEuid() {
        return euid;
    }
}
