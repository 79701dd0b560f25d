package io.tapdb.domain.error;

/**
 * Thrown when an instance would be linked to itself.
 */
public class SelfReferenceNotAllowedException extends TapdbException {

    private final String euid;

    public SelfReferenceNotAllowedException(String euid) {
        super(String.format("[%s] an instance cannot be linked to itself", euid));
        this.euid = euid;
    }

    public String getEuid() {
        return euid;
    }
}
