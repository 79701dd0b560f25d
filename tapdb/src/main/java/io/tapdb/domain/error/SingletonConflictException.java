package io.tapdb.domain.error;

/**
 * Thrown when a second live instance of a singleton template would be created.
 */
public class SingletonConflictException extends TapdbException {

    private final String templateCode;
    private final String existingEuid;

    public SingletonConflictException(String templateCode, String existingEuid) {
        super(String.format("[%s] singleton instance already exists: %s", templateCode, existingEuid));
        this.templateCode = templateCode;
        this.existingEuid = existingEuid;
    }

    public SingletonConflictException(String templateCode, Throwable cause) {
        super(String.format("[%s] singleton instance already exists", templateCode), cause);
        this.templateCode = templateCode;
        this.existingEuid = null;
    }

    public String getTemplateCode() {
        return templateCode;
    }

    /** EUID of the live instance, when known. */
    public String getExistingEuid() {
        return existingEuid;
    }
}
