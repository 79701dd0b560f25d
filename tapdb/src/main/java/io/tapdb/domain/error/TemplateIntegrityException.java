package io.tapdb.domain.error;

/**
 * Thrown when stored templates violate a structural rule: duplicate live rows
 * for one code, cyclic or too deep instantiation layouts, malformed layouts.
 */
public class TemplateIntegrityException extends TapdbException {

    private final String templateCode;

    public TemplateIntegrityException(String templateCode, String message) {
        super(String.format("[%s] %s", templateCode, message));
        this.templateCode = templateCode;
    }

    public TemplateIntegrityException(String templateCode, String message, Throwable cause) {
        super(String.format("[%s] %s", templateCode, message), cause);
        this.templateCode = templateCode;
    }

    public String getTemplateCode() {
        return templateCode;
    }
}
