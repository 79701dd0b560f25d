package io.tapdb.domain.error;

/**
 * Thrown when a template code or identifier does not resolve to a live template.
 */
public class TemplateNotFoundException extends TapdbException {

    private final String templateCode;

    public TemplateNotFoundException(String templateCode) {
        this(templateCode, "template not found");
    }

    public TemplateNotFoundException(String templateCode, String message) {
        super(String.format("[%s] %s", templateCode, message));
        this.templateCode = templateCode;
    }

    public String getTemplateCode() {
        return templateCode;
    }
}
