package io.tapdb.domain.error;

import java.util.List;

/**
 * Thrown when instance properties do not satisfy the template's payload schema.
 */
public class SchemaValidationException extends TapdbException {

    private final String templateCode;
    private final List<String> violations;

    public SchemaValidationException(String templateCode, List<String> violations) {
        super(String.format("[%s] payload schema violated: %s", templateCode, String.join("; ", violations)));
        this.templateCode = templateCode;
        this.violations = List.copyOf(violations);
    }

    public String getTemplateCode() {
        return templateCode;
    }

    public List<String> getViolations() {
        return violations;
    }
}
