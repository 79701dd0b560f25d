package io.tapdb.config;

import io.tapdb.domain.error.TapdbException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when template configuration cannot be read or fails validation.
 */
public class TemplateConfigException extends TapdbException {

    private final List<ConfigIssue> issues;

    public TemplateConfigException(List<ConfigIssue> issues) {
        super(String.format("Template configuration has %d error(s): %s", issues.size(),
            issues.stream().map(ConfigIssue::toString).collect(Collectors.joining("; "))));
        this.issues = List.copyOf(issues);
    }

    public TemplateConfigException(String message, Throwable cause) {
        super(message, cause);
        this.issues = List.of();
    }

    public List<ConfigIssue> getIssues() {
        return issues;
    }
}
