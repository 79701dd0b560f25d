package io.tapdb.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating a set of configuration documents.
 *
 * @param templates the templates that passed validation, in document order
 */
public record ConfigValidationResult(List<TemplateDefinition> templates, List<ConfigIssue> issues) {

    public ConfigValidationResult {
        templates = List.copyOf(templates);
        issues = List.copyOf(issues);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(ConfigIssue::isError);
    }

    public List<ConfigIssue> errors() {
        return issues.stream().filter(ConfigIssue::isError).collect(Collectors.toList());
    }

    public List<ConfigIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).collect(Collectors.toList());
    }
}
