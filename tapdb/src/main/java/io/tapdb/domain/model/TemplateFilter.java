package io.tapdb.domain.model;

/**
 * Template listing filter; null fields match anything.
 */
public record TemplateFilter(
    String category,
    String type,
    String subtype,
    String polymorphicDiscriminator,
    boolean includeDeleted
) {

    public static TemplateFilter all() {
        return new TemplateFilter(null, null, null, null, false);
    }

    public static TemplateFilter byCategory(String category) {
        return new TemplateFilter(category, null, null, null, false);
    }
}
