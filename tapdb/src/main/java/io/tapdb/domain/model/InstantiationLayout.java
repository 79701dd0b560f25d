package io.tapdb.domain.model;

import java.util.List;

/**
 * Declares which children are created alongside an instance and how they are linked.
 */
public record InstantiationLayout(String relationshipType, String namePattern, List<ChildTemplateRef> children) {

    public static final String DEFAULT_NAME_PATTERN = "{parent_name}_{child_subtype}_{index}";

    public InstantiationLayout {
        children = List.copyOf(children);
    }

    /** Pattern used for {@code child}: its own, else the layout's, else the default. */
    public String namePatternFor(ChildTemplateRef child) {
        if (child.namePattern() != null) {
            return child.namePattern();
        }
        return namePattern != null ? namePattern : DEFAULT_NAME_PATTERN;
    }
}
