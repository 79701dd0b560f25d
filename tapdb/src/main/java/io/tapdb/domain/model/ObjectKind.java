package io.tapdb.domain.model;

import java.util.Locale;

/**
 * Polymorphic kind of a stored object, derived from its discriminator stem or category.
 */
public enum ObjectKind {
    GENERIC("generic", "#888888"),
    WORKFLOW("workflow", "#00FF7F"),
    WORKFLOW_STEP("workflow_step", "#ADFF2F"),
    CONTAINER("container", "#8B00FF"),
    CONTENT("content", "#00BFFF"),
    EQUIPMENT("equipment", "#FF4500"),
    DATA("data", "#FFD700"),
    TEST_REQUISITION("test_requisition", "#FFA500"),
    ACTOR("actor", "#FF69B4"),
    ACTION("action", "#FF8C00"),
    HEALTH_EVENT("health_event", "#DC143C"),
    FILE("file", "#00FF00"),
    SUBJECT("subject", "#9370DB");

    private static final String TEMPLATE_SUFFIX = "_template";
    private static final String INSTANCE_SUFFIX = "_instance";
    private static final String LINEAGE_SUFFIX = "_instance_lineage";

    private final String stem;
    private final String graphColor;

    ObjectKind(String stem, String graphColor) {
        this.stem = stem;
        this.graphColor = graphColor;
    }

    public String stem() {
        return stem;
    }

    public String graphColor() {
        return graphColor;
    }

    public String templateDiscriminator() {
        return stem + TEMPLATE_SUFFIX;
    }

    public String instanceDiscriminator() {
        return stem + INSTANCE_SUFFIX;
    }

    public String lineageDiscriminator() {
        return stem + LINEAGE_SUFFIX;
    }

    /** Kind for a template, instance or lineage discriminator; unknown stems map to GENERIC. */
    public static ObjectKind fromDiscriminator(String discriminator) {
        if (discriminator == null) {
            return GENERIC;
        }
        String d = discriminator.trim().toLowerCase(Locale.ROOT);
        if (d.endsWith(LINEAGE_SUFFIX)) {
            d = d.substring(0, d.length() - LINEAGE_SUFFIX.length());
        } else if (d.endsWith(TEMPLATE_SUFFIX)) {
            d = d.substring(0, d.length() - TEMPLATE_SUFFIX.length());
        } else if (d.endsWith(INSTANCE_SUFFIX)) {
            d = d.substring(0, d.length() - INSTANCE_SUFFIX.length());
        }
        return fromStem(d);
    }

    public static ObjectKind fromCategory(String category) {
        return category == null ? GENERIC : fromStem(category.trim().toLowerCase(Locale.ROOT));
    }

    private static ObjectKind fromStem(String stem) {
        for (ObjectKind kind : values()) {
            if (kind.stem.equals(stem)) {
                return kind;
            }
        }
        return GENERIC;
    }
}
