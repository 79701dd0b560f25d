package io.tapdb.domain.model;

/**
 * Instance listing filter; null fields match anything.
 */
public record InstanceFilter(
    String category,
    String type,
    String subtype,
    String status,
    boolean includeDeleted
) {

    public static InstanceFilter all() {
        return new InstanceFilter(null, null, null, null, false);
    }
}
