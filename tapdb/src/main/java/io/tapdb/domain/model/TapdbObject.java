package io.tapdb.domain.model;

import java.util.UUID;

/**
 * Common view of templates, instances and lineage edges.
 */
public interface TapdbObject {

    UUID uuid();

    String euid();

    String name();

    String polymorphicDiscriminator();

    boolean deleted();

    default ObjectKind kind() {
        return ObjectKind.fromDiscriminator(polymorphicDiscriminator());
    }
}
