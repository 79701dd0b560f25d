package io.tapdb.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Directed parent to child relationship between two instances.
 */
public record LineageEdge(
    UUID uuid,
    String euid,
    String name,
    String polymorphicDiscriminator,
    UUID parentInstanceUuid,
    UUID childInstanceUuid,
    String parentType,
    String childType,
    String relationshipType,
    JsonNode payload,
    String status,
    boolean deleted,
    Instant createdAt,
    Instant modifiedAt
) implements TapdbObject {

    public static final String LAYOUT_RELATIONSHIP = "contains";
    public static final String MANUAL_RELATIONSHIP = "generic";

    public static LineageEdge draft(Instance parent, Instance child, String relationshipType) {
        return new LineageEdge(null, null, parent.euid() + "->" + child.euid(),
            ObjectKind.GENERIC.lineageDiscriminator(), parent.uuid(), child.uuid(),
            parent.polymorphicDiscriminator(), child.polymorphicDiscriminator(), relationshipType,
            JsonNodeFactory.instance.objectNode(), "active", false, null, null);
    }
}
