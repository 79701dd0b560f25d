package io.tapdb.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Instance domain model. Type fields are copied from the template at creation.
 */
public record Instance(
    UUID uuid,
    String euid,
    String name,
    String polymorphicDiscriminator,
    String category,
    String type,
    String subtype,
    String version,
    UUID templateUuid,
    JsonNode payload,
    String status,
    boolean singleton,
    boolean deleted,
    Instant createdAt,
    Instant modifiedAt
) implements TapdbObject {

    /** Unsaved instance of {@code template}; the repository assigns uuid, euid and timestamps. */
    public static Instance draft(Template template, String name, JsonNode payload, String status) {
        return new Instance(null, null, name, template.instanceDiscriminator(),
            template.category(), template.type(), template.subtype(), template.version(),
            template.uuid(), payload, status, template.singleton(), false,
            null, null);
    }

    public TemplateCode templateCode() {
        return new TemplateCode(category, type, subtype, version);
    }

    /** Current properties, never null. */
    public ObjectNode properties() {
        JsonNode props = payload == null ? null : payload.get("properties");
        return props != null && props.isObject() ? ((ObjectNode) props).deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public ObjectNode actionGroups() {
        JsonNode groups = payload == null ? null : payload.get("action_groups");
        return groups != null && groups.isObject() ? ((ObjectNode) groups).deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public Instance withName(String newName) {
        return new Instance(uuid, euid, newName, polymorphicDiscriminator, category, type, subtype, version,
            templateUuid, payload, status, singleton, deleted, createdAt, modifiedAt);
    }

    public Instance withStatus(String newStatus) {
        return new Instance(uuid, euid, name, polymorphicDiscriminator, category, type, subtype, version,
            templateUuid, payload, newStatus, singleton, deleted, createdAt, modifiedAt);
    }

    public Instance withPayload(JsonNode newPayload) {
        return new Instance(uuid, euid, name, polymorphicDiscriminator, category, type, subtype, version,
            templateUuid, newPayload, status, singleton, deleted, createdAt, modifiedAt);
    }

    public Instance withProperties(ObjectNode newProperties) {
        ObjectNode newPayload = payloadCopy();
        newPayload.set("properties", newProperties);
        return withPayload(newPayload);
    }

    public Instance withActionGroups(ObjectNode newActionGroups) {
        ObjectNode newPayload = payloadCopy();
        newPayload.set("action_groups", newActionGroups);
        return withPayload(newPayload);
    }

    private ObjectNode payloadCopy() {
        return payload != null && payload.isObject()
            ? ((ObjectNode) payload).deepCopy() : JsonNodeFactory.instance.objectNode();
    }
}
