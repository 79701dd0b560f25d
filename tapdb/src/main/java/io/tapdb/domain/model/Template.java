package io.tapdb.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Template domain model: the blueprint instances are created from.
 *
 * <p>Payload keys understood by the engine: {@code properties} (default
 * instance properties), {@code action_imports}, {@code instantiation_layouts},
 * {@code action_definition} and {@code default_status}.
 */
public record Template(
    UUID uuid,
    String euid,
    String name,
    String polymorphicDiscriminator,
    String category,
    String type,
    String subtype,
    String version,
    String instancePrefix,
    String instancePolymorphicIdentity,
    JsonNode payload,
    JsonNode payloadSchema,
    String status,
    boolean singleton,
    boolean deleted,
    Instant createdAt,
    Instant modifiedAt
) implements TapdbObject {

    public static final String DEFAULT_INSTANCE_STATUS = "created";

    /** Unsaved template; the repository assigns uuid, euid and timestamps. */
    public static Template draft(String name, String polymorphicDiscriminator, TemplateCode code,
                                 String instancePrefix, String instancePolymorphicIdentity,
                                 JsonNode payload, JsonNode payloadSchema, String status, boolean singleton) {
        return new Template(null, null, name, polymorphicDiscriminator,
            code.category(), code.type(), code.subtype(), code.version(),
            instancePrefix, instancePolymorphicIdentity,
            payload == null ? JsonNodeFactory.instance.objectNode() : payload,
            payloadSchema, status == null ? "active" : status, singleton, false, null, null);
    }

    public TemplateCode code() {
        return new TemplateCode(category, type, subtype, version);
    }

    /** Default instance properties, never null. */
    public ObjectNode defaultProperties() {
        JsonNode props = payload == null ? null : payload.get("properties");
        return props != null && props.isObject() ? ((ObjectNode) props).deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public JsonNode actionImports() {
        return payload == null ? null : payload.get("action_imports");
    }

    public JsonNode instantiationLayouts() {
        return payload == null ? null : payload.get("instantiation_layouts");
    }

    public JsonNode actionDefinition() {
        return payload == null ? null : payload.get("action_definition");
    }

    public String defaultInstanceStatus() {
        JsonNode status = payload == null ? null : payload.get("default_status");
        return status != null && status.isTextual() && !status.asText().isBlank()
            ? status.asText() : DEFAULT_INSTANCE_STATUS;
    }

    /** Discriminator stamped on instances created from this template. */
    public String instanceDiscriminator() {
        if (instancePolymorphicIdentity != null && !instancePolymorphicIdentity.isBlank()) {
            return instancePolymorphicIdentity;
        }
        return kind().instanceDiscriminator();
    }

    public boolean hasPayloadSchema() {
        return payloadSchema != null && !payloadSchema.isNull() && !payloadSchema.isEmpty();
    }

    public Template withName(String newName) {
        return new Template(uuid, euid, newName, polymorphicDiscriminator, category, type, subtype, version,
            instancePrefix, instancePolymorphicIdentity, payload, payloadSchema, status, singleton, deleted,
            createdAt, modifiedAt);
    }

    public Template withStatus(String newStatus) {
        return new Template(uuid, euid, name, polymorphicDiscriminator, category, type, subtype, version,
            instancePrefix, instancePolymorphicIdentity, payload, payloadSchema, newStatus, singleton, deleted,
            createdAt, modifiedAt);
    }

    public Template withPayload(JsonNode newPayload) {
        return new Template(uuid, euid, name, polymorphicDiscriminator, category, type, subtype, version,
            instancePrefix, instancePolymorphicIdentity, newPayload, payloadSchema, status, singleton, deleted,
            createdAt, modifiedAt);
    }

    /** This stored template, live, with the editable fields of {@code source}. */
    public Template withDefinitionOf(Template source) {
        return new Template(uuid, euid, source.name, source.polymorphicDiscriminator, category, type, subtype,
            version, source.instancePrefix, source.instancePolymorphicIdentity, source.payload,
            source.payloadSchema, source.status, source.singleton, false, createdAt, modifiedAt);
    }
}
