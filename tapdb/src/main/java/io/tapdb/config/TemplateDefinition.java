package io.tapdb.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateCode;

/**
 * A structurally valid template read from configuration.
 */
public record TemplateDefinition(
    String sourceFile,
    String name,
    String polymorphicDiscriminator,
    TemplateCode code,
    String instancePrefix,
    String instancePolymorphicIdentity,
    boolean singleton,
    String status,
    JsonNode payload,
    JsonNode payloadSchema
) {

    public Template toDraft() {
        return Template.draft(name, polymorphicDiscriminator, code, instancePrefix, instancePolymorphicIdentity,
            payload, payloadSchema, status, singleton);
    }
}
