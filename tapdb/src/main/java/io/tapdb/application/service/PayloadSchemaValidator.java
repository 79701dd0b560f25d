package io.tapdb.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.tapdb.domain.error.SchemaValidationException;
import io.tapdb.domain.error.TemplateIntegrityException;
import io.tapdb.domain.model.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Validates instance properties against a template's JSON Schema (draft 7).
 * Compiled schemas are cached by their JSON text.
 */
public class PayloadSchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(PayloadSchemaValidator.class);

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<String, JsonSchema> compiled = new ConcurrentHashMap<>();

    /**
     * @throws SchemaValidationException listing every violated field path
     */
    public void validate(Template template, JsonNode properties) {
        if (!template.hasPayloadSchema()) {
            return;
        }
        String code = template.code().toString();
        JsonSchema schema = compile(code, template.payloadSchema());
        Set<ValidationMessage> messages = schema.validate(properties);
        if (!messages.isEmpty()) {
            List<String> violations = messages.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .collect(Collectors.toList());
            log.warn("Properties for {} violate payload schema: {}", code, violations);
            throw new SchemaValidationException(code, violations);
        }
    }

    private JsonSchema compile(String code, JsonNode schemaNode) {
        return compiled.computeIfAbsent(schemaNode.toString(), key -> {
            try {
                return factory.getSchema(schemaNode);
            } catch (RuntimeException e) {
                log.error("Payload schema of {} does not compile", code, e);
                throw new TemplateIntegrityException(code, "payload schema does not compile", e);
            }
        });
    }
}
