package io.tapdb.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.tapdb.domain.euid.EuidCodec;
import io.tapdb.domain.euid.EuidRegistry;
import io.tapdb.domain.model.InstantiationLayouts;
import io.tapdb.domain.model.TemplateCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of template configuration documents. Needs no database.
 *
 * <p>Checks each document has a {@code templates} list, each template has the
 * required fields with the right types, composite keys are unique, and every
 * referenced template code is well formed. References to templates that are
 * neither in the documents nor in {@code knownCodes} are warnings, or errors
 * in strict mode.
 */
public class TemplateConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(TemplateConfigValidator.class);

    private static final List<String> REQUIRED_FIELDS = List.of(
        "polymorphic_discriminator", "category", "type", "subtype", "version", "instance_prefix");

    public ConfigValidationResult validate(List<TemplateDocument> documents, boolean strict) {
        return validate(documents, strict, Set.of());
    }

    /**
     * @param knownCodes normalized codes of templates that already exist elsewhere
     */
    public ConfigValidationResult validate(List<TemplateDocument> documents, boolean strict, Set<String> knownCodes) {
        List<ConfigIssue> issues = new ArrayList<>();
        List<TemplateDefinition> definitions = new ArrayList<>();
        Map<String, String> seen = new HashMap<>();
        List<Reference> references = new ArrayList<>();

        for (TemplateDocument document : documents) {
            String file = document.sourceFile();
            if (document.parseError() != null) {
                issues.add(ConfigIssue.error(file, null, "invalid JSON: " + document.parseError()));
                continue;
            }
            JsonNode root = document.root();
            if (root == null || !root.isObject()) {
                issues.add(ConfigIssue.error(file, null, "root must be an object"));
                continue;
            }
            JsonNode templates = root.get("templates");
            if (templates == null || !templates.isArray()) {
                issues.add(ConfigIssue.error(file, null, "'templates' must be a list"));
                continue;
            }
            for (int i = 0; i < templates.size(); i++) {
                TemplateDefinition definition = validateTemplate(file, i, templates.get(i), issues, references);
                if (definition == null) {
                    continue;
                }
                String code = definition.code().toString();
                String firstFile = seen.putIfAbsent(code, file);
                if (firstFile != null) {
                    issues.add(ConfigIssue.error(file, code, "duplicate template code, first defined in " + firstFile));
                    continue;
                }
                definitions.add(definition);
            }
        }

        for (Reference ref : references) {
            String target = TemplateCode.normalize(ref.target());
            if (!seen.containsKey(target) && !knownCodes.contains(target)) {
                String message = ref.kind() + " references unknown template " + ref.target();
                issues.add(strict
                    ? ConfigIssue.error(ref.sourceFile(), ref.templateCode(), message)
                    : ConfigIssue.warning(ref.sourceFile(), ref.templateCode(), message));
            }
        }

        ConfigValidationResult result = new ConfigValidationResult(definitions, issues);
        log.info("Validated {} template(s): {} error(s), {} warning(s)",
            definitions.size(), result.errors().size(), result.warnings().size());
        return result;
    }

    private TemplateDefinition validateTemplate(String file, int index, JsonNode node, List<ConfigIssue> issues,
                                                List<Reference> references) {
        String label = "templates[" + index + "]";
        if (node == null || !node.isObject()) {
            issues.add(ConfigIssue.error(file, label, "template must be an object"));
            return null;
        }
        int errorsBefore = errorCount(issues);

        for (String field : REQUIRED_FIELDS) {
            JsonNode value = node.get(field);
            if (value == null || !value.isTextual() || value.asText().isBlank()) {
                issues.add(ConfigIssue.error(file, label, "'" + field + "' must be a non-empty string"));
            }
        }
        if (errorCount(issues) > errorsBefore) {
            return null;
        }

        TemplateCode code;
        try {
            code = new TemplateCode(text(node, "category"), text(node, "type"), text(node, "subtype"),
                text(node, "version"));
        } catch (IllegalArgumentException e) {
            issues.add(ConfigIssue.error(file, label, e.getMessage()));
            return null;
        }
        String codeText = code.toString();
        if (!TemplateCode.isValid(codeText)) {
            issues.add(ConfigIssue.error(file, codeText, "template code segments must not contain '/' or padding"));
        }

        String prefix = text(node, "instance_prefix").trim().toUpperCase();
        if (!EuidCodec.isValidPrefix(prefix)) {
            issues.add(ConfigIssue.error(file, codeText,
                "instance_prefix must contain identifier letters only (no I, L, O, U or digits)"));
        } else if (EuidRegistry.TEMPLATE_PREFIX.equals(prefix) || EuidRegistry.LINEAGE_PREFIX.equals(prefix)) {
            issues.add(ConfigIssue.error(file, codeText, "instance_prefix " + prefix + " is reserved"));
        }

        JsonNode singleton = node.get("is_singleton");
        if (singleton != null && !singleton.isBoolean()) {
            issues.add(ConfigIssue.error(file, codeText, "'is_singleton' must be a boolean"));
        }
        for (String optional : List.of("name", "status", "instance_polymorphic_identity")) {
            JsonNode value = node.get(optional);
            if (value != null && !value.isNull() && !value.isTextual()) {
                issues.add(ConfigIssue.error(file, codeText, "'" + optional + "' must be a string"));
            }
        }

        JsonNode payload = node.get("payload");
        if (payload != null && !payload.isNull()) {
            if (!payload.isObject()) {
                issues.add(ConfigIssue.error(file, codeText, "'payload' must be an object"));
            } else {
                validatePayload(file, codeText, payload, issues, references);
            }
        }
        JsonNode schema = node.get("payload_schema");
        if (schema != null && !schema.isNull() && !schema.isObject()) {
            issues.add(ConfigIssue.error(file, codeText, "'payload_schema' must be an object"));
        }

        if (errorCount(issues) > errorsBefore) {
            return null;
        }
        return new TemplateDefinition(file,
            node.hasNonNull("name") ? node.get("name").asText() : code.subtype(),
            text(node, "polymorphic_discriminator"), code, prefix,
            node.hasNonNull("instance_polymorphic_identity") ? node.get("instance_polymorphic_identity").asText() : null,
            singleton != null && singleton.asBoolean(),
            node.hasNonNull("status") ? node.get("status").asText() : "active",
            payload == null || payload.isNull() ? null : payload.deepCopy(),
            schema == null || schema.isNull() ? null : schema.deepCopy());
    }

    private void validatePayload(String file, String code, JsonNode payload, List<ConfigIssue> issues,
                                 List<Reference> references) {
        JsonNode properties = payload.get("properties");
        if (properties != null && !properties.isObject()) {
            issues.add(ConfigIssue.error(file, code, "'payload.properties' must be an object"));
        }

        JsonNode imports = payload.get("action_imports");
        if (imports != null && !imports.isNull()) {
            if (!imports.isObject()) {
                issues.add(ConfigIssue.error(file, code, "'action_imports' must be an object"));
            } else {
                Iterator<Map.Entry<String, JsonNode>> entries = imports.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    JsonNode target = entry.getValue();
                    if (!target.isTextual() || !TemplateCode.isValid(target.asText())) {
                        issues.add(ConfigIssue.error(file, code,
                            "action_imports." + entry.getKey() + " must be a template code"));
                    } else {
                        references.add(new Reference(file, code, "action import " + entry.getKey(), target.asText()));
                    }
                }
            }
        }

        JsonNode layouts = payload.get("instantiation_layouts");
        for (String error : InstantiationLayouts.validate(layouts)) {
            issues.add(ConfigIssue.error(file, code, error));
        }
        for (String target : InstantiationLayouts.referencedCodes(layouts)) {
            if (TemplateCode.isValid(target)) {
                references.add(new Reference(file, code, "instantiation layout", target));
            }
        }
    }

    private static String text(JsonNode node, String field) {
        return node.get(field).asText();
    }

    private static int errorCount(List<ConfigIssue> issues) {
        int count = 0;
        for (ConfigIssue issue : issues) {
            if (issue.isError()) {
                count++;
            }
        }
        return count;
    }

    private record Reference(String sourceFile, String templateCode, String kind, String target) {}
}
