package io.tapdb.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.tapdb.domain.error.TemplateIntegrityException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code instantiation_layouts} payload section.
 *
 * <p>Accepted shape:
 * <pre>
 * [
 *   {
 *     "relationship_type": "contains",
 *     "name_pattern": "{parent_name}_well_{index}",
 *     "child_templates": [
 *       "content/well/standard/1.0",
 *       {"template_code": "content/sample/blood/1.0", "count": 3, "name_pattern": "..."}
 *     ]
 *   }
 * ]
 * </pre>
 * Shared by the config validator and the instance factory so both read layouts the same way.
 */
public final class InstantiationLayouts {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private InstantiationLayouts() {}

    /** Every structural problem of the section; empty when well formed or absent. */
    public static List<String> validate(JsonNode layouts) {
        List<String> errors = new ArrayList<>();
        if (isAbsent(layouts)) {
            return errors;
        }
        if (!layouts.isArray()) {
            errors.add("instantiation_layouts: must be a list");
            return errors;
        }
        for (int i = 0; i < layouts.size(); i++) {
            validateLayout(layouts.get(i), "instantiation_layouts[" + i + "]", errors);
        }
        return errors;
    }

    /**
     * Parse a well formed section.
     *
     * @throws TemplateIntegrityException listing the problems when malformed
     */
    public static List<InstantiationLayout> parse(String templateCode, JsonNode layouts) {
        List<String> errors = validate(layouts);
        if (!errors.isEmpty()) {
            throw new TemplateIntegrityException(templateCode,
                "malformed instantiation layouts: " + String.join("; ", errors));
        }
        if (isAbsent(layouts)) {
            return Collections.emptyList();
        }
        List<InstantiationLayout> result = new ArrayList<>();
        for (JsonNode layout : layouts) {
            String relationship = textOrNull(layout, "relationship_type");
            List<ChildTemplateRef> children = new ArrayList<>();
            for (JsonNode child : layout.get("child_templates")) {
                if (child.isTextual()) {
                    children.add(new ChildTemplateRef(TemplateCode.parse(child.asText()), 1, null));
                } else {
                    int count = child.has("count") ? child.get("count").intValue() : 1;
                    children.add(new ChildTemplateRef(
                        TemplateCode.parse(child.get("template_code").asText()), count,
                        textOrNull(child, "name_pattern")));
                }
            }
            result.add(new InstantiationLayout(
                relationship == null ? LineageEdge.LAYOUT_RELATIONSHIP : relationship,
                textOrNull(layout, "name_pattern"), children));
        }
        return result;
    }

    /** Every child template code referenced by the section, in declaration order. */
    public static List<String> referencedCodes(JsonNode layouts) {
        List<String> codes = new ArrayList<>();
        if (isAbsent(layouts) || !layouts.isArray()) {
            return codes;
        }
        for (JsonNode layout : layouts) {
            JsonNode children = layout.get("child_templates");
            if (children == null || !children.isArray()) {
                continue;
            }
            for (JsonNode child : children) {
                if (child.isTextual()) {
                    codes.add(child.asText());
                } else if (child.isObject() && child.path("template_code").isTextual()) {
                    codes.add(child.get("template_code").asText());
                }
            }
        }
        return codes;
    }

    /**
     * Substitute {@code {placeholder}} tokens in a single pass, so substituted
     * values are never expanded again. Unknown placeholders are left as written.
     */
    public static String renderName(String pattern, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder name = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = values.containsKey(key)
                ? (values.get(key) == null ? "" : values.get(key))
                : matcher.group();
            matcher.appendReplacement(name, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(name);
        return name.toString();
    }

    private static void validateLayout(JsonNode layout, String path, List<String> errors) {
        if (layout == null || !layout.isObject()) {
            errors.add(path + ": must be an object");
            return;
        }
        JsonNode relationship = layout.get("relationship_type");
        if (relationship != null && (!relationship.isTextual() || relationship.asText().isBlank())) {
            errors.add(path + ".relationship_type: must be a non-empty string");
        }
        JsonNode pattern = layout.get("name_pattern");
        if (pattern != null && !pattern.isTextual()) {
            errors.add(path + ".name_pattern: must be a string");
        }
        JsonNode children = layout.get("child_templates");
        if (children == null || !children.isArray()) {
            errors.add(path + ".child_templates: must be a list");
            return;
        }
        for (int j = 0; j < children.size(); j++) {
            validateChild(children.get(j), path + ".child_templates[" + j + "]", errors);
        }
    }

    private static void validateChild(JsonNode child, String path, List<String> errors) {
        if (child.isTextual()) {
            if (!TemplateCode.isValid(child.asText())) {
                errors.add(path + ": invalid template code '" + child.asText() + "'");
            }
            return;
        }
        if (!child.isObject()) {
            errors.add(path + ": must be a template code or an object");
            return;
        }
        JsonNode code = child.get("template_code");
        if (code == null || !code.isTextual()) {
            errors.add(path + ".template_code: required string");
        } else if (!TemplateCode.isValid(code.asText())) {
            errors.add(path + ".template_code: invalid template code '" + code.asText() + "'");
        }
        JsonNode count = child.get("count");
        if (count != null && (!count.isIntegralNumber() || !count.canConvertToInt() || count.intValue() < 1)) {
            errors.add(path + ".count: must be an integer >= 1");
        }
        JsonNode pattern = child.get("name_pattern");
        if (pattern != null && !pattern.isTextual()) {
            errors.add(path + ".name_pattern: must be a string");
        }
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || (node.isContainerNode() && node.isEmpty());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
