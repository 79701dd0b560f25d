package io.tapdb.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Deep merge of JSON objects.
 */
public final class JsonMerge {

    /**
     * Merge {@code overrides} onto a copy of {@code base}. Nested objects merge
     * recursively; arrays and scalars from {@code overrides} replace. Neither
     * argument is modified.
     */
    public static ObjectNode deepMerge(JsonNode base, JsonNode overrides) {
        ObjectNode result = base != null && base.isObject()
            ? ((ObjectNode) base).deepCopy() : JsonNodeFactory.instance.objectNode();
        if (overrides == null || !overrides.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = result.get(field.getKey());
            JsonNode value = field.getValue();
            if (existing != null && existing.isObject() && value.isObject()) {
                result.set(field.getKey(), deepMerge(existing, value));
            } else {
                result.set(field.getKey(), value.deepCopy());
            }
        }
        return result;
    }

    private JsonMerge() {}
}
