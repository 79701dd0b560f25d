package io.tapdb.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.domain.error.TemplateNotFoundException;
import io.tapdb.domain.model.Template;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;

/**
 * Copies a template's imported action templates into the {@code action_groups}
 * of a new instance.
 *
 * <p>Each import {@code key -> action template code} lands at
 * {@code action_groups["<action type>_actions"][key]}.
 */
public class ActionMaterializer {
    private static final Logger log = LoggerFactory.getLogger(ActionMaterializer.class);

    private final TemplateResolver resolver;

    public ActionMaterializer(TemplateResolver resolver) {
        this.resolver = resolver;
    }

    public ObjectNode materialize(UnitOfWork uow, Template template) {
        ObjectNode groups = JsonNodeFactory.instance.objectNode();
        JsonNode imports = template.actionImports();
        if (imports == null || !imports.isObject()) {
            return groups;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = imports.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String actionKey = entry.getKey();
            String actionCode = entry.getValue().asText();
            Template action;
            try {
                action = resolver.resolve(uow, actionCode);
            } catch (TemplateNotFoundException e) {
                log.warn("Skipping action import {} of {}: {}", actionKey, template.code(), e.getMessage());
                continue;
            }
            String group = action.type() + "_actions";
            ObjectNode groupNode = groups.has(group) ? (ObjectNode) groups.get(group) : groups.putObject(group);
            groupNode.set(actionKey, actionEntry(action));
        }
        return groups;
    }

    private ObjectNode actionEntry(Template action) {
        ObjectNode entry = JsonNodeFactory.instance.objectNode();
        entry.put("action_template_uuid", action.uuid().toString());
        entry.put("action_template_euid", action.euid());
        entry.put("action_template_code", action.code().toCanonicalString());
        JsonNode definition = action.actionDefinition();
        if (definition != null && definition.isObject()) {
            entry.setAll((ObjectNode) definition.deepCopy());
        }
        entry.put("action_executed", "0");
        entry.putArray("executed_datetime");
        entry.put("action_enabled", "1");
        return entry;
    }
}
