package io.tapdb.application.action;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Deep-merges captured {@code properties} into the instance properties.
 */
public class SetPropertiesActionHandler implements ActionHandler {

    public static final String ACTION_KEY = "set_properties";

    @Override
    public ActionResult handle(ActionContext context) {
        JsonNode changes = context.capturedData().get("properties");
        if (changes == null || !changes.isObject()) {
            throw new IllegalArgumentException("set_properties requires a 'properties' object");
        }
        context.mergeProperties(changes);
        return ActionResult.success("Updated " + changes.size() + " propert" + (changes.size() == 1 ? "y" : "ies"));
    }
}
