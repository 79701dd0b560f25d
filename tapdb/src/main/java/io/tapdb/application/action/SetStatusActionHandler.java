package io.tapdb.application.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.tapdb.domain.model.Instance;

/**
 * Sets the instance status from captured {@code status}, falling back to the
 * definition's {@code target_status}.
 */
public class SetStatusActionHandler implements ActionHandler {

    public static final String ACTION_KEY = "set_status";

    @Override
    public ActionResult handle(ActionContext context) {
        String status = text(context.capturedData(), "status");
        if (status == null) {
            status = text(context.actionDefinition(), "target_status");
        }
        if (status == null) {
            throw new IllegalArgumentException("set_status requires a 'status' value");
        }
        String previous = context.instance().status();
        Instance updated = context.updateStatus(status);
        return ActionResult.success("Status changed from " + previous + " to " + updated.status(),
            JsonNodeFactory.instance.objectNode().put("previous_status", previous).put("status", status));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
