package io.tapdb.application.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.domain.error.ActionHandlerFailureException;
import io.tapdb.domain.model.Instance;

/**
 * Outcome of an action.
 *
 * @param instance the target instance as it stands after the action, set by the dispatcher
 * @param failure  set when the handler threw
 */
public record ActionResult(
    boolean success,
    String message,
    JsonNode data,
    Instance instance,
    ActionHandlerFailureException failure
) {

    public static ActionResult success(String message) {
        return new ActionResult(true, message, JsonNodeFactory.instance.objectNode(), null, null);
    }

    public static ActionResult success(String message, JsonNode data) {
        return new ActionResult(true, message, data, null, null);
    }

    public static ActionResult failure(ActionHandlerFailureException failure) {
        return new ActionResult(false, failure.getMessage(), JsonNodeFactory.instance.objectNode(), null, failure);
    }

    public String status() {
        return success ? "success" : "error";
    }

    public ActionResult withInstance(Instance updated) {
        return new ActionResult(success, message, data, updated, failure);
    }

    /** JSON form stored in action records. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("status", status());
        node.put("message", message);
        node.set("data", data == null ? JsonNodeFactory.instance.objectNode() : data);
        return node;
    }
}
