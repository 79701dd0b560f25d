package io.tapdb.application.action;

/**
 * Executes one named action against an instance.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Run the action. Mutations must go through the context so they are audited.
     * Throwing rolls back the handler's writes and yields a failed result.
     */
    ActionResult handle(ActionContext context);
}
