package io.tapdb.domain.error;

/**
 * Wraps an exception raised by an action handler. Carried inside a failed
 * action result rather than thrown to the caller.
 */
public class ActionHandlerFailureException extends TapdbException {

    private final String actionKey;
    private final String instanceEuid;

    public ActionHandlerFailureException(String actionKey, String instanceEuid, Throwable cause) {
        super(String.format("[%s:%s] action handler failed: %s", actionKey, instanceEuid, cause.getMessage()), cause);
        this.actionKey = actionKey;
        this.instanceEuid = instanceEuid;
    }

    public String getActionKey() {
        return actionKey;
    }

    public String getInstanceEuid() {
        return instanceEuid;
    }
}
