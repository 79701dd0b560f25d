package io.tapdb.domain.error;

/**
 * Thrown when no handler is registered for an action key.
 */
public class UnknownActionException extends TapdbException {

    private final String actionKey;

    public UnknownActionException(String actionKey) {
        super(String.format("[%s] no handler registered for action", actionKey));
        this.actionKey = actionKey;
    }

    public String getActionKey() {
        return actionKey;
    }
}
