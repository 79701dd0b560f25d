package io.tapdb.application.action;

import io.tapdb.domain.error.UnknownActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit action key to handler map, filled at startup.
 */
public class ActionHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    /** Registry preloaded with {@code set_status} and {@code set_properties}. */
    public static ActionHandlerRegistry withBuiltIns() {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        registry.register(SetStatusActionHandler.ACTION_KEY, new SetStatusActionHandler());
        registry.register(SetPropertiesActionHandler.ACTION_KEY, new SetPropertiesActionHandler());
        return registry;
    }

    public ActionHandlerRegistry register(String actionKey, ActionHandler handler) {
        if (actionKey == null || actionKey.isBlank()) {
            throw new IllegalArgumentException("action key must not be blank");
        }
        ActionHandler previous = handlers.put(actionKey, handler);
        if (previous != null) {
            log.warn("Replaced handler for action {}", actionKey);
        } else {
            log.debug("Registered handler for action {}", actionKey);
        }
        return this;
    }

    public ActionHandler get(String actionKey) {
        ActionHandler handler = actionKey == null ? null : handlers.get(actionKey);
        if (handler == null) {
            throw new UnknownActionException(actionKey);
        }
        return handler;
    }

    public boolean contains(String actionKey) {
        return actionKey != null && handlers.containsKey(actionKey);
    }

    public Set<String> actionKeys() {
        return new TreeSet<>(handlers.keySet());
    }
}
