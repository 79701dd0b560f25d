package io.tapdb.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.application.action.ActionContext;
import io.tapdb.application.action.ActionHandler;
import io.tapdb.application.action.ActionHandlerRegistry;
import io.tapdb.application.action.ActionResult;
import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.domain.error.ActionHandlerFailureException;
import io.tapdb.domain.error.UnknownActionException;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.Template;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs registered action handlers against instances.
 *
 * <p>The handler runs under its own savepoint. A failing handler has its writes
 * rolled back and is reported as a failed result; writes made earlier in the
 * same unit of work survive.
 */
public class ActionDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    public static final String ACTION_RECORD_STATUS = "completed";

    private final ActionHandlerRegistry handlerRegistry;
    private final InstanceRepository instanceRepository;
    private final TemplateRepository templateRepository;

    public ActionDispatcher(ActionHandlerRegistry handlerRegistry, InstanceRepository instanceRepository,
                            TemplateRepository templateRepository) {
        this.handlerRegistry = handlerRegistry;
        this.instanceRepository = instanceRepository;
        this.templateRepository = templateRepository;
    }

    public ActionResult executeAction(UnitOfWork uow, Instance instance, String actionGroup, String actionKey,
                                      JsonNode actionDefinition, JsonNode capturedData, String actor) {
        return executeAction(uow, instance, actionGroup, actionKey, actionDefinition, capturedData, actor, true);
    }

    /**
     * Execute {@code actionKey} on {@code instance}.
     *
     * @param actor              recorded as {@code executed_by}; defaults to the unit of work's actor
     * @param createActionRecord create an action instance describing a successful execution
     * @throws UnknownActionException when no handler is registered for the key
     */
    public ActionResult executeAction(UnitOfWork uow, Instance instance, String actionGroup, String actionKey,
                                      JsonNode actionDefinition, JsonNode capturedData, String actor,
                                      boolean createActionRecord) {
        ActionHandler handler = handlerRegistry.get(actionKey);
        String executedBy = actor == null ? uow.actor() : actor;
        ActionContext context = new ActionContext(uow, instanceRepository, instance, actionGroup, actionKey,
            actionDefinition, capturedData, executedBy);

        ActionResult result;
        try {
            ActionResult handled = uow.atomically(() -> handler.handle(context));
            result = handled != null ? handled : ActionResult.success(actionKey + " completed");
        } catch (RuntimeException e) {
            log.error("Action {} failed on {}", actionKey, instance.euid(), e);
            result = ActionResult.failure(new ActionHandlerFailureException(actionKey, instance.euid(), e));
        }

        Instance current = result.success()
            ? context.instance()
            : instanceRepository.findByUuid(uow, instance.uuid(), true).orElse(instance);
        current = trackExecution(uow, current, actionGroup, actionKey);

        if (result.success() && createActionRecord) {
            createActionRecord(uow, current, actionGroup, actionKey, context.actionDefinition(),
                context.capturedData(), result, executedBy);
        }
        log.info("Action {} on {} by {}: {}", actionKey, instance.euid(), executedBy, result.status());
        return result.withInstance(current);
    }

    /** Bump {@code action_executed} and append a timestamp when the instance carries the action. */
    private Instance trackExecution(UnitOfWork uow, Instance instance, String actionGroup, String actionKey) {
        ObjectNode groups = instance.actionGroups();
        JsonNode entry = groups.path(actionGroup).get(actionKey);
        if (entry == null || !entry.isObject()) {
            return instance;
        }
        ObjectNode action = (ObjectNode) entry;
        int executed = parseCount(action.path("action_executed").asText("0"));
        action.put("action_executed", String.valueOf(executed + 1));
        JsonNode timestamps = action.get("executed_datetime");
        ArrayNode history = timestamps != null && timestamps.isArray()
            ? (ArrayNode) timestamps : action.putArray("executed_datetime");
        history.add(Instant.now().toString());
        return instanceRepository.update(uow, instance.withActionGroups(groups));
    }

    private void createActionRecord(UnitOfWork uow, Instance target, String actionGroup, String actionKey,
                                    JsonNode definition, JsonNode capturedData, ActionResult result,
                                    String executedBy) {
        String templateRef = definition.path("action_template_uuid").asText(null);
        if (templateRef == null || templateRef.isBlank()) {
            log.warn("Action {} on {} has no action template reference; no action record created",
                actionKey, target.euid());
            return;
        }
        Optional<Template> actionTemplate = findTemplate(uow, templateRef);
        if (actionTemplate.isEmpty()) {
            log.warn("Action template {} for {} not found; no action record created", templateRef, actionKey);
            return;
        }

        ObjectNode record = JsonNodeFactory.instance.objectNode();
        record.put("target_instance_uuid", target.uuid().toString());
        record.put("target_instance_euid", target.euid());
        record.put("action_group", actionGroup);
        record.put("action_key", actionKey);
        record.set("action_definition", definition.deepCopy());
        record.set("captured_data", capturedData.deepCopy());
        record.set("result", result.toJson());
        record.put("executed_by", executedBy);
        record.put("executed_at", Instant.now().toString());
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.set("properties", record);

        Template template = actionTemplate.get();
        Instance saved = instanceRepository.insert(uow,
            Instance.draft(template, actionKey + "@" + target.euid(), payload, ACTION_RECORD_STATUS),
            template.instancePrefix());
        log.info("Recorded action {} on {} as {}", actionKey, target.euid(), saved.euid());
    }

    private Optional<Template> findTemplate(UnitOfWork uow, String reference) {
        try {
            return templateRepository.findByUuid(uow, UUID.fromString(reference), false);
        } catch (IllegalArgumentException e) {
            return templateRepository.findByEuid(uow, reference, false);
        }
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
