package io.tapdb.application.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.domain.model.Instance;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import io.tapdb.util.JsonMerge;

/**
 * What a handler sees: the target instance, the action definition, the data
 * captured from the user, and audited mutation methods.
 */
public class ActionContext {

    private final UnitOfWork unitOfWork;
    private final InstanceRepository instanceRepository;
    private final String actionGroup;
    private final String actionKey;
    private final JsonNode actionDefinition;
    private final JsonNode capturedData;
    private final String actor;
    private Instance instance;

    public ActionContext(UnitOfWork unitOfWork, InstanceRepository instanceRepository, Instance instance,
                         String actionGroup, String actionKey, JsonNode actionDefinition,
                         JsonNode capturedData, String actor) {
        this.unitOfWork = unitOfWork;
        this.instanceRepository = instanceRepository;
        this.instance = instance;
        this.actionGroup = actionGroup;
        this.actionKey = actionKey;
        this.actionDefinition = actionDefinition == null ? JsonNodeFactory.instance.objectNode() : actionDefinition;
        this.capturedData = capturedData == null ? JsonNodeFactory.instance.objectNode() : capturedData;
        this.actor = actor;
    }

    /** Current state of the target instance, including the handler's own changes. */
    public Instance instance() {
        return instance;
    }

    public UnitOfWork unitOfWork() {
        return unitOfWork;
    }

    public String actionGroup() {
        return actionGroup;
    }

    public String actionKey() {
        return actionKey;
    }

    public JsonNode actionDefinition() {
        return actionDefinition;
    }

    public JsonNode capturedData() {
        return capturedData;
    }

    public String actor() {
        return actor;
    }

    public Instance updateStatus(String status) {
        return save(instance.withStatus(status));
    }

    public Instance updateName(String name) {
        return save(instance.withName(name));
    }

    /** Deep-merge {@code changes} into the instance properties. */
    public Instance mergeProperties(JsonNode changes) {
        ObjectNode merged = JsonMerge.deepMerge(instance.properties(), changes);
        return save(instance.withProperties(merged));
    }

    /** Persist an arbitrary modification of the instance. */
    public Instance save(Instance updated) {
        instance = instanceRepository.update(unitOfWork, updated);
        return instance;
    }
}
