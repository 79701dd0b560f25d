package io.tapdb.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.application.port.output.LineageRepository;
import io.tapdb.domain.error.DuplicateEdgeException;
import io.tapdb.domain.error.SelfReferenceNotAllowedException;
import io.tapdb.domain.error.SingletonConflictException;
import io.tapdb.domain.error.TemplateIntegrityException;
import io.tapdb.domain.model.ChildTemplateRef;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstantiationLayout;
import io.tapdb.domain.model.InstantiationLayouts;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.domain.model.Template;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import io.tapdb.util.JsonMerge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates instances from templates and links instances together.
 *
 * <p>A top-level call runs under one savepoint: when any part of a cascade
 * fails, every instance, edge and audit row written by that call is rolled back.
 */
public class InstanceFactory {
    private static final Logger log = LoggerFactory.getLogger(InstanceFactory.class);

    public static final int MAX_LAYOUT_DEPTH = 10;

    private final TemplateResolver resolver;
    private final InstanceRepository instanceRepository;
    private final LineageRepository lineageRepository;
    private final PayloadSchemaValidator schemaValidator;
    private final ActionMaterializer actionMaterializer;

    public InstanceFactory(TemplateResolver resolver, InstanceRepository instanceRepository,
                           LineageRepository lineageRepository, PayloadSchemaValidator schemaValidator,
                           ActionMaterializer actionMaterializer) {
        this.resolver = resolver;
        this.instanceRepository = instanceRepository;
        this.lineageRepository = lineageRepository;
        this.schemaValidator = schemaValidator;
        this.actionMaterializer = actionMaterializer;
    }

    public Instance createInstance(UnitOfWork uow, String templateCode, String name) {
        return createInstance(uow, templateCode, name, null, true);
    }

    public Instance createInstance(UnitOfWork uow, String templateCode, String name, JsonNode properties) {
        return createInstance(uow, templateCode, name, properties, true);
    }

    /**
     * Create an instance, and its layout children when {@code createChildren} is set.
     *
     * @param properties caller properties deep-merged over the template defaults; may be null
     */
    public Instance createInstance(UnitOfWork uow, String templateCode, String name, JsonNode properties,
                                   boolean createChildren) {
        return uow.atomically(() ->
            create(uow, templateCode, name, properties, createChildren, 0, new ArrayDeque<>()));
    }

    /**
     * Return the live instance of a singleton template, creating it when absent.
     * Soft-deleted instances are never revived.
     */
    public Instance getOrCreateSingleton(UnitOfWork uow, String templateCode, String name, JsonNode properties) {
        Template template = resolver.resolve(uow, templateCode);
        if (!template.singleton()) {
            throw new TemplateIntegrityException(template.code().toString(), "template is not a singleton");
        }
        Optional<Instance> existing = instanceRepository.findLiveSingleton(uow, template.code());
        if (existing.isPresent()) {
            return existing.get();
        }
        return createInstance(uow, templateCode, name, properties, true);
    }

    public LineageEdge linkInstances(UnitOfWork uow, Instance parent, Instance child) {
        return linkInstances(uow, parent, child, LineageEdge.MANUAL_RELATIONSHIP);
    }

    /**
     * Add a live parent to child edge.
     *
     * @throws SelfReferenceNotAllowedException when parent and child are the same instance
     * @throws DuplicateEdgeException when the same live edge already exists
     */
    public LineageEdge linkInstances(UnitOfWork uow, Instance parent, Instance child, String relationshipType) {
        String relationship = relationshipType == null || relationshipType.isBlank()
            ? LineageEdge.MANUAL_RELATIONSHIP : relationshipType;
        return uow.atomically(() -> link(uow, parent, child, relationship));
    }

    private Instance create(UnitOfWork uow, String templateCode, String name, JsonNode properties,
                            boolean createChildren, int depth, Deque<String> chain) {
        Template template = resolver.resolve(uow, templateCode);
        String code = template.code().toString();
        if (depth > MAX_LAYOUT_DEPTH) {
            throw new TemplateIntegrityException(code,
                "instantiation layouts nest deeper than " + MAX_LAYOUT_DEPTH + " levels");
        }
        if (chain.contains(code)) {
            throw new TemplateIntegrityException(code,
                "cycle in instantiation layouts: " + String.join(" -> ", chain) + " -> " + code);
        }

        ObjectNode finalProperties = JsonMerge.deepMerge(template.defaultProperties(), properties);
        schemaValidator.validate(template, finalProperties);

        if (template.singleton()) {
            instanceRepository.findLiveSingleton(uow, template.code()).ifPresent(existing -> {
                throw new SingletonConflictException(code, existing.euid());
            });
        }

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.set("properties", finalProperties);
        payload.set("action_groups", actionMaterializer.materialize(uow, template));
        Instance instance = instanceRepository.insert(uow,
            Instance.draft(template, name, payload, template.defaultInstanceStatus()), template.instancePrefix());

        if (createChildren) {
            chain.addLast(code);
            try {
                createChildren(uow, instance, template, depth, chain);
            } finally {
                chain.removeLast();
            }
        }
        return instance;
    }

    private void createChildren(UnitOfWork uow, Instance parent, Template template, int depth, Deque<String> chain) {
        List<InstantiationLayout> layouts =
            InstantiationLayouts.parse(template.code().toString(), template.instantiationLayouts());
        for (int li = 0; li < layouts.size(); li++) {
            InstantiationLayout layout = layouts.get(li);
            for (int ci = 0; ci < layout.children().size(); ci++) {
                ChildTemplateRef childRef = layout.children().get(ci);
                for (int index = 1; index <= childRef.count(); index++) {
                    String childName = InstantiationLayouts.renderName(layout.namePatternFor(childRef),
                        nameValues(parent, childRef, li, ci, index));
                    Instance child = create(uow, childRef.templateCode().toString(), childName, null,
                        true, depth + 1, chain);
                    link(uow, parent, child, layout.relationshipType());
                }
            }
        }
    }

    private LineageEdge link(UnitOfWork uow, Instance parent, Instance child, String relationship) {
        if (parent.uuid().equals(child.uuid())) {
            throw new SelfReferenceNotAllowedException(parent.euid());
        }
        if (lineageRepository.findLive(uow, parent.uuid(), child.uuid(), relationship).isPresent()) {
            throw new DuplicateEdgeException(parent.euid(), child.euid(), relationship);
        }
        return lineageRepository.insert(uow, LineageEdge.draft(parent, child, relationship));
    }

    private static Map<String, String> nameValues(Instance parent, ChildTemplateRef child,
                                                  int layoutIndex, int childIndex, int index) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("parent_name", parent.name());
        values.put("parent_euid", parent.euid());
        values.put("index", String.valueOf(index));
        values.put("layout_index", String.valueOf(layoutIndex));
        values.put("child_index", String.valueOf(childIndex));
        values.put("child_subtype", child.templateCode().subtype());
        values.put("child_template_code", child.templateCode().toString());
        return values;
    }
}
