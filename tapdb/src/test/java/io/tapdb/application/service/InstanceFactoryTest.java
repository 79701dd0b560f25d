package io.tapdb.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.application.action.ActionHandlerRegistry;
import io.tapdb.bootstrap.TapdbEngine;
import io.tapdb.domain.error.DuplicateEdgeException;
import io.tapdb.domain.error.SchemaValidationException;
import io.tapdb.domain.error.SelfReferenceNotAllowedException;
import io.tapdb.domain.error.SingletonConflictException;
import io.tapdb.domain.error.TemplateIntegrityException;
import io.tapdb.domain.error.TemplateNotFoundException;
import io.tapdb.domain.euid.EuidCodec;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.domain.model.Template;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import io.tapdb.support.H2TestSupport;
import io.tapdb.support.TestTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static io.tapdb.support.TestTemplates.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InstanceFactory against an in-memory store.
 *
 * Tests:
 * - Identifier, property merge and schema validation
 * - Singleton enforcement
 * - Layout cascades and their all-or-nothing rollback
 * - Manual linking rules
 */
@DisplayName("Instance Factory Tests")
class InstanceFactoryTest {

    private static final String PLATE = "container/plate/fixed-plate-96/1.0/";
    private static final String WELL = "content/well/standard/1.0";
    private static final String TUBE = "container/tube/generic/1.0";

    private TapdbEngine engine;
    private UnitOfWork uow;

    private void start(TapdbEngine started) {
        engine = started;
        uow = engine.database().begin();
    }

    @AfterEach
    void tearDown() {
        if (uow != null) {
            uow.close();
        }
    }

    private long liveInstances() {
        return engine.instanceRepository().count(uow, InstanceFilter.all());
    }

    private long liveEdges() {
        return engine.lineageRepository().count(uow, false);
    }

    @Test
    @DisplayName("Plate instance gets a valid CX identifier and merged properties")
    void testCreateInstance() {
        TapdbEngine e = H2TestSupport.newEngine();
        TestTemplates.create(e, PLATE, "CX", """
            {"properties": {"barcode": "", "dims": {"rows": 8, "columns": 12}}}
            """, """
            {"type": "object", "properties": {"barcode": {"type": "string"}}}
            """, false);
        start(e);

        Instance plate = engine.instanceFactory().createInstance(uow, PLATE, "Plate 1",
            json("{\"barcode\": \"PL-1\", \"dims\": {\"rows\": 16}}"));

        assertTrue(plate.euid().startsWith("CX-"));
        assertTrue(EuidCodec.validate(plate.euid()));
        assertEquals("Plate 1", plate.name());
        assertEquals("created", plate.status());
        assertEquals("container_instance", plate.polymorphicDiscriminator());
        assertEquals("container/plate/fixed-plate-96/1.0", plate.templateCode().toString());
        ObjectNode props = plate.properties();
        assertEquals("PL-1", props.get("barcode").asText());
        assertEquals(16, props.get("dims").get("rows").asInt());
        assertEquals(12, props.get("dims").get("columns").asInt());
        assertTrue(plate.actionGroups().isEmpty());

        Instance second = engine.instanceFactory().createInstance(uow, PLATE, "Plate 2");
        assertNotEquals(plate.euid(), second.euid());
        assertEquals(EuidCodec.decode(plate.euid()).counterValue() + 1,
            EuidCodec.decode(second.euid()).counterValue());
    }

    @Test
    @DisplayName("Schema violation writes nothing")
    void testSchemaViolation() {
        TapdbEngine e = H2TestSupport.newEngine();
        TestTemplates.create(e, PLATE, "CX", "{}",
            "{\"type\": \"object\", \"required\": [\"barcode\"]}", false);
        start(e);

        assertThrows(SchemaValidationException.class,
            () -> engine.instanceFactory().createInstance(uow, PLATE, "Plate 1"));
        assertEquals(0, liveInstances());
        assertEquals(0, engine.auditRepository().count(uow));
    }

    @Test
    @DisplayName("Unknown template code is rejected")
    void testUnknownTemplate() {
        start(H2TestSupport.newEngine());

        assertThrows(TemplateNotFoundException.class,
            () -> engine.instanceFactory().createInstance(uow, "container/plate/nope/1.0", "X"));
    }

    @Test
    @DisplayName("Singleton templates allow one live instance")
    void testSingleton() {
        TapdbEngine e = H2TestSupport.newEngine();
        TestTemplates.create(e, "equipment/freezer/minus-80/1.0", "EX", "{}", null, true);
        TestTemplates.create(e, WELL, "MX", "{}");
        start(e);
        String code = "equipment/freezer/minus-80/1.0";

        Instance first = engine.instanceFactory().createInstance(uow, code, "Freezer");
        SingletonConflictException conflict = assertThrows(SingletonConflictException.class,
            () -> engine.instanceFactory().createInstance(uow, code, "Freezer again"));
        assertEquals(1, liveInstances());
        assertNotNull(conflict.getMessage());

        Instance same = engine.instanceFactory().getOrCreateSingleton(uow, code, "ignored", null);
        assertEquals(first.euid(), same.euid());

        engine.instanceRepository().softDelete(uow, first.uuid());
        Instance replacement = engine.instanceFactory().getOrCreateSingleton(uow, code, "Freezer 2", null);
        assertNotEquals(first.euid(), replacement.euid());

        assertThrows(TemplateIntegrityException.class,
            () -> engine.instanceFactory().getOrCreateSingleton(uow, WELL, "Well", null));
    }

    @Test
    @DisplayName("Layout creates one T1 child and three T2 children, all linked")
    void testLayoutCascade() {
        TapdbEngine e = H2TestSupport.newEngine();
        TestTemplates.create(e, WELL, "MX", "{}");
        TestTemplates.create(e, TUBE, "CX", "{}");
        TestTemplates.create(e, PLATE, "CX", """
            {"instantiation_layouts": [{"relationship_type": "contains",
              "child_templates": ["%s", {"template_code": "%s", "count": 3, "name_pattern": "{parent_name}_tube_{index}"}]}]}
            """.formatted(WELL, TUBE), null, false);
        start(e);

        Instance plate = engine.instanceFactory().createInstance(uow, PLATE, "P");

        List<Instance> children = engine.lineageGraphManager().childrenOf(uow, plate);
        assertEquals(4, children.size());
        assertEquals(5, liveInstances());
        assertEquals(4, liveEdges());
        List<String> names = children.stream().map(Instance::name).sorted().collect(Collectors.toList());
        assertEquals(List.of("P_standard_1", "P_tube_1", "P_tube_2", "P_tube_3"), names);
        for (LineageEdge edge : engine.lineageGraphManager().edgesFrom(uow, plate)) {
            assertEquals("contains", edge.relationshipType());
            assertEquals("container_instance", edge.parentType());
        }

        Instance bare = engine.instanceFactory().createInstance(uow, PLATE, "Bare", null, false);
        assertTrue(engine.lineageGraphManager().childrenOf(uow, bare).isEmpty());
    }

    @Test
    @DisplayName("Parent names containing braces are copied into child names verbatim")
    void testLayoutNamesKeepParentName() {
        TapdbEngine e = H2TestSupport.newEngine();
        TestTemplates.create(e, WELL, "MX", "{}");
        TestTemplates.create(e, PLATE, "CX", """
            {"instantiation_layouts": [{"child_templates": [{"template_code": "%s", "count": 2}]}]}
            """.formatted(WELL), null, false);
        start(e);

        Instance rack = engine.instanceFactory().createInstance(uow, PLATE, "Rack {index}");

        List<String> names = engine.lineageGraphManager().childrenOf(uow, rack).stream()
            .map(Instance::name).sorted().collect(Collectors.toList());
        assertEquals(List.of("Rack {index}_standard_1", "Rack {index}_standard_2"), names);
    }

    @Test
    @DisplayName("Failure on the third T2 child rolls back the whole cascade")
    void testLayoutCascadeRollback() {
        PayloadSchemaValidator failingThirdTube = new PayloadSchemaValidator() {
            private int tubes;

            @Override
            public void validate(Template template, JsonNode properties) {
                if (template.type().equals("tube") && ++tubes == 3) {
                    throw new SchemaValidationException(template.code().toString(), List.of("rejected"));
                }
                super.validate(template, properties);
            }
        };
        TapdbEngine e = new TapdbEngine(H2TestSupport.newDatabase(), null,
            ActionHandlerRegistry.withBuiltIns(), failingThirdTube);
        e.startup();
        TestTemplates.create(e, WELL, "MX", "{}");
        TestTemplates.create(e, TUBE, "CX", "{}");
        TestTemplates.create(e, PLATE, "CX", """
            {"instantiation_layouts": [{"child_templates": ["%s", {"template_code": "%s", "count": 3}]}]}
            """.formatted(WELL, TUBE), null, false);
        start(e);

        Instance before = engine.instanceFactory().createInstance(uow, WELL, "kept");
        long auditRows = engine.auditRepository().count(uow);

        assertThrows(SchemaValidationException.class,
            () -> engine.instanceFactory().createInstance(uow, PLATE, "P"));

        assertEquals(1, liveInstances());
        assertEquals(0, liveEdges());
        assertEquals(auditRows, engine.auditRepository().count(uow));
        assertTrue(engine.instanceRepository().findByUuid(uow, before.uuid(), false).isPresent());
    }

    @Test
    @DisplayName("Cyclic layouts are rejected without writes")
    void testLayoutCycle() {
        TapdbEngine e = H2TestSupport.newEngine();
        TestTemplates.create(e, "container/box/a/1.0", "CX",
            "{\"instantiation_layouts\": [{\"child_templates\": [\"container/box/b/1.0\"]}]}");
        TestTemplates.create(e, "container/box/b/1.0", "CX",
            "{\"instantiation_layouts\": [{\"child_templates\": [\"container/box/a/1.0\"]}]}");
        start(e);

        TemplateIntegrityException error = assertThrows(TemplateIntegrityException.class,
            () -> engine.instanceFactory().createInstance(uow, "container/box/a/1.0", "A"));

        assertTrue(error.getMessage().contains("cycle"));
        assertEquals(0, liveInstances());
        assertEquals(0, liveEdges());
    }

    @Test
    @DisplayName("Action imports are materialized into action groups")
    void testActionMaterialization() {
        TapdbEngine e = H2TestSupport.newEngine();
        Template action = TestTemplates.create(e, "action/core/set_status/1.0", "XX",
            "{\"action_definition\": {\"action_name\": \"Set status\", \"target_status\": \"done\"}}");
        TestTemplates.create(e, WELL, "MX", """
            {"action_imports": {"set_status": "action/core/set_status/1.0",
                                "missing": "action/core/none/1.0"}}
            """);
        start(e);

        Instance well = engine.instanceFactory().createInstance(uow, WELL, "W");

        JsonNode entry = well.actionGroups().get("core_actions").get("set_status");
        assertEquals(action.uuid().toString(), entry.get("action_template_uuid").asText());
        assertEquals(action.euid(), entry.get("action_template_euid").asText());
        assertEquals("action/core/set_status/1.0/", entry.get("action_template_code").asText());
        assertEquals("Set status", entry.get("action_name").asText());
        assertEquals("done", entry.get("target_status").asText());
        assertEquals("0", entry.get("action_executed").asText());
        assertTrue(entry.get("executed_datetime").isEmpty());
        assertEquals("1", entry.get("action_enabled").asText());
        assertFalse(well.actionGroups().get("core_actions").has("missing"));
    }

    @Test
    @DisplayName("Manual links reject duplicates and self references")
    void testLinking() {
        TapdbEngine e = H2TestSupport.newEngine();
        TestTemplates.create(e, WELL, "MX", "{}");
        start(e);
        Instance a = engine.instanceFactory().createInstance(uow, WELL, "A");
        Instance b = engine.instanceFactory().createInstance(uow, WELL, "B");

        LineageEdge edge = engine.instanceFactory().linkInstances(uow, a, b);
        assertEquals(LineageEdge.MANUAL_RELATIONSHIP, edge.relationshipType());
        assertTrue(edge.euid().startsWith("GN-"));
        assertEquals(a.euid() + "->" + b.euid(), edge.name());

        assertThrows(DuplicateEdgeException.class, () -> engine.instanceFactory().linkInstances(uow, a, b));
        assertEquals(1, liveEdges());

        assertDoesNotThrow(() -> engine.instanceFactory().linkInstances(uow, a, b, "derived_from"));
        assertDoesNotThrow(() -> engine.instanceFactory().linkInstances(uow, b, a));
        assertThrows(SelfReferenceNotAllowedException.class,
            () -> engine.instanceFactory().linkInstances(uow, a, a));
        assertEquals(3, liveEdges());

        engine.lineageGraphManager().softDeleteEdge(uow, edge);
        LineageEdge relinked = engine.instanceFactory().linkInstances(uow, a, b);
        assertNotEquals(edge.euid(), relinked.euid());
    }
}
