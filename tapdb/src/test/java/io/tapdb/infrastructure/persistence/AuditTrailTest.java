package io.tapdb.infrastructure.persistence;

import io.tapdb.bootstrap.TapdbEngine;
import io.tapdb.domain.model.AuditEntry;
import io.tapdb.domain.model.AuditOperation;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateFilter;
import io.tapdb.support.H2TestSupport;
import io.tapdb.support.TestTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Audit trail and soft delete behaviour of the JDBC repositories, against H2.
 *
 * Tests:
 * - INSERT entries on create
 * - One UPDATE entry per changed column, none for unchanged values
 * - Soft delete keeps the row and writes one DELETE entry with a snapshot
 * - Per-table history reads
 */
@DisplayName("Audit Trail Tests")
class AuditTrailTest {

    private TapdbEngine engine;
    private UnitOfWork uow;
    private Template wellTemplate;

    @BeforeEach
    void setUp() {
        engine = H2TestSupport.newEngine();
        wellTemplate = TestTemplates.create(engine, "content/well/standard/1.0", "MX",
            "{\"default_status\": \"new\", \"properties\": {\"volume_ul\": 0}}");
        uow = engine.database().begin();
    }

    @AfterEach
    void tearDown() {
        uow.close();
    }

    private List<AuditEntry> entries(String euid, AuditOperation operation) {
        return engine.auditRepository().findByTarget(uow, euid).stream()
            .filter(e -> e.operation() == operation)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Creating an instance writes one INSERT entry")
    void testInsertAudited() {
        Instance well = engine.instanceFactory().createInstance(uow, "content/well/standard/1.0", "W1");

        List<AuditEntry> inserts = entries(well.euid(), AuditOperation.INSERT);
        assertEquals(1, inserts.size());
        assertEquals(CoreTables.INSTANCE, inserts.get(0).tableName());
        assertEquals(H2TestSupport.TEST_ACTOR, inserts.get(0).changedBy());
        assertEquals("new", well.status());
    }

    @Test
    @DisplayName("Status change writes exactly one UPDATE entry; same value writes none")
    void testStatusChangeAudited() {
        Instance well = engine.instanceFactory().createInstance(uow, "content/well/standard/1.0", "W1");

        Instance active = engine.instanceRepository().update(uow, well.withStatus("active"));

        List<AuditEntry> updates = entries(well.euid(), AuditOperation.UPDATE);
        assertEquals(1, updates.size());
        assertEquals("status", updates.get(0).columnName());
        assertEquals("new", updates.get(0).oldValue());
        assertEquals("active", updates.get(0).newValue());

        engine.instanceRepository().update(uow, active.withStatus("active"));
        assertEquals(1, entries(well.euid(), AuditOperation.UPDATE).size());
    }

    @Test
    @DisplayName("Soft deleted instance keeps its row and a DELETE snapshot")
    void testInstanceSoftDelete() {
        Instance well = engine.instanceFactory().createInstance(uow, "content/well/standard/1.0", "W1",
            TestTemplates.json("{\"volume_ul\": 40}"));

        assertTrue(engine.instanceRepository().softDelete(uow, well.uuid()));
        assertFalse(engine.instanceRepository().softDelete(uow, well.uuid()));

        assertTrue(engine.instanceRepository().findByEuid(uow, well.euid(), false).isEmpty());
        Instance deleted = engine.instanceRepository().findByEuid(uow, well.euid(), true).orElseThrow();
        assertTrue(deleted.deleted());
        assertEquals(0, engine.instanceRepository().count(uow, InstanceFilter.all()));

        List<AuditEntry> deletes = entries(well.euid(), AuditOperation.DELETE);
        assertEquals(1, deletes.size());
        AuditEntry entry = deletes.get(0);
        assertEquals(well.euid(), entry.deletedRecord().get("euid").asText());
        assertEquals("false", entry.deletedRecord().get("is_deleted").asText());
        assertEquals(40, entry.deletedRecord().get("payload").get("properties").get("volume_ul").asInt());
    }

    @Test
    @DisplayName("Soft deleted template and edge are audited the same way")
    void testTemplateAndEdgeSoftDelete() {
        Instance a = engine.instanceFactory().createInstance(uow, "content/well/standard/1.0", "A");
        Instance b = engine.instanceFactory().createInstance(uow, "content/well/standard/1.0", "B");
        LineageEdge edge = engine.instanceFactory().linkInstances(uow, a, b);

        assertTrue(engine.lineageGraphManager().softDeleteEdge(uow, edge));
        assertTrue(engine.lineageRepository().findByEuid(uow, edge.euid(), false).isEmpty());
        assertTrue(engine.lineageRepository().findByEuid(uow, edge.euid(), true).orElseThrow().deleted());
        assertEquals(1, entries(edge.euid(), AuditOperation.DELETE).size());
        assertTrue(engine.instanceRepository().findByUuid(uow, a.uuid(), false).isPresent());

        engine.templateService().softDelete(uow, wellTemplate);
        assertTrue(engine.templateRepository().findByEuid(uow, wellTemplate.euid(), false).isEmpty());
        assertTrue(engine.templateRepository().findByEuid(uow, wellTemplate.euid(), true).orElseThrow().deleted());
        assertEquals(0, engine.templateRepository().count(uow, TemplateFilter.all()));
        List<AuditEntry> deletes = entries(wellTemplate.euid(), AuditOperation.DELETE);
        assertEquals(1, deletes.size());
        assertEquals("content", deletes.get(0).deletedRecord().get("category").asText());
    }

    @Test
    @DisplayName("Template update audits each changed column")
    void testTemplateUpdateAudited() {
        engine.templateService().update(uow, wellTemplate.withName("Renamed well").withStatus("retired"));

        List<AuditEntry> updates = entries(wellTemplate.euid(), AuditOperation.UPDATE);
        assertEquals(2, updates.size());
        assertEquals(List.of("name", "status"),
            updates.stream().map(AuditEntry::columnName).sorted().collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Table history is limited and scoped to one table")
    void testFindByTable() {
        for (int i = 1; i <= 3; i++) {
            engine.instanceFactory().createInstance(uow, "content/well/standard/1.0", "W" + i);
        }

        List<AuditEntry> history = engine.auditRepository().findByTable(uow, CoreTables.INSTANCE, 2);
        assertEquals(2, history.size());
        assertTrue(history.stream().allMatch(e -> CoreTables.INSTANCE.equals(e.tableName())));
        assertEquals(3, engine.auditRepository().findByTable(uow, CoreTables.INSTANCE, 10).size());
    }
}
