package io.tapdb.application.service;

import io.tapdb.application.service.DatabaseStatusService.TableCount;
import io.tapdb.bootstrap.TapdbEngine;
import io.tapdb.domain.error.ObjectNotFoundException;
import io.tapdb.domain.error.TemplateNotFoundException;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.domain.model.ObjectKind;
import io.tapdb.domain.model.Page;
import io.tapdb.domain.model.TapdbObject;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateFilter;
import io.tapdb.infrastructure.persistence.CoreTables;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import io.tapdb.support.H2TestSupport;
import io.tapdb.support.TestTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObjectServiceTest {

    private static final String WELL = "content/well/standard/1.0";

    private TapdbEngine engine;
    private UnitOfWork uow;
    private ObjectService objects;
    private Template wellTemplate;

    @BeforeEach
    void setUp() {
        engine = H2TestSupport.newEngine();
        wellTemplate = TestTemplates.create(engine, WELL, "MX", "{}");
        uow = engine.database().begin();
        objects = engine.objectService();
    }

    @AfterEach
    void tearDown() {
        uow.close();
    }

    @Test
    void findByEuidRoutesEveryObjectKind() {
        Instance a = engine.instanceFactory().createInstance(uow, WELL, "A");
        Instance b = engine.instanceFactory().createInstance(uow, WELL, "B");
        LineageEdge edge = objects.createEdge(uow, a.euid(), b.euid(), null);

        TapdbObject template = objects.getByEuid(uow, wellTemplate.euid());
        assertEquals(wellTemplate.uuid(), template.uuid());
        assertEquals(ObjectKind.CONTENT, template.kind());

        assertEquals(a.uuid(), objects.getByEuid(uow, a.euid()).uuid());
        TapdbObject foundEdge = objects.getByEuid(uow, edge.euid());
        assertEquals(edge.uuid(), foundEdge.uuid());
        assertEquals(ObjectKind.GENERIC, foundEdge.kind());
        assertEquals(LineageEdge.MANUAL_RELATIONSHIP, edge.relationshipType());

        assertThrows(ObjectNotFoundException.class, () -> objects.getByEuid(uow, "MX-ZZZZ9"));
        assertThrows(ObjectNotFoundException.class, () -> objects.getInstance(uow, wellTemplate.euid()));
    }

    @Test
    void softDeleteDispatchesByKind() {
        Instance a = engine.instanceFactory().createInstance(uow, WELL, "A");
        Instance b = engine.instanceFactory().createInstance(uow, WELL, "B");
        LineageEdge edge = objects.createEdge(uow, a.euid(), b.euid(), "contains");

        assertTrue(objects.softDelete(uow, edge.euid()) instanceof LineageEdge);
        assertTrue(objects.softDelete(uow, b.euid()) instanceof Instance);
        assertTrue(objects.findByEuid(uow, b.euid(), false).isEmpty());
        assertTrue(objects.findByEuid(uow, b.euid(), true).orElseThrow().deleted());
        assertThrows(ObjectNotFoundException.class, () -> objects.softDelete(uow, b.euid()));

        objects.softDelete(uow, wellTemplate.euid());
        assertThrows(TemplateNotFoundException.class,
            () -> engine.instanceFactory().createInstance(uow, WELL, "C"));
        assertTrue(objects.findByEuid(uow, a.euid(), false).isPresent());
    }

    @Test
    void listingIsPaginated() {
        for (int i = 1; i <= 5; i++) {
            engine.instanceFactory().createInstance(uow, WELL, "W" + i);
        }

        Page<Instance> first = objects.listInstances(uow, InstanceFilter.all(), 1, 2);
        assertEquals(2, first.items().size());
        assertEquals(5, first.total());
        assertEquals(3, first.totalPages());
        assertTrue(first.hasNext());

        Page<Instance> last = objects.listInstances(uow, InstanceFilter.all(), 3, 2);
        assertEquals(1, last.items().size());
        assertFalse(last.hasNext());

        Page<Instance> clamped = objects.listInstances(uow, InstanceFilter.all(), 0, 10_000);
        assertEquals(1, clamped.page());
        assertEquals(ObjectService.MAX_PAGE_SIZE, clamped.pageSize());
        assertEquals(5, clamped.items().size());

        Page<Template> templates = objects.listTemplates(uow, TemplateFilter.byCategory("content"), 1, 10);
        assertEquals(1, templates.total());
        assertEquals(0, objects.listEdges(uow, false, 1, 10).total());
    }

    @Test
    void tableCountsSeparateLiveFromTotal() {
        Instance a = engine.instanceFactory().createInstance(uow, WELL, "A");
        engine.instanceFactory().createInstance(uow, WELL, "B");
        objects.softDelete(uow, a.euid());

        Map<String, TableCount> counts = engine.statusService().tableCounts(uow);

        assertEquals(CoreTables.ALL, List.copyOf(counts.keySet()));
        assertEquals(new TableCount(1, 1), counts.get(CoreTables.TEMPLATE));
        assertEquals(new TableCount(1, 2), counts.get(CoreTables.INSTANCE));
        assertEquals(new TableCount(0, 0), counts.get(CoreTables.LINEAGE));
        assertTrue(counts.get(CoreTables.AUDIT_LOG).total() >= 4);
    }
}
