package io.tapdb.application.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.bootstrap.TapdbEngine;
import io.tapdb.domain.model.GraphExport;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.LineageDirection;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import io.tapdb.support.H2TestSupport;
import io.tapdb.support.TestTemplates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.tapdb.support.TestTemplates.json;
import static org.junit.jupiter.api.Assertions.*;

class LineageGraphManagerTest {

    private static final String PLATE = "container/plate/fixed-plate-96/1.0";
    private static final String WELL = "content/well/standard/1.0";

    private TapdbEngine engine;
    private UnitOfWork uow;
    private LineageGraphManager graph;

    // plate -> w1, w2 (contains); w1 -> sample (generic)
    private Instance plate;
    private Instance w1;
    private Instance w2;
    private Instance sample;

    @BeforeEach
    void setUp() {
        engine = H2TestSupport.newEngine();
        TestTemplates.create(engine, PLATE, "CX", "{}");
        TestTemplates.create(engine, WELL, "MX", "{\"properties\": {\"position\": \"\"}}");
        uow = engine.database().begin();
        graph = engine.lineageGraphManager();

        plate = engine.instanceFactory().createInstance(uow, PLATE, "plate");
        w1 = engine.instanceFactory().createInstance(uow, WELL, "w1", json("{\"position\": \"A1\"}"));
        w2 = engine.instanceFactory().createInstance(uow, WELL, "w2", json("{\"position\": \"A2\"}"));
        sample = engine.instanceFactory().createInstance(uow, WELL, "sample");
        engine.instanceFactory().linkInstances(uow, plate, w1, "contains");
        engine.instanceFactory().linkInstances(uow, plate, w2, "contains");
        engine.instanceFactory().linkInstances(uow, w1, sample);
    }

    @AfterEach
    void tearDown() {
        uow.close();
    }

    private static List<String> names(List<Instance> instances) {
        return instances.stream().map(Instance::name).sorted().collect(Collectors.toList());
    }

    @Test
    void childrenAndParents() {
        assertEquals(List.of("w1", "w2"), names(graph.childrenOf(uow, plate)));
        assertEquals(List.of("w1", "w2"), names(graph.childrenOf(uow, plate, "contains")));
        assertTrue(graph.childrenOf(uow, plate, "generic").isEmpty());
        assertEquals(List.of("plate"), names(graph.parentsOf(uow, w1)));
        assertEquals(List.of("w1"), names(graph.parentsOf(uow, sample, "generic")));
        assertTrue(graph.parentsOf(uow, plate).isEmpty());
    }

    @Test
    void deletedEdgesAndMembersAreHidden() {
        LineageEdge edge = graph.edgesFrom(uow, plate).stream()
            .filter(e -> e.childInstanceUuid().equals(w2.uuid())).findFirst().orElseThrow();
        graph.softDeleteEdge(uow, edge);
        assertEquals(List.of("w1"), names(graph.childrenOf(uow, plate)));

        engine.instanceRepository().softDelete(uow, w1.uuid());
        assertTrue(graph.childrenOf(uow, plate).isEmpty());
    }

    @Test
    void filterMembersMatchesAttributesAndProperties() {
        assertEquals(List.of("w2"),
            names(graph.filterMembers(uow, plate, LineageDirection.CHILDREN, Map.of("position", "A2"))));
        assertEquals(List.of("w1", "w2"),
            names(graph.filterMembers(uow, plate, LineageDirection.CHILDREN, Map.of("subtype", "standard"))));
        assertEquals(List.of("plate"),
            names(graph.filterMembers(uow, w1, LineageDirection.PARENTS, Map.of("category", "container"))));
        assertTrue(graph.filterMembers(uow, plate, LineageDirection.CHILDREN,
            Map.of("subtype", "standard", "position", "Z9")).isEmpty());

        assertThrows(IllegalArgumentException.class,
            () -> graph.filterMembers(uow, plate, LineageDirection.CHILDREN, Map.of()));
    }

    @Test
    void exportGraphFollowsEdgesToDepth() {
        GraphExport oneHop = graph.exportGraph(uow, plate.euid(), 1);
        assertEquals(3, oneHop.nodes().size());
        assertEquals(2, oneHop.edges().size());
        for (GraphExport.Edge edge : oneHop.edges()) {
            assertEquals(plate.euid(), edge.target());
        }

        GraphExport twoHops = graph.exportGraph(uow, plate.euid(), 2);
        assertEquals(4, twoHops.nodes().size());
        assertEquals(3, twoHops.edges().size());

        GraphExport.Node plateNode = twoHops.nodes().stream()
            .filter(n -> n.id().equals(plate.euid())).findFirst().orElseThrow();
        assertEquals("#8B00FF", plateNode.color());
    }

    @Test
    void exportGraphEdgeCases() {
        assertTrue(graph.exportGraph(uow, "CX-ZZZZ9", 3).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> graph.exportGraph(uow, plate.euid(), 0));
        assertThrows(IllegalArgumentException.class, () -> graph.exportGraph(uow, plate.euid(), 11));

        engine.instanceFactory().linkInstances(uow, sample, plate);
        GraphExport cyclic = graph.exportGraph(uow, plate.euid(), 10);
        assertEquals(4, cyclic.nodes().size());
        assertEquals(4, cyclic.edges().size());
    }

    @Test
    void overviewExportAndElementsJson() {
        GraphExport overview = graph.exportGraph(uow);
        assertEquals(4, overview.nodes().size());
        assertEquals(3, overview.edges().size());

        ObjectNode elements = overview.toElements();
        assertEquals(4, elements.get("elements").get("nodes").size());
        assertTrue(elements.get("elements").get("nodes").get(0).has("data"));
        assertEquals(3, elements.get("elements").get("edges").size());
    }
}
