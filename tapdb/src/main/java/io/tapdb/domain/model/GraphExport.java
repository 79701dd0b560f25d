package io.tapdb.domain.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Node and edge lists of an exported lineage subgraph. Edges point from child
 * ({@code source}) to parent ({@code target}).
 */
public record GraphExport(List<Node> nodes, List<Edge> edges) {

    public GraphExport {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static GraphExport empty() {
        return new GraphExport(List.of(), List.of());
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Graph-viewer document: {@code {"elements": {"nodes": [{"data": ...}], "edges": [...]}}}. */
    public ObjectNode toElements() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ArrayNode nodeArray = f.arrayNode();
        for (Node n : nodes) {
            ObjectNode data = f.objectNode()
                .put("id", n.id())
                .put("name", n.name())
                .put("category", n.category())
                .put("type", n.type())
                .put("subtype", n.subtype())
                .put("color", n.color());
            nodeArray.addObject().set("data", data);
        }
        ArrayNode edgeArray = f.arrayNode();
        for (Edge e : edges) {
            ObjectNode data = f.objectNode()
                .put("id", e.id())
                .put("source", e.source())
                .put("target", e.target())
                .put("relationship_type", e.relationshipType());
            edgeArray.addObject().set("data", data);
        }
        ObjectNode elements = f.objectNode();
        elements.set("nodes", nodeArray);
        elements.set("edges", edgeArray);
        ObjectNode root = f.objectNode();
        root.set("elements", elements);
        return root;
    }

    public record Node(String id, String name, String category, String type, String subtype, String color) {}

    public record Edge(String id, String source, String target, String relationshipType) {}
}
