package io.tapdb.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.application.port.output.LineageRepository;
import io.tapdb.domain.model.GraphExport;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.LineageDirection;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.domain.model.ObjectKind;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Navigation and export of the lineage graph. Only live edges with live
 * endpoints are visible.
 */
public class LineageGraphManager {
    private static final Logger log = LoggerFactory.getLogger(LineageGraphManager.class);

    public static final int MAX_EXPORT_DEPTH = 10;
    public static final int OVERVIEW_INSTANCE_LIMIT = 200;
    public static final int OVERVIEW_EDGE_LIMIT = 500;

    private final InstanceRepository instanceRepository;
    private final LineageRepository lineageRepository;

    public LineageGraphManager(InstanceRepository instanceRepository, LineageRepository lineageRepository) {
        this.instanceRepository = instanceRepository;
        this.lineageRepository = lineageRepository;
    }

    public List<Instance> childrenOf(UnitOfWork uow, Instance instance) {
        return childrenOf(uow, instance, null);
    }

    /** Live children ordered by EUID; {@code relationshipType} null matches any. */
    public List<Instance> childrenOf(UnitOfWork uow, Instance instance, String relationshipType) {
        return endpoints(uow, lineageRepository.findByParent(uow, instance.uuid(), relationshipType),
            LineageEdge::childInstanceUuid);
    }

    public List<Instance> parentsOf(UnitOfWork uow, Instance instance) {
        return parentsOf(uow, instance, null);
    }

    /** Live parents ordered by EUID; {@code relationshipType} null matches any. */
    public List<Instance> parentsOf(UnitOfWork uow, Instance instance, String relationshipType) {
        return endpoints(uow, lineageRepository.findByChild(uow, instance.uuid(), relationshipType),
            LineageEdge::parentInstanceUuid);
    }

    public List<LineageEdge> edgesFrom(UnitOfWork uow, Instance instance) {
        return lineageRepository.findByParent(uow, instance.uuid(), null);
    }

    public List<LineageEdge> edgesTo(UnitOfWork uow, Instance instance) {
        return lineageRepository.findByChild(uow, instance.uuid(), null);
    }

    /**
     * Direct lineage members whose attribute or property equals every criterion.
     * Attributes: category, type, subtype, version, status, name, euid,
     * polymorphic_discriminator; any other key is looked up in the properties.
     */
    public List<Instance> filterMembers(UnitOfWork uow, Instance instance, LineageDirection direction,
                                        Map<String, ?> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            throw new IllegalArgumentException("at least one filter criterion is required");
        }
        List<Instance> members = direction == LineageDirection.CHILDREN
            ? childrenOf(uow, instance) : parentsOf(uow, instance);
        List<Instance> matching = new ArrayList<>();
        for (Instance member : members) {
            if (matches(member, criteria)) {
                matching.add(member);
            }
        }
        return matching;
    }

    /** Soft delete an edge; the endpoints are untouched. */
    public boolean softDeleteEdge(UnitOfWork uow, LineageEdge edge) {
        return lineageRepository.softDelete(uow, edge.uuid());
    }

    /**
     * Breadth-first export around {@code startEuid}, following edges both ways
     * up to {@code depth} hops. Unknown or deleted start yields an empty graph.
     */
    public GraphExport exportGraph(UnitOfWork uow, String startEuid, int depth) {
        if (depth < 1 || depth > MAX_EXPORT_DEPTH) {
            throw new IllegalArgumentException("depth must be between 1 and " + MAX_EXPORT_DEPTH + ": " + depth);
        }
        Optional<Instance> start = instanceRepository.findByEuid(uow, startEuid, false);
        if (start.isEmpty()) {
            log.debug("Graph export start {} not found", startEuid);
            return GraphExport.empty();
        }

        Map<UUID, Instance> visited = new LinkedHashMap<>();
        Map<UUID, LineageEdge> edges = new LinkedHashMap<>();
        Deque<Instance> queue = new ArrayDeque<>();
        Map<UUID, Integer> distance = new HashMap<>();
        visited.put(start.get().uuid(), start.get());
        distance.put(start.get().uuid(), 0);
        queue.add(start.get());

        while (!queue.isEmpty()) {
            Instance current = queue.poll();
            int d = distance.get(current.uuid());
            if (d >= depth) {
                continue;
            }
            List<LineageEdge> adjacent = new ArrayList<>(edgesFrom(uow, current));
            adjacent.addAll(edgesTo(uow, current));
            for (LineageEdge edge : adjacent) {
                UUID neighbourId = edge.parentInstanceUuid().equals(current.uuid())
                    ? edge.childInstanceUuid() : edge.parentInstanceUuid();
                Instance neighbour = visited.get(neighbourId);
                if (neighbour == null) {
                    Optional<Instance> loaded = instanceRepository.findByUuid(uow, neighbourId, false);
                    if (loaded.isEmpty()) {
                        continue;
                    }
                    neighbour = loaded.get();
                    visited.put(neighbourId, neighbour);
                    distance.put(neighbourId, d + 1);
                    queue.add(neighbour);
                }
                edges.putIfAbsent(edge.uuid(), edge);
            }
        }
        return toExport(visited, edges.values());
    }

    /** Overview export: the most recent live instances and the live edges among them. */
    public GraphExport exportGraph(UnitOfWork uow) {
        Map<UUID, Instance> nodes = new LinkedHashMap<>();
        for (Instance instance : instanceRepository.list(uow, InstanceFilter.all(), OVERVIEW_INSTANCE_LIMIT, 0)) {
            nodes.put(instance.uuid(), instance);
        }
        return toExport(nodes, lineageRepository.findLiveBetween(uow, nodes.keySet(), OVERVIEW_EDGE_LIMIT));
    }

    private GraphExport toExport(Map<UUID, Instance> nodes, Iterable<LineageEdge> edges) {
        List<GraphExport.Node> nodeList = new ArrayList<>();
        for (Instance i : nodes.values()) {
            nodeList.add(new GraphExport.Node(i.euid(), i.name(), i.category(), i.type(), i.subtype(),
                ObjectKind.fromCategory(i.category()).graphColor()));
        }
        List<GraphExport.Edge> edgeList = new ArrayList<>();
        for (LineageEdge e : edges) {
            Instance parent = nodes.get(e.parentInstanceUuid());
            Instance child = nodes.get(e.childInstanceUuid());
            if (parent != null && child != null) {
                edgeList.add(new GraphExport.Edge(e.euid(), child.euid(), parent.euid(), e.relationshipType()));
            }
        }
        return new GraphExport(nodeList, edgeList);
    }

    private List<Instance> endpoints(UnitOfWork uow, List<LineageEdge> edges, Function<LineageEdge, UUID> side) {
        Set<UUID> seen = new HashSet<>();
        List<Instance> result = new ArrayList<>();
        for (LineageEdge edge : edges) {
            UUID id = side.apply(edge);
            if (seen.add(id)) {
                instanceRepository.findByUuid(uow, id, false).ifPresent(result::add);
            }
        }
        result.sort(Comparator.comparing(Instance::euid));
        return result;
    }

    private static boolean matches(Instance instance, Map<String, ?> criteria) {
        JsonNode properties = instance.properties();
        for (Map.Entry<String, ?> criterion : criteria.entrySet()) {
            String expected = criterion.getValue() == null ? null : String.valueOf(criterion.getValue());
            String actual = attribute(instance, criterion.getKey());
            if (actual == null) {
                JsonNode value = properties.get(criterion.getKey());
                actual = value == null || value.isNull() ? null : value.asText();
            }
            if (expected == null ? actual != null : !expected.equals(actual)) {
                return false;
            }
        }
        return true;
    }

    private static String attribute(Instance instance, String key) {
        return switch (key) {
            case "category" -> instance.category();
            case "type" -> instance.type();
            case "subtype" -> instance.subtype();
            case "version" -> instance.version();
            case "status" -> instance.status();
            case "name" -> instance.name();
            case "euid" -> instance.euid();
            case "polymorphic_discriminator" -> instance.polymorphicDiscriminator();
            default -> null;
        };
    }
}
