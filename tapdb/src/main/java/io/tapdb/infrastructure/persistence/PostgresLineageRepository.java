package io.tapdb.infrastructure.persistence;

import io.tapdb.application.port.output.LineageRepository;
import io.tapdb.domain.error.DuplicateEdgeException;
import io.tapdb.domain.error.PersistenceException;
import io.tapdb.domain.euid.EuidGenerator;
import io.tapdb.domain.euid.EuidRegistry;
import io.tapdb.domain.model.LineageEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of LineageRepository.
 *
 * <p>Live edges carry {@code parent|child|relationship} in the unique
 * {@code live_edge_key}; soft delete clears it.
 */
public class PostgresLineageRepository implements LineageRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLineageRepository.class);

    private static final String COLUMNS = """
        uuid, euid, name, polymorphic_discriminator, parent_instance_uuid, child_instance_uuid,
        parent_type, child_type, relationship_type, payload, status, live_edge_key, is_deleted,
        created_at, modified_at
        """;

    private final AuditRecorder auditRecorder;
    private final EuidGenerator euidGenerator;

    public PostgresLineageRepository(AuditRecorder auditRecorder, EuidGenerator euidGenerator) {
        this.auditRecorder = auditRecorder;
        this.euidGenerator = euidGenerator;
    }

    @Override
    public Optional<LineageEdge> findByUuid(UnitOfWork uow, UUID uuid, boolean includeDeleted) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance_lineage WHERE uuid = ?"
            + (includeDeleted ? "" : " AND is_deleted = FALSE");

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setObject(1, uuid);
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding lineage edge by uuid: {}", uuid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public Optional<LineageEdge> findByEuid(UnitOfWork uow, String euid, boolean includeDeleted) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance_lineage WHERE euid = ?"
            + (includeDeleted ? "" : " AND is_deleted = FALSE");

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, euid);
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding lineage edge by euid: {}", euid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public Optional<LineageEdge> findLive(UnitOfWork uow, UUID parentUuid, UUID childUuid, String relationshipType) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance_lineage WHERE live_edge_key = ?";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, liveKey(parentUuid, childUuid, relationshipType));
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding live edge {} -> {}", parentUuid, childUuid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public List<LineageEdge> findByParent(UnitOfWork uow, UUID parentUuid, String relationshipType) {
        return findByEndpoint(uow, "parent_instance_uuid", parentUuid, relationshipType);
    }

    @Override
    public List<LineageEdge> findByChild(UnitOfWork uow, UUID childUuid, String relationshipType) {
        return findByEndpoint(uow, "child_instance_uuid", childUuid, relationshipType);
    }

    @Override
    public List<LineageEdge> findLiveBetween(UnitOfWork uow, Collection<UUID> instanceUuids, int limit) {
        if (instanceUuids.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = String.join(", ", Collections.nCopies(instanceUuids.size(), "?"));
        String sql = "SELECT " + COLUMNS + " FROM generic_instance_lineage WHERE is_deleted = FALSE"
            + " AND parent_instance_uuid IN (" + placeholders + ")"
            + " AND child_instance_uuid IN (" + placeholders + ")"
            + " ORDER BY created_at LIMIT ?";

        List<Object> params = new ArrayList<>(instanceUuids);
        params.addAll(instanceUuids);
        params.add(limit);
        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            JdbcRows.bind(ps, params);
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error reading edges between {} instances", instanceUuids.size(), e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public List<LineageEdge> list(UnitOfWork uow, boolean includeDeleted, int limit, int offset) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance_lineage"
            + (includeDeleted ? "" : " WHERE is_deleted = FALSE")
            + " ORDER BY created_at DESC, euid LIMIT ? OFFSET ?";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setInt(1, limit);
            ps.setInt(2, offset);
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error listing lineage edges", e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public long count(UnitOfWork uow, boolean includeDeleted) {
        String sql = "SELECT COUNT(*) FROM generic_instance_lineage" + (includeDeleted ? "" : " WHERE is_deleted = FALSE");

        try (PreparedStatement ps = uow.connection().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            log.error("Error counting lineage edges", e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public LineageEdge insert(UnitOfWork uow, LineageEdge draft) {
        Instant now = Instant.now();
        LineageEdge edge = new LineageEdge(
            UUID.randomUUID(), euidGenerator.generate(uow, EuidRegistry.LINEAGE_PREFIX), draft.name(),
            draft.polymorphicDiscriminator(), draft.parentInstanceUuid(), draft.childInstanceUuid(),
            draft.parentType(), draft.childType(), draft.relationshipType(), draft.payload(), draft.status(),
            false, now, now);

        String sql = "INSERT INTO generic_instance_lineage (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setObject(1, edge.uuid());
            ps.setString(2, edge.euid());
            ps.setString(3, edge.name());
            ps.setString(4, edge.polymorphicDiscriminator());
            ps.setObject(5, edge.parentInstanceUuid());
            ps.setObject(6, edge.childInstanceUuid());
            ps.setString(7, edge.parentType());
            ps.setString(8, edge.childType());
            ps.setString(9, edge.relationshipType());
            ps.setString(10, JdbcRows.toJson(edge.payload()));
            ps.setString(11, edge.status());
            ps.setString(12, liveKey(edge.parentInstanceUuid(), edge.childInstanceUuid(), edge.relationshipType()));
            ps.setBoolean(13, false);
            ps.setTimestamp(14, Timestamp.from(now));
            ps.setTimestamp(15, Timestamp.from(now));
            ps.executeUpdate();
        } catch (SQLException e) {
            if (JdbcRows.isUniqueViolation(e)) {
                String[] ends = edge.name().split("->", 2);
                throw new DuplicateEdgeException(ends[0], ends.length > 1 ? ends[1] : "", edge.relationshipType(), e);
            }
            log.error("Error inserting lineage edge {}", edge.name(), e);
            throw new PersistenceException("Database error", e);
        }

        auditRecorder.recordInsert(uow, CoreTables.LINEAGE, edge.uuid(), edge.euid());
        log.info("Linked {} ({}) as {}", edge.name(), edge.relationshipType(), edge.euid());
        return edge;
    }

    @Override
    public boolean softDelete(UnitOfWork uow, UUID uuid) {
        Optional<LineageEdge> current = findByUuid(uow, uuid, true);
        if (current.isEmpty() || current.get().deleted()) {
            return false;
        }

        String sql = "UPDATE generic_instance_lineage SET is_deleted = TRUE, live_edge_key = NULL, modified_at = ? WHERE uuid = ?";
        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setObject(2, uuid);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error soft deleting lineage edge: {}", uuid, e);
            throw new PersistenceException("Database error", e);
        }

        LineageEdge edge = current.get();
        auditRecorder.recordDelete(uow, CoreTables.LINEAGE, edge.uuid(), edge.euid(), columns(edge));
        return true;
    }

    static String liveKey(UUID parentUuid, UUID childUuid, String relationshipType) {
        return parentUuid + "|" + childUuid + "|" + relationshipType;
    }

    static Map<String, String> columns(LineageEdge e) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("uuid", JdbcRows.text(e.uuid()));
        row.put("euid", e.euid());
        row.put("name", e.name());
        row.put("polymorphic_discriminator", e.polymorphicDiscriminator());
        row.put("parent_instance_uuid", JdbcRows.text(e.parentInstanceUuid()));
        row.put("child_instance_uuid", JdbcRows.text(e.childInstanceUuid()));
        row.put("parent_type", e.parentType());
        row.put("child_type", e.childType());
        row.put("relationship_type", e.relationshipType());
        row.put("payload", JdbcRows.text(e.payload()));
        row.put("status", e.status());
        row.put("is_deleted", String.valueOf(e.deleted()));
        row.put("created_at", JdbcRows.text(e.createdAt()));
        row.put("modified_at", JdbcRows.text(e.modifiedAt()));
        return row;
    }

    private List<LineageEdge> findByEndpoint(UnitOfWork uow, String column, UUID uuid, String relationshipType) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance_lineage WHERE " + column + " = ? AND is_deleted = FALSE"
            + (relationshipType == null ? "" : " AND relationship_type = ?")
            + " ORDER BY created_at";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setObject(1, uuid);
            if (relationshipType != null) {
                ps.setString(2, relationshipType);
            }
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error finding edges by {} = {}", column, uuid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    private Optional<LineageEdge> readFirst(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapEdge(rs)) : Optional.empty();
        }
    }

    private List<LineageEdge> readAll(PreparedStatement ps) throws SQLException {
        List<LineageEdge> edges = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                edges.add(mapEdge(rs));
            }
        }
        return edges;
    }

    private LineageEdge mapEdge(ResultSet rs) throws SQLException {
        return new LineageEdge(
            JdbcRows.readUuid(rs, "uuid"),
            rs.getString("euid"),
            rs.getString("name"),
            rs.getString("polymorphic_discriminator"),
            JdbcRows.readUuid(rs, "parent_instance_uuid"),
            JdbcRows.readUuid(rs, "child_instance_uuid"),
            rs.getString("parent_type"),
            rs.getString("child_type"),
            rs.getString("relationship_type"),
            JdbcRows.readJson(rs, "payload"),
            rs.getString("status"),
            rs.getBoolean("is_deleted"),
            JdbcRows.readInstant(rs, "created_at"),
            JdbcRows.readInstant(rs, "modified_at")
        );
    }
}
