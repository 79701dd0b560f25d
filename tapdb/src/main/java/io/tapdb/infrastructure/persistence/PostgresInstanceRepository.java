package io.tapdb.infrastructure.persistence;

import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.domain.error.ObjectNotFoundException;
import io.tapdb.domain.error.PersistenceException;
import io.tapdb.domain.error.SingletonConflictException;
import io.tapdb.domain.euid.EuidGenerator;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.TemplateCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of InstanceRepository.
 *
 * <p>Live singletons carry their template code in {@code singleton_key}, which
 * is unique; soft delete clears it.
 */
public class PostgresInstanceRepository implements InstanceRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresInstanceRepository.class);

    private static final String COLUMNS = """
        uuid, euid, name, polymorphic_discriminator, category, type, subtype, version,
        template_uuid, payload, status, is_singleton, singleton_key, is_deleted, created_at, modified_at
        """;

    private final AuditRecorder auditRecorder;
    private final EuidGenerator euidGenerator;

    public PostgresInstanceRepository(AuditRecorder auditRecorder, EuidGenerator euidGenerator) {
        this.auditRecorder = auditRecorder;
        this.euidGenerator = euidGenerator;
    }

    @Override
    public Optional<Instance> findByUuid(UnitOfWork uow, UUID uuid, boolean includeDeleted) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance WHERE uuid = ?"
            + (includeDeleted ? "" : " AND is_deleted = FALSE");

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setObject(1, uuid);
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding instance by uuid: {}", uuid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public Optional<Instance> findByEuid(UnitOfWork uow, String euid, boolean includeDeleted) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance WHERE euid = ?"
            + (includeDeleted ? "" : " AND is_deleted = FALSE");

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, euid);
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding instance by euid: {}", euid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public Optional<Instance> findLiveSingleton(UnitOfWork uow, TemplateCode code) {
        String sql = "SELECT " + COLUMNS + " FROM generic_instance WHERE singleton_key = ? AND is_deleted = FALSE";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, code.toString());
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding singleton instance for {}", code, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public List<Instance> list(UnitOfWork uow, InstanceFilter filter, int limit, int offset) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT " + COLUMNS + " FROM generic_instance" + where(filter, params)
            + " ORDER BY created_at DESC, euid LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            JdbcRows.bind(ps, params);
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error listing instances with filter {}", filter, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public long count(UnitOfWork uow, InstanceFilter filter) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM generic_instance" + where(filter, params);

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            JdbcRows.bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            log.error("Error counting instances with filter {}", filter, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public Instance insert(UnitOfWork uow, Instance draft, String euidPrefix) {
        Instant now = Instant.now();
        Instance instance = new Instance(
            UUID.randomUUID(), euidGenerator.generate(uow, euidPrefix), draft.name(),
            draft.polymorphicDiscriminator(), draft.category(), draft.type(), draft.subtype(), draft.version(),
            draft.templateUuid(), draft.payload(), draft.status(), draft.singleton(), false, now, now);
        String singletonKey = instance.singleton() ? instance.templateCode().toString() : null;

        String sql = "INSERT INTO generic_instance (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setObject(1, instance.uuid());
            ps.setString(2, instance.euid());
            ps.setString(3, instance.name());
            ps.setString(4, instance.polymorphicDiscriminator());
            ps.setString(5, instance.category());
            ps.setString(6, instance.type());
            ps.setString(7, instance.subtype());
            ps.setString(8, instance.version());
            ps.setObject(9, instance.templateUuid());
            ps.setString(10, JdbcRows.toJson(instance.payload()));
            ps.setString(11, instance.status());
            ps.setBoolean(12, instance.singleton());
            JdbcRows.setNullableString(ps, 13, singletonKey);
            ps.setBoolean(14, false);
            ps.setTimestamp(15, Timestamp.from(now));
            ps.setTimestamp(16, Timestamp.from(now));
            ps.executeUpdate();
        } catch (SQLException e) {
            if (singletonKey != null && JdbcRows.isUniqueViolation(e)) {
                throw new SingletonConflictException(singletonKey, e);
            }
            log.error("Error inserting instance {} of {}", instance.euid(), instance.templateCode(), e);
            throw new PersistenceException("Database error", e);
        }

        auditRecorder.recordInsert(uow, CoreTables.INSTANCE, instance.uuid(), instance.euid());
        log.info("Inserted instance {} '{}' of {}", instance.euid(), instance.name(), instance.templateCode());
        return instance;
    }

    @Override
    public Instance update(UnitOfWork uow, Instance instance) {
        Instance current = findByUuid(uow, instance.uuid(), true)
            .orElseThrow(() -> new ObjectNotFoundException(instance.euid()));
        Instant now = Instant.now();

        String sql = "UPDATE generic_instance SET name = ?, payload = ?, status = ?, modified_at = ? WHERE uuid = ?";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, instance.name());
            ps.setString(2, JdbcRows.toJson(instance.payload()));
            ps.setString(3, instance.status());
            ps.setTimestamp(4, Timestamp.from(now));
            ps.setObject(5, instance.uuid());
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error updating instance: {}", instance.euid(), e);
            throw new PersistenceException("Database error", e);
        }

        Instance updated = new Instance(current.uuid(), current.euid(), instance.name(),
            current.polymorphicDiscriminator(), current.category(), current.type(), current.subtype(),
            current.version(), current.templateUuid(), instance.payload(), instance.status(),
            current.singleton(), current.deleted(), current.createdAt(), now);
        auditRecorder.recordUpdate(uow, CoreTables.INSTANCE, current.uuid(), current.euid(),
            columns(current), columns(updated));
        return updated;
    }

    @Override
    public boolean softDelete(UnitOfWork uow, UUID uuid) {
        Optional<Instance> current = findByUuid(uow, uuid, true);
        if (current.isEmpty() || current.get().deleted()) {
            return false;
        }

        String sql = "UPDATE generic_instance SET is_deleted = TRUE, singleton_key = NULL, modified_at = ? WHERE uuid = ?";
        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setObject(2, uuid);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error soft deleting instance: {}", uuid, e);
            throw new PersistenceException("Database error", e);
        }

        Instance i = current.get();
        auditRecorder.recordDelete(uow, CoreTables.INSTANCE, i.uuid(), i.euid(), columns(i));
        return true;
    }

    static Map<String, String> columns(Instance i) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("uuid", JdbcRows.text(i.uuid()));
        row.put("euid", i.euid());
        row.put("name", i.name());
        row.put("polymorphic_discriminator", i.polymorphicDiscriminator());
        row.put("category", i.category());
        row.put("type", i.type());
        row.put("subtype", i.subtype());
        row.put("version", i.version());
        row.put("template_uuid", JdbcRows.text(i.templateUuid()));
        row.put("payload", JdbcRows.text(i.payload()));
        row.put("status", i.status());
        row.put("is_singleton", String.valueOf(i.singleton()));
        row.put("is_deleted", String.valueOf(i.deleted()));
        row.put("created_at", JdbcRows.text(i.createdAt()));
        row.put("modified_at", JdbcRows.text(i.modifiedAt()));
        return row;
    }

    private String where(InstanceFilter filter, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (!filter.includeDeleted()) {
            clauses.add("is_deleted = FALSE");
        }
        JdbcRows.addClause(clauses, params, "category", filter.category());
        JdbcRows.addClause(clauses, params, "type", filter.type());
        JdbcRows.addClause(clauses, params, "subtype", filter.subtype());
        JdbcRows.addClause(clauses, params, "status", filter.status());
        return JdbcRows.where(clauses);
    }

    private Optional<Instance> readFirst(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapInstance(rs)) : Optional.empty();
        }
    }

    private List<Instance> readAll(PreparedStatement ps) throws SQLException {
        List<Instance> instances = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                instances.add(mapInstance(rs));
            }
        }
        return instances;
    }

    private Instance mapInstance(ResultSet rs) throws SQLException {
        return new Instance(
            JdbcRows.readUuid(rs, "uuid"),
            rs.getString("euid"),
            rs.getString("name"),
            rs.getString("polymorphic_discriminator"),
            rs.getString("category"),
            rs.getString("type"),
            rs.getString("subtype"),
            rs.getString("version"),
            JdbcRows.readUuid(rs, "template_uuid"),
            JdbcRows.readJson(rs, "payload"),
            rs.getString("status"),
            rs.getBoolean("is_singleton"),
            rs.getBoolean("is_deleted"),
            JdbcRows.readInstant(rs, "created_at"),
            JdbcRows.readInstant(rs, "modified_at")
        );
    }
}
