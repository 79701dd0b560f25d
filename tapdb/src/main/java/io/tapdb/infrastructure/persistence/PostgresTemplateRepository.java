package io.tapdb.infrastructure.persistence;

import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.domain.error.ObjectNotFoundException;
import io.tapdb.domain.error.PersistenceException;
import io.tapdb.domain.error.TemplateIntegrityException;
import io.tapdb.domain.euid.EuidGenerator;
import io.tapdb.domain.euid.EuidRegistry;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateCode;
import io.tapdb.domain.model.TemplateFilter;
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
 * JDBC implementation of TemplateRepository.
 */
public class PostgresTemplateRepository implements TemplateRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTemplateRepository.class);

    private static final String COLUMNS = """
        uuid, euid, name, polymorphic_discriminator, category, type, subtype, version,
        instance_prefix, instance_polymorphic_identity, payload, payload_schema, status,
        is_singleton, is_deleted, created_at, modified_at
        """;

    private final AuditRecorder auditRecorder;
    private final EuidGenerator euidGenerator;

    public PostgresTemplateRepository(AuditRecorder auditRecorder, EuidGenerator euidGenerator) {
        this.auditRecorder = auditRecorder;
        this.euidGenerator = euidGenerator;
    }

    @Override
    public Optional<Template> findByCode(UnitOfWork uow, TemplateCode code) {
        String sql = "SELECT " + COLUMNS + """
            FROM generic_template
            WHERE category = ? AND type = ? AND subtype = ? AND version = ? AND is_deleted = FALSE
            """;

        List<Template> found = queryByCode(uow, sql, code);
        if (found.size() > 1) {
            throw new TemplateIntegrityException(code.toString(),
                found.size() + " live templates share this code");
        }
        return found.stream().findFirst();
    }

    @Override
    public Optional<Template> findAnyByCode(UnitOfWork uow, TemplateCode code) {
        String sql = "SELECT " + COLUMNS + """
            FROM generic_template
            WHERE category = ? AND type = ? AND subtype = ? AND version = ?
            ORDER BY is_deleted, created_at DESC
            """;

        return queryByCode(uow, sql, code).stream().findFirst();
    }

    @Override
    public Optional<Template> findByEuid(UnitOfWork uow, String euid, boolean includeDeleted) {
        String sql = "SELECT " + COLUMNS + " FROM generic_template WHERE euid = ?"
            + (includeDeleted ? "" : " AND is_deleted = FALSE");

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, euid);
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding template by euid: {}", euid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public Optional<Template> findByUuid(UnitOfWork uow, UUID uuid, boolean includeDeleted) {
        String sql = "SELECT " + COLUMNS + " FROM generic_template WHERE uuid = ?"
            + (includeDeleted ? "" : " AND is_deleted = FALSE");

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setObject(1, uuid);
            return readFirst(ps);
        } catch (SQLException e) {
            log.error("Error finding template by uuid: {}", uuid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public List<Template> list(UnitOfWork uow, TemplateFilter filter, int limit, int offset) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT " + COLUMNS + " FROM generic_template" + where(filter, params)
            + " ORDER BY category, type, subtype, version LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            JdbcRows.bind(ps, params);
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error listing templates with filter {}", filter, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public long count(UnitOfWork uow, TemplateFilter filter) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM generic_template" + where(filter, params);

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            JdbcRows.bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            log.error("Error counting templates with filter {}", filter, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public List<String> findInstancePrefixes(UnitOfWork uow) {
        String sql = """
            SELECT DISTINCT instance_prefix FROM generic_template
            WHERE is_deleted = FALSE ORDER BY instance_prefix
            """;

        List<String> prefixes = new ArrayList<>();
        try (PreparedStatement ps = uow.connection().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                prefixes.add(rs.getString(1));
            }
        } catch (SQLException e) {
            log.error("Error reading template instance prefixes", e);
            throw new PersistenceException("Database error", e);
        }
        return prefixes;
    }

    @Override
    public Template insert(UnitOfWork uow, Template draft) {
        Instant now = Instant.now();
        Template template = new Template(
            UUID.randomUUID(), euidGenerator.generate(uow, EuidRegistry.TEMPLATE_PREFIX), draft.name(),
            draft.polymorphicDiscriminator(), draft.category(), draft.type(), draft.subtype(), draft.version(),
            EuidRegistry.normalizePrefix(draft.instancePrefix()), draft.instancePolymorphicIdentity(),
            draft.payload(), draft.payloadSchema(), draft.status(), draft.singleton(), false, now, now);

        String sql = "INSERT INTO generic_template (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setObject(1, template.uuid());
            ps.setString(2, template.euid());
            ps.setString(3, template.name());
            ps.setString(4, template.polymorphicDiscriminator());
            ps.setString(5, template.category());
            ps.setString(6, template.type());
            ps.setString(7, template.subtype());
            ps.setString(8, template.version());
            ps.setString(9, template.instancePrefix());
            JdbcRows.setNullableString(ps, 10, template.instancePolymorphicIdentity());
            ps.setString(11, JdbcRows.toJson(template.payload()));
            JdbcRows.setNullableString(ps, 12, JdbcRows.toJson(template.payloadSchema()));
            ps.setString(13, template.status());
            ps.setBoolean(14, template.singleton());
            ps.setBoolean(15, false);
            ps.setTimestamp(16, Timestamp.from(now));
            ps.setTimestamp(17, Timestamp.from(now));
            ps.executeUpdate();
        } catch (SQLException e) {
            if (JdbcRows.isUniqueViolation(e)) {
                throw new TemplateIntegrityException(template.code().toString(), "template code already exists", e);
            }
            log.error("Error inserting template: {}", template.code(), e);
            throw new PersistenceException("Database error", e);
        }

        auditRecorder.recordInsert(uow, CoreTables.TEMPLATE, template.uuid(), template.euid());
        log.info("Inserted template {} ({})", template.euid(), template.code());
        return template;
    }

    @Override
    public Template update(UnitOfWork uow, Template template) {
        Template current = findByUuid(uow, template.uuid(), true)
            .orElseThrow(() -> new ObjectNotFoundException(template.euid()));
        Instant now = Instant.now();

        String sql = """
            UPDATE generic_template SET
                name = ?, polymorphic_discriminator = ?, instance_prefix = ?, instance_polymorphic_identity = ?,
                payload = ?, payload_schema = ?, status = ?, is_singleton = ?, is_deleted = ?, modified_at = ?
            WHERE uuid = ?
            """;

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, template.name());
            ps.setString(2, template.polymorphicDiscriminator());
            ps.setString(3, template.instancePrefix());
            JdbcRows.setNullableString(ps, 4, template.instancePolymorphicIdentity());
            ps.setString(5, JdbcRows.toJson(template.payload()));
            JdbcRows.setNullableString(ps, 6, JdbcRows.toJson(template.payloadSchema()));
            ps.setString(7, template.status());
            ps.setBoolean(8, template.singleton());
            ps.setBoolean(9, template.deleted());
            ps.setTimestamp(10, Timestamp.from(now));
            ps.setObject(11, template.uuid());
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error updating template: {}", template.euid(), e);
            throw new PersistenceException("Database error", e);
        }

        Template updated = new Template(current.uuid(), current.euid(), template.name(),
            template.polymorphicDiscriminator(), current.category(), current.type(), current.subtype(),
            current.version(), template.instancePrefix(), template.instancePolymorphicIdentity(),
            template.payload(), template.payloadSchema(), template.status(), template.singleton(),
            template.deleted(), current.createdAt(), now);
        auditRecorder.recordUpdate(uow, CoreTables.TEMPLATE, current.uuid(), current.euid(),
            columns(current), columns(updated));
        return updated;
    }

    @Override
    public boolean softDelete(UnitOfWork uow, UUID uuid) {
        Optional<Template> current = findByUuid(uow, uuid, true);
        if (current.isEmpty() || current.get().deleted()) {
            return false;
        }

        String sql = "UPDATE generic_template SET is_deleted = TRUE, modified_at = ? WHERE uuid = ?";
        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setObject(2, uuid);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error soft deleting template: {}", uuid, e);
            throw new PersistenceException("Database error", e);
        }

        Template t = current.get();
        auditRecorder.recordDelete(uow, CoreTables.TEMPLATE, t.uuid(), t.euid(), columns(t));
        return true;
    }

    /** Text form of every column, for audit diffs and snapshots. */
    static Map<String, String> columns(Template t) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("uuid", JdbcRows.text(t.uuid()));
        row.put("euid", t.euid());
        row.put("name", t.name());
        row.put("polymorphic_discriminator", t.polymorphicDiscriminator());
        row.put("category", t.category());
        row.put("type", t.type());
        row.put("subtype", t.subtype());
        row.put("version", t.version());
        row.put("instance_prefix", t.instancePrefix());
        row.put("instance_polymorphic_identity", t.instancePolymorphicIdentity());
        row.put("payload", JdbcRows.text(t.payload()));
        row.put("payload_schema", JdbcRows.text(t.payloadSchema()));
        row.put("status", t.status());
        row.put("is_singleton", String.valueOf(t.singleton()));
        row.put("is_deleted", String.valueOf(t.deleted()));
        row.put("created_at", JdbcRows.text(t.createdAt()));
        row.put("modified_at", JdbcRows.text(t.modifiedAt()));
        return row;
    }

    private List<Template> queryByCode(UnitOfWork uow, String sql, TemplateCode code) {
        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, code.category());
            ps.setString(2, code.type());
            ps.setString(3, code.subtype());
            ps.setString(4, code.version());
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error finding template by code: {}", code, e);
            throw new PersistenceException("Database error", e);
        }
    }

    private String where(TemplateFilter filter, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (!filter.includeDeleted()) {
            clauses.add("is_deleted = FALSE");
        }
        JdbcRows.addClause(clauses, params, "category", filter.category());
        JdbcRows.addClause(clauses, params, "type", filter.type());
        JdbcRows.addClause(clauses, params, "subtype", filter.subtype());
        JdbcRows.addClause(clauses, params, "polymorphic_discriminator", filter.polymorphicDiscriminator());
        return JdbcRows.where(clauses);
    }

    private Optional<Template> readFirst(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapTemplate(rs)) : Optional.empty();
        }
    }

    private List<Template> readAll(PreparedStatement ps) throws SQLException {
        List<Template> templates = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                templates.add(mapTemplate(rs));
            }
        }
        return templates;
    }

    private Template mapTemplate(ResultSet rs) throws SQLException {
        return new Template(
            JdbcRows.readUuid(rs, "uuid"),
            rs.getString("euid"),
            rs.getString("name"),
            rs.getString("polymorphic_discriminator"),
            rs.getString("category"),
            rs.getString("type"),
            rs.getString("subtype"),
            rs.getString("version"),
            rs.getString("instance_prefix"),
            rs.getString("instance_polymorphic_identity"),
            JdbcRows.readJson(rs, "payload"),
            JdbcRows.readJson(rs, "payload_schema"),
            rs.getString("status"),
            rs.getBoolean("is_singleton"),
            rs.getBoolean("is_deleted"),
            JdbcRows.readInstant(rs, "created_at"),
            JdbcRows.readInstant(rs, "modified_at")
        );
    }
}
