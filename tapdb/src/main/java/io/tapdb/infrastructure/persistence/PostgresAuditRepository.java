package io.tapdb.infrastructure.persistence;

import io.tapdb.application.port.output.AuditRepository;
import io.tapdb.domain.error.PersistenceException;
import io.tapdb.domain.model.AuditEntry;
import io.tapdb.domain.model.AuditOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of AuditRepository. Entries are only ever inserted.
 */
public class PostgresAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAuditRepository.class);

    private static final String COLUMNS = """
        uuid, rel_table_name, rel_table_uuid, rel_table_euid, column_name, old_value, new_value,
        changed_by, changed_at, operation_type, deleted_record_json
        """;

    @Override
    public void append(UnitOfWork uow, AuditEntry entry) {
        String sql = "INSERT INTO audit_log (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        Connection conn = uow.connection();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, entry.uuid());
            ps.setString(2, entry.tableName());
            ps.setObject(3, entry.targetUuid());
            JdbcRows.setNullableString(ps, 4, entry.targetEuid());
            JdbcRows.setNullableString(ps, 5, entry.columnName());
            JdbcRows.setNullableString(ps, 6, entry.oldValue());
            JdbcRows.setNullableString(ps, 7, entry.newValue());
            JdbcRows.setNullableString(ps, 8, entry.changedBy());
            ps.setTimestamp(9, Timestamp.from(entry.changedAt()));
            ps.setString(10, entry.operation().name());
            JdbcRows.setNullableString(ps, 11, JdbcRows.toJson(entry.deletedRecord()));
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error appending audit entry for {} {}", entry.tableName(), entry.targetEuid(), e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public List<AuditEntry> findByTarget(UnitOfWork uow, String euid) {
        String sql = "SELECT " + COLUMNS + " FROM audit_log WHERE rel_table_euid = ? ORDER BY changed_at, operation_type";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, euid);
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error reading audit trail for {}", euid, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public List<AuditEntry> findByTable(UnitOfWork uow, String tableName, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM audit_log WHERE rel_table_name = ? ORDER BY changed_at DESC LIMIT ?";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, tableName);
            ps.setInt(2, limit);
            return readAll(ps);
        } catch (SQLException e) {
            log.error("Error reading audit trail for table {}", tableName, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public long count(UnitOfWork uow) {
        try (PreparedStatement ps = uow.connection().prepareStatement("SELECT COUNT(*) FROM audit_log");
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            log.error("Error counting audit entries", e);
            throw new PersistenceException("Database error", e);
        }
    }

    private List<AuditEntry> readAll(PreparedStatement ps) throws SQLException {
        List<AuditEntry> entries = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(mapEntry(rs));
            }
        }
        return entries;
    }

    private AuditEntry mapEntry(ResultSet rs) throws SQLException {
        return new AuditEntry(
            JdbcRows.readUuid(rs, "uuid"),
            rs.getString("rel_table_name"),
            JdbcRows.readUuid(rs, "rel_table_uuid"),
            rs.getString("rel_table_euid"),
            rs.getString("column_name"),
            rs.getString("old_value"),
            rs.getString("new_value"),
            rs.getString("changed_by"),
            JdbcRows.readInstant(rs, "changed_at"),
            AuditOperation.valueOf(rs.getString("operation_type")),
            JdbcRows.readJson(rs, "deleted_record_json")
        );
    }
}
