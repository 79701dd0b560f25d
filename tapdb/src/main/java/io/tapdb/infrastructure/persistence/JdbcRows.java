package io.tapdb.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tapdb.domain.error.PersistenceException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Column conversions shared by the JDBC repositories. JSON columns hold text.
 */
final class JdbcRows {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String UNIQUE_VIOLATION = "23505";

    private JdbcRows() {}

    static String toJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize JSON column", e);
        }
    }

    static JsonNode readJson(ResultSet rs, String column) throws SQLException {
        return parseJson(rs.getString(column));
    }

    static JsonNode parseJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored JSON is not parseable", e);
        }
    }

    static UUID readUuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    static Instant readInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, java.sql.Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    /** Text form used for audit diffs and delete snapshots. */
    static String text(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode) {
            return toJson((JsonNode) value);
        }
        return value.toString();
    }

    static boolean isUniqueViolation(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (UNIQUE_VIOLATION.equals(current.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /** Append {@code column = ?} when a filter value is set. */
    static void addClause(List<String> clauses, List<Object> params, String column, String value) {
        if (value != null && !value.isBlank()) {
            clauses.add(column + " = ?");
            params.add(value.trim());
        }
    }

    static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    static String where(List<String> clauses) {
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }
}
