package io.tapdb.migration;

import io.tapdb.infrastructure.persistence.CoreTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Schema Migration - Creates the core tables and counters on startup.
 *
 * Applies the bundled DDL when any core table is missing. Every statement is
 * {@code IF NOT EXISTS}, so running it again is harmless.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    public static final String SCHEMA_RESOURCE = "/schema/tapdb_schema.sql";

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration.
     *
     * @return true when DDL was applied, false when the schema was already complete
     */
    public boolean migrate() {
        log.info("[SCHEMA MIGRATION] Checking core tables");

        try (Connection conn = dataSource.getConnection()) {
            List<String> missing = new ArrayList<>();
            for (String table : CoreTables.ALL) {
                if (!tableExists(conn, table)) {
                    missing.add(table);
                }
            }
            if (missing.isEmpty()) {
                log.info("[SCHEMA MIGRATION] All core tables present");
                return false;
            }

            log.info("[SCHEMA MIGRATION] Missing tables {}, applying {}", missing, SCHEMA_RESOURCE);
            List<String> statements = statements(readSchema());
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement()) {
                for (String sql : statements) {
                    st.execute(sql);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.info("[SCHEMA MIGRATION] Applied {} statement(s)", statements.size());
            return true;

        } catch (SQLException | IOException e) {
            log.error("[SCHEMA MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        for (String candidate : List.of(tableName, tableName.toUpperCase())) {
            try (ResultSet rs = metadata.getTables(null, null, candidate, new String[]{"TABLE"})) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String readSchema() throws IOException {
        try (InputStream in = SchemaMigration.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IOException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /** Split a script into statements, dropping {@code --} comment lines. */
    static List<String> statements(String script) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\n")) {
            if (!line.trim().startsWith("--")) {
                cleaned.append(line).append('\n');
            }
        }
        List<String> statements = new ArrayList<>();
        for (String part : cleaned.toString().split(";")) {
            if (!part.isBlank()) {
                statements.add(part.trim());
            }
        }
        return statements;
    }
}
