package io.tapdb.support;

import io.tapdb.bootstrap.TapdbEngine;
import io.tapdb.infrastructure.persistence.Database;
import io.tapdb.infrastructure.persistence.SqlDialect;
import io.tapdb.migration.SchemaMigration;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * In-memory H2 stores in PostgreSQL mode, one fresh database per call.
 */
public final class H2TestSupport {

    public static final String TEST_ACTOR = "test-user";

    public static DataSource newDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:tapdb_" + UUID.randomUUID().toString().replace("-", "")
            + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
        return ds;
    }

    /** Fresh database with the core schema applied. */
    public static Database newDatabase() {
        DataSource dataSource = newDataSource();
        new SchemaMigration(dataSource).migrate();
        return new Database(dataSource, SqlDialect.H2, TEST_ACTOR);
    }

    /** Started engine over a fresh database. */
    public static TapdbEngine newEngine() {
        TapdbEngine engine = new TapdbEngine(newDatabase());
        engine.startup();
        return engine;
    }

    private H2TestSupport() {}
}
