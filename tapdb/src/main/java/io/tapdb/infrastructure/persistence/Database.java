package io.tapdb.infrastructure.persistence;

import io.tapdb.domain.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Entry point for opening units of work on a pooled data source.
 */
public class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final String defaultActor;

    public Database(DataSource dataSource, SqlDialect dialect, String defaultActor) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.defaultActor = defaultActor;
    }

    public UnitOfWork begin() {
        return begin(defaultActor);
    }

    public UnitOfWork begin(String actor) {
        try {
            Connection conn = dataSource.getConnection();
            return new UnitOfWork(conn, actor == null ? defaultActor : actor, dialect);
        } catch (SQLException e) {
            log.error("Failed to obtain connection for actor {}", actor, e);
            throw new PersistenceException("Failed to obtain connection", e);
        }
    }

    /** Run {@code work} in a new transaction: commit on success, roll back on any exception. */
    public <T> T inTransaction(String actor, Function<UnitOfWork, T> work) {
        try (UnitOfWork uow = begin(actor)) {
            T result = work.apply(uow);
            uow.commit();
            return result;
        }
    }

    public void runInTransaction(String actor, Consumer<UnitOfWork> work) {
        inTransaction(actor, uow -> {
            work.accept(uow);
            return null;
        });
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public String defaultActor() {
        return defaultActor;
    }
}
