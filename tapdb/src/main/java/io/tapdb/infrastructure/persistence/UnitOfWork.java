package io.tapdb.infrastructure.persistence;

import io.tapdb.domain.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One database transaction plus the actor recorded in audit rows.
 *
 * <p>Every engine operation receives the unit of work explicitly. Closing a unit
 * of work that was not committed rolls it back.
 *
 * <pre>
 * try (UnitOfWork uow = database.begin("alice")) {
 *     Instance plate = factory.createInstance(uow, "container/plate/fixed-plate-96/1.0", "P1");
 *     uow.commit();
 * }
 * </pre>
 */
public final class UnitOfWork implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final Connection connection;
    private final String actor;
    private final SqlDialect dialect;
    private final Set<Runnable> rollbackHooks = new LinkedHashSet<>();
    private final Set<Runnable> commitHooks = new LinkedHashSet<>();
    private boolean completed;

    public UnitOfWork(Connection connection, String actor, SqlDialect dialect) {
        this.connection = connection;
        this.actor = actor;
        this.dialect = dialect;
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            log.error("Failed to start transaction for actor {}", actor, e);
            throw new PersistenceException("Failed to start transaction", e);
        }
    }

    public Connection connection() {
        return connection;
    }

    public String actor() {
        return actor;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    /**
     * Run {@code work} under a savepoint. On any exception the work's writes are
     * rolled back to the savepoint, rollback hooks run, and the exception is rethrown.
     * Writes made earlier in this unit of work are kept.
     */
    public <T> T atomically(Supplier<T> work) {
        Savepoint savepoint;
        try {
            savepoint = connection.setSavepoint();
        } catch (SQLException e) {
            log.error("Failed to set savepoint", e);
            throw new PersistenceException("Failed to set savepoint", e);
        }
        try {
            T result = work.get();
            release(savepoint);
            return result;
        } catch (RuntimeException e) {
            try {
                connection.rollback(savepoint);
            } catch (SQLException rollbackError) {
                e.addSuppressed(rollbackError);
                log.error("Failed to roll back to savepoint", rollbackError);
            }
            runRollbackHooks();
            throw e;
        }
    }

    public void atomically(Runnable work) {
        atomically(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Register a callback that runs when this unit of work (or a savepoint in it) rolls back.
     * Registering the same hook instance again is a no-op.
     */
    public void onRollback(Runnable hook) {
        rollbackHooks.add(hook);
    }

    /** Register a callback that runs once after a successful commit. Duplicates are ignored. */
    public void onCommit(Runnable hook) {
        commitHooks.add(hook);
    }

    public void commit() {
        try {
            connection.commit();
            completed = true;
            rollbackHooks.clear();
        } catch (SQLException e) {
            log.error("Commit failed for actor {}", actor, e);
            throw new PersistenceException("Commit failed", e);
        }
        List<Runnable> hooks = new ArrayList<>(commitHooks);
        commitHooks.clear();
        for (Runnable hook : hooks) {
            hook.run();
        }
    }

    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed for actor {}", actor, e);
            throw new PersistenceException("Rollback failed", e);
        } finally {
            completed = true;
            commitHooks.clear();
            runRollbackHooks();
        }
    }

    @Override
    public void close() {
        try {
            if (!completed) {
                log.debug("Unit of work for {} closed without commit, rolling back", actor);
                rollback();
            }
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close connection: {}", e.getMessage());
            }
        }
    }

    private void release(Savepoint savepoint) {
        try {
            connection.releaseSavepoint(savepoint);
        } catch (SQLException e) {
            log.error("Failed to release savepoint", e);
            throw new PersistenceException("Failed to release savepoint", e);
        }
    }

    private void runRollbackHooks() {
        for (Runnable hook : new ArrayList<>(rollbackHooks)) {
            hook.run();
        }
    }
}
