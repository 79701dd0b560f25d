package io.tapdb.application.port.output;

import io.tapdb.domain.model.AuditEntry;
import io.tapdb.infrastructure.persistence.UnitOfWork;

import java.util.List;

/**
 * Append-only audit trail.
 */
public interface AuditRepository {

    /** Append one entry. */
    void append(UnitOfWork uow, AuditEntry entry);

    /** Entries for one object, oldest first. */
    List<AuditEntry> findByTarget(UnitOfWork uow, String euid);

    /** Most recent entries of one table. */
    List<AuditEntry> findByTable(UnitOfWork uow, String tableName, int limit);

    long count(UnitOfWork uow);
}
