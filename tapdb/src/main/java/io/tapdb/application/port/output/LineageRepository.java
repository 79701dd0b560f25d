package io.tapdb.application.port.output;

import io.tapdb.domain.model.LineageEdge;
import io.tapdb.infrastructure.persistence.UnitOfWork;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for lineage edges. Writes are audited.
 */
public interface LineageRepository {

    Optional<LineageEdge> findByUuid(UnitOfWork uow, UUID uuid, boolean includeDeleted);

    Optional<LineageEdge> findByEuid(UnitOfWork uow, String euid, boolean includeDeleted);

    /** Find the live edge for a (parent, child, relationship) triple. */
    Optional<LineageEdge> findLive(UnitOfWork uow, UUID parentUuid, UUID childUuid, String relationshipType);

    /** Live edges leaving a parent; {@code relationshipType} null matches any. */
    List<LineageEdge> findByParent(UnitOfWork uow, UUID parentUuid, String relationshipType);

    /** Live edges entering a child; {@code relationshipType} null matches any. */
    List<LineageEdge> findByChild(UnitOfWork uow, UUID childUuid, String relationshipType);

    /** Live edges whose both endpoints are in {@code instanceUuids}. */
    List<LineageEdge> findLiveBetween(UnitOfWork uow, Collection<UUID> instanceUuids, int limit);

    List<LineageEdge> list(UnitOfWork uow, boolean includeDeleted, int limit, int offset);

    long count(UnitOfWork uow, boolean includeDeleted);

    /** Insert a draft; assigns uuid, euid and timestamps. */
    LineageEdge insert(UnitOfWork uow, LineageEdge draft);

    /** Soft delete; returns false when the edge was already deleted. */
    boolean softDelete(UnitOfWork uow, UUID uuid);
}
