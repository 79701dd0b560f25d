package io.tapdb.application.port.output;

import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.TemplateCode;
import io.tapdb.infrastructure.persistence.UnitOfWork;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for instances. Writes are audited.
 */
public interface InstanceRepository {

    Optional<Instance> findByUuid(UnitOfWork uow, UUID uuid, boolean includeDeleted);

    Optional<Instance> findByEuid(UnitOfWork uow, String euid, boolean includeDeleted);

    /** Find the live instance of a singleton template. */
    Optional<Instance> findLiveSingleton(UnitOfWork uow, TemplateCode code);

    /** List instances ordered by EUID. */
    List<Instance> list(UnitOfWork uow, InstanceFilter filter, int limit, int offset);

    long count(UnitOfWork uow, InstanceFilter filter);

    /** Insert a draft numbered from {@code euidPrefix}; assigns uuid, euid and timestamps. */
    Instance insert(UnitOfWork uow, Instance draft, String euidPrefix);

    /** Persist name, status and payload of a stored instance. */
    Instance update(UnitOfWork uow, Instance instance);

    /** Soft delete; returns false when the instance was already deleted. */
    boolean softDelete(UnitOfWork uow, UUID uuid);
}
