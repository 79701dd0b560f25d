package io.tapdb.application.port.output;

import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateCode;
import io.tapdb.domain.model.TemplateFilter;
import io.tapdb.infrastructure.persistence.UnitOfWork;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for templates. Writes are audited.
 */
public interface TemplateRepository {

    /** Find the live template for a code; more than one live row is an integrity failure. */
    Optional<Template> findByCode(UnitOfWork uow, TemplateCode code);

    /** Find a template for a code whether deleted or not. */
    Optional<Template> findAnyByCode(UnitOfWork uow, TemplateCode code);

    Optional<Template> findByEuid(UnitOfWork uow, String euid, boolean includeDeleted);

    Optional<Template> findByUuid(UnitOfWork uow, UUID uuid, boolean includeDeleted);

    /** List templates ordered by code. */
    List<Template> list(UnitOfWork uow, TemplateFilter filter, int limit, int offset);

    long count(UnitOfWork uow, TemplateFilter filter);

    /** Instance prefixes used by live templates. */
    List<String> findInstancePrefixes(UnitOfWork uow);

    /** Insert a draft; assigns uuid, euid and timestamps. */
    Template insert(UnitOfWork uow, Template draft);

    /** Persist the editable fields of a stored template. */
    Template update(UnitOfWork uow, Template template);

    /** Soft delete; returns false when the template was already deleted. */
    boolean softDelete(UnitOfWork uow, UUID uuid);
}
