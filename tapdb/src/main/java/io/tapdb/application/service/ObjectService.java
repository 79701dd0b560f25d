package io.tapdb.application.service;

import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.application.port.output.LineageRepository;
import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.domain.error.ObjectNotFoundException;
import io.tapdb.domain.euid.EuidCodec;
import io.tapdb.domain.euid.EuidRegistry;
import io.tapdb.domain.model.Instance;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.LineageEdge;
import io.tapdb.domain.model.Page;
import io.tapdb.domain.model.TapdbObject;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateFilter;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Lookup, listing and deletion of any stored object by EUID.
 */
public class ObjectService {
    private static final Logger log = LoggerFactory.getLogger(ObjectService.class);

    public static final int MAX_PAGE_SIZE = 500;

    private final TemplateRepository templateRepository;
    private final InstanceRepository instanceRepository;
    private final LineageRepository lineageRepository;
    private final TemplateService templateService;
    private final InstanceFactory instanceFactory;
    private final LineageGraphManager lineageGraphManager;

    public ObjectService(TemplateRepository templateRepository, InstanceRepository instanceRepository,
                         LineageRepository lineageRepository, TemplateService templateService,
                         InstanceFactory instanceFactory, LineageGraphManager lineageGraphManager) {
        this.templateRepository = templateRepository;
        this.instanceRepository = instanceRepository;
        this.lineageRepository = lineageRepository;
        this.templateService = templateService;
        this.instanceFactory = instanceFactory;
        this.lineageGraphManager = lineageGraphManager;
    }

    /**
     * Find a template, instance or edge. The prefix picks the table to look in
     * first; the other tables are tried when it is not there.
     */
    public Optional<TapdbObject> findByEuid(UnitOfWork uow, String euid, boolean includeDeleted) {
        String prefix = EuidCodec.prefixOf(euid);
        if (EuidRegistry.TEMPLATE_PREFIX.equals(prefix)) {
            Optional<TapdbObject> found = findTemplate(uow, euid, includeDeleted);
            return found.isPresent() ? found : findInstanceOrEdge(uow, euid, includeDeleted);
        }
        if (EuidRegistry.LINEAGE_PREFIX.equals(prefix)) {
            Optional<TapdbObject> found = findEdge(uow, euid, includeDeleted);
            if (found.isEmpty()) {
                found = findInstance(uow, euid, includeDeleted);
            }
            return found.isPresent() ? found : findTemplate(uow, euid, includeDeleted);
        }
        Optional<TapdbObject> found = findInstance(uow, euid, includeDeleted);
        if (found.isEmpty()) {
            found = findTemplate(uow, euid, includeDeleted);
        }
        return found.isPresent() ? found : findEdge(uow, euid, includeDeleted);
    }

    public TapdbObject getByEuid(UnitOfWork uow, String euid) {
        return findByEuid(uow, euid, false).orElseThrow(() -> new ObjectNotFoundException(euid));
    }

    public Instance getInstance(UnitOfWork uow, String euid) {
        return instanceRepository.findByEuid(uow, euid, false).orElseThrow(() -> new ObjectNotFoundException(euid));
    }

    /**
     * Soft delete whatever object carries {@code euid}.
     *
     * @throws ObjectNotFoundException when no live object has this EUID
     */
    public TapdbObject softDelete(UnitOfWork uow, String euid) {
        TapdbObject target = getByEuid(uow, euid);
        if (target instanceof Template) {
            templateService.softDelete(uow, (Template) target);
        } else if (target instanceof LineageEdge) {
            lineageGraphManager.softDeleteEdge(uow, (LineageEdge) target);
        } else {
            instanceRepository.softDelete(uow, target.uuid());
        }
        log.info("Deleted {} by {}", euid, uow.actor());
        return target;
    }

    /** Link two live instances by EUID. */
    public LineageEdge createEdge(UnitOfWork uow, String parentEuid, String childEuid, String relationshipType) {
        Instance parent = getInstance(uow, parentEuid);
        Instance child = getInstance(uow, childEuid);
        return instanceFactory.linkInstances(uow, parent, child, relationshipType);
    }

    public Page<Template> listTemplates(UnitOfWork uow, TemplateFilter filter, int page, int pageSize) {
        int size = clampPageSize(pageSize);
        int offset = offset(page, size);
        return new Page<>(templateRepository.list(uow, filter, size, offset), Math.max(page, 1), size,
            templateRepository.count(uow, filter));
    }

    public Page<Instance> listInstances(UnitOfWork uow, InstanceFilter filter, int page, int pageSize) {
        int size = clampPageSize(pageSize);
        int offset = offset(page, size);
        return new Page<>(instanceRepository.list(uow, filter, size, offset), Math.max(page, 1), size,
            instanceRepository.count(uow, filter));
    }

    public Page<LineageEdge> listEdges(UnitOfWork uow, boolean includeDeleted, int page, int pageSize) {
        int size = clampPageSize(pageSize);
        int offset = offset(page, size);
        return new Page<>(lineageRepository.list(uow, includeDeleted, size, offset), Math.max(page, 1), size,
            lineageRepository.count(uow, includeDeleted));
    }

    private Optional<TapdbObject> findTemplate(UnitOfWork uow, String euid, boolean includeDeleted) {
        return templateRepository.findByEuid(uow, euid, includeDeleted).map(t -> t);
    }

    private Optional<TapdbObject> findInstance(UnitOfWork uow, String euid, boolean includeDeleted) {
        return instanceRepository.findByEuid(uow, euid, includeDeleted).map(i -> i);
    }

    private Optional<TapdbObject> findEdge(UnitOfWork uow, String euid, boolean includeDeleted) {
        return lineageRepository.findByEuid(uow, euid, includeDeleted).map(e -> e);
    }

    private Optional<TapdbObject> findInstanceOrEdge(UnitOfWork uow, String euid, boolean includeDeleted) {
        Optional<TapdbObject> found = findInstance(uow, euid, includeDeleted);
        return found.isPresent() ? found : findEdge(uow, euid, includeDeleted);
    }

    private static int clampPageSize(int pageSize) {
        return Math.min(Math.max(pageSize, 1), MAX_PAGE_SIZE);
    }

    private static int offset(int page, int pageSize) {
        return (Math.max(page, 1) - 1) * pageSize;
    }
}
