package io.tapdb.application.service;

import io.tapdb.application.port.output.SequenceAllocator;
import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.domain.error.ObjectNotFoundException;
import io.tapdb.domain.euid.EuidRegistry;
import io.tapdb.domain.model.Template;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Template writes. Every mutation invalidates the resolver cache, immediately and
 * again when the mutating unit of work commits.
 */
public class TemplateService {
    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final TemplateRepository templateRepository;
    private final TemplateResolver resolver;
    private final EuidRegistry euidRegistry;
    private final SequenceAllocator sequenceAllocator;

    public TemplateService(TemplateRepository templateRepository, TemplateResolver resolver,
                           EuidRegistry euidRegistry, SequenceAllocator sequenceAllocator) {
        this.templateRepository = templateRepository;
        this.resolver = resolver;
        this.euidRegistry = euidRegistry;
        this.sequenceAllocator = sequenceAllocator;
    }

    /** Insert a template, provisioning its instance prefix counter first. */
    public Template create(UnitOfWork uow, Template draft) {
        provisionPrefix(uow, draft.instancePrefix());
        try {
            Template created = templateRepository.insert(uow, draft);
            log.info("Created template {} {}", created.euid(), created.code());
            return created;
        } finally {
            resolver.invalidateOnCommit(uow);
        }
    }

    public Template update(UnitOfWork uow, Template template) {
        provisionPrefix(uow, template.instancePrefix());
        try {
            return templateRepository.update(uow, template);
        } finally {
            resolver.invalidateOnCommit(uow);
        }
    }

    public void softDelete(UnitOfWork uow, Template template) {
        try {
            if (!templateRepository.softDelete(uow, template.uuid())) {
                log.debug("Template {} already deleted", template.euid());
            }
        } finally {
            resolver.invalidateOnCommit(uow);
        }
    }

    public Template findByEuid(UnitOfWork uow, String euid, boolean includeDeleted) {
        return templateRepository.findByEuid(uow, euid, includeDeleted)
            .orElseThrow(() -> new ObjectNotFoundException(euid));
    }

    /**
     * Register a prefix with its default counter and create the counter if the
     * store lacks it.
     *
     * @return counter name
     */
    public String provisionPrefix(UnitOfWork uow, String prefix) {
        String counter = euidRegistry.register(prefix);
        sequenceAllocator.ensure(uow, counter);
        return counter;
    }

    /** Register the prefixes of every live template; run once at startup. */
    public int registerStoredPrefixes(UnitOfWork uow) {
        int registered = 0;
        for (String prefix : templateRepository.findInstancePrefixes(uow)) {
            euidRegistry.register(prefix);
            registered++;
        }
        log.info("Registered {} instance prefix(es) from stored templates", registered);
        return registered;
    }
}
