package io.tapdb.application.service;

import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.domain.error.TemplateNotFoundException;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateCode;
import io.tapdb.domain.model.TemplateFilter;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through template cache keyed by normalized code and by EUID.
 *
 * <p>Entries are dropped on any template mutation made through
 * {@link TemplateService}, on {@link #invalidateCache()}, and when the unit of
 * work that loaded them rolls back.
 */
public class TemplateResolver {
    private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

    private static final int LIST_LIMIT = 10_000;

    private final TemplateRepository templateRepository;
    private final Map<String, Template> byCode = new ConcurrentHashMap<>();
    private final Map<String, Template> byEuid = new ConcurrentHashMap<>();
    private final Runnable invalidation = this::invalidateCache;

    public TemplateResolver(TemplateRepository templateRepository) {
        this.templateRepository = templateRepository;
    }

    /**
     * Resolve {@code category/type/subtype/version}, with or without a trailing slash.
     *
     * @throws TemplateNotFoundException for malformed, unknown or soft-deleted codes
     */
    public Template resolve(UnitOfWork uow, String code) {
        TemplateCode parsed;
        try {
            parsed = TemplateCode.parse(code);
        } catch (IllegalArgumentException e) {
            throw new TemplateNotFoundException(String.valueOf(code), "malformed template code");
        }
        String key = parsed.toString();
        Template cached = byCode.get(key);
        if (cached != null) {
            log.debug("Template cache hit for {}", key);
            return cached;
        }
        Template template = templateRepository.findByCode(uow, parsed)
            .orElseThrow(() -> new TemplateNotFoundException(key));
        remember(uow, template);
        return template;
    }

    public Template resolveByIdentifier(UnitOfWork uow, String euid) {
        Template cached = byEuid.get(euid);
        if (cached != null) {
            log.debug("Template cache hit for {}", euid);
            return cached;
        }
        Template template = templateRepository.findByEuid(uow, euid, false)
            .orElseThrow(() -> new TemplateNotFoundException(euid));
        remember(uow, template);
        return template;
    }

    public List<Template> list(UnitOfWork uow, TemplateFilter filter) {
        return templateRepository.list(uow, filter, LIST_LIMIT, 0);
    }

    /** Canonical code of a template, with trailing slash. */
    public static String templateCode(Template template) {
        return template.code().toCanonicalString();
    }

    public void invalidateCache() {
        byCode.clear();
        byEuid.clear();
        log.debug("Template cache invalidated");
    }

    /**
     * Invalidate now and again once {@code uow} commits, so entries loaded by other
     * units of work before the commit do not outlive the mutation.
     */
    public void invalidateOnCommit(UnitOfWork uow) {
        invalidateCache();
        uow.onCommit(invalidation);
    }

    int cacheSize() {
        return byCode.size();
    }

    private void remember(UnitOfWork uow, Template template) {
        byCode.put(template.code().toString(), template);
        byEuid.put(template.euid(), template);
        uow.onRollback(invalidation);
    }
}
