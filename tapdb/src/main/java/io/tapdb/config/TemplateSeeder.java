package io.tapdb.config;

import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.application.service.TemplateService;
import io.tapdb.domain.model.Template;
import io.tapdb.domain.model.TemplateFilter;
import io.tapdb.infrastructure.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Loads template configuration into the store.
 *
 * <p>Validation runs first and any error aborts the run before a single write.
 * Each template's instance prefix is registered and its counter provisioned;
 * missing templates are inserted. With {@code overwrite} existing templates are
 * updated and soft-deleted ones revived; otherwise they are skipped.
 */
public class TemplateSeeder {
    private static final Logger log = LoggerFactory.getLogger(TemplateSeeder.class);

    private static final int KNOWN_CODES_LIMIT = 100_000;

    private final TemplateConfigLoader loader;
    private final TemplateConfigValidator validator;
    private final TemplateRepository templateRepository;
    private final TemplateService templateService;

    public TemplateSeeder(TemplateConfigLoader loader, TemplateConfigValidator validator,
                          TemplateRepository templateRepository, TemplateService templateService) {
        this.loader = loader;
        this.validator = validator;
        this.templateRepository = templateRepository;
        this.templateService = templateService;
    }

    public SeedResult seedDirectory(UnitOfWork uow, Path configDir, boolean overwrite, boolean strict) {
        return seed(uow, loader.loadDirectory(configDir), overwrite, strict);
    }

    /**
     * @throws TemplateConfigException when validation reports errors
     */
    public SeedResult seed(UnitOfWork uow, List<TemplateDocument> documents, boolean overwrite, boolean strict) {
        ConfigValidationResult validation = validator.validate(documents, strict, storedCodes(uow));
        if (validation.hasErrors()) {
            log.error("Template seeding aborted: {} validation error(s)", validation.errors().size());
            throw new TemplateConfigException(validation.errors());
        }

        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        for (TemplateDefinition definition : validation.templates()) {
            templateService.provisionPrefix(uow, definition.instancePrefix());
            Template draft = definition.toDraft();
            Optional<Template> existing = templateRepository.findAnyByCode(uow, definition.code());
            if (existing.isEmpty()) {
                templateService.create(uow, draft);
                inserted++;
            } else if (overwrite) {
                templateService.update(uow, existing.get().withDefinitionOf(draft));
                updated++;
            } else {
                log.debug("Template {} exists, skipping", definition.code());
                skipped++;
            }
        }
        log.info("Seeded templates: {} inserted, {} updated, {} skipped", inserted, updated, skipped);
        return new SeedResult(inserted, updated, skipped, validation.warnings());
    }

    private Set<String> storedCodes(UnitOfWork uow) {
        Set<String> codes = new HashSet<>();
        for (Template t : templateRepository.list(uow, TemplateFilter.all(), KNOWN_CODES_LIMIT, 0)) {
            codes.add(t.code().toString());
        }
        return codes;
    }
}
