package io.tapdb.bootstrap;

import io.tapdb.application.action.ActionHandlerRegistry;
import io.tapdb.application.port.output.AuditRepository;
import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.application.port.output.LineageRepository;
import io.tapdb.application.port.output.SequenceAllocator;
import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.application.service.ActionDispatcher;
import io.tapdb.application.service.ActionMaterializer;
import io.tapdb.application.service.DatabaseStatusService;
import io.tapdb.application.service.InstanceFactory;
import io.tapdb.application.service.LineageGraphManager;
import io.tapdb.application.service.ObjectService;
import io.tapdb.application.service.PayloadSchemaValidator;
import io.tapdb.application.service.TemplateResolver;
import io.tapdb.application.service.TemplateService;
import io.tapdb.config.TemplateConfigLoader;
import io.tapdb.config.TemplateConfigValidator;
import io.tapdb.config.TemplateSeeder;
import io.tapdb.domain.euid.EuidGenerator;
import io.tapdb.domain.euid.EuidRegistry;
import io.tapdb.infrastructure.persistence.AuditRecorder;
import io.tapdb.infrastructure.persistence.Database;
import io.tapdb.infrastructure.persistence.PostgresAuditRepository;
import io.tapdb.infrastructure.persistence.PostgresInstanceRepository;
import io.tapdb.infrastructure.persistence.PostgresLineageRepository;
import io.tapdb.infrastructure.persistence.PostgresSequenceAllocator;
import io.tapdb.infrastructure.persistence.PostgresTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine's repositories and services around one {@link Database}.
 *
 * <p>The template cache and the counter registry live here, one of each per
 * engine, and are handed to the services that need them.
 */
public final class TapdbEngine {
    private static final Logger log = LoggerFactory.getLogger(TapdbEngine.class);

    private final Database database;
    private final EuidRegistry euidRegistry;
    private final SequenceAllocator sequenceAllocator;
    private final AuditRepository auditRepository;
    private final TemplateRepository templateRepository;
    private final InstanceRepository instanceRepository;
    private final LineageRepository lineageRepository;
    private final TemplateResolver templateResolver;
    private final TemplateService templateService;
    private final PayloadSchemaValidator schemaValidator;
    private final InstanceFactory instanceFactory;
    private final LineageGraphManager lineageGraphManager;
    private final ActionHandlerRegistry actionHandlers;
    private final ActionDispatcher actionDispatcher;
    private final ObjectService objectService;
    private final DatabaseStatusService statusService;
    private final TemplateSeeder templateSeeder;

    public TapdbEngine(Database database) {
        this(database, null, ActionHandlerRegistry.withBuiltIns(), new PayloadSchemaValidator());
    }

    public TapdbEngine(Database database, String sandbox) {
        this(database, sandbox, ActionHandlerRegistry.withBuiltIns(), new PayloadSchemaValidator());
    }

    /**
     * @param sandbox sandbox letter for every new identifier, or null in production
     */
    public TapdbEngine(Database database, String sandbox, ActionHandlerRegistry actionHandlers,
                       PayloadSchemaValidator schemaValidator) {
        this.database = database;
        this.euidRegistry = new EuidRegistry();
        this.sequenceAllocator = new PostgresSequenceAllocator();
        EuidGenerator euidGenerator = new EuidGenerator(euidRegistry, sequenceAllocator, sandbox);

        this.auditRepository = new PostgresAuditRepository();
        AuditRecorder auditRecorder = new AuditRecorder(auditRepository);
        this.templateRepository = new PostgresTemplateRepository(auditRecorder, euidGenerator);
        this.instanceRepository = new PostgresInstanceRepository(auditRecorder, euidGenerator);
        this.lineageRepository = new PostgresLineageRepository(auditRecorder, euidGenerator);

        this.templateResolver = new TemplateResolver(templateRepository);
        this.templateService = new TemplateService(templateRepository, templateResolver, euidRegistry, sequenceAllocator);
        this.schemaValidator = schemaValidator;
        this.instanceFactory = new InstanceFactory(templateResolver, instanceRepository, lineageRepository,
            schemaValidator, new ActionMaterializer(templateResolver));
        this.lineageGraphManager = new LineageGraphManager(instanceRepository, lineageRepository);
        this.actionHandlers = actionHandlers;
        this.actionDispatcher = new ActionDispatcher(actionHandlers, instanceRepository, templateRepository);
        this.objectService = new ObjectService(templateRepository, instanceRepository, lineageRepository,
            templateService, instanceFactory, lineageGraphManager);
        this.statusService = new DatabaseStatusService(templateRepository, instanceRepository, lineageRepository,
            auditRepository);
        this.templateSeeder = new TemplateSeeder(new TemplateConfigLoader(), new TemplateConfigValidator(),
            templateRepository, templateService);
    }

    /** Register the instance prefixes of stored templates. Call once before creating instances. */
    public void startup() {
        int prefixes = database.inTransaction(database.defaultActor(), templateService::registerStoredPrefixes);
        log.info("TAPDB engine ready: dialect={}, prefixes={}", database.dialect(), prefixes);
    }

    public Database database() { return database; }
    public EuidRegistry euidRegistry() { return euidRegistry; }
    public SequenceAllocator sequenceAllocator() { return sequenceAllocator; }
    public AuditRepository auditRepository() { return auditRepository; }
    public TemplateRepository templateRepository() { return templateRepository; }
    public InstanceRepository instanceRepository() { return instanceRepository; }
    public LineageRepository lineageRepository() { return lineageRepository; }
    public TemplateResolver templateResolver() { return templateResolver; }
    public TemplateService templateService() { return templateService; }
    public PayloadSchemaValidator schemaValidator() { return schemaValidator; }
    public InstanceFactory instanceFactory() { return instanceFactory; }
    public LineageGraphManager lineageGraphManager() { return lineageGraphManager; }
    public ActionHandlerRegistry actionHandlers() { return actionHandlers; }
    public ActionDispatcher actionDispatcher() { return actionDispatcher; }
    public ObjectService objectService() { return objectService; }
    public DatabaseStatusService statusService() { return statusService; }
    public TemplateSeeder templateSeeder() { return templateSeeder; }
}
