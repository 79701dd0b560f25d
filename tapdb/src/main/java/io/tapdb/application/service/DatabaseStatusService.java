package io.tapdb.application.service;

import io.tapdb.application.port.output.AuditRepository;
import io.tapdb.application.port.output.InstanceRepository;
import io.tapdb.application.port.output.LineageRepository;
import io.tapdb.application.port.output.TemplateRepository;
import io.tapdb.domain.model.InstanceFilter;
import io.tapdb.domain.model.TemplateFilter;
import io.tapdb.infrastructure.persistence.CoreTables;
import io.tapdb.infrastructure.persistence.UnitOfWork;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row counts of the core tables.
 */
public class DatabaseStatusService {

    private final TemplateRepository templateRepository;
    private final InstanceRepository instanceRepository;
    private final LineageRepository lineageRepository;
    private final AuditRepository auditRepository;

    public DatabaseStatusService(TemplateRepository templateRepository, InstanceRepository instanceRepository,
                                 LineageRepository lineageRepository, AuditRepository auditRepository) {
        this.templateRepository = templateRepository;
        this.instanceRepository = instanceRepository;
        this.lineageRepository = lineageRepository;
        this.auditRepository = auditRepository;
    }

    /** Live and total rows per core table, in schema order. The audit log has no soft delete. */
    public Map<String, TableCount> tableCounts(UnitOfWork uow) {
        Map<String, TableCount> counts = new LinkedHashMap<>();
        counts.put(CoreTables.TEMPLATE, new TableCount(
            templateRepository.count(uow, TemplateFilter.all()),
            templateRepository.count(uow, new TemplateFilter(null, null, null, null, true))));
        counts.put(CoreTables.INSTANCE, new TableCount(
            instanceRepository.count(uow, InstanceFilter.all()),
            instanceRepository.count(uow, new InstanceFilter(null, null, null, null, true))));
        counts.put(CoreTables.LINEAGE, new TableCount(
            lineageRepository.count(uow, false),
            lineageRepository.count(uow, true)));
        long audit = auditRepository.count(uow);
        counts.put(CoreTables.AUDIT_LOG, new TableCount(audit, audit));
        return counts;
    }

    public record TableCount(long live, long total) {}
}
