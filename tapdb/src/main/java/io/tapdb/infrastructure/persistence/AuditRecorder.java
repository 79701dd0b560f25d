package io.tapdb.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tapdb.application.port.output.AuditRepository;
import io.tapdb.domain.model.AuditEntry;
import io.tapdb.domain.model.AuditOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Writes the audit trail for every repository write on the core tables.
 *
 * <p>Rows are passed as ordered column maps in text form. Updates produce one
 * entry per changed column; deletes produce a single entry carrying the full
 * pre-delete snapshot.
 */
public class AuditRecorder {
    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private static final Set<String> NOT_DIFFED = Set.of("modified_at");
    private static final Set<String> JSON_COLUMNS = Set.of("payload", "payload_schema");

    private final AuditRepository auditRepository;

    public AuditRecorder(AuditRepository auditRepository) {
        this.auditRepository = auditRepository;
    }

    public void recordInsert(UnitOfWork uow, String table, UUID uuid, String euid) {
        auditRepository.append(uow, entry(uow, table, uuid, euid, null, null, null, AuditOperation.INSERT, null));
    }

    /**
     * Diff two versions of a row.
     *
     * @return number of UPDATE entries written
     */
    public int recordUpdate(UnitOfWork uow, String table, UUID uuid, String euid,
                            Map<String, String> before, Map<String, String> after) {
        int written = 0;
        for (Map.Entry<String, String> column : after.entrySet()) {
            String name = column.getKey();
            if (NOT_DIFFED.contains(name)) {
                continue;
            }
            String oldValue = before.get(name);
            String newValue = column.getValue();
            if (!Objects.equals(oldValue, newValue)) {
                auditRepository.append(uow,
                    entry(uow, table, uuid, euid, name, oldValue, newValue, AuditOperation.UPDATE, null));
                written++;
            }
        }
        log.debug("Audited {} changed column(s) on {} {}", written, table, euid);
        return written;
    }

    public void recordDelete(UnitOfWork uow, String table, UUID uuid, String euid, Map<String, String> row) {
        auditRepository.append(uow,
            entry(uow, table, uuid, euid, null, null, null, AuditOperation.DELETE, snapshot(row)));
        log.info("Soft deleted {} {} by {}", table, euid, uow.actor());
    }

    /** Column map as a JSON object; JSON columns are embedded rather than quoted. */
    static ObjectNode snapshot(Map<String, String> row) {
        ObjectNode node = JdbcRows.MAPPER.createObjectNode();
        for (Map.Entry<String, String> column : row.entrySet()) {
            String value = column.getValue();
            if (value == null) {
                node.putNull(column.getKey());
            } else if (JSON_COLUMNS.contains(column.getKey())) {
                node.set(column.getKey(), JdbcRows.parseJson(value));
            } else {
                node.put(column.getKey(), value);
            }
        }
        return node;
    }

    private static AuditEntry entry(UnitOfWork uow, String table, UUID uuid, String euid, String column,
                                    String oldValue, String newValue, AuditOperation operation,
                                    JsonNode deletedRecord) {
        return new AuditEntry(UUID.randomUUID(), table, uuid, euid, column, oldValue, newValue,
            uow.actor(), Instant.now(), operation, deletedRecord);
    }
}
