package io.tapdb.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit trail row.
 *
 * <p>{@code columnName}, {@code oldValue} and {@code newValue} are only set for
 * UPDATE entries; {@code deletedRecord} only for DELETE entries.
 */
public record AuditEntry(
    UUID uuid,
    String tableName,
    UUID targetUuid,
    String targetEuid,
    String columnName,
    String oldValue,
    String newValue,
    String changedBy,
    Instant changedAt,
    AuditOperation operation,
    JsonNode deletedRecord
) {}
