package io.tapdb.domain.model;

public enum AuditOperation {
    INSERT,
    UPDATE,
    DELETE
}
