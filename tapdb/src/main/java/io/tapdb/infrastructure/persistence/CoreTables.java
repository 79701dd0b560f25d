package io.tapdb.infrastructure.persistence;

import java.util.List;

/**
 * Names of the core tables.
 */
public final class CoreTables {

    public static final String TEMPLATE = "generic_template";
    public static final String INSTANCE = "generic_instance";
    public static final String LINEAGE = "generic_instance_lineage";
    public static final String AUDIT_LOG = "audit_log";

    public static final List<String> ALL = List.of(TEMPLATE, INSTANCE, LINEAGE, AUDIT_LOG);

    private CoreTables() {}
}
