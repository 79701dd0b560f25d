package io.tapdb.domain.model;

/**
 * Which side of an instance's lineage to traverse.
 */
public enum LineageDirection {
    CHILDREN,
    PARENTS
}
