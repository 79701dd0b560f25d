package io.tapdb.domain.error;

/**
 * Thrown when a live lineage edge with the same parent, child and relationship exists.
 */
public class DuplicateEdgeException extends TapdbException {

    private final String parentEuid;
    private final String childEuid;
    private final String relationshipType;

    public DuplicateEdgeException(String parentEuid, String childEuid, String relationshipType) {
        this(parentEuid, childEuid, relationshipType, null);
    }

    public DuplicateEdgeException(String parentEuid, String childEuid, String relationshipType, Throwable cause) {
        super(String.format("[%s->%s:%s] lineage edge already exists", parentEuid, childEuid, relationshipType), cause);
        this.parentEuid = parentEuid;
        this.childEuid = childEuid;
        this.relationshipType = relationshipType;
    }

    public String getParentEuid() {
        return parentEuid;
    }

    public String getChildEuid() {
        return childEuid;
    }

    public String getRelationshipType() {
        return relationshipType;
    }
}
