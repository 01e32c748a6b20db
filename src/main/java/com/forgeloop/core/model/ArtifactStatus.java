package com.forgeloop.core.model;

/**
 * Generation status of an artifact node.
 */
public enum ArtifactStatus {
    PLANNED,
    GENERATING,
    GENERATED,
    MODIFIED,   // code replaced after the first generation (user edit or debugger fix)
    ERROR;

    /**
     * True once the node holds code produced by a generation or an edit.
     */
    public boolean hasCode() {
        return this == GENERATED || this == MODIFIED;
    }
}
