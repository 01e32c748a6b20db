package com.forgeloop.core.build;

/**
 * Result of an adaptive file insertion.
 */
public enum InsertionResult {
    INSERTED,
    /** The path already existed; the tree is unchanged. */
    DUPLICATE,
    /** The path is invalid or blocked by a file ancestor; the tree is unchanged. */
    REJECTED;

    public String metricTag() {
        return name().toLowerCase();
    }
}
