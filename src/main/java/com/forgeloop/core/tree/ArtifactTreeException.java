package com.forgeloop.core.tree;

/**
 * Base class for structural errors raised by {@link ArtifactTree} mutations.
 */
public abstract class ArtifactTreeException extends RuntimeException {

    private final String path;

    protected ArtifactTreeException(String path, String message) {
        super(message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
