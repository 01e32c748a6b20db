package com.forgeloop.core.tree;

/**
 * Thrown when inserting a node at a path that is already taken.
 */
public class DuplicatePathException extends ArtifactTreeException {

    public DuplicatePathException(String path) {
        super(path, "Artifact already exists: " + path);
    }
}
