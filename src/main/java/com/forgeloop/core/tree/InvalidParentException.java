package com.forgeloop.core.tree;

/**
 * Thrown when the parent segment of a path is missing or is not a directory.
 */
public class InvalidParentException extends ArtifactTreeException {

    public InvalidParentException(String path, String parent) {
        super(path, "Parent of " + path + " is not an existing directory: " + parent);
    }
}
