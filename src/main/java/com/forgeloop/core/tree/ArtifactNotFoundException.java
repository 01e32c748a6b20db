package com.forgeloop.core.tree;

public class ArtifactNotFoundException extends ArtifactTreeException {

    public ArtifactNotFoundException(String path) {
        super(path, "No artifact at path: " + path);
    }
}
