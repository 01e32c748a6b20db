package com.forgeloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable snapshot of one node of the artifact tree.
 *
 * @param path       unique slash-separated path within the tree (e.g. "src/App.tsx")
 * @param kind       file or directory
 * @param code       generated code; always null for directories
 * @param status     generation status
 * @param testStatus outcome of the latest test run
 * @param testError  error reported by the latest failing test run (nullable)
 * @param children   ordered child snapshots; always empty for files
 */
public record ArtifactNode(
    String path,
    ArtifactKind kind,
    String code,
    ArtifactStatus status,
    TestStatus testStatus,
    String testError,
    List<ArtifactNode> children
) implements Serializable {

    public ArtifactNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean isFile() {
        return kind == ArtifactKind.FILE;
    }

    public boolean isDirectory() {
        return kind == ArtifactKind.DIRECTORY;
    }

    /** Last path segment. */
    public String name() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
