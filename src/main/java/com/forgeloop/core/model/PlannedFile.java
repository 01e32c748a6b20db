package com.forgeloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One entry of a plan's file structure.
 *
 * @param path     path of the file or directory; child paths may be absolute within the
 *                 project ("src/App.tsx") or relative to the parent ("App.tsx")
 * @param type     file or directory
 * @param children nested entries for directories
 */
public record PlannedFile(
    String path,
    ArtifactKind type,
    List<PlannedFile> children
) implements Serializable {

    public PlannedFile {
        type = type == null ? ArtifactKind.FILE : type;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static PlannedFile file(String path) {
        return new PlannedFile(path, ArtifactKind.FILE, List.of());
    }

    public static PlannedFile directory(String path, PlannedFile... children) {
        return new PlannedFile(path, ArtifactKind.DIRECTORY, List.of(children));
    }
}
