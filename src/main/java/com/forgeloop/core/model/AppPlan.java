package com.forgeloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Project plan produced by the planning collaborator or supplied by a user.
 *
 * @param projectName   short project name
 * @param description   what the project does
 * @param techStack     chosen technologies (nullable)
 * @param fileStructure top-level entries of the planned file tree
 */
public record AppPlan(
    String projectName,
    String description,
    TechStack techStack,
    List<PlannedFile> fileStructure
) implements Serializable {

    public AppPlan {
        fileStructure = fileStructure == null ? List.of() : List.copyOf(fileStructure);
    }
}
