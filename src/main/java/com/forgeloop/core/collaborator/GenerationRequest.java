package com.forgeloop.core.collaborator;

import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;

import java.util.List;

/**
 * Input to one code generation call.
 *
 * @param artifact  the file to generate
 * @param plan      the full project plan
 * @param knowledge snippets recalled from earlier successful files
 * @param allNodes  the whole tree, flattened, for cross-file awareness
 */
public record GenerationRequest(
    ArtifactNode artifact,
    AppPlan plan,
    List<String> knowledge,
    List<ArtifactNode> allNodes
) {

    public GenerationRequest {
        knowledge = knowledge == null ? List.of() : List.copyOf(knowledge);
        allNodes = allNodes == null ? List.of() : List.copyOf(allNodes);
    }
}
