package com.forgeloop.core.collaborator;

import com.forgeloop.core.build.GenerationException;

/**
 * Produces code for one artifact.
 */
public interface GenerationCollaborator extends CapabilityAware {

    /**
     * @throws GenerationException when no code could be produced (timeouts included)
     */
    GenerationResult generate(GenerationRequest request);
}
