package com.forgeloop.core.collaborator;

import java.util.Optional;

public interface DebugCollaborator extends CapabilityAware {

    /**
     * Proposes fixed code for a failing file.
     *
     * @return the fixed code, or empty when no fix could be produced
     */
    Optional<String> debug(String code, String errorMessage);
}
