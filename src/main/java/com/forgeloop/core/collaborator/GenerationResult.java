package com.forgeloop.core.collaborator;

import java.util.Optional;

/**
 * @param code               generated code for the requested file
 * @param planModification   optional request to add a file; null when absent
 */
public record GenerationResult(
    String code,
    PlanModificationRequest planModification
) {

    public static GenerationResult of(String code) {
        return new GenerationResult(code, null);
    }

    public Optional<PlanModificationRequest> planModificationRequest() {
        return Optional.ofNullable(planModification);
    }
}
