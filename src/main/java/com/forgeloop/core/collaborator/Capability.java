package com.forgeloop.core.collaborator;

/**
 * Optional abilities a collaborator implementation declares up front.
 * Callers check them explicitly before relying on the matching behaviour.
 */
public enum Capability {
    GENERATE_CODE,
    /** Generation results may carry a request to add a file to the plan. */
    PLAN_MODIFICATION,
    RUN_TESTS,
    DEBUG,
    KNOWLEDGE_RECALL,
    KNOWLEDGE_LEARN,
    IDEATION,
    PLANNING
}
