package com.forgeloop.core.model;

/**
 * Overall phase of a project, from raw idea to code generation.
 */
public enum ProjectPhase {
    IDEA_INPUT,
    IDEATION,
    PLANNING,
    CODING
}
