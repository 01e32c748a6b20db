package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shared status vocabulary for all agent roles. Each {@link AgentRole} accepts a subset.
 */
public enum AgentStatus {
    IDLE("Idle"),
    THINKING("Thinking..."),
    RESEARCHING("Researching..."),
    PLANNING("Planning"),
    CODING("Coding"),
    TESTING("Testing"),
    DEBUGGING("Debugging"),
    REFACTORING("Refactoring"),
    DEPLOYING("Deploying"),
    AUDITING("Auditing"),
    INGESTING("Ingesting");

    private final String label;

    AgentStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
