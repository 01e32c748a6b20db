package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether an artifact node holds code or other nodes.
 */
public enum ArtifactKind {
    FILE,
    DIRECTORY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ArtifactKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            return FILE;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
