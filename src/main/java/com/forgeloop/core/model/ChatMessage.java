package com.forgeloop.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry of the project chat log.
 */
public record ChatMessage(
    String id,
    Role role,
    String content,
    Instant timestamp
) implements Serializable {

    public enum Role { USER, ASSISTANT, SYSTEM }

    public static ChatMessage of(Role role, String content) {
        return new ChatMessage(UUID.randomUUID().toString(), role, content, Instant.now());
    }
}
