package com.forgeloop.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A lifecycle notification. Serialized as the body of every webhook request.
 *
 * @param id        unique event id
 * @param type      milestone type
 * @param timestamp creation time
 * @param payload   event data, written as {@code "data"} on the wire
 * @param source    tag naming the emitter (e.g. "sdlc-agent")
 */
public record LifecycleEvent(
    String id,
    LifecycleEventType type,
    Instant timestamp,
    @JsonProperty("data") Map<String, Object> payload,
    String source
) {

    public LifecycleEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static LifecycleEvent create(LifecycleEventType type, Map<String, Object> payload, String source) {
        return new LifecycleEvent(UUID.randomUUID().toString(), type, Instant.now(), payload, source);
    }
}
