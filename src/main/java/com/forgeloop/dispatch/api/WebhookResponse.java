package com.forgeloop.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.events.WebhookSubscription;

import java.time.Instant;
import java.util.List;

/**
 * Outbound view of a webhook subscription. The secret is never echoed.
 */
public record WebhookResponse(
    String id,
    String url,
    List<String> events,
    boolean active,
    @JsonProperty("has_secret") boolean hasSecret,
    @JsonProperty("header_names") List<String> headerNames,
    @JsonProperty("created_at") Instant createdAt
) {

    static WebhookResponse from(WebhookSubscription sub) {
        return new WebhookResponse(
                sub.id(),
                sub.url().toString(),
                sub.eventTypes().stream().map(LifecycleEventType::wireName).sorted().toList(),
                sub.active(),
                sub.hasSecret(),
                sub.headers().keySet().stream().sorted().toList(),
                sub.createdAt());
    }
}
