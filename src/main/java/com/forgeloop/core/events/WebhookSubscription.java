package com.forgeloop.core.events;

import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * A webhook destination and the event types it wants.
 *
 * @param id         subscription id
 * @param url        destination receiving HTTP POSTs
 * @param eventTypes event types delivered to this destination
 * @param active     inactive subscriptions are skipped
 * @param secret     shared secret for request signing (nullable)
 * @param headers    static headers added to every request
 * @param createdAt  when the subscription was made
 */
public record WebhookSubscription(
    String id,
    URI url,
    Set<LifecycleEventType> eventTypes,
    boolean active,
    String secret,
    Map<String, String> headers,
    Instant createdAt
) {

    public WebhookSubscription {
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean hasSecret() {
        return secret != null && !secret.isEmpty();
    }

    public boolean wants(LifecycleEventType type) {
        return active && eventTypes.contains(type);
    }

    public WebhookSubscription withActive(boolean active) {
        return new WebhookSubscription(id, url, eventTypes, active, secret, headers, createdAt);
    }
}
