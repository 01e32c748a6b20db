package com.forgeloop.dispatch.api;

import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.events.LifecycleEvent;
import com.forgeloop.core.events.LifecycleEventType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for webhook subscriptions and the dispatched-event history.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    static final int DEFAULT_HISTORY_LIMIT = 50;

    private final EventBus eventBus;

    public WebhookController(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * POST /api/v1/webhooks: Subscribe a URL to a set of event types.
     */
    @PostMapping
    public ResponseEntity<?> subscribe(@RequestBody WebhookRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "URL is required"));
        }
        URI url;
        try {
            url = URI.create(request.url().trim());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid URL: " + request.url()));
        }
        if (!"http".equalsIgnoreCase(url.getScheme()) && !"https".equalsIgnoreCase(url.getScheme())) {
            return ResponseEntity.badRequest().body(Map.of("error", "URL must use http or https: " + request.url()));
        }
        if (request.events() == null || request.events().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one event type is required"));
        }

        Set<LifecycleEventType> types = EnumSet.noneOf(LifecycleEventType.class);
        for (String name : request.events()) {
            try {
                types.add(LifecycleEventType.fromWireName(name));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
            }
        }

        String id = eventBus.subscribe(url, types, request.secret(), request.headers());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    /**
     * GET /api/v1/webhooks: All subscriptions, active or paused.
     */
    @GetMapping
    public ResponseEntity<List<WebhookResponse>> list() {
        return ResponseEntity.ok(eventBus.getSubscriptions().stream().map(WebhookResponse::from).toList());
    }

    /**
     * DELETE /api/v1/webhooks/{id}: Remove a subscription.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> unsubscribe(@PathVariable String id) {
        return eventBus.unsubscribe(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * PUT /api/v1/webhooks/{id}/active: Pause or resume a subscription.
     */
    @PutMapping("/{id}/active")
    public ResponseEntity<?> setActive(@PathVariable String id, @RequestBody Map<String, Boolean> body) {
        Boolean active = body != null ? body.get("active") : null;
        if (active == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Field 'active' is required"));
        }
        if (!eventBus.setActive(id, active)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("id", id, "active", active));
    }

    /**
     * GET /api/v1/webhooks/history: Most recently dispatched events, oldest first.
     */
    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestParam(name = "limit", required = false) Integer limit) {
        int effective = limit != null ? limit : DEFAULT_HISTORY_LIMIT;
        if (effective < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must not be negative"));
        }
        List<LifecycleEvent> events = eventBus.getEventHistory(effective);
        return ResponseEntity.ok(events);
    }
}
