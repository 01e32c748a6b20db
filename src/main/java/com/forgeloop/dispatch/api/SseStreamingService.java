package com.forgeloop.dispatch.api;

import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.events.LifecycleEvent;
import com.forgeloop.core.events.LifecycleEventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams lifecycle events to browser clients over SSE.
 * <p>
 * Every client is a {@link StreamClient}: one emitter, one local {@link EventBus} listener and
 * the set of event types it asked for. Frames are named after the event's wire name and carry
 * the event id, so a client can tell frames apart after a reconnect. Clients are dropped on
 * completion, timeout or error. Idle streams get a comment frame every
 * {@value #KEEPALIVE_SECONDS}s.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Long enough for a full build of a large plan. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    static final long KEEPALIVE_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final Map<String, StreamClient> clients = new ConcurrentHashMap<>();

    private final ScheduledExecutorService keepalive = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-keepalive");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void start() {
        keepalive.scheduleAtFixedRate(this::pingIdleClients, KEEPALIVE_SECONDS, KEEPALIVE_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        keepalive.shutdownNow();
        clients.values().forEach(client -> client.emitter().complete());
        clients.values().forEach(this::drop);
        log.info("SSE streaming stopped");
    }

    /**
     * Opens a stream of every lifecycle event emitted from now on.
     */
    public SseEmitter createEmitter() {
        return createEmitter(EnumSet.allOf(LifecycleEventType.class));
    }

    /**
     * Opens a stream limited to the given event types. An empty set means every type.
     */
    public SseEmitter createEmitter(Set<LifecycleEventType> types) {
        Set<LifecycleEventType> wanted = types == null || types.isEmpty()
                ? EnumSet.allOf(LifecycleEventType.class)
                : EnumSet.copyOf(types);
        String clientId = UUID.randomUUID().toString().substring(0, 8);
        SseEmitter emitter = new SseEmitter(timeoutMs);

        var client = new StreamClient(clientId, emitter, wanted, new AtomicLong(System.nanoTime()),
                eventBus.subscribeLocal(event -> forward(clientId, event)));
        clients.put(clientId, client);

        emitter.onCompletion(() -> drop(client));
        emitter.onTimeout(() -> {
            log.debug("SSE client {} timed out", clientId);
            drop(client);
        });
        emitter.onError(ex -> {
            log.debug("SSE client {} failed: {}", clientId, ex.getMessage());
            drop(client);
        });

        send(client, SseEmitter.event().comment("connected " + clientId));
        log.info("SSE client {} connected for {} event type(s)", clientId, wanted.size());
        return emitter;
    }

    public int activeEmitterCount() {
        return clients.size();
    }

    /** Pings clients that have not received a frame for a full keepalive interval. */
    void pingIdleClients() {
        long threshold = System.nanoTime() - TimeUnit.SECONDS.toNanos(KEEPALIVE_SECONDS);
        for (StreamClient client : clients.values()) {
            if (client.lastFrameNanos().get() <= threshold) {
                send(client, SseEmitter.event().comment("keepalive"));
            }
        }
    }

    private void forward(String clientId, LifecycleEvent event) {
        StreamClient client = clients.get(clientId);
        if (client == null || !client.types().contains(event.type())) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", event.id());
        data.put("source", event.source());
        data.put("timestamp", event.timestamp().toString());
        data.put("data", event.payload());
        send(client, SseEmitter.event()
                .id(event.id())
                .name(event.type().wireName())
                .data(data));
    }

    private void send(StreamClient client, SseEmitter.SseEventBuilder frame) {
        try {
            client.emitter().send(frame);
            client.lastFrameNanos().set(System.nanoTime());
        } catch (IOException | IllegalStateException e) {
            // the emitter's own callbacks drop the client
            log.debug("SSE frame to client {} not sent: {}", client.id(), e.getMessage());
        }
    }

    private void drop(StreamClient client) {
        if (clients.remove(client.id(), client)) {
            client.subscription().unsubscribe();
            log.debug("SSE client {} disconnected", client.id());
        }
    }

    private record StreamClient(
            String id,
            SseEmitter emitter,
            Set<LifecycleEventType> types,
            AtomicLong lastFrameNanos,
            EventBus.Subscription subscription
    ) {}
}
