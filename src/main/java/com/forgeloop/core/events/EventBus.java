package com.forgeloop.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forgeloop.core.metrics.ForgeloopMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Queues lifecycle events and fans them out to webhook subscribers and in-process listeners.
 * <p>
 * {@link #emit} only enqueues. A single drain loop takes events oldest-first; for each event it
 * delivers to every matching active subscription concurrently and waits for all attempts before
 * taking the next event. Event order is therefore preserved per subscriber, while one slow
 * subscriber only delays the event it is receiving.
 * <p>
 * Delivery is best effort: failures are logged and counted, never retried, and never reach
 * the caller of {@link #emit}. Dispatched events stay in a bounded history for diagnostics.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final String HEADER_EVENT = "X-Webhook-Event";
    public static final String HEADER_ID = "X-Webhook-ID";
    public static final String HEADER_TIMESTAMP = "X-Webhook-Timestamp";
    public static final String HEADER_SIGNATURE = "X-Webhook-Signature";

    private final WebhookTransport transport;
    private final ObjectMapper objectMapper;
    private final ForgeloopMetrics metrics;
    private final String defaultSource;
    private final int historySize;
    private final Executor drainExecutor;
    private final ExecutorService deliveryPool;
    private final boolean ownsExecutors;

    private final ConcurrentHashMap<String, WebhookSubscription> subscriptions = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<LifecycleEvent>> localListeners = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedQueue<LifecycleEvent> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final Deque<LifecycleEvent> history = new ArrayDeque<>();
    private volatile boolean closed;

    /**
     * Creates a bus with its own drain thread and a bounded delivery pool.
     */
    public EventBus(WebhookTransport transport, ObjectMapper objectMapper, ForgeloopMetrics metrics,
                    String defaultSource, int historySize, int maxConcurrentDeliveries) {
        this(transport, objectMapper, metrics, defaultSource, historySize,
                Executors.newSingleThreadExecutor(daemonThreads("event-drain")),
                Executors.newFixedThreadPool(Math.max(1, maxConcurrentDeliveries), daemonThreads("webhook-delivery")),
                true);
    }

    /**
     * Creates a bus on caller-supplied executors, which the caller keeps ownership of.
     */
    public EventBus(WebhookTransport transport, ObjectMapper objectMapper, ForgeloopMetrics metrics,
                    String defaultSource, int historySize, Executor drainExecutor, ExecutorService deliveryPool) {
        this(transport, objectMapper, metrics, defaultSource, historySize, drainExecutor, deliveryPool, false);
    }

    private EventBus(WebhookTransport transport, ObjectMapper objectMapper, ForgeloopMetrics metrics,
                     String defaultSource, int historySize, Executor drainExecutor, ExecutorService deliveryPool,
                     boolean ownsExecutors) {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be positive: " + historySize);
        }
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.defaultSource = defaultSource;
        this.historySize = historySize;
        this.drainExecutor = drainExecutor;
        this.deliveryPool = deliveryPool;
        this.ownsExecutors = ownsExecutors;
    }

    /**
     * Object mapper producing the webhook wire format (ISO-8601 timestamps).
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    // ------------------------------------------------------------------
    // Subscriptions
    // ------------------------------------------------------------------

    /**
     * Registers an active webhook subscription.
     *
     * @return the new subscription id
     */
    public String subscribe(URI destination, Set<LifecycleEventType> eventTypes,
                            String secret, Map<String, String> headers) {
        if (destination == null) {
            throw new IllegalArgumentException("Webhook destination is required");
        }
        String id = UUID.randomUUID().toString();
        subscriptions.put(id, new WebhookSubscription(id, destination, eventTypes, true, secret, headers, Instant.now()));
        log.info("Webhook {} subscribed to {} for {}", id, destination, eventTypes);
        return id;
    }

    /**
     * Removes a subscription. Removing an unknown or already removed id returns false.
     */
    public boolean unsubscribe(String subscriptionId) {
        boolean removed = subscriptionId != null && subscriptions.remove(subscriptionId) != null;
        if (removed) {
            log.info("Webhook {} unsubscribed", subscriptionId);
        }
        return removed;
    }

    /**
     * Pauses or resumes a subscription.
     *
     * @return false if no such subscription exists
     */
    public boolean setActive(String subscriptionId, boolean active) {
        return subscriptions.computeIfPresent(subscriptionId, (id, sub) -> sub.withActive(active)) != null;
    }

    /** All subscriptions, active or not, oldest first. */
    public List<WebhookSubscription> getSubscriptions() {
        return subscriptions.values().stream()
                .sorted(Comparator.comparing(WebhookSubscription::createdAt))
                .toList();
    }

    /**
     * Registers an in-process listener, invoked from the drain loop after webhook fan-out.
     */
    public Subscription subscribeLocal(Consumer<LifecycleEvent> listener) {
        localListeners.add(listener);
        return () -> localListeners.remove(listener);
    }

    /**
     * Handle for cancelling an in-process subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    // ------------------------------------------------------------------
    // Emission and drain
    // ------------------------------------------------------------------

    public LifecycleEvent emit(LifecycleEventType type, Map<String, Object> payload) {
        return emit(type, payload, defaultSource);
    }

    /**
     * Enqueues an event and makes sure a drain loop is running. Never blocks on delivery.
     */
    public LifecycleEvent emit(LifecycleEventType type, Map<String, Object> payload, String source) {
        var event = LifecycleEvent.create(type, payload, source != null ? source : defaultSource);
        if (closed) {
            log.warn("Event bus closed, dropping {} {}", type.wireName(), event.id());
            return event;
        }
        queue.offer(event);
        log.debug("Queued event {} ({})", type.wireName(), event.id());
        scheduleDrain();
        return event;
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            try {
                drainExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.warn("Drain executor rejected work, {} event(s) left queued", queue.size());
            }
        }
    }

    private void drain() {
        while (true) {
            LifecycleEvent event;
            while ((event = queue.poll()) != null) {
                dispatch(event);
            }
            draining.set(false);
            // An emit can enqueue between the last poll and the flag reset; reclaim the loop if so.
            if (queue.isEmpty() || !draining.compareAndSet(false, true)) {
                return;
            }
        }
    }

    private void dispatch(LifecycleEvent event) {
        List<WebhookSubscription> targets = subscriptions.values().stream()
                .filter(sub -> sub.wants(event.type()))
                .toList();

        if (!targets.isEmpty()) {
            byte[] body = serialize(event);
            if (body != null) {
                var attempts = new ArrayList<CompletableFuture<Void>>(targets.size());
                for (WebhookSubscription sub : targets) {
                    attempts.add(submitDelivery(event, body, sub));
                }
                CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).join();
            }
        }

        for (Consumer<LifecycleEvent> listener : localListeners) {
            deliverSafely(listener, event);
        }
        remember(event);
    }

    private CompletableFuture<Void> submitDelivery(LifecycleEvent event, byte[] body, WebhookSubscription sub) {
        try {
            return CompletableFuture.runAsync(() -> deliver(event, body, sub), deliveryPool);
        } catch (RejectedExecutionException e) {
            log.warn("Delivery pool rejected {} for webhook {}", event.type().wireName(), sub.id());
            metrics.recordWebhookDelivery(false);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void deliver(LifecycleEvent event, byte[] body, WebhookSubscription sub) {
        try {
            transport.post(sub.url(), headersFor(event, body, sub), body);
            metrics.recordWebhookDelivery(true);
            log.debug("Delivered {} to webhook {}", event.type().wireName(), sub.id());
        } catch (WebhookDeliveryException e) {
            metrics.recordWebhookDelivery(false);
            log.warn("Webhook delivery failed for {} ({}): {}", sub.id(), event.type().wireName(), e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordWebhookDelivery(false);
            log.warn("Webhook delivery error for {} ({}): {}", sub.id(), event.type().wireName(), e.getMessage(), e);
        }
    }

    /**
     * Request headers for one delivery. Static subscription headers come first so the
     * required headers always win on a name clash.
     */
    Map<String, String> headersFor(LifecycleEvent event, byte[] body, WebhookSubscription sub) {
        var headers = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(sub.headers());
        headers.put("Content-Type", "application/json");
        headers.put(HEADER_EVENT, event.type().wireName());
        headers.put(HEADER_ID, event.id());
        headers.put(HEADER_TIMESTAMP, event.timestamp().toString());
        if (sub.hasSecret()) {
            headers.put(HEADER_SIGNATURE, WebhookSignature.sign(body, sub.secret()));
        }
        return headers;
    }

    private byte[] serialize(LifecycleEvent event) {
        try {
            return objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize event {} ({}), skipping webhook delivery: {}",
                    event.type().wireName(), event.id(), e.getMessage());
            return null;
        }
    }

    private void deliverSafely(Consumer<LifecycleEvent> listener, LifecycleEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.warn("Listener threw exception processing event {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // History and lifecycle
    // ------------------------------------------------------------------

    private void remember(LifecycleEvent event) {
        synchronized (history) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    /**
     * The most recent dispatched events, oldest first.
     */
    public List<LifecycleEvent> getEventHistory(int limit) {
        synchronized (history) {
            int skip = Math.max(0, history.size() - Math.max(0, limit));
            return history.stream().skip(skip).toList();
        }
    }

    /** Events emitted but not yet dispatched. */
    public int pendingEvents() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean validateSignature(String payload, String signature, String secret) {
        return WebhookSignature.validate(payload, signature, secret);
    }

    /**
     * Waits until the queue is empty and no drain loop is running.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!queue.isEmpty() || draining.get()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    /**
     * Stops accepting events, drains what is queued, then stops owned executors.
     */
    @Override
    public void close() {
        closed = true;
        if (!awaitIdle(Duration.ofSeconds(5))) {
            log.warn("Event bus closed with {} undelivered event(s)", queue.size());
        }
        if (ownsExecutors) {
            ((ExecutorService) drainExecutor).shutdown();
            deliveryPool.shutdown();
            try {
                if (!deliveryPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    deliveryPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                deliveryPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Event bus closed");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
