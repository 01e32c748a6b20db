package com.forgeloop.core.build;

import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.ChatMessage;
import com.forgeloop.core.model.TerminalEntry;

import java.util.HashSet;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Context of one pipeline run, passed explicitly to every step.
 * <p>
 * A bulk session (a full build) keeps terminal lines but suppresses per-step chat narration,
 * so a long build does not flood the chat log.
 */
public final class BuildSession {

    private final String id;
    private final boolean bulk;
    private final BuildObserver observer;
    private final Integer maxDebugAttempts;
    private volatile boolean cancelled;
    private final Set<String> attempted = new HashSet<>();
    private final AtomicInteger filesGenerated = new AtomicInteger();
    private final AtomicInteger debugAttempts = new AtomicInteger();

    BuildSession(boolean bulk, BuildObserver observer, Integer maxDebugAttempts) {
        if (maxDebugAttempts != null && maxDebugAttempts < 0) {
            throw new IllegalArgumentException("maxDebugAttempts must not be negative: " + maxDebugAttempts);
        }
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.bulk = bulk;
        this.observer = observer != null ? observer : BuildObserver.NOOP;
        this.maxDebugAttempts = maxDebugAttempts;
    }

    public static BuildSession bulk(BuildObserver observer) {
        return new BuildSession(true, observer, null);
    }

    /**
     * @param maxDebugAttempts overrides the configured self-healing bound; null keeps it
     */
    public static BuildSession bulk(BuildObserver observer, Integer maxDebugAttempts) {
        return new BuildSession(true, observer, maxDebugAttempts);
    }

    public static BuildSession interactive(BuildObserver observer) {
        return new BuildSession(false, observer, null);
    }

    public String id() {
        return id;
    }

    public boolean isBulk() {
        return bulk;
    }

    public BuildObserver observer() {
        return observer;
    }

    /** Self-healing bound for this session, if overridden. */
    public OptionalInt maxDebugAttempts() {
        return maxDebugAttempts != null ? OptionalInt.of(maxDebugAttempts) : OptionalInt.empty();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws BuildCancelledException if {@link #cancel()} has been called
     */
    public void checkCancelled() {
        if (cancelled) {
            throw new BuildCancelledException("Build " + id + " was cancelled");
        }
    }

    /** Marks a path as attempted; returns false if it already was. */
    synchronized boolean markAttempted(String path) {
        return attempted.add(path);
    }

    synchronized boolean wasAttempted(String path) {
        return attempted.contains(path);
    }

    void recordFileGenerated() {
        filesGenerated.incrementAndGet();
    }

    void recordDebugAttempt() {
        debugAttempts.incrementAndGet();
    }

    public int filesGenerated() {
        return filesGenerated.get();
    }

    public int debugAttempts() {
        return debugAttempts.get();
    }

    void terminal(AgentRole agent, String message, TerminalEntry.Level level) {
        observer.terminal(agent, message, level);
    }

    /** Chat narration, dropped for bulk sessions. */
    void narrate(ChatMessage.Role role, String content) {
        if (!bulk) {
            observer.chat(role, content);
        }
    }

    /** Chat message shown regardless of session kind. */
    void announce(ChatMessage.Role role, String content) {
        observer.chat(role, content);
    }
}
