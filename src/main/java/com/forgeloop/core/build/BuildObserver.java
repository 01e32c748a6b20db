package com.forgeloop.core.build;

import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.ChatMessage;
import com.forgeloop.core.model.TerminalEntry;

/**
 * Receives the human-facing narration of a build: terminal lines, chat messages and the
 * project-level error. Every method defaults to a no-op.
 */
public interface BuildObserver {

    BuildObserver NOOP = new BuildObserver() {};

    /** A full build acquired the pipeline. */
    default void buildStarted(String buildId) {}

    /** A full build released the pipeline; not called for rejected builds. */
    default void buildFinished(BuildOutcome outcome) {}

    default void terminal(AgentRole agent, String message, TerminalEntry.Level level) {}

    default void chat(ChatMessage.Role role, String content) {}

    /**
     * Sets or, with null, clears the project error.
     */
    default void projectError(String message) {}
}
