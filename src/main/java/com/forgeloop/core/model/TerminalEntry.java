package com.forgeloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One line of the build terminal log.
 *
 * @param agent     role that produced the line, or null for system lines
 * @param message   text
 * @param level     severity
 * @param timestamp when the line was written
 */
public record TerminalEntry(
    AgentRole agent,
    String message,
    Level level,
    Instant timestamp
) implements Serializable {

    public enum Level { INFO, SUCCESS, WARNING, ERROR }
}
