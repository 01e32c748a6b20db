package com.forgeloop.core.build;

/**
 * Result of {@link BuildPipeline#buildAll}. File-level failures end up here rather than
 * being thrown.
 *
 * @param status          how the run ended
 * @param failedPath      artifact the build halted on; null unless HALTED or CANCELLED mid-file
 * @param failureKind     kind of the halting failure; null when none
 * @param message         human-readable summary
 * @param filesGenerated  files generated during the run
 * @param debugAttempts   debug cycles spent during the run
 * @param sessionId       id of the build session; null when REJECTED
 */
public record BuildOutcome(
    Status status,
    String failedPath,
    FailureKind failureKind,
    String message,
    int filesGenerated,
    int debugAttempts,
    String sessionId
) {

    public enum Status {
        COMPLETED,
        HALTED,
        CANCELLED,
        /** Another build was already running; nothing was touched. */
        REJECTED
    }

    public static BuildOutcome rejected() {
        return new BuildOutcome(Status.REJECTED, null, null, "A build is already in progress", 0, 0, null);
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }
}
