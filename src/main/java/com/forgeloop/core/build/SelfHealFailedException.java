package com.forgeloop.core.build;

/**
 * A file whose tests still fail after self-healing gave up.
 * <p>
 * Callers treat every instance the same way; {@link #getResult()} tells
 * "debugger produced no fix" apart from {@link SelfHealExhaustedException}.
 */
public class SelfHealFailedException extends BuildStepException {

    private final String path;
    private final int debugAttempts;
    private final String lastError;

    public SelfHealFailedException(String path, int debugAttempts, String lastError) {
        this("Debugger could not fix " + path + ": " + lastError, path, debugAttempts, lastError);
    }

    protected SelfHealFailedException(String message, String path, int debugAttempts, String lastError) {
        super(message);
        this.path = path;
        this.debugAttempts = debugAttempts;
        this.lastError = lastError;
    }

    public HealResult getResult() {
        return HealResult.NO_FIX;
    }

    public String getPath() {
        return path;
    }

    public int getDebugAttempts() {
        return debugAttempts;
    }

    public String getLastError() {
        return lastError;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.SELF_HEAL;
    }
}
