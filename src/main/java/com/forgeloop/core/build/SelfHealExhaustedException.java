package com.forgeloop.core.build;

/**
 * Tests still failed after the configured number of debug-and-retest cycles.
 */
public class SelfHealExhaustedException extends SelfHealFailedException {

    public SelfHealExhaustedException(String path, int debugAttempts, String lastError) {
        super("Self-healing exhausted for " + path + " after " + debugAttempts
                + " debug attempt(s): " + lastError, path, debugAttempts, lastError);
    }

    @Override
    public HealResult getResult() {
        return HealResult.EXHAUSTED;
    }
}
