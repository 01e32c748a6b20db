package com.forgeloop.core.build;

/**
 * A file whose tests pass after self-healing.
 *
 * @param path          the healed file
 * @param debugAttempts debug cycles it took; 0 when the first test run passed
 */
public record HealOutcome(String path, int debugAttempts) {}
