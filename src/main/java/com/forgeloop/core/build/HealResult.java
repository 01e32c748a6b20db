package com.forgeloop.core.build;

/**
 * Terminal result of a self-healing run for one file.
 */
public enum HealResult {
    PASSED,
    /** The debugger returned no fix for the latest failure. */
    NO_FIX,
    /** The debug-and-retest bound was reached while tests still failed. */
    EXHAUSTED
}
