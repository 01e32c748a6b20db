package com.forgeloop.core.build;

/**
 * File-level failure kinds that halt a build.
 */
public enum FailureKind {
    GENERATION,
    TEST_INVOCATION,
    SELF_HEAL,
    CANCELLED
}
