package com.forgeloop.core.model;

/**
 * Outcome of the most recent test run for a file.
 */
public enum TestStatus {
    UNTESTED,
    PASSING,
    FAILING
}
