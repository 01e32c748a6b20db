package com.forgeloop.core.build;

/**
 * Raised when a test run could not be carried out at all, as opposed to a run that reported failures.
 */
public class TestInvocationException extends BuildStepException {

    public TestInvocationException(String message) {
        super(message);
    }

    public TestInvocationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TEST_INVOCATION;
    }
}
