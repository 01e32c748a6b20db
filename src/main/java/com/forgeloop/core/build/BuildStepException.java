package com.forgeloop.core.build;

/**
 * Base class for failures that halt the build pipeline at one artifact.
 */
public abstract class BuildStepException extends RuntimeException {

    protected BuildStepException(String message) {
        super(message);
    }

    protected BuildStepException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
