package com.forgeloop.core.build;

/**
 * Raised by a generation collaborator that could not produce code.
 */
public class GenerationException extends BuildStepException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.GENERATION;
    }
}
