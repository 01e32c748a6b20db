package com.forgeloop.core.build;

public class BuildCancelledException extends BuildStepException {

    public BuildCancelledException(String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CANCELLED;
    }
}
