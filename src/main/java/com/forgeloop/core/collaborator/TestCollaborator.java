package com.forgeloop.core.collaborator;

import com.forgeloop.core.build.TestInvocationException;

public interface TestCollaborator extends CapabilityAware {

    /**
     * Runs the tests for a piece of code.
     *
     * @throws TestInvocationException if the tests could not be run at all
     */
    TestOutcome runTests(String code);
}
