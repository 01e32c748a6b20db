package com.forgeloop.core.collaborator;

/**
 * @param success      true when every test passed
 * @param errorMessage failure description; null on success
 */
public record TestOutcome(boolean success, String errorMessage) {

    public static TestOutcome passed() {
        return new TestOutcome(true, null);
    }

    public static TestOutcome failed(String errorMessage) {
        return new TestOutcome(false, errorMessage);
    }
}
