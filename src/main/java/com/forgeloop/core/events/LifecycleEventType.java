package com.forgeloop.core.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of lifecycle milestones broadcast to subscribers.
 */
public enum LifecycleEventType {
    PROJECT_CREATED("project.created"),
    PROJECT_UPDATED("project.updated"),
    IDEATION_COMPLETED("ideation.completed"),
    PLAN_GENERATED("plan.generated"),
    CODE_GENERATED("code.generated"),
    CODE_UPDATED("code.updated"),
    TEST_PASSED("test.passed"),
    TEST_FAILED("test.failed"),
    BUILD_STARTED("build.started"),
    BUILD_COMPLETED("build.completed"),
    BUILD_FAILED("build.failed"),
    DEPLOYMENT_STARTED("deployment.started"),
    DEPLOYMENT_COMPLETED("deployment.completed"),
    DEPLOYMENT_FAILED("deployment.failed"),
    ERROR_OCCURRED("error.occurred");

    private final String wireName;

    LifecycleEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name such as {@code "build.failed"}.
     *
     * @throws IllegalArgumentException for names outside the closed set
     */
    @JsonCreator
    public static LifecycleEventType fromWireName(String value) {
        for (LifecycleEventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
