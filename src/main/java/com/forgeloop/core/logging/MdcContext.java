package com.forgeloop.core.logging;

import com.forgeloop.core.model.AgentRole;
import org.slf4j.MDC;

/**
 * Utility for managing Forgeloop-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String BUILD_ID = "buildId";
    public static final String ARTIFACT_PATH = "artifactPath";
    public static final String AGENT_ROLE = "agentRole";

    private MdcContext() {}

    public static void setBuild(String buildId) {
        MDC.put(BUILD_ID, buildId);
    }

    public static void setStep(String buildId, String artifactPath, AgentRole role) {
        MDC.put(BUILD_ID, buildId);
        MDC.put(ARTIFACT_PATH, artifactPath);
        if (role != null) {
            MDC.put(AGENT_ROLE, role.name());
        } else {
            MDC.remove(AGENT_ROLE);
        }
    }

    public static void setRole(AgentRole role) {
        MDC.put(AGENT_ROLE, role.name());
    }

    public static void clearStep() {
        MDC.remove(ARTIFACT_PATH);
        MDC.remove(AGENT_ROLE);
    }

    public static void clear() {
        MDC.remove(BUILD_ID);
        MDC.remove(ARTIFACT_PATH);
        MDC.remove(AGENT_ROLE);
    }
}
