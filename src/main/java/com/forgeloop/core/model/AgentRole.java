package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.forgeloop.core.model.AgentStatus.*;

/**
 * Fixed worker roles. Every role can be {@link AgentStatus#IDLE}; the other statuses
 * a role may report are listed per constant.
 */
public enum AgentRole {
    ORCHESTRATOR("Orchestrator", THINKING, PLANNING, INGESTING),
    MARKET_ANALYST("Market Analyst", RESEARCHING, THINKING),
    PRODUCT_STRATEGIST("Product Strategist", THINKING, RESEARCHING),
    FRONTEND_EXPERT("Frontend Expert", CODING, REFACTORING),
    BACKEND_EXPERT("Backend Expert", CODING, REFACTORING),
    DB_ARCHITECT("DB Architect", PLANNING, CODING),
    QA_ENGINEER("QA Engineer", TESTING),
    DEBUGGER("Debugger", DEBUGGING),
    SENIOR_ARCHITECT("Senior Architect", THINKING, REFACTORING),
    DEVOPS_ENGINEER("DevOps Engineer", DEPLOYING, CODING),
    SECURITY_ANALYST("Security Analyst", AUDITING),
    SOFTWARE_ARCHITECT("Software Architect", THINKING, PLANNING),
    FULL_STACK_DEVELOPER("Full-Stack Developer", CODING, TESTING, DEBUGGING),
    UI_UX_EXPERT("UI/UX Expert", THINKING, CODING);

    private final String displayName;
    private final Set<AgentStatus> allowedStatuses;

    AgentRole(String displayName, AgentStatus... statuses) {
        this.displayName = displayName;
        this.allowedStatuses = Collections.unmodifiableSet(EnumSet.of(IDLE, statuses));
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public Set<AgentStatus> allowedStatuses() {
        return allowedStatuses;
    }

    public boolean accepts(AgentStatus status) {
        return allowedStatuses.contains(status);
    }
}
