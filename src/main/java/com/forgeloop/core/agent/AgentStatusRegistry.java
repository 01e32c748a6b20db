package com.forgeloop.core.agent;

import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-writer-wins status per agent role.
 * <p>
 * No ordering is enforced across roles. Callers keep to the convention that one
 * logical step at a time owns a given role's status.
 */
@Service
public class AgentStatusRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentStatusRegistry.class);

    private final ConcurrentHashMap<AgentRole, AgentStatus> statuses = new ConcurrentHashMap<>();

    /**
     * Overwrites the role's status.
     *
     * @throws IllegalArgumentException if the status is not one the role can report
     */
    public void setStatus(AgentRole role, AgentStatus status) {
        if (!role.accepts(status)) {
            throw new IllegalArgumentException(
                    role.displayName() + " cannot report status " + status.label());
        }
        AgentStatus previous = statuses.put(role, status);
        if (previous != status) {
            log.debug("{}: {} -> {}", role.displayName(), previous != null ? previous.label() : "Idle", status.label());
        }
    }

    public AgentStatus getStatus(AgentRole role) {
        return statuses.getOrDefault(role, AgentStatus.IDLE);
    }

    /** Every role with its current status, in declaration order. */
    public Map<AgentRole, AgentStatus> snapshot() {
        var out = new EnumMap<AgentRole, AgentStatus>(AgentRole.class);
        for (AgentRole role : AgentRole.values()) {
            out.put(role, getStatus(role));
        }
        return out;
    }

    /** Returns every role to {@link AgentStatus#IDLE}. */
    public void reset() {
        statuses.clear();
    }
}
