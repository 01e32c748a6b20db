package com.forgeloop.core.agent;

import com.forgeloop.core.model.AgentRole;

/**
 * Picks the coder role that generates a given artifact path.
 */
@FunctionalInterface
public interface RoleClassifier {

    AgentRole coderFor(String path);
}
