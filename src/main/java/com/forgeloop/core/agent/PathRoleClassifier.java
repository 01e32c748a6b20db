package com.forgeloop.core.agent;

import com.forgeloop.core.config.ForgeloopProperties;
import com.forgeloop.core.model.AgentRole;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes presentation-layer files to {@link AgentRole#FRONTEND_EXPERT} and everything else
 * to {@link AgentRole#BACKEND_EXPERT}. The matching rules come from {@code forgeloop.roles.*}.
 */
@Component
public class PathRoleClassifier implements RoleClassifier {

    private final List<String> frontendPathFragments;
    private final List<String> frontendSuffixes;

    @Autowired
    public PathRoleClassifier(ForgeloopProperties properties) {
        this(properties.getRoles().getFrontendPathFragments(), properties.getRoles().getFrontendSuffixes());
    }

    public PathRoleClassifier(List<String> frontendPathFragments, List<String> frontendSuffixes) {
        this.frontendPathFragments = List.copyOf(frontendPathFragments);
        this.frontendSuffixes = List.copyOf(frontendSuffixes);
    }

    @Override
    public AgentRole coderFor(String path) {
        for (String fragment : frontendPathFragments) {
            if (path.contains(fragment)) {
                return AgentRole.FRONTEND_EXPERT;
            }
        }
        for (String suffix : frontendSuffixes) {
            if (path.endsWith(suffix)) {
                return AgentRole.FRONTEND_EXPERT;
            }
        }
        return AgentRole.BACKEND_EXPERT;
    }
}
