package com.forgeloop.core.collaborator;

import java.util.Set;

public interface CapabilityAware {

    Set<Capability> capabilities();

    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }
}
