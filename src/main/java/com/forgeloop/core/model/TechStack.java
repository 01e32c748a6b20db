package com.forgeloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Technology choices recorded in a plan.
 */
public record TechStack(
    List<String> frontend,
    List<String> backend,
    String database,
    List<String> deployment
) implements Serializable {

    public TechStack {
        frontend = frontend == null ? List.of() : List.copyOf(frontend);
        backend = backend == null ? List.of() : List.copyOf(backend);
        deployment = deployment == null ? List.of() : List.copyOf(deployment);
    }
}
