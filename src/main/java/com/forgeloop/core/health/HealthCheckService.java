package com.forgeloop.core.health;

import com.forgeloop.core.build.BuildPipeline;
import com.forgeloop.core.collaborator.Capability;
import com.forgeloop.core.collaborator.CapabilityAware;
import com.forgeloop.core.events.EventBus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class HealthCheckService {

    static final String UNSET_KEY = "unset";

    /** Needed for a build to get from an idea to tested code. Knowledge is optional. */
    static final Set<Capability> REQUIRED = EnumSet.of(Capability.IDEATION, Capability.PLANNING,
            Capability.GENERATE_CODE, Capability.RUN_TESTS, Capability.DEBUG);

    private final EventBus eventBus;
    private final BuildPipeline pipeline;
    private final List<CapabilityAware> collaborators;
    private final String openAiApiKey;

    public HealthCheckService(EventBus eventBus, BuildPipeline pipeline, List<CapabilityAware> collaborators,
                              @Value("${spring.ai.openai.api-key:" + UNSET_KEY + "}") String openAiApiKey) {
        this.eventBus = eventBus;
        this.pipeline = pipeline;
        this.collaborators = collaborators;
        this.openAiApiKey = openAiApiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkEventBus());
        results.add(checkPipeline());
        results.add(checkCollaborators());
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkEventBus() {
        if (eventBus.isClosed()) {
            return new HealthStatus("eventBus", HealthStatus.Status.DOWN, "Event bus closed", Map.of());
        }
        return new HealthStatus("eventBus", HealthStatus.Status.UP, "Accepting events", Map.of(
                "subscriptions", String.valueOf(eventBus.getSubscriptions().size()),
                "pendingEvents", String.valueOf(eventBus.pendingEvents())));
    }

    private HealthStatus checkPipeline() {
        return pipeline.activeBuildId()
                .map(id -> new HealthStatus("pipeline", HealthStatus.Status.UP, "Build in progress",
                        Map.of("buildId", id)))
                .orElseGet(() -> new HealthStatus("pipeline", HealthStatus.Status.UP, "Idle", Map.of()));
    }

    private HealthStatus checkCollaborators() {
        Set<Capability> declared = EnumSet.noneOf(Capability.class);
        var metadata = new LinkedHashMap<String, String>();
        for (CapabilityAware collaborator : collaborators) {
            Set<Capability> capabilities = collaborator.capabilities();
            declared.addAll(capabilities);
            metadata.put(collaborator.getClass().getSimpleName(), capabilities.stream()
                    .sorted().map(Capability::name).collect(Collectors.joining(",")));
        }
        Set<Capability> missing = EnumSet.copyOf(REQUIRED);
        missing.removeAll(declared);
        if (!missing.isEmpty()) {
            metadata.put("missing", missing.stream().map(Capability::name).collect(Collectors.joining(",")));
            return new HealthStatus("collaborators", HealthStatus.Status.DEGRADED,
                    "Missing capabilities: " + missing, metadata);
        }
        return new HealthStatus("collaborators", HealthStatus.Status.UP,
                "All required capabilities declared", metadata);
    }

    private HealthStatus checkLlm() {
        if (openAiApiKey == null || openAiApiKey.isBlank() || UNSET_KEY.equals(openAiApiKey)) {
            return new HealthStatus("llm", HealthStatus.Status.DEGRADED,
                    "No OpenAI API key configured; generation calls will fail", Map.of());
        }
        return new HealthStatus("llm", HealthStatus.Status.UP, "OpenAI API key configured", Map.of());
    }
}
