package com.forgeloop.dispatch.api;

import com.forgeloop.core.build.BuildOutcome;
import com.forgeloop.core.build.BuildStepException;
import com.forgeloop.core.build.HealOutcome;
import com.forgeloop.core.build.InsertionResult;
import com.forgeloop.core.build.SelfHealFailedException;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AgentStatus;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.project.ProjectPhaseController;
import com.forgeloop.core.project.ProjectSnapshot;
import com.forgeloop.core.tree.ArtifactNotFoundException;
import com.forgeloop.core.tree.ArtifactTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * REST controller for the project lifecycle: idea, plan, build and per-artifact operations.
 */
@RestController
@RequestMapping("/api/v1/project")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectPhaseController project;
    private final SseStreamingService sseStreamingService;

    public ProjectController(ProjectPhaseController project, SseStreamingService sseStreamingService) {
        this.project = project;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/project: Current project snapshot.
     */
    @GetMapping
    public ResponseEntity<ProjectSnapshot> getProject() {
        return ResponseEntity.ok(project.snapshot());
    }

    /**
     * POST /api/v1/project/idea: Start a new project and run ideation.
     */
    @PostMapping("/idea")
    public ResponseEntity<?> submitIdea(@RequestBody IdeaRequest request) {
        if (request == null || request.prompt() == null || request.prompt().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Prompt is required"));
        }
        return execute(() -> ResponseEntity.ok(project.submitIdea(request.prompt())));
    }

    /**
     * POST /api/v1/project/finalize: Refine the idea with chosen features and plan it.
     */
    @PostMapping("/finalize")
    public ResponseEntity<?> finalizeIdea(@RequestBody(required = false) FinalizeRequest request) {
        List<String> features = request != null && request.selectedFeatures() != null
                ? request.selectedFeatures()
                : List.of();
        return execute(() -> ResponseEntity.ok(project.finalizeIdea(features)));
    }

    /**
     * POST /api/v1/project/plan: Load a ready-made plan, skipping ideation.
     */
    @PostMapping("/plan")
    public ResponseEntity<?> loadPlan(@RequestBody AppPlan plan) {
        return execute(() -> ResponseEntity.ok(project.loadPlan(plan)));
    }

    /**
     * POST /api/v1/project/build: Start a full build. Runs asynchronously.
     */
    @PostMapping("/build")
    public ResponseEntity<Map<String, Object>> startBuild() {
        if (project.snapshot().plan() == null) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "No plan is loaded"));
        }
        if (project.isBuilding()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A build is already in progress"));
        }

        CompletableFuture.supplyAsync(project::buildProject).whenComplete((outcome, ex) -> {
            if (ex != null) {
                log.error("Build failed unexpectedly", ex);
            } else if (outcome.status() == BuildOutcome.Status.REJECTED) {
                log.warn("Build request lost the race with another build");
            } else {
                log.info("Build {} finished: {}", outcome.sessionId(), outcome.status());
            }
        });

        return ResponseEntity.accepted().body(Map.of("status", "BUILDING"));
    }

    /**
     * POST /api/v1/project/build/cancel: Ask the running build to stop.
     */
    @PostMapping("/build/cancel")
    public ResponseEntity<Map<String, Object>> cancelBuild() {
        boolean cancelled = project.cancelBuild();
        if (!cancelled) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "No build is running"));
        }
        return ResponseEntity.ok(Map.of("cancelled", true));
    }

    /**
     * GET /api/v1/project/artifacts: Every artifact in pre-order.
     */
    @GetMapping("/artifacts")
    public ResponseEntity<List<ArtifactNode>> listArtifacts() {
        return ResponseEntity.ok(project.artifacts());
    }

    /**
     * PUT /api/v1/project/artifacts/code: Replace a file's code. A missing path means the selected file.
     */
    @PutMapping("/artifacts/code")
    public ResponseEntity<?> updateCode(@RequestBody ArtifactRequest request) {
        if (request == null || request.code() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Code is required"));
        }
        return execute(() -> ResponseEntity.ok(project.editCode(request.path(), request.code())));
    }

    /**
     * POST /api/v1/project/artifacts/generate: Generate one file now.
     */
    @PostMapping("/artifacts/generate")
    public ResponseEntity<?> generateArtifact(@RequestBody ArtifactRequest request) {
        if (request == null || request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Path is required"));
        }
        return execute(() -> ResponseEntity.ok(project.generateFile(request.path())));
    }

    /**
     * POST /api/v1/project/artifacts/test: Test one file, self-healing on failure.
     */
    @PostMapping("/artifacts/test")
    public ResponseEntity<?> testArtifact(@RequestBody(required = false) ArtifactRequest request) {
        String path = request != null ? request.path() : null;
        return execute(() -> {
            HealOutcome outcome = project.runTests(path);
            return ResponseEntity.ok(Map.of(
                    "path", outcome.path(),
                    "test_status", "PASSING",
                    "debug_attempts", outcome.debugAttempts()));
        });
    }

    /**
     * POST /api/v1/project/artifacts: Add a file the plan did not include.
     */
    @PostMapping("/artifacts")
    public ResponseEntity<?> addArtifact(@RequestBody ArtifactRequest request) {
        if (request == null || request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Path is required"));
        }
        InsertionResult result = project.addFile(request.path(), request.reason());
        return switch (result) {
            case INSERTED -> ResponseEntity.status(HttpStatus.CREATED).body(Map.of("result", result.name()));
            case DUPLICATE -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Path already exists: " + request.path(), "result", result.name()));
            case REJECTED -> ResponseEntity.badRequest()
                    .body(Map.of("error", "Path cannot be added: " + request.path(), "result", result.name()));
        };
    }

    /**
     * PUT /api/v1/project/selection: Select an artifact; a null path clears the selection.
     */
    @PutMapping("/selection")
    public ResponseEntity<?> select(@RequestBody(required = false) ArtifactRequest request) {
        String path = request != null ? request.path() : null;
        return execute(() -> {
            project.selectArtifact(path);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("selected_path", project.snapshot().selectedPath());
            return ResponseEntity.ok(body);
        });
    }

    /**
     * GET /api/v1/project/agents: Status of every agent role.
     */
    @GetMapping("/agents")
    public ResponseEntity<Map<String, String>> agents() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<AgentRole, AgentStatus> entry : project.agentStatuses().entrySet()) {
            out.put(entry.getKey().displayName(), entry.getValue().label());
        }
        return ResponseEntity.ok(out);
    }

    /**
     * GET /api/v1/project/events: SSE stream of lifecycle events, optionally limited with
     * {@code ?types=build.failed,code.generated}.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@RequestParam(name = "types", required = false) List<String> types) {
        if (types == null || types.isEmpty()) {
            return sseStreamingService.createEmitter();
        }
        Set<LifecycleEventType> wanted = EnumSet.noneOf(LifecycleEventType.class);
        for (String name : types) {
            try {
                wanted.add(LifecycleEventType.fromWireName(name));
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
            }
        }
        return sseStreamingService.createEmitter(wanted);
    }

    /**
     * Runs an operation and turns domain exceptions into error responses.
     */
    private ResponseEntity<?> execute(Supplier<ResponseEntity<?>> operation) {
        try {
            return operation.get();
        } catch (ArtifactNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (ArtifactTreeException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (SelfHealFailedException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("path", e.getPath());
            body.put("result", e.getResult().name());
            body.put("debug_attempts", e.getDebugAttempts());
            return ResponseEntity.unprocessableEntity().body(body);
        } catch (BuildStepException e) {
            log.warn("{} failure: {}", e.kind(), e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("error", e.getMessage(), "kind", e.kind().name()));
        }
    }
}
