package com.forgeloop.core.project;

import com.forgeloop.core.agent.AgentStatusRegistry;
import com.forgeloop.core.build.AdaptivePlanner;
import com.forgeloop.core.build.BuildObserver;
import com.forgeloop.core.build.BuildOutcome;
import com.forgeloop.core.build.BuildPipeline;
import com.forgeloop.core.build.HealOutcome;
import com.forgeloop.core.build.InsertionResult;
import com.forgeloop.core.collaborator.Capability;
import com.forgeloop.core.collaborator.PlanningCollaborator;
import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AgentStatus;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ChatMessage;
import com.forgeloop.core.model.IdeationResult;
import com.forgeloop.core.model.ProjectPhase;
import com.forgeloop.core.model.TerminalEntry;
import com.forgeloop.core.tree.ArtifactNotFoundException;
import com.forgeloop.core.tree.ArtifactTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the project state and moves it through its phases:
 * idea intake, ideation, planning and coding.
 * <p>
 * Every user-facing operation goes through here. The controller is also the
 * {@link BuildObserver} of the builds it starts, so terminal lines, chat narration and
 * build errors land in the project state.
 * <p>
 * Operations that replace the plan or the tree are refused while a build is running. The check
 * and the swap happen under {@code lifecycleLock}, which {@link #buildProject} also takes to
 * reserve the tree it is about to build.
 */
@Service
public class ProjectPhaseController implements BuildObserver {

    private static final Logger log = LoggerFactory.getLogger(ProjectPhaseController.class);

    private final ProjectState state = new ProjectState();
    private final PlanningCollaborator planning;
    private final BuildPipeline pipeline;
    private final AdaptivePlanner planner;
    private final AgentStatusRegistry agents;
    private final EventBus eventBus;

    private final Object lifecycleLock = new Object();
    /** Builds started through this controller and not yet finished. Guarded by lifecycleLock. */
    private int reservedBuilds;

    public ProjectPhaseController(PlanningCollaborator planning, BuildPipeline pipeline, AdaptivePlanner planner,
                                  AgentStatusRegistry agents, EventBus eventBus) {
        this.planning = planning;
        this.pipeline = pipeline;
        this.planner = planner;
        this.agents = agents;
        this.eventBus = eventBus;
    }

    // ------------------------------------------------------------------
    // Phases
    // ------------------------------------------------------------------

    /**
     * Starts a new project from a raw idea and runs the ideation analysis.
     * A failed analysis is recorded as the project error; the phase stays IDEATION.
     */
    public ProjectSnapshot submitIdea(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Idea prompt is required");
        }
        synchronized (lifecycleLock) {
            requireIdle("start a new project");
            state.reset();
            agents.reset();
            state.startIdeation(prompt);
        }
        state.addChat(ChatMessage.of(ChatMessage.Role.USER, prompt));
        eventBus.emit(LifecycleEventType.PROJECT_CREATED, Map.of("prompt", prompt));
        log.info("New project idea submitted ({} chars)", prompt.length());

        agents.setStatus(AgentRole.MARKET_ANALYST, AgentStatus.RESEARCHING);
        agents.setStatus(AgentRole.PRODUCT_STRATEGIST, AgentStatus.THINKING);
        try {
            if (!planning.supports(Capability.IDEATION)) {
                throw new IllegalStateException("Ideation is not available");
            }
            IdeationResult result = planning.ideate(prompt);
            if (result == null) {
                throw new IllegalStateException("The AI failed to generate a valid ideation analysis.");
            }
            state.setIdeation(result);
            var payload = new LinkedHashMap<String, Object>();
            payload.put("competitors", result.competitors().size());
            payload.put("featureSuggestions", result.featureSuggestions());
            eventBus.emit(LifecycleEventType.IDEATION_COMPLETED, payload);
        } catch (RuntimeException e) {
            fail("ideation", e);
            state.addChat(ChatMessage.of(ChatMessage.Role.SYSTEM, "Error during ideation: " + messageOf(e)));
        } finally {
            agents.setStatus(AgentRole.MARKET_ANALYST, AgentStatus.IDLE);
            agents.setStatus(AgentRole.PRODUCT_STRATEGIST, AgentStatus.IDLE);
        }
        return state.snapshot();
    }

    /**
     * Refines the idea with the chosen features and produces a plan.
     *
     * @throws IllegalStateException if the project is not in the ideation phase
     */
    public ProjectSnapshot finalizeIdea(List<String> selectedFeatures) {
        synchronized (lifecycleLock) {
            requireIdle("plan the project");
            if (state.phase() != ProjectPhase.IDEATION) {
                throw new IllegalStateException("Cannot finalize an idea in phase " + state.phase());
            }
        }

        agents.setStatus(AgentRole.ORCHESTRATOR, AgentStatus.PLANNING);
        try {
            if (!planning.supports(Capability.PLANNING)) {
                throw new IllegalStateException("Planning is not available");
            }
            String refined = planning.refinePrompt(state.originalPrompt(),
                    selectedFeatures != null ? selectedFeatures : List.of());
            if (refined == null || refined.isBlank()) {
                throw new IllegalStateException("Could not refine the prompt.");
            }
            state.startPlanning(refined);
            AppPlan plan = planning.generatePlan(refined);
            if (plan == null) {
                throw new IllegalStateException("The AI failed to generate a valid plan.");
            }
            installPlan(plan, "planner");
        } catch (RuntimeException e) {
            fail("planning", e);
            state.addChat(ChatMessage.of(ChatMessage.Role.ASSISTANT,
                    "I'm sorry, I ran into an error while planning: " + messageOf(e)));
        } finally {
            agents.setStatus(AgentRole.ORCHESTRATOR, AgentStatus.IDLE);
        }
        return state.snapshot();
    }

    /**
     * Installs a ready-made plan, skipping ideation. The previous tree is discarded.
     *
     * @throws IllegalArgumentException if the plan's file structure is inconsistent
     */
    public ProjectSnapshot loadPlan(AppPlan plan) {
        if (plan == null) {
            throw new IllegalArgumentException("Plan is required");
        }
        synchronized (lifecycleLock) {
            requireIdle("load a plan");
            if (state.phase() == ProjectPhase.IDEA_INPUT) {
                eventBus.emit(LifecycleEventType.PROJECT_CREATED, Map.of("projectName", String.valueOf(plan.projectName())));
            }
            installPlan(plan, "user");
        }
        return state.snapshot();
    }

    private void installPlan(AppPlan plan, String source) {
        ArtifactTree tree;
        try {
            tree = ArtifactTree.fromPlan(plan.fileStructure());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid plan file structure: " + e.getMessage(), e);
        }
        synchronized (lifecycleLock) {
            requireIdle("install a plan");
            state.setPlan(plan, tree);
            state.setError(null);
        }
        int files = tree.files().size();
        state.addChat(ChatMessage.of(ChatMessage.Role.ASSISTANT,
                "The plan for `" + plan.projectName() + "` is ready with " + files + " file(s). Start the build when you are ready."));

        var payload = new LinkedHashMap<String, Object>();
        payload.put("projectName", plan.projectName());
        payload.put("description", plan.description());
        payload.put("fileCount", files);
        payload.put("source", source);
        eventBus.emit(LifecycleEventType.PLAN_GENERATED, payload);
        log.info("Plan '{}' installed from {} with {} file(s)", plan.projectName(), source, files);
    }

    // ------------------------------------------------------------------
    // Build
    // ------------------------------------------------------------------

    /**
     * Runs a full build on the current tree. Blocks until the build ends.
     *
     * @throws IllegalStateException if no plan is loaded
     */
    public BuildOutcome buildProject() {
        return buildProject(null);
    }

    /**
     * @param maxDebugAttempts self-healing bound for this build; null keeps the configured one
     */
    public BuildOutcome buildProject(Integer maxDebugAttempts) {
        AppPlan plan;
        ArtifactTree tree;
        synchronized (lifecycleLock) {
            plan = requirePlan();
            tree = state.tree();
            reservedBuilds++;
        }
        try {
            return pipeline.buildAll(tree, plan, this, maxDebugAttempts);
        } finally {
            synchronized (lifecycleLock) {
                reservedBuilds--;
            }
        }
    }

    public boolean cancelBuild() {
        return pipeline.cancel();
    }

    public boolean isBuilding() {
        synchronized (lifecycleLock) {
            return reservedBuilds > 0 || pipeline.isBuilding();
        }
    }

    /**
     * Generates one file interactively, without running its tests.
     */
    public ArtifactNode generateFile(String path) {
        AppPlan plan = requirePlan();
        return pipeline.generateSingle(state.tree(), plan, path, this);
    }

    /**
     * Tests one file, self-healing it on failure. A null path means the selected file.
     */
    public HealOutcome runTests(String path) {
        requirePlan();
        return pipeline.testSingle(state.tree(), resolvePath(path), this);
    }

    // ------------------------------------------------------------------
    // Editing
    // ------------------------------------------------------------------

    /**
     * Replaces a file's code with user-written code. A null path means the selected file.
     */
    public ArtifactNode editCode(String path, String code) {
        if (code == null) {
            throw new IllegalArgumentException("Code is required");
        }
        String target = resolvePath(path);
        ArtifactNode node = state.tree().setCode(target, code);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("path", node.path());
        payload.put("reason", "edit");
        eventBus.emit(LifecycleEventType.CODE_UPDATED, payload);
        return node;
    }

    /**
     * Selects an artifact, or clears the selection when the path is null.
     */
    public void selectArtifact(String path) {
        if (path == null) {
            state.setSelectedPath(null);
            return;
        }
        ArtifactNode node = state.tree().findByPath(path).orElseThrow(() -> new ArtifactNotFoundException(path));
        state.setSelectedPath(node.path());
    }

    /**
     * Adds a user-requested file to the tree; it is picked up by the next build.
     */
    public InsertionResult addFile(String path, String reason) {
        InsertionResult result = planner.insertRequestedFile(state.tree(), path,
                reason != null ? reason : "requested by user");
        if (result == InsertionResult.INSERTED) {
            state.addChat(ChatMessage.of(ChatMessage.Role.SYSTEM, "Added `" + path + "` to the plan."));
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public ProjectSnapshot snapshot() {
        return state.snapshot();
    }

    /** Every node of the current tree in pre-order. */
    public List<ArtifactNode> artifacts() {
        return state.tree().flatten();
    }

    public Map<AgentRole, AgentStatus> agentStatuses() {
        return agents.snapshot();
    }

    // ------------------------------------------------------------------
    // BuildObserver
    // ------------------------------------------------------------------

    @Override
    public void buildStarted(String buildId) {
        state.clearTerminal();
        state.setBuilding(true);
    }

    @Override
    public void buildFinished(BuildOutcome outcome) {
        state.setBuilding(false);
    }

    @Override
    public void terminal(AgentRole agent, String message, TerminalEntry.Level level) {
        state.addTerminal(agent, message, level);
    }

    @Override
    public void chat(ChatMessage.Role role, String content) {
        state.addChat(ChatMessage.of(role, content));
    }

    @Override
    public void projectError(String message) {
        state.setError(message);
    }

    // ------------------------------------------------------------------

    private void fail(String stage, RuntimeException e) {
        String message = messageOf(e);
        log.warn("Project {} failed: {}", stage, message);
        state.setError(message);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("stage", stage);
        payload.put("error", message);
        eventBus.emit(LifecycleEventType.ERROR_OCCURRED, payload);
    }

    private AppPlan requirePlan() {
        AppPlan plan = state.plan();
        if (plan == null) {
            throw new IllegalStateException("No plan is loaded");
        }
        return plan;
    }

    private void requireIdle(String action) {
        if (isBuilding()) {
            throw new IllegalStateException("Cannot " + action + " while a build is in progress");
        }
    }

    private String resolvePath(String path) {
        if (path != null && !path.isBlank()) {
            return path;
        }
        String selected = state.selectedPath();
        if (selected == null) {
            throw new IllegalArgumentException("No artifact path given and none selected");
        }
        return selected;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
