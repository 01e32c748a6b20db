package com.forgeloop.core.build;

import com.forgeloop.core.agent.AgentStatusRegistry;
import com.forgeloop.core.agent.RoleClassifier;
import com.forgeloop.core.collaborator.Capability;
import com.forgeloop.core.collaborator.GenerationCollaborator;
import com.forgeloop.core.collaborator.GenerationRequest;
import com.forgeloop.core.collaborator.GenerationResult;
import com.forgeloop.core.collaborator.KnowledgeCollaborator;
import com.forgeloop.core.collaborator.PlanModificationRequest;
import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.logging.MdcContext;
import com.forgeloop.core.metrics.ForgeloopMetrics;
import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AgentStatus;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ArtifactStatus;
import com.forgeloop.core.model.ChatMessage;
import com.forgeloop.core.model.TerminalEntry;
import com.forgeloop.core.tree.ArtifactNotFoundException;
import com.forgeloop.core.tree.ArtifactTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Generates, tests and self-heals every planned file of a tree, one file at a time.
 * <p>
 * The work list is re-derived from {@link ArtifactTree#flatten()} after every file: the next
 * file is the first one in pre-order that has no code yet and has not been attempted in the
 * current session. Files added by adaptive planning are therefore built in the same run,
 * wherever they land in the tree. The first unrecoverable failure halts the build.
 * <p>
 * At most one full build runs at a time; a concurrent {@link #buildAll} call is rejected.
 */
@Service
public class BuildPipeline {

    private static final Logger log = LoggerFactory.getLogger(BuildPipeline.class);

    private final GenerationCollaborator generator;
    private final KnowledgeCollaborator knowledge;
    private final RoleClassifier roles;
    private final AgentStatusRegistry agents;
    private final AdaptivePlanner planner;
    private final SelfHealingLoop healer;
    private final EventBus eventBus;
    private final ForgeloopMetrics metrics;

    private final AtomicReference<BuildSession> active = new AtomicReference<>();

    public BuildPipeline(GenerationCollaborator generator, KnowledgeCollaborator knowledge, RoleClassifier roles,
                         AgentStatusRegistry agents, AdaptivePlanner planner, SelfHealingLoop healer,
                         EventBus eventBus, ForgeloopMetrics metrics) {
        this.generator = generator;
        this.knowledge = knowledge;
        this.roles = roles;
        this.agents = agents;
        this.planner = planner;
        this.healer = healer;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Builds every pending file of the tree.
     * <p>
     * File-level failures are reported through the returned outcome, the observer and a
     * {@code build.failed} event; they are never thrown.
     */
    public BuildOutcome buildAll(ArtifactTree tree, AppPlan plan, BuildObserver observer) {
        return buildAll(tree, plan, observer, null);
    }

    /**
     * Same as {@link #buildAll(ArtifactTree, AppPlan, BuildObserver)} with a per-run
     * self-healing bound; null keeps the configured one.
     */
    public BuildOutcome buildAll(ArtifactTree tree, AppPlan plan, BuildObserver observer, Integer maxDebugAttempts) {
        BuildSession session = BuildSession.bulk(observer, maxDebugAttempts);
        if (!active.compareAndSet(null, session)) {
            log.warn("Build requested while build {} is running, rejecting", active.get() != null ? active.get().id() : "?");
            metrics.recordBuildResult("rejected");
            return BuildOutcome.rejected();
        }
        MdcContext.setBuild(session.id());
        BuildOutcome outcome = null;
        try {
            session.observer().buildStarted(session.id());
            outcome = runBuild(session, tree, plan);
            return outcome;
        } finally {
            active.compareAndSet(session, null);
            MdcContext.clear();
            session.observer().buildFinished(outcome != null ? outcome
                    : new BuildOutcome(BuildOutcome.Status.HALTED, null, null, "Build aborted",
                            session.filesGenerated(), session.debugAttempts(), session.id()));
        }
    }

    private BuildOutcome runBuild(BuildSession session, ArtifactTree tree, AppPlan plan) {
        long pending = tree.files().stream().filter(f -> !f.status().hasCode()).count();
        log.info("Build {} started with {} pending file(s)", session.id(), pending);
        session.observer().projectError(null);
        session.announce(ChatMessage.Role.SYSTEM, "Starting full project build...");

        var started = new LinkedHashMap<String, Object>();
        started.put("buildId", session.id());
        started.put("projectName", plan != null ? plan.projectName() : null);
        started.put("pendingFiles", pending);
        eventBus.emit(LifecycleEventType.BUILD_STARTED, started);

        String current = null;
        try {
            while (true) {
                current = null;
                session.checkCancelled();
                Optional<ArtifactNode> next = nextPending(tree, session);
                if (next.isEmpty()) {
                    break;
                }
                current = next.get().path();
                session.markAttempted(current);
                session.terminal(AgentRole.ORCHESTRATOR, "--- Starting work on " + current + " ---",
                        TerminalEntry.Level.INFO);
                buildFile(session, tree, plan, next.get());
            }
        } catch (BuildStepException e) {
            return halt(session, current, e);
        }

        session.announce(ChatMessage.Role.SYSTEM, "Full project build process finished.");
        var completed = new LinkedHashMap<String, Object>();
        completed.put("buildId", session.id());
        completed.put("filesGenerated", session.filesGenerated());
        completed.put("debugAttempts", session.debugAttempts());
        eventBus.emit(LifecycleEventType.BUILD_COMPLETED, completed);
        metrics.recordBuildResult("completed");
        log.info("Build {} completed: {} file(s) generated, {} debug attempt(s)",
                session.id(), session.filesGenerated(), session.debugAttempts());
        return new BuildOutcome(BuildOutcome.Status.COMPLETED, null, null, "Build completed",
                session.filesGenerated(), session.debugAttempts(), session.id());
    }

    private void buildFile(BuildSession session, ArtifactTree tree, AppPlan plan, ArtifactNode node) {
        AgentRole coder = roles.coderFor(node.path());
        MdcContext.setStep(session.id(), node.path(), coder);
        try {
            generate(session, tree, plan, node.path(), coder);
            healer.heal(session, tree, node.path());
        } finally {
            MdcContext.clearStep();
        }
    }

    private BuildOutcome halt(BuildSession session, String path, BuildStepException e) {
        BuildOutcome.Status status = e.kind() == FailureKind.CANCELLED
                ? BuildOutcome.Status.CANCELLED
                : BuildOutcome.Status.HALTED;

        if (status == BuildOutcome.Status.CANCELLED) {
            session.announce(ChatMessage.Role.SYSTEM, "Build cancelled.");
            session.terminal(AgentRole.ORCHESTRATOR, "Build CANCELLED"
                    + (path != null ? " while working on " + path : "") + ".", TerminalEntry.Level.WARNING);
        } else if (e instanceof SelfHealFailedException) {
            session.announce(ChatMessage.Role.SYSTEM,
                    "Tests failed for " + path + " and could not be self-healed. Halting build.");
            session.terminal(AgentRole.ORCHESTRATOR,
                    "Build HALTED due to unresolvable test failure in " + path + ".", TerminalEntry.Level.ERROR);
        } else {
            session.announce(ChatMessage.Role.SYSTEM, "Build failed on " + path + ". Halting process.");
            session.terminal(AgentRole.ORCHESTRATOR,
                    "Build HALTED due to error in " + path + ".", TerminalEntry.Level.ERROR);
        }
        session.observer().projectError(e.getMessage());

        var failed = new LinkedHashMap<String, Object>();
        failed.put("buildId", session.id());
        failed.put("path", path);
        failed.put("kind", e.kind().name());
        failed.put("error", e.getMessage());
        failed.put("filesGenerated", session.filesGenerated());
        eventBus.emit(LifecycleEventType.BUILD_FAILED, failed);

        metrics.recordBuildResult(status.name().toLowerCase());
        log.warn("Build {} {} at {}: {}", session.id(), status.name().toLowerCase(), path, e.getMessage());
        return new BuildOutcome(status, path, e.kind(), e.getMessage(),
                session.filesGenerated(), session.debugAttempts(), session.id());
    }

    /**
     * Generates one file outside a full build. Chat narration is on and tests are not run.
     *
     * @throws GenerationException        if the collaborator fails; the node is left in ERROR
     * @throws ArtifactNotFoundException  if the path does not exist
     * @throws IllegalArgumentException   if the path is a directory
     */
    public ArtifactNode generateSingle(ArtifactTree tree, AppPlan plan, String path, BuildObserver observer) {
        ArtifactNode node = requireFile(tree, path);
        BuildSession session = BuildSession.interactive(observer);
        AgentRole coder = roles.coderFor(node.path());
        MdcContext.setStep(session.id(), node.path(), coder);
        try {
            observer.projectError(null);
            generate(session, tree, plan, node.path(), coder);
            return tree.findByPath(node.path()).orElseThrow(() -> new ArtifactNotFoundException(node.path()));
        } catch (GenerationException e) {
            observer.projectError("Failed to generate code for " + node.path() + ".");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs the self-healing loop on one file outside a full build.
     *
     * @throws SelfHealFailedException  if the file could not be healed
     * @throws TestInvocationException  if the tests could not be run
     */
    public HealOutcome testSingle(ArtifactTree tree, String path, BuildObserver observer) {
        ArtifactNode node = requireFile(tree, path);
        BuildSession session = BuildSession.interactive(observer);
        MdcContext.setStep(session.id(), node.path(), AgentRole.QA_ENGINEER);
        try {
            return healer.heal(session, tree, node.path());
        } catch (SelfHealFailedException e) {
            session.narrate(ChatMessage.Role.ASSISTANT, "I tried to fix `" + node.path()
                    + "` but couldn't resolve the issue. You may need to manually edit the code "
                    + "or ask me for specific changes.");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private void generate(BuildSession session, ArtifactTree tree, AppPlan plan, String path, AgentRole coder) {
        agents.setStatus(coder, AgentStatus.CODING);
        session.narrate(ChatMessage.Role.SYSTEM, "(Consulting knowledge base for patterns related to `" + path + "`...)");
        session.narrate(ChatMessage.Role.ASSISTANT, "On it! Generating code for `" + path + "`...");
        session.terminal(coder, "Generating code for " + path + "...", TerminalEntry.Level.INFO);

        long start = System.nanoTime();
        try {
            if (!generator.supports(Capability.GENERATE_CODE)) {
                throw new GenerationException("Generator does not declare " + Capability.GENERATE_CODE);
            }
            tree.setStatus(path, ArtifactStatus.GENERATING);
            ArtifactNode node = tree.findByPath(path).orElseThrow(() -> new ArtifactNotFoundException(path));
            GenerationResult result = generator.generate(
                    new GenerationRequest(node, plan, recall(path), tree.flatten()));
            if (result == null || result.code() == null) {
                throw new GenerationException("Generator returned no code for " + path);
            }
            applyPlanModification(session, tree, result);
            tree.setCode(path, result.code());
        } catch (GenerationException e) {
            generationFailed(session, tree, path, coder, e);
            throw e;
        } catch (RuntimeException e) {
            var wrapped = new GenerationException("Code generation failed for " + path + ": " + e.getMessage(), e);
            generationFailed(session, tree, path, coder, wrapped);
            throw wrapped;
        } finally {
            agents.setStatus(coder, AgentStatus.IDLE);
        }

        session.recordFileGenerated();
        metrics.recordFileGeneration(coder, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        session.terminal(coder, "Code generation complete for " + path + ".", TerminalEntry.Level.SUCCESS);
        session.narrate(ChatMessage.Role.ASSISTANT,
                "I've finished writing the code for `" + path + "`. You can review it in the editor.");

        var payload = new LinkedHashMap<String, Object>();
        payload.put("path", path);
        payload.put("role", coder.displayName());
        payload.put("buildId", session.id());
        eventBus.emit(LifecycleEventType.CODE_GENERATED, payload);
    }

    private void generationFailed(BuildSession session, ArtifactTree tree, String path, AgentRole coder,
                                  GenerationException e) {
        log.warn("Generation failed for {}: {}", path, e.getMessage());
        if (tree.contains(path)) {
            tree.setStatus(path, ArtifactStatus.ERROR);
        }
        session.terminal(coder, "Code generation failed for " + path + ".", TerminalEntry.Level.ERROR);
        session.narrate(ChatMessage.Role.ASSISTANT,
                "Sorry, I hit a snag while generating code for `" + path + "`: " + e.getMessage());
    }

    private List<String> recall(String path) {
        if (!knowledge.supports(Capability.KNOWLEDGE_RECALL)) {
            return List.of();
        }
        try {
            return knowledge.getRelevantKnowledge(path);
        } catch (RuntimeException e) {
            log.warn("Knowledge recall failed for {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    private void applyPlanModification(BuildSession session, ArtifactTree tree, GenerationResult result) {
        Optional<PlanModificationRequest> request = result.planModificationRequest()
                .filter(PlanModificationRequest::isCreateFile);
        if (request.isEmpty()) {
            return;
        }
        if (!generator.supports(Capability.PLAN_MODIFICATION)) {
            log.debug("Ignoring plan modification for {}: generator does not declare it", request.get().path());
            return;
        }
        PlanModificationRequest req = request.get();
        InsertionResult inserted = planner.insertRequestedFile(tree, req.path(), req.reason());
        if (inserted == InsertionResult.INSERTED) {
            session.announce(ChatMessage.Role.ASSISTANT, "(Adaptive Planning) I realized I need a new file: "
                    + req.reason() + ". I've added `" + req.path() + "` to the file tree.");
            session.terminal(AgentRole.ORCHESTRATOR, "Added " + req.path() + " to the plan.", TerminalEntry.Level.INFO);
        } else {
            session.terminal(AgentRole.ORCHESTRATOR, "Skipped requested file " + req.path()
                    + " (" + inserted.metricTag() + ").", TerminalEntry.Level.WARNING);
        }
    }

    private static Optional<ArtifactNode> nextPending(ArtifactTree tree, BuildSession session) {
        return tree.flatten().stream()
                .filter(ArtifactNode::isFile)
                .filter(node -> !node.status().hasCode())
                .filter(node -> !session.wasAttempted(node.path()))
                .findFirst();
    }

    private static ArtifactNode requireFile(ArtifactTree tree, String path) {
        ArtifactNode node = tree.findByPath(path).orElseThrow(() -> new ArtifactNotFoundException(path));
        if (!node.isFile()) {
            throw new IllegalArgumentException("Not a file: " + node.path());
        }
        return node;
    }

    /**
     * Signals the running build to stop. It halts before the next file or test cycle.
     *
     * @return false if no build was running
     */
    public boolean cancel() {
        BuildSession session = active.get();
        if (session == null) {
            return false;
        }
        session.cancel();
        log.info("Cancellation requested for build {}", session.id());
        return true;
    }

    public boolean isBuilding() {
        return active.get() != null;
    }

    public Optional<String> activeBuildId() {
        return Optional.ofNullable(active.get()).map(BuildSession::id);
    }
}
