package com.forgeloop.core.build;

import com.forgeloop.core.agent.AgentStatusRegistry;
import com.forgeloop.core.agent.PathRoleClassifier;
import com.forgeloop.core.collaborator.Capability;
import com.forgeloop.core.collaborator.DebugCollaborator;
import com.forgeloop.core.collaborator.GenerationCollaborator;
import com.forgeloop.core.collaborator.GenerationRequest;
import com.forgeloop.core.collaborator.GenerationResult;
import com.forgeloop.core.collaborator.KnowledgeCollaborator;
import com.forgeloop.core.collaborator.PlanModificationRequest;
import com.forgeloop.core.collaborator.TestCollaborator;
import com.forgeloop.core.collaborator.TestOutcome;
import com.forgeloop.core.events.LifecycleEvent;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.metrics.ForgeloopMetrics;
import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AgentStatus;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ArtifactStatus;
import com.forgeloop.core.model.PlannedFile;
import com.forgeloop.core.model.TestStatus;
import com.forgeloop.core.tree.ArtifactNotFoundException;
import com.forgeloop.core.tree.ArtifactTree;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BuildPipelineTest {

    private static final AppPlan PLAN = new AppPlan("demo", "Demo app", null, List.of());

    private ScriptedGenerator generator;
    private TestCollaborator tests;
    private DebugCollaborator debugger;
    private KnowledgeCollaborator knowledge;
    private AgentStatusRegistry agents;
    private SimpleMeterRegistry registry;
    private EventRecorder recorder;
    private RecordingObserver observer;
    private BuildPipeline pipeline;

    @BeforeEach
    void setUp() {
        generator = new ScriptedGenerator();
        tests = mock(TestCollaborator.class);
        debugger = mock(DebugCollaborator.class);
        knowledge = mock(KnowledgeCollaborator.class);
        when(tests.supports(Capability.RUN_TESTS)).thenReturn(true);
        when(debugger.supports(Capability.DEBUG)).thenReturn(true);
        when(tests.runTests(anyString())).thenReturn(TestOutcome.passed());
        agents = new AgentStatusRegistry();
        registry = new SimpleMeterRegistry();
        var metrics = new ForgeloopMetrics(registry);
        recorder = new EventRecorder(metrics);
        observer = new RecordingObserver();

        var healer = new SelfHealingLoop(tests, debugger, knowledge, agents, recorder.bus, metrics, 3);
        var planner = new AdaptivePlanner(recorder.bus, metrics);
        var roles = new PathRoleClassifier(List.of("src/components"), List.of(".css"));
        pipeline = new BuildPipeline(generator, knowledge, roles, agents, planner, healer, recorder.bus, metrics);
    }

    private static ArtifactTree tree(PlannedFile... entries) {
        return ArtifactTree.fromPlan(List.of(entries));
    }

    private static ArtifactTree singleFileTree() {
        return tree(PlannedFile.directory("src", PlannedFile.file("src/a.ext")));
    }

    @Nested
    @DisplayName("full build")
    class FullBuild {

        @Test
        @DisplayName("generates and tests every file in pre-order")
        void buildsEverything() {
            ArtifactTree tree = tree(
                    PlannedFile.directory("src", PlannedFile.file("src/a.ts"), PlannedFile.file("src/b.ts")),
                    PlannedFile.file("README.md"));

            BuildOutcome outcome = pipeline.buildAll(tree, PLAN, observer);

            assertTrue(outcome.isSuccess());
            assertEquals(3, outcome.filesGenerated());
            assertEquals(List.of("src/a.ts", "src/b.ts", "README.md"), generator.requested);
            for (ArtifactNode file : tree.files()) {
                assertEquals(ArtifactStatus.GENERATED, file.status());
                assertEquals(TestStatus.PASSING, file.testStatus());
            }
            assertEquals(LifecycleEventType.BUILD_STARTED, recorder.types().get(0));
            assertEquals(LifecycleEventType.BUILD_COMPLETED, recorder.types().get(recorder.types().size() - 1));
            assertFalse(pipeline.isBuilding());
        }

        @Test
        @DisplayName("skips files that already hold code")
        void skipsGeneratedFiles() {
            ArtifactTree tree = tree(PlannedFile.file("done.ts"), PlannedFile.file("todo.ts"));
            tree.setCode("done.ts", "existing");

            pipeline.buildAll(tree, PLAN, observer);

            assertEquals(List.of("todo.ts"), generator.requested);
            assertEquals("existing", tree.findByPath("done.ts").orElseThrow().code());
        }

        @Test
        @DisplayName("an empty tree completes immediately")
        void emptyTree() {
            BuildOutcome outcome = pipeline.buildAll(new ArtifactTree(), PLAN, observer);
            assertEquals(BuildOutcome.Status.COMPLETED, outcome.status());
            assertEquals(0, outcome.filesGenerated());
        }

        @Test
        @DisplayName("hands the generator recalled knowledge and the whole tree")
        void passesContext() {
            when(knowledge.supports(Capability.KNOWLEDGE_RECALL)).thenReturn(true);
            when(knowledge.getRelevantKnowledge("src/a.ext")).thenReturn(List.of("// snippet"));

            pipeline.buildAll(singleFileTree(), PLAN, observer);

            GenerationRequest request = generator.requests.get(0);
            assertEquals(List.of("// snippet"), request.knowledge());
            assertEquals(2, request.allNodes().size());
            assertSame(PLAN, request.plan());
        }

        @Test
        @DisplayName("observer sees start and finish, and coders end idle")
        void observerLifecycle() {
            BuildOutcome outcome = pipeline.buildAll(singleFileTree(), PLAN, observer);

            assertEquals(List.of(outcome.sessionId()), observer.started);
            assertEquals(List.of(outcome), observer.finished);
            assertTrue(observer.chatContains("Starting full project build"));
            assertTrue(observer.terminalContains("--- Starting work on src/a.ext ---"));
            assertEquals(AgentStatus.IDLE, agents.getStatus(AgentRole.BACKEND_EXPERT));
        }
    }

    @Nested
    @DisplayName("halting")
    class Halting {

        @Test
        @DisplayName("generation failure halts the build, marks ERROR and emits build.failed")
        void generationFailure() {
            generator.failOn("src/a.ext");
            ArtifactTree tree = singleFileTree();

            BuildOutcome outcome = pipeline.buildAll(tree, PLAN, observer);

            assertEquals(BuildOutcome.Status.HALTED, outcome.status());
            assertEquals("src/a.ext", outcome.failedPath());
            assertEquals(FailureKind.GENERATION, outcome.failureKind());
            assertEquals(ArtifactStatus.ERROR, tree.findByPath("src/a.ext").orElseThrow().status());
            List<LifecycleEvent> failed = recorder.ofType(LifecycleEventType.BUILD_FAILED);
            assertEquals(1, failed.size());
            assertEquals("GENERATION", failed.get(0).payload().get("kind"));
            assertNotNull(observer.error);
            verifyNoInteractions(tests);
        }

        @Test
        @DisplayName("a failure stops later files from being generated")
        void stopsAfterFailure() {
            generator.failOn("a.ts");
            ArtifactTree tree = tree(PlannedFile.file("a.ts"), PlannedFile.file("b.ts"));

            pipeline.buildAll(tree, PLAN, observer);

            assertEquals(List.of("a.ts"), generator.requested);
            assertEquals(ArtifactStatus.PLANNED, tree.findByPath("b.ts").orElseThrow().status());
        }

        @Test
        @DisplayName("collaborators without declared capabilities are never called")
        void undeclaredCapabilities() {
            generator.declaresGeneration = false;
            when(tests.supports(Capability.RUN_TESTS)).thenReturn(false);
            when(debugger.supports(Capability.DEBUG)).thenReturn(false);
            ArtifactTree tree = tree(PlannedFile.file("a.ts"));

            BuildOutcome outcome = pipeline.buildAll(tree, PLAN, observer);

            assertEquals(BuildOutcome.Status.HALTED, outcome.status());
            assertEquals(FailureKind.GENERATION, outcome.failureKind());
            assertTrue(generator.requested.isEmpty());
            assertEquals(ArtifactStatus.ERROR, tree.findByPath("a.ts").orElseThrow().status());
            verify(tests, never()).runTests(anyString());
            verify(debugger, never()).debug(anyString(), anyString());
        }

        @Test
        @DisplayName("a test runner without RUN_TESTS halts the build after generation")
        void undeclaredTestRunner() {
            when(tests.supports(Capability.RUN_TESTS)).thenReturn(false);
            ArtifactTree tree = tree(PlannedFile.file("a.ts"), PlannedFile.file("b.ts"));

            BuildOutcome outcome = pipeline.buildAll(tree, PLAN, observer);

            assertEquals(BuildOutcome.Status.HALTED, outcome.status());
            assertEquals("a.ts", outcome.failedPath());
            assertEquals(FailureKind.TEST_INVOCATION, outcome.failureKind());
            assertEquals(List.of("a.ts"), generator.requested);
            verify(tests, never()).runTests(anyString());
        }

        @Test
        @DisplayName("a generator returning no code is a generation failure")
        void nullCode() {
            generator.script("src/a.ext", request -> new GenerationResult(null, null));

            BuildOutcome outcome = pipeline.buildAll(singleFileTree(), PLAN, observer);

            assertEquals(FailureKind.GENERATION, outcome.failureKind());
        }

        @Test
        @DisplayName("an unhealable file halts with SELF_HEAL")
        void selfHealFailure() {
            when(tests.runTests(anyString())).thenReturn(TestOutcome.failed("boom"));
            when(debugger.debug(anyString(), anyString())).thenReturn(Optional.empty());

            BuildOutcome outcome = pipeline.buildAll(singleFileTree(), PLAN, observer);

            assertEquals(BuildOutcome.Status.HALTED, outcome.status());
            assertEquals(FailureKind.SELF_HEAL, outcome.failureKind());
            assertTrue(observer.chatContains("could not be self-healed"));
            assertEquals(1.0, registry.find("forgeloop.builds.total").tag("status", "halted").counter().count());
        }

        @Test
        @DisplayName("fails once, heals after one debug cycle, and completes")
        void healsOnce() {
            when(tests.runTests("code for src/a.ext")).thenReturn(TestOutcome.failed("boom"));
            when(tests.runTests("fixed")).thenReturn(TestOutcome.passed());
            when(debugger.debug("code for src/a.ext", "boom")).thenReturn(Optional.of("fixed"));
            ArtifactTree tree = singleFileTree();

            BuildOutcome outcome = pipeline.buildAll(tree, PLAN, observer);

            assertTrue(outcome.isSuccess());
            assertEquals(1, outcome.debugAttempts());
            assertEquals(TestStatus.PASSING, tree.findByPath("src/a.ext").orElseThrow().testStatus());
            verify(debugger, times(1)).debug(anyString(), anyString());
        }

        @Test
        @DisplayName("a per-build bound overrides the configured one")
        void perBuildBound() {
            when(tests.runTests(anyString())).thenReturn(TestOutcome.failed("boom"));
            when(debugger.debug(anyString(), anyString())).thenReturn(Optional.of("retry"));

            BuildOutcome outcome = pipeline.buildAll(singleFileTree(), PLAN, observer, 1);

            assertEquals(FailureKind.SELF_HEAL, outcome.failureKind());
            assertEquals(1, outcome.debugAttempts());
        }
    }

    @Nested
    @DisplayName("adaptive planning")
    class Adaptive {

        @Test
        @DisplayName("a file inserted before the cursor is still generated in the same build")
        void insertBeforeCursor() {
            ArtifactTree tree = tree(
                    PlannedFile.directory("src", PlannedFile.file("src/z.ts")),
                    PlannedFile.file("main.ts"));
            generator.supportsPlanModification = true;
            generator.script("main.ts", request -> new GenerationResult("main",
                    PlanModificationRequest.createFile("src/a.ts", "shared helper")));

            BuildOutcome outcome = pipeline.buildAll(tree, PLAN, observer);

            assertTrue(outcome.isSuccess());
            assertEquals(List.of("src/z.ts", "main.ts", "src/a.ts"), generator.requested);
            assertEquals(ArtifactStatus.GENERATED, tree.findByPath("src/a.ts").orElseThrow().status());
            assertEquals(3, outcome.filesGenerated());
            assertTrue(observer.chatContains("(Adaptive Planning)"));
        }

        @Test
        @DisplayName("requests are ignored when the generator does not declare PLAN_MODIFICATION")
        void ignoredWithoutCapability() {
            ArtifactTree tree = tree(PlannedFile.file("main.ts"));
            generator.script("main.ts", request -> new GenerationResult("main",
                    PlanModificationRequest.createFile("extra.ts", "helper")));

            pipeline.buildAll(tree, PLAN, observer);

            assertFalse(tree.contains("extra.ts"));
        }

        @Test
        @DisplayName("a duplicate request only warns")
        void duplicateRequest() {
            ArtifactTree tree = tree(PlannedFile.file("a.ts"), PlannedFile.file("b.ts"));
            generator.supportsPlanModification = true;
            generator.script("b.ts", request -> new GenerationResult("b",
                    PlanModificationRequest.createFile("a.ts", "again")));

            BuildOutcome outcome = pipeline.buildAll(tree, PLAN, observer);

            assertTrue(outcome.isSuccess());
            assertEquals(List.of("a.ts", "b.ts"), generator.requested);
            assertTrue(observer.terminalContains("Skipped requested file a.ts (duplicate)"));
        }
    }

    @Nested
    @DisplayName("concurrency and cancellation")
    class Concurrency {

        @Test
        @DisplayName("a second build while one runs is rejected")
        void singleFlight() throws Exception {
            var entered = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            generator.script("a.ts", request -> {
                entered.countDown();
                await(release);
                return GenerationResult.of("a");
            });
            ArtifactTree tree = tree(PlannedFile.file("a.ts"));

            CompletableFuture<BuildOutcome> first = CompletableFuture.supplyAsync(
                    () -> pipeline.buildAll(tree, PLAN, observer));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(pipeline.isBuilding());
            assertTrue(pipeline.activeBuildId().isPresent());

            var second = new RecordingObserver();
            BuildOutcome rejected = pipeline.buildAll(tree, PLAN, second);

            assertEquals(BuildOutcome.Status.REJECTED, rejected.status());
            assertTrue(second.started.isEmpty());
            assertTrue(second.finished.isEmpty());

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS).isSuccess());
            assertFalse(pipeline.isBuilding());
        }

        @Test
        @DisplayName("cancel stops the build before the next file")
        void cancel() throws Exception {
            var entered = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            generator.script("a.ts", request -> {
                entered.countDown();
                await(release);
                return GenerationResult.of("a");
            });
            ArtifactTree tree = tree(PlannedFile.file("a.ts"), PlannedFile.file("b.ts"));

            CompletableFuture<BuildOutcome> build = CompletableFuture.supplyAsync(
                    () -> pipeline.buildAll(tree, PLAN, observer));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(pipeline.cancel());
            release.countDown();

            BuildOutcome outcome = build.get(5, TimeUnit.SECONDS);
            assertEquals(BuildOutcome.Status.CANCELLED, outcome.status());
            assertEquals(FailureKind.CANCELLED, outcome.failureKind());
            assertEquals(List.of("a.ts"), generator.requested);
            assertEquals(1, recorder.ofType(LifecycleEventType.BUILD_FAILED).size());
            verifyNoInteractions(tests);
        }

        @Test
        @DisplayName("cancel without a running build returns false")
        void cancelIdle() {
            assertFalse(pipeline.cancel());
        }
    }

    @Nested
    @DisplayName("single-file operations")
    class SingleFile {

        @Test
        @DisplayName("generateSingle generates without testing and narrates in chat")
        void generateSingle() {
            ArtifactTree tree = singleFileTree();

            ArtifactNode node = pipeline.generateSingle(tree, PLAN, "src/a.ext", observer);

            assertEquals("code for src/a.ext", node.code());
            verifyNoInteractions(tests);
            assertTrue(observer.chatContains("On it! Generating code for `src/a.ext`"));
        }

        @Test
        @DisplayName("generateSingle failure sets the project error and rethrows")
        void generateSingleFailure() {
            generator.failOn("src/a.ext");

            assertThrows(GenerationException.class,
                    () -> pipeline.generateSingle(singleFileTree(), PLAN, "src/a.ext", observer));
            assertEquals("Failed to generate code for src/a.ext.", observer.error);
        }

        @Test
        @DisplayName("generateSingle rejects unknown paths and directories")
        void generateSingleBadPath() {
            ArtifactTree tree = singleFileTree();
            assertThrows(ArtifactNotFoundException.class, () -> pipeline.generateSingle(tree, PLAN, "nope", observer));
            assertThrows(IllegalArgumentException.class, () -> pipeline.generateSingle(tree, PLAN, "src", observer));
        }

        @Test
        @DisplayName("testSingle heals and reports attempts")
        void testSingle() {
            ArtifactTree tree = singleFileTree();
            tree.setCode("src/a.ext", "x");

            HealOutcome outcome = pipeline.testSingle(tree, "src/a.ext", observer);

            assertEquals(0, outcome.debugAttempts());
        }

        @Test
        @DisplayName("testSingle failure narrates and rethrows")
        void testSingleFailure() {
            ArtifactTree tree = singleFileTree();
            tree.setCode("src/a.ext", "x");
            when(tests.runTests(anyString())).thenReturn(TestOutcome.failed("boom"));
            when(debugger.debug(anyString(), anyString())).thenReturn(Optional.empty());

            assertThrows(SelfHealFailedException.class, () -> pipeline.testSingle(tree, "src/a.ext", observer));
            assertTrue(observer.chatContains("I tried to fix `src/a.ext`"));
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /**
     * Generator returning "code for &lt;path&gt;" unless a path is scripted otherwise.
     */
    private static final class ScriptedGenerator implements GenerationCollaborator {

        final List<String> requested = new ArrayList<>();
        final List<GenerationRequest> requests = new ArrayList<>();
        final Map<String, Function<GenerationRequest, GenerationResult>> scripts = new HashMap<>();
        volatile boolean supportsPlanModification;
        volatile boolean declaresGeneration = true;

        void script(String path, Function<GenerationRequest, GenerationResult> script) {
            scripts.put(path, script);
        }

        void failOn(String path) {
            script(path, request -> {
                throw new GenerationException("model timed out on " + path);
            });
        }

        @Override
        public Set<Capability> capabilities() {
            if (!declaresGeneration) {
                return Set.of();
            }
            return supportsPlanModification
                    ? EnumSet.of(Capability.GENERATE_CODE, Capability.PLAN_MODIFICATION)
                    : EnumSet.of(Capability.GENERATE_CODE);
        }

        @Override
        public synchronized GenerationResult generate(GenerationRequest request) {
            String path = request.artifact().path();
            requested.add(path);
            requests.add(request);
            var script = scripts.get(path);
            return script != null ? script.apply(request) : GenerationResult.of("code for " + path);
        }
    }
}
