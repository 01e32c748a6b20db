package com.forgeloop.core.build;

import com.forgeloop.core.agent.AgentStatusRegistry;
import com.forgeloop.core.collaborator.Capability;
import com.forgeloop.core.collaborator.DebugCollaborator;
import com.forgeloop.core.collaborator.KnowledgeCollaborator;
import com.forgeloop.core.collaborator.TestCollaborator;
import com.forgeloop.core.collaborator.TestOutcome;
import com.forgeloop.core.config.ForgeloopProperties;
import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.logging.MdcContext;
import com.forgeloop.core.metrics.ForgeloopMetrics;
import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AgentStatus;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ChatMessage;
import com.forgeloop.core.model.TerminalEntry;
import com.forgeloop.core.model.TestStatus;
import com.forgeloop.core.tree.ArtifactNotFoundException;
import com.forgeloop.core.tree.ArtifactTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Test, debug and retest one file until its tests pass or the debug budget runs out.
 * <p>
 * Each cycle runs the tests as {@link AgentRole#QA_ENGINEER}. On failure the file is handed to
 * {@link AgentRole#DEBUGGER}; a proposed fix replaces the code and the tests run again. At most
 * {@code maxDebugAttempts} fixes are tried per call.
 */
@Component
public class SelfHealingLoop {

    private static final Logger log = LoggerFactory.getLogger(SelfHealingLoop.class);

    private final TestCollaborator tests;
    private final DebugCollaborator debugger;
    private final KnowledgeCollaborator knowledge;
    private final AgentStatusRegistry agents;
    private final EventBus eventBus;
    private final ForgeloopMetrics metrics;
    private final int maxDebugAttempts;

    @Autowired
    public SelfHealingLoop(TestCollaborator tests, DebugCollaborator debugger, KnowledgeCollaborator knowledge,
                           AgentStatusRegistry agents, EventBus eventBus, ForgeloopMetrics metrics,
                           ForgeloopProperties properties) {
        this(tests, debugger, knowledge, agents, eventBus, metrics, properties.getBuild().getMaxDebugAttempts());
    }

    public SelfHealingLoop(TestCollaborator tests, DebugCollaborator debugger, KnowledgeCollaborator knowledge,
                           AgentStatusRegistry agents, EventBus eventBus, ForgeloopMetrics metrics,
                           int maxDebugAttempts) {
        if (maxDebugAttempts < 0) {
            throw new IllegalArgumentException("maxDebugAttempts must not be negative: " + maxDebugAttempts);
        }
        this.tests = tests;
        this.debugger = debugger;
        this.knowledge = knowledge;
        this.agents = agents;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxDebugAttempts = maxDebugAttempts;
    }

    public int maxDebugAttempts() {
        return maxDebugAttempts;
    }

    /**
     * Runs the loop for one file that already has code.
     *
     * @throws SelfHealExhaustedException if tests still fail after the session's debug bound
     * @throws SelfHealFailedException    if the debugger produced no fix
     * @throws TestInvocationException    if the tests could not be run
     * @throws BuildCancelledException    if the session was cancelled between cycles
     */
    public HealOutcome heal(BuildSession session, ArtifactTree tree, String path) {
        int limit = session.maxDebugAttempts().orElse(maxDebugAttempts);
        int attempts = 0;
        while (true) {
            session.checkCancelled();
            ArtifactNode node = tree.findByPath(path).orElseThrow(() -> new ArtifactNotFoundException(path));
            if (!node.isFile() || node.code() == null) {
                throw new TestInvocationException("No code to test for " + path);
            }

            TestOutcome outcome = runTests(session, node);
            if (outcome.success()) {
                tree.setTestStatus(path, TestStatus.PASSING, null);
                session.terminal(AgentRole.QA_ENGINEER, "Tests PASSED for " + path, TerminalEntry.Level.SUCCESS);
                eventBus.emit(LifecycleEventType.TEST_PASSED, payload(path, "debugAttempts", attempts));
                learn(path, node.code());
                metrics.recordHealResult(HealResult.PASSED);
                metrics.recordDebugAttempts(attempts);
                return new HealOutcome(path, attempts);
            }

            String error = outcome.errorMessage() != null ? outcome.errorMessage() : "Tests failed";
            tree.setTestStatus(path, TestStatus.FAILING, error);
            session.terminal(AgentRole.QA_ENGINEER, "Tests FAILED for " + path + ": " + error, TerminalEntry.Level.ERROR);
            var failed = payload(path, "error", error);
            failed.put("debugAttempts", attempts);
            eventBus.emit(LifecycleEventType.TEST_FAILED, failed);

            if (attempts >= limit) {
                log.warn("Giving up on {} after {} debug attempt(s)", path, attempts);
                metrics.recordHealResult(HealResult.EXHAUSTED);
                metrics.recordDebugAttempts(attempts);
                throw new SelfHealExhaustedException(path, attempts, error);
            }

            session.narrate(ChatMessage.Role.SYSTEM,
                    "Tests failed for `" + path + "`. Handing off to Debugger agent for self-healing.");
            Optional<String> fix = debug(session, node.code(), path, error);
            if (fix.isEmpty()) {
                session.terminal(AgentRole.DEBUGGER, "Failed to fix the bug in " + path + ".", TerminalEntry.Level.ERROR);
                metrics.recordHealResult(HealResult.NO_FIX);
                metrics.recordDebugAttempts(attempts);
                throw new SelfHealFailedException(path, attempts, error);
            }

            attempts++;
            session.recordDebugAttempt();
            tree.setCode(path, fix.get());
            eventBus.emit(LifecycleEventType.CODE_UPDATED, payload(path, "reason", "debug"));
            session.terminal(AgentRole.DEBUGGER,
                    "Successfully applied a fix to " + path + ". Re-running tests...", TerminalEntry.Level.SUCCESS);
        }
    }

    private TestOutcome runTests(BuildSession session, ArtifactNode node) {
        agents.setStatus(AgentRole.QA_ENGINEER, AgentStatus.TESTING);
        MdcContext.setRole(AgentRole.QA_ENGINEER);
        session.terminal(AgentRole.QA_ENGINEER, "Running tests on " + node.path() + "...", TerminalEntry.Level.INFO);
        try {
            if (!tests.supports(Capability.RUN_TESTS)) {
                throw new TestInvocationException("Test runner does not declare " + Capability.RUN_TESTS);
            }
            TestOutcome outcome = tests.runTests(node.code());
            if (outcome == null) {
                throw new TestInvocationException("Test collaborator returned no result for " + node.path());
            }
            return outcome;
        } catch (BuildStepException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TestInvocationException("Could not run tests for " + node.path() + ": " + e.getMessage(), e);
        } finally {
            agents.setStatus(AgentRole.QA_ENGINEER, AgentStatus.IDLE);
        }
    }

    private Optional<String> debug(BuildSession session, String code, String path, String error) {
        if (!debugger.supports(Capability.DEBUG)) {
            log.warn("No fix for {}: debugger does not declare {}", path, Capability.DEBUG);
            return Optional.empty();
        }
        agents.setStatus(AgentRole.DEBUGGER, AgentStatus.DEBUGGING);
        MdcContext.setRole(AgentRole.DEBUGGER);
        session.terminal(AgentRole.DEBUGGER, "Attempting to fix bug in " + path + "...", TerminalEntry.Level.INFO);
        try {
            return debugger.debug(code, error).filter(fix -> !fix.isBlank());
        } catch (RuntimeException e) {
            log.warn("Debugger failed on {}: {}", path, e.getMessage());
            return Optional.empty();
        } finally {
            agents.setStatus(AgentRole.DEBUGGER, AgentStatus.IDLE);
        }
    }

    private void learn(String path, String code) {
        if (!knowledge.supports(Capability.KNOWLEDGE_LEARN)) {
            return;
        }
        try {
            knowledge.learnFromSuccess(path, code);
        } catch (RuntimeException e) {
            log.warn("Knowledge store rejected {}: {}", path, e.getMessage());
        }
    }

    private static Map<String, Object> payload(String path, String key, Object value) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("path", path);
        payload.put(key, value);
        return payload;
    }
}
