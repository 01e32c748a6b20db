package com.forgeloop.core.llm;

import com.forgeloop.core.build.GenerationException;
import com.forgeloop.core.build.TestInvocationException;
import com.forgeloop.core.collaborator.Capability;
import com.forgeloop.core.collaborator.DebugCollaborator;
import com.forgeloop.core.collaborator.GenerationCollaborator;
import com.forgeloop.core.collaborator.GenerationRequest;
import com.forgeloop.core.collaborator.GenerationResult;
import com.forgeloop.core.collaborator.PlanModificationRequest;
import com.forgeloop.core.collaborator.PlanningCollaborator;
import com.forgeloop.core.collaborator.TestCollaborator;
import com.forgeloop.core.collaborator.TestOutcome;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.IdeationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * LLM-backed generation, test judgement, debugging and planning.
 * <p>
 * Tests are not executed: the model reviews the code and reports whether it would pass.
 */
@Service
public class LlmCollaborators implements GenerationCollaborator, TestCollaborator, DebugCollaborator,
        PlanningCollaborator {

    private static final Logger log = LoggerFactory.getLogger(LlmCollaborators.class);

    private static final Set<Capability> CAPABILITIES = EnumSet.of(
            Capability.GENERATE_CODE, Capability.PLAN_MODIFICATION, Capability.RUN_TESTS,
            Capability.DEBUG, Capability.IDEATION, Capability.PLANNING);

    static final String GENERATION_SYSTEM_PROMPT = """
            You are a senior software engineer writing one file of a larger project.
            Return the complete contents of the requested file in "code".
            If the file needs another file that is not in the project yet, set
            "planModificationRequest" to {"action": "createFile", "path": ..., "reason": ...};
            otherwise leave it null.
            """;

    static final String TEST_SYSTEM_PROMPT = """
            You are a QA engineer. Review the code as if running its unit tests.
            Set "success" to true when the tests would pass. Otherwise set it to false and
            put the failing test output in "errorMessage".
            """;

    static final String DEBUG_SYSTEM_PROMPT = """
            You are a debugger. Fix the code so the reported error goes away.
            Return the complete fixed file in "fixedCode", or null if you cannot fix it.
            """;

    static final String IDEATION_SYSTEM_PROMPT = """
            You are a market analyst and product strategist. Analyse the app idea: list
            comparable products, what would set the idea apart and features worth building.
            """;

    static final String REFINE_SYSTEM_PROMPT = """
            You are a product strategist. Rewrite the app idea as one detailed prompt that
            includes the selected features. Reply with the prompt text only.
            """;

    static final String PLAN_SYSTEM_PROMPT = """
            You are a software architect. Produce a project plan: name, description, tech
            stack and the file structure. Directories have type "directory" and list their
            children; files have type "file".
            """;

    private final LlmService llm;

    public LlmCollaborators(LlmService llm) {
        this.llm = llm;
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    // -- generation -------------------------------------------------------

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String path = request.artifact().path();
        CodeResponse response;
        try {
            response = llm.structuredCall(GENERATION_SYSTEM_PROMPT, generationPrompt(request), CodeResponse.class);
        } catch (RuntimeException e) {
            throw new GenerationException("LLM generation failed for " + path + ": " + e.getMessage(), e);
        }
        if (response == null || response.code() == null || response.code().isBlank()) {
            throw new GenerationException("LLM returned no code for " + path);
        }
        return new GenerationResult(response.code(), response.planModificationRequest());
    }

    static String generationPrompt(GenerationRequest request) {
        var sb = new StringBuilder();
        AppPlan plan = request.plan();
        if (plan != null) {
            sb.append("Project: ").append(plan.projectName()).append('\n');
            sb.append("Description: ").append(plan.description()).append('\n');
            if (plan.techStack() != null) {
                sb.append("Tech stack: ").append(plan.techStack()).append('\n');
            }
        }
        sb.append("\nProject files:\n");
        sb.append(request.allNodes().stream()
                .filter(ArtifactNode::isFile)
                .map(node -> "- " + node.path() + " (" + node.status().name().toLowerCase() + ")")
                .collect(Collectors.joining("\n")));
        if (!request.knowledge().isEmpty()) {
            sb.append("\n\nPatterns from files that already passed their tests:\n");
            for (String snippet : request.knowledge()) {
                sb.append("---\n").append(snippet).append('\n');
            }
        }
        sb.append("\nWrite the file: ").append(request.artifact().path());
        return sb.toString();
    }

    // -- tests ------------------------------------------------------------

    @Override
    public TestOutcome runTests(String code) {
        TestVerdict verdict;
        try {
            verdict = llm.structuredCall(TEST_SYSTEM_PROMPT, "Code under test:\n" + code, TestVerdict.class);
        } catch (RuntimeException e) {
            throw new TestInvocationException("LLM test run failed: " + e.getMessage(), e);
        }
        if (verdict == null) {
            throw new TestInvocationException("LLM returned no test verdict");
        }
        return verdict.success()
                ? TestOutcome.passed()
                : TestOutcome.failed(verdict.errorMessage() != null ? verdict.errorMessage() : "Tests failed");
    }

    // -- debugging --------------------------------------------------------

    @Override
    public Optional<String> debug(String code, String errorMessage) {
        try {
            DebugResponse response = llm.structuredCall(DEBUG_SYSTEM_PROMPT,
                    "Error:\n" + errorMessage + "\n\nCode:\n" + code, DebugResponse.class);
            return Optional.ofNullable(response)
                    .map(DebugResponse::fixedCode)
                    .filter(fix -> !fix.isBlank());
        } catch (LlmEmptyResponseException | LlmParseException e) {
            log.warn("Debugger produced no usable fix: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // -- planning ---------------------------------------------------------

    @Override
    public IdeationResult ideate(String prompt) {
        return llm.structuredCall(IDEATION_SYSTEM_PROMPT, "App idea:\n" + prompt, IdeationResult.class);
    }

    @Override
    public String refinePrompt(String originalPrompt, List<String> selectedFeatures) {
        String features = selectedFeatures.isEmpty()
                ? "(none)"
                : selectedFeatures.stream().map(f -> "- " + f).collect(Collectors.joining("\n"));
        return llm.textCall(REFINE_SYSTEM_PROMPT,
                "App idea:\n" + originalPrompt + "\n\nSelected features:\n" + features);
    }

    @Override
    public AppPlan generatePlan(String prompt) {
        return llm.structuredCall(PLAN_SYSTEM_PROMPT, prompt, AppPlan.class);
    }

    // -- structured replies -------------------------------------------------

    public record CodeResponse(String code, PlanModificationRequest planModificationRequest) {}

    public record TestVerdict(boolean success, String errorMessage) {}

    public record DebugResponse(String fixedCode) {}
}
