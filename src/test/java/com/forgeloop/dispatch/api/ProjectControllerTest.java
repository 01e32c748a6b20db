package com.forgeloop.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.build.BuildOutcome;
import com.forgeloop.core.build.GenerationException;
import com.forgeloop.core.build.HealOutcome;
import com.forgeloop.core.build.InsertionResult;
import com.forgeloop.core.build.SelfHealExhaustedException;
import com.forgeloop.core.events.LifecycleEventType;
import com.forgeloop.core.model.AgentRole;
import com.forgeloop.core.model.AgentStatus;
import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.ArtifactKind;
import com.forgeloop.core.model.ArtifactNode;
import com.forgeloop.core.model.ArtifactStatus;
import com.forgeloop.core.model.PlannedFile;
import com.forgeloop.core.model.ProjectPhase;
import com.forgeloop.core.model.TestStatus;
import com.forgeloop.core.project.ProjectPhaseController;
import com.forgeloop.core.project.ProjectSnapshot;
import com.forgeloop.core.tree.ArtifactNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProjectController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ProjectPhaseController project;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static ProjectSnapshot snapshot(ProjectPhase phase, AppPlan plan, String selectedPath) {
        return new ProjectSnapshot(phase, "a todo app", null, plan, List.of(), List.of(),
                selectedPath, false, null, List.of());
    }

    private static ArtifactNode file(String path, String code) {
        return new ArtifactNode(path, ArtifactKind.FILE, code, ArtifactStatus.MODIFIED,
                TestStatus.UNTESTED, null, List.of());
    }

    // ── idea / finalize / plan ───────────────────────────────────────

    @Test
    @DisplayName("POST /idea returns the project snapshot")
    void submitIdea() throws Exception {
        when(project.submitIdea("a todo app")).thenReturn(snapshot(ProjectPhase.IDEATION, null, null));

        mockMvc.perform(post("/api/v1/project/idea")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"a todo app\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("IDEATION"))
                .andExpect(jsonPath("$.originalPrompt").value("a todo app"));
    }

    @Test
    @DisplayName("POST /idea without a prompt returns 400")
    void submitIdeaBlank() throws Exception {
        mockMvc.perform(post("/api/v1/project/idea")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Prompt is required"));
        verifyNoInteractions(project);
    }

    @Test
    @DisplayName("POST /finalize while a build runs returns 409")
    void finalizeConflict() throws Exception {
        when(project.finalizeIdea(any())).thenThrow(new IllegalStateException("Cannot finalize an idea in phase CODING"));

        mockMvc.perform(post("/api/v1/project/finalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selected_features\":[\"sharing\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("CODING")));
        verify(project).finalizeIdea(List.of("sharing"));
    }

    @Test
    @DisplayName("POST /plan loads a ready-made plan")
    void loadPlan() throws Exception {
        var plan = new AppPlan("todo", "Todo app", null, List.of(PlannedFile.file("src/App.tsx")));
        when(project.loadPlan(any())).thenReturn(snapshot(ProjectPhase.CODING, plan, null));

        mockMvc.perform(post("/api/v1/project/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(plan)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("CODING"))
                .andExpect(jsonPath("$.plan.projectName").value("todo"));
    }

    @Test
    @DisplayName("POST /plan with an inconsistent structure returns 400")
    void loadPlanInvalid() throws Exception {
        when(project.loadPlan(any())).thenThrow(new IllegalArgumentException("Invalid plan file structure: duplicate"));

        mockMvc.perform(post("/api/v1/project/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectName\":\"x\",\"fileStructure\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", startsWith("Invalid plan")));
    }

    // ── build ────────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /build returns 202 and starts the build")
    void startBuild() throws Exception {
        var plan = new AppPlan("todo", "Todo app", null, List.of());
        when(project.snapshot()).thenReturn(snapshot(ProjectPhase.CODING, plan, null));
        when(project.buildProject()).thenReturn(BuildOutcome.rejected());

        mockMvc.perform(post("/api/v1/project/build"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("BUILDING"));

        verify(project, timeout(2000)).buildProject();
    }

    @Test
    @DisplayName("POST /build without a plan or during a build returns 409")
    void startBuildConflict() throws Exception {
        when(project.snapshot()).thenReturn(snapshot(ProjectPhase.IDEA_INPUT, null, null));
        mockMvc.perform(post("/api/v1/project/build"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("No plan is loaded"));

        when(project.snapshot()).thenReturn(snapshot(ProjectPhase.CODING, new AppPlan("x", "x", null, null), null));
        when(project.isBuilding()).thenReturn(true);
        mockMvc.perform(post("/api/v1/project/build"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("A build is already in progress"));

        verify(project, never()).buildProject();
    }

    @Test
    @DisplayName("POST /build/cancel reports whether a build was cancelled")
    void cancelBuild() throws Exception {
        when(project.cancelBuild()).thenReturn(true, false);

        mockMvc.perform(post("/api/v1/project/build/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
        mockMvc.perform(post("/api/v1/project/build/cancel"))
                .andExpect(status().isConflict());
    }

    // ── artifacts ────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /artifacts lists nodes in pre-order")
    void listArtifacts() throws Exception {
        when(project.artifacts()).thenReturn(List.of(file("a.ts", "x"), file("b.ts", null)));

        mockMvc.perform(get("/api/v1/project/artifacts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].path").value("a.ts"))
                .andExpect(jsonPath("$[0].status").value("MODIFIED"));
    }

    @Test
    @DisplayName("PUT /artifacts/code stores code; an unknown path returns 404")
    void updateCode() throws Exception {
        when(project.editCode("a.ts", "new")).thenReturn(file("a.ts", "new"));
        when(project.editCode(eq("missing.ts"), anyString())).thenThrow(new ArtifactNotFoundException("missing.ts"));

        mockMvc.perform(put("/api/v1/project/artifacts/code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"a.ts\",\"code\":\"new\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("new"));

        mockMvc.perform(put("/api/v1/project/artifacts/code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"missing.ts\",\"code\":\"new\"}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(put("/api/v1/project/artifacts/code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"a.ts\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /artifacts/generate maps a generation failure to 502")
    void generateFailure() throws Exception {
        when(project.generateFile("a.ts")).thenThrow(new GenerationException("model timed out"));

        mockMvc.perform(post("/api/v1/project/artifacts/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"a.ts\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.kind").value("GENERATION"));
    }

    @Test
    @DisplayName("POST /artifacts/test returns the heal outcome")
    void testArtifact() throws Exception {
        when(project.runTests(null)).thenReturn(new HealOutcome("a.ts", 2));

        mockMvc.perform(post("/api/v1/project/artifacts/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("a.ts"))
                .andExpect(jsonPath("$.test_status").value("PASSING"))
                .andExpect(jsonPath("$.debug_attempts").value(2));
    }

    @Test
    @DisplayName("POST /artifacts/test returns 422 when self-healing gives up")
    void testArtifactExhausted() throws Exception {
        when(project.runTests("a.ts")).thenThrow(new SelfHealExhaustedException("a.ts", 3, "boom"));

        mockMvc.perform(post("/api/v1/project/artifacts/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"a.ts\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.result").value("EXHAUSTED"))
                .andExpect(jsonPath("$.debug_attempts").value(3));
    }

    @Test
    @DisplayName("POST /artifacts maps insertion results to 201, 409 and 400")
    void addArtifact() throws Exception {
        when(project.addFile("src/new.ts", null)).thenReturn(InsertionResult.INSERTED);
        when(project.addFile("src/App.tsx", null)).thenReturn(InsertionResult.DUPLICATE);
        when(project.addFile("../x", null)).thenReturn(InsertionResult.REJECTED);

        mockMvc.perform(post("/api/v1/project/artifacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"src/new.ts\"}"))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/v1/project/artifacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"src/App.tsx\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.result").value("DUPLICATE"));
        mockMvc.perform(post("/api/v1/project/artifacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"../x\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PUT /selection selects an artifact")
    void select() throws Exception {
        when(project.snapshot()).thenReturn(snapshot(ProjectPhase.CODING, null, "a.ts"));

        mockMvc.perform(put("/api/v1/project/selection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"./a.ts\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.selected_path").value("a.ts"));
        verify(project).selectArtifact("./a.ts");
    }

    @Test
    @DisplayName("GET /agents uses display names and status labels")
    void agents() throws Exception {
        Map<AgentRole, AgentStatus> statuses = new LinkedHashMap<>();
        statuses.put(AgentRole.ORCHESTRATOR, AgentStatus.PLANNING);
        statuses.put(AgentRole.QA_ENGINEER, AgentStatus.IDLE);
        when(project.agentStatuses()).thenReturn(statuses);

        mockMvc.perform(get("/api/v1/project/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.Orchestrator").value("Planning"))
                .andExpect(jsonPath("$['QA Engineer']").value("Idle"));
    }

    // ── events ───────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /events narrows the stream to the requested types")
    void streamFiltered() throws Exception {
        when(sseStreamingService.createEmitter(any())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/project/events").param("types", "build.failed,code.generated"))
                .andExpect(status().isOk());

        verify(sseStreamingService).createEmitter(
                EnumSet.of(LifecycleEventType.BUILD_FAILED, LifecycleEventType.CODE_GENERATED));
    }

    @Test
    @DisplayName("GET /events with an unknown type returns 400")
    void streamUnknownType() throws Exception {
        mockMvc.perform(get("/api/v1/project/events").param("types", "build.exploded"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(sseStreamingService);
    }
}
