package com.agentforge.dispatch.api;

import com.agentforge.core.directory.AgentRegistry;
import com.agentforge.core.directory.WorkflowRegistry;
import com.agentforge.core.events.EventKind;
import com.agentforge.core.events.EventStream;
import com.agentforge.core.events.OrchestrationEvent;
import com.agentforge.core.model.AgentDefinition;
import com.agentforge.core.model.AgentRole;
import com.agentforge.core.model.ChatMessage;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import com.agentforge.core.orchestration.OrchestrationDispatcher;
import com.agentforge.core.orchestration.StrategyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RunController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class RunControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private OrchestrationDispatcher dispatcher;

    @MockitoBean
    private StrategyFactory strategyFactory;

    @MockitoBean
    private WorkflowRegistry workflowRegistry;

    @MockitoBean
    private AgentRegistry agentRegistry;

    @MockitoBean
    private RunStreamingService streamingService;

    private final WorkflowDescriptor blogPipeline = new WorkflowDescriptor("blog-pipeline", "Write a post",
            PatternKind.SEQUENTIAL, List.of("researcher", "writer"), 10, Optional.empty(), Map.of());

    @BeforeEach
    void setUp() {
        when(workflowRegistry.find("blog-pipeline")).thenReturn(Optional.of(blogPipeline));
        when(workflowRegistry.find("missing")).thenReturn(Optional.empty());
        when(streamingService.stream(any(EventStream.class))).thenReturn(new SseEmitter());
    }

    // ── GET listings ────────────────────────────────────────────────

    @Test
    @DisplayName("GET /patterns lists every pattern with its support flag")
    void listPatterns() throws Exception {
        when(strategyFactory.isSupported(PatternKind.SEQUENTIAL)).thenReturn(true);
        when(strategyFactory.isSupported(PatternKind.PARALLEL)).thenReturn(true);

        mockMvc.perform(get("/api/v1/patterns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(PatternKind.values().length)))
                .andExpect(jsonPath("$[0].pattern").value("sequential"))
                .andExpect(jsonPath("$[0].supported").value(true))
                .andExpect(jsonPath("$[4].pattern").value("debate"))
                .andExpect(jsonPath("$[4].supported").value(false));
    }

    @Test
    @DisplayName("GET /workflows uses snake_case field names")
    void listWorkflows() throws Exception {
        var debate = new WorkflowDescriptor("debate-club", "", PatternKind.DEBATE, List.of("pro", "con"),
                5, Optional.of("consensus reached"), Map.of());
        when(workflowRegistry.list()).thenReturn(List.of(blogPipeline, debate));

        mockMvc.perform(get("/api/v1/workflows"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name").value("blog-pipeline"))
                .andExpect(jsonPath("$[0].agents", contains("researcher", "writer")))
                .andExpect(jsonPath("$[1].pattern").value("debate"))
                .andExpect(jsonPath("$[1].max_iterations").value(5))
                .andExpect(jsonPath("$[1].termination_condition").value("consensus reached"));
    }

    @Test
    @DisplayName("GET /agents lists registered definitions")
    void listAgents() throws Exception {
        when(agentRegistry.definitions()).thenReturn(List.of(
                new AgentDefinition("writer", AgentRole.WRITER, "Drafts prose", null, null, 0.7, null, null)));

        mockMvc.perform(get("/api/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("writer"))
                .andExpect(jsonPath("$[0].role").value("WRITER"));
    }

    @Test
    @DisplayName("GET /agents/templates lists the built-in templates")
    void listAgentTemplates() throws Exception {
        mockMvc.perform(get("/api/v1/agents/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(5)))
                .andExpect(jsonPath("$[0].name").value("critic"))
                .andExpect(jsonPath("$[0].role").value("CRITIC"))
                .andExpect(jsonPath("$[2].name").value("researcher"))
                .andExpect(jsonPath("$[2].instructions", not(emptyString())));
    }

    // ── POST /workflows/{name}/runs ──────────────────────────────────

    @Test
    @DisplayName("POST /runs starts an SSE stream for the input")
    void runWorkflow() throws Exception {
        when(dispatcher.run(any(WorkflowDescriptor.class), anyString(), anyString()))
                .thenReturn(EventStream.error("RUN-2026-0001", "stub"));

        String body = objectMapper.writeValueAsString(new RunRequest("alice", "Write about Java", null, null));

        mockMvc.perform(post("/api/v1/workflows/blog-pipeline/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(request().asyncStarted());

        verify(dispatcher).run(blogPipeline, "alice", "Write about Java");
    }

    @Test
    @DisplayName("POST /runs without user_id runs as anonymous")
    void runWorkflowDefaultUser() throws Exception {
        when(dispatcher.run(any(WorkflowDescriptor.class), anyString(), anyString()))
                .thenReturn(EventStream.error("RUN-2026-0002", "stub"));

        mockMvc.perform(post("/api/v1/workflows/blog-pipeline/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"input":"hello"}
                                """))
                .andExpect(request().asyncStarted());

        verify(dispatcher).run(blogPipeline, "anonymous", "hello");
    }

    @Test
    @DisplayName("POST /runs with messages runs the conversation")
    void runWorkflowWithMessages() throws Exception {
        when(dispatcher.run(any(WorkflowDescriptor.class), anyString(), anyList()))
                .thenReturn(EventStream.error("RUN-2026-0003", "stub"));

        mockMvc.perform(post("/api/v1/workflows/blog-pipeline/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id":"bob","messages":[{"role":"user","content":"hi"},{"role":"user","content":"again"}]}
                                """))
                .andExpect(request().asyncStarted());

        verify(dispatcher).run(blogPipeline, "bob",
                List.of(new ChatMessage("user", "hi"), new ChatMessage("user", "again")));
    }

    @Test
    @DisplayName("POST /runs with a pattern override re-selects the pattern")
    void runWorkflowPatternOverride() throws Exception {
        when(dispatcher.run(any(WorkflowDescriptor.class), anyString(), anyString()))
                .thenReturn(EventStream.error("RUN-2026-0004", "stub"));

        mockMvc.perform(post("/api/v1/workflows/blog-pipeline/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"input":"hello","pattern":"parallel"}
                                """))
                .andExpect(request().asyncStarted());

        ArgumentCaptor<WorkflowDescriptor> captor = ArgumentCaptor.forClass(WorkflowDescriptor.class);
        verify(dispatcher).run(captor.capture(), eq("anonymous"), eq("hello"));
        assertEquals(PatternKind.PARALLEL, captor.getValue().pattern());
        assertEquals(blogPipeline.agentNames(), captor.getValue().agentNames());
    }

    @Test
    @DisplayName("POST /runs for an unknown workflow returns 404")
    void runUnknownWorkflow() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/missing/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"input":"hello"}
                                """))
                .andExpect(status().isNotFound());

        verify(dispatcher, never()).run(any(WorkflowDescriptor.class), anyString(), anyString());
    }

    @Test
    @DisplayName("POST /runs with an unknown pattern returns 400")
    void runUnknownPattern() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/blog-pipeline/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"input":"hello","pattern":"round-robin"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /runs without input or messages returns 400")
    void runWithoutInput() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/blog-pipeline/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id":"alice","input":"  "}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("events serialise with snake_case fields and omit a null source")
    void eventJson() throws Exception {
        var withSource = objectMapper.readTree(objectMapper.writeValueAsString(
                new OrchestrationEvent(EventKind.WARNING, "writer", "Agent writer not found", 3)));
        var withoutSource = objectMapper.readTree(objectMapper.writeValueAsString(
                new OrchestrationEvent(EventKind.FINAL, null, "done", 4)));

        assertEquals("WARNING", withSource.get("kind").asText());
        assertEquals("writer", withSource.get("source_agent").asText());
        assertEquals(3, withSource.get("sequence_number").asLong());
        assertFalse(withoutSource.has("source_agent"));
        assertEquals("done", withoutSource.get("payload").asText());
    }
}
