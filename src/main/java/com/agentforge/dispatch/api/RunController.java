package com.agentforge.dispatch.api;

import com.agentforge.core.directory.AgentRegistry;
import com.agentforge.core.directory.AgentTemplates;
import com.agentforge.core.directory.WorkflowRegistry;
import com.agentforge.core.events.EventStream;
import com.agentforge.core.model.AgentDefinition;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import com.agentforge.core.orchestration.OrchestrationDispatcher;
import com.agentforge.core.orchestration.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Arrays;
import java.util.List;

/**
 * REST controller for listing patterns, workflows and agents, and for streaming workflow
 * runs as Server-Sent Events.
 */
@RestController
@RequestMapping("/api/v1")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private static final String DEFAULT_USER = "anonymous";

    private final OrchestrationDispatcher dispatcher;
    private final StrategyFactory strategyFactory;
    private final WorkflowRegistry workflowRegistry;
    private final AgentRegistry agentRegistry;
    private final RunStreamingService streamingService;

    public RunController(OrchestrationDispatcher dispatcher,
                         StrategyFactory strategyFactory,
                         WorkflowRegistry workflowRegistry,
                         AgentRegistry agentRegistry,
                         RunStreamingService streamingService) {
        this.dispatcher = dispatcher;
        this.strategyFactory = strategyFactory;
        this.workflowRegistry = workflowRegistry;
        this.agentRegistry = agentRegistry;
        this.streamingService = streamingService;
    }

    /**
     * GET /api/v1/patterns: all known patterns and whether they can run.
     */
    @GetMapping("/patterns")
    public List<PatternInfo> listPatterns() {
        return Arrays.stream(PatternKind.values())
                .map(kind -> new PatternInfo(kind.tag(), strategyFactory.isSupported(kind)))
                .toList();
    }

    /**
     * GET /api/v1/workflows: configured workflows.
     */
    @GetMapping("/workflows")
    public List<WorkflowSummary> listWorkflows() {
        return workflowRegistry.list().stream().map(WorkflowSummary::from).toList();
    }

    /**
     * GET /api/v1/agents: registered agent definitions.
     */
    @GetMapping("/agents")
    public List<AgentDefinition> listAgents() {
        return agentRegistry.definitions();
    }

    /**
     * GET /api/v1/agents/templates: built-in agent templates.
     */
    @GetMapping("/agents/templates")
    public List<AgentDefinition> listAgentTemplates() {
        return AgentTemplates.all();
    }

    /**
     * POST /api/v1/workflows/{name}/runs: run a workflow and stream its events.
     */
    @PostMapping(path = "/workflows/{name}/runs", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter runWorkflow(@PathVariable String name, @RequestBody RunRequest request) {
        WorkflowDescriptor workflow = workflowRegistry.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown workflow: " + name));

        if (request.pattern() != null && !request.pattern().isBlank()) {
            PatternKind override = PatternKind.fromTag(request.pattern())
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                            "Unknown pattern: " + request.pattern()));
            workflow = workflow.withPattern(override);
        }

        boolean hasMessages = request.messages() != null && !request.messages().isEmpty();
        if (!hasMessages && (request.input() == null || request.input().isBlank())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Input or messages are required");
        }

        String userId = request.userId() != null && !request.userId().isBlank() ? request.userId() : DEFAULT_USER;
        EventStream events = hasMessages
                ? dispatcher.run(workflow, userId, request.messages())
                : dispatcher.run(workflow, userId, request.input());
        log.info("Accepted run {} of workflow {} [{}] for user {}",
                events.runId(), workflow.name(), workflow.pattern(), userId);
        return streamingService.stream(events);
    }
}
