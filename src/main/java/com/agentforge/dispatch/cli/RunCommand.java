package com.agentforge.dispatch.cli;

import com.agentforge.core.directory.WorkflowRegistry;
import com.agentforge.core.events.EventKind;
import com.agentforge.core.events.EventStream;
import com.agentforge.core.events.OrchestrationEvent;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import com.agentforge.core.orchestration.OrchestrationDispatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: agentforge run &lt;workflow&gt; "&lt;input&gt;"
 * <p>
 * Runs a configured workflow and prints each event as it arrives. With {@code --json} every
 * event is written as one JSON object per line. Exits with 1 when the run ends in an error.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow and stream its events")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow name")
    private String workflowName;

    @Parameters(index = "1", description = "Input text for the agents")
    private String input;

    @Option(names = {"--user", "-u"}, description = "User id the run is issued for", defaultValue = "cli-user")
    private String userId;

    @Option(names = {"--pattern", "-p"},
            description = "Override the workflow's pattern: sequential, parallel, hierarchical, dynamic, ...")
    private String pattern;

    @Option(names = "--json", description = "Print events as JSON lines")
    private boolean json;

    private final OrchestrationDispatcher dispatcher;
    private final WorkflowRegistry workflowRegistry;
    private final ObjectMapper objectMapper;

    public RunCommand(OrchestrationDispatcher dispatcher, WorkflowRegistry workflowRegistry, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.workflowRegistry = workflowRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        Optional<WorkflowDescriptor> found = workflowRegistry.find(workflowName);
        if (found.isEmpty()) {
            ConsoleOutput.error("Unknown workflow: " + workflowName);
            return 2;
        }
        WorkflowDescriptor workflow = found.get();

        if (pattern != null) {
            Optional<PatternKind> override = PatternKind.fromTag(pattern);
            if (override.isEmpty()) {
                ConsoleOutput.error("Unknown pattern: " + pattern);
                return 2;
            }
            workflow = workflow.withPattern(override.get());
        }

        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Workflow " + workflow.name() + " [" + workflow.pattern() + "] agents "
                    + workflow.agentNames());
        }

        boolean failed = false;
        try (EventStream events = dispatcher.run(workflow, userId, input)) {
            while (events.hasNext()) {
                OrchestrationEvent event = events.next();
                failed |= event.kind() == EventKind.ERROR;
                print(event);
            }
        }
        return failed ? 1 : 0;
    }

    private void print(OrchestrationEvent event) {
        if (!json) {
            ConsoleOutput.event(event);
            return;
        }
        try {
            System.out.println(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise event " + event.sequenceNumber(), e);
        }
    }
}
