package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.directory.AgentHandle;
import com.agentforge.core.events.EventSink;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Pipeline: each agent receives the previous agent's output. A missing or failing agent is
 * reported as a warning and skipped; the pipeline keeps going with unchanged content.
 */
public class SequentialStrategy extends AbstractOrchestrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(SequentialStrategy.class);

    static final String COMPLETE = "Sequential processing complete";

    public SequentialStrategy(WorkflowDescriptor workflow, AgentDirectory directory, OrchestrationRuntime runtime) {
        super(workflow, directory, runtime);
    }

    @Override
    public PatternKind pattern() {
        return PatternKind.SEQUENTIAL;
    }

    @Override
    protected void orchestrate(RunContext context, EventSink sink) {
        log.info("Sequential orchestration of {} agents for user {}",
                workflow.agentNames().size(), context.userId());

        for (String agent : workflow.agentNames()) {
            sink.progress(agent, "Agent " + agent + " processing...");

            Optional<AgentHandle> handle = directory.lookup(agent);
            if (handle.isEmpty()) {
                log.warn("Agent {} not found, passing content through", agent);
                sink.warning(agent, "Agent " + agent + " not found");
                continue;
            }

            AgentInvoker.Outcome outcome = runtime.invoker()
                    .invoke(context.runId(), agent, handle.get(), context.currentContent());
            if (!outcome.succeeded()) {
                sink.warning(agent, outcome.failure());
                continue;
            }
            context.setCurrentContent(outcome.output());
            sink.partial(agent, outcome.output());
        }

        sink.complete(COMPLETE);
    }
}
