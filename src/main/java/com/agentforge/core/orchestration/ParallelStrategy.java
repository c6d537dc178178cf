package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.directory.AgentHandle;
import com.agentforge.core.events.EventSink;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Fan-out/aggregate: every agent receives the original input. Invocations run concurrently,
 * bounded by {@code maxParallel}, and an agent's timeout starts once it holds a slot. Events
 * and the aggregate follow descriptor order regardless of completion order.
 * <p>
 * Agents missing from the directory contribute nothing and produce no warning.
 */
public class ParallelStrategy extends AbstractOrchestrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ParallelStrategy.class);

    static final String AGGREGATING = "Aggregating results...";
    static final String RESULT_SEPARATOR = "\n\n";

    public ParallelStrategy(WorkflowDescriptor workflow, AgentDirectory directory, OrchestrationRuntime runtime) {
        super(workflow, directory, runtime);
    }

    @Override
    public PatternKind pattern() {
        return PatternKind.PARALLEL;
    }

    @Override
    protected void orchestrate(RunContext context, EventSink sink) {
        List<String> agents = workflow.agentNames();
        log.info("Parallel orchestration of {} agents for user {} (maxParallel={})",
                agents.size(), context.userId(), runtime.maxParallel());

        var permits = new Semaphore(runtime.maxParallel());
        // index-aligned with agents; null where the agent is missing
        var launched = new ArrayList<AgentInvoker.Pending>(agents.size());
        try {
            for (String agent : agents) {
                Optional<AgentHandle> handle = directory.lookup(agent);
                launched.add(handle
                        .map(h -> runtime.invoker().submit(context.runId(), agent,
                                h, context.originalInput(), permits))
                        .orElse(null));
            }

            for (int i = 0; i < agents.size(); i++) {
                String agent = agents.get(i);
                sink.progress(agent, "Agent " + agent + " starting...");

                AgentInvoker.Pending pending = launched.get(i);
                if (pending == null) {
                    log.warn("Agent {} not found, no result collected", agent);
                    continue;
                }
                AgentInvoker.Outcome outcome = runtime.invoker().await(pending);
                if (!outcome.succeeded()) {
                    sink.warning(agent, outcome.failure());
                    continue;
                }
                context.addWorkerResult(outcome.output());
                sink.partial(agent, outcome.output());
            }

            sink.progress(null, AGGREGATING);
            sink.complete(String.join(RESULT_SEPARATOR, context.workerResults()));
        } finally {
            for (AgentInvoker.Pending pending : launched) {
                if (pending != null) {
                    pending.cancel();
                }
            }
        }
    }
}
