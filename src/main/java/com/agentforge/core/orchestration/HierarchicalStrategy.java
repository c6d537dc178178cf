package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.directory.AgentHandle;
import com.agentforge.core.events.EventSink;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Coordinator/worker: the first agent coordinates, the rest are workers invoked in order
 * with the original input. The coordinator synthesizes the workers' completion notices into
 * the final output.
 */
public class HierarchicalStrategy extends AbstractOrchestrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalStrategy.class);

    static final String NO_AGENTS = "No agents in workflow";

    public HierarchicalStrategy(WorkflowDescriptor workflow, AgentDirectory directory, OrchestrationRuntime runtime) {
        super(workflow, directory, runtime);
    }

    @Override
    public PatternKind pattern() {
        return PatternKind.HIERARCHICAL;
    }

    @Override
    protected void orchestrate(RunContext context, EventSink sink) {
        List<String> agents = workflow.agentNames();
        if (agents.isEmpty()) {
            log.warn("Hierarchical workflow {} has no agents", workflow.name());
            sink.error(NO_AGENTS);
            return;
        }

        String coordinator = agents.get(0);
        List<String> workers = agents.subList(1, agents.size());
        log.info("Hierarchical orchestration: coordinator {} with {} workers for user {}",
                coordinator, workers.size(), context.userId());

        sink.progress(coordinator, "Coordinator " + coordinator + " analyzing task...");
        sink.progress(coordinator, "Plan: Will delegate to " + workers.size() + " worker agents");

        for (String worker : workers) {
            sink.progress(worker, "Worker " + worker + " executing...");

            Optional<AgentHandle> handle = directory.lookup(worker);
            if (handle.isEmpty()) {
                log.warn("Worker {} not found, skipping", worker);
                sink.warning(worker, "Agent " + worker + " not found");
                continue;
            }

            AgentInvoker.Outcome outcome = runtime.invoker()
                    .invoke(context.runId(), worker, handle.get(), context.originalInput());
            if (!outcome.succeeded()) {
                sink.warning(worker, outcome.failure());
                continue;
            }
            String notice = "[" + worker + "]: " + outcome.output();
            context.addWorkerResult(notice);
            sink.partial(worker, notice);
        }

        sink.progress(coordinator, "Coordinator " + coordinator + " synthesizing results...");
        sink.complete("Coordinator " + coordinator + " final output:\n"
                + String.join("\n", context.workerResults()));
    }
}
