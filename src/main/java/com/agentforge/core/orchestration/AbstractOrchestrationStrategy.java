package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.events.EventSink;
import com.agentforge.core.events.EventStream;
import com.agentforge.core.events.RunCancelledException;
import com.agentforge.core.logging.MdcContext;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;

import java.util.Objects;

/**
 * Base for the concrete strategies: opens the event stream, creates the {@link RunContext},
 * sets up MDC and records the run outcome. Subclasses implement {@link #orchestrate}.
 */
public abstract class AbstractOrchestrationStrategy implements OrchestrationStrategy {

    protected final WorkflowDescriptor workflow;
    protected final AgentDirectory directory;
    protected final OrchestrationRuntime runtime;

    protected AbstractOrchestrationStrategy(WorkflowDescriptor workflow, AgentDirectory directory,
                                            OrchestrationRuntime runtime) {
        this.workflow = Objects.requireNonNull(workflow, "workflow");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    public abstract PatternKind pattern();

    @Override
    public final EventStream process(String userId, String input) {
        RunContext context = new RunContext(runtime.nextRunId(), userId, input != null ? input : "");
        return EventStream.open(context.runId(), runtime.executor(), runtime.streamBufferSize(),
                sink -> execute(context, sink));
    }

    private void execute(RunContext context, EventSink sink) {
        MdcContext.setRun(context.runId(), workflow.name(), context.userId());
        String outcome = "failed";
        try {
            orchestrate(context, sink);
            outcome = "completed";
        } catch (RunCancelledException e) {
            outcome = "cancelled";
            throw e;
        } finally {
            if (runtime.metrics() != null) {
                runtime.metrics().recordRun(pattern().tag(), outcome);
            }
            MdcContext.clear();
        }
    }

    /**
     * Drives the agents of {@link #workflow} and emits the run's events, ending with a
     * {@code FINAL} or {@code ERROR} event.
     */
    protected abstract void orchestrate(RunContext context, EventSink sink);
}
