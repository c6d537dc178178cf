package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.events.EventStream;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Meta-pattern that picks a concrete pattern per run and delegates to the strategy the
 * factory builds for it. Adds no events of its own.
 */
public class DynamicStrategy implements OrchestrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(DynamicStrategy.class);

    private final WorkflowDescriptor workflow;
    private final AgentDirectory directory;
    private final StrategyFactory factory;
    private final PatternSelector selector;

    public DynamicStrategy(WorkflowDescriptor workflow, AgentDirectory directory,
                           StrategyFactory factory, PatternSelector selector) {
        this.workflow = workflow;
        this.directory = directory;
        this.factory = factory;
        this.selector = selector;
    }

    @Override
    public EventStream process(String userId, String input) {
        PatternKind selected;
        try {
            selected = selector.select(workflow, input);
        } catch (RuntimeException e) {
            log.warn("Pattern selection failed for workflow {}: {}", workflow.name(), e.getMessage());
            return EventStream.error(factory.runtime().nextRunId(), "Pattern selection failed: " + e.getMessage());
        }

        if (selected == null || selected == PatternKind.DYNAMIC || !factory.isSupported(selected)) {
            PatternKind reported = selected != null ? selected : PatternKind.DYNAMIC;
            log.warn("Dynamic workflow {} selected unsupported pattern {}", workflow.name(), reported);
            return EventStream.error(factory.runtime().nextRunId(), UnsupportedPatternException.describe(reported));
        }

        log.info("Dynamic workflow {} running as {}", workflow.name(), selected);
        return factory.createStrategy(selected, directory, workflow.withPattern(selected))
                .process(userId, input);
    }
}
