package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.events.EventStream;
import com.agentforge.core.metrics.OrchestrationMetrics;
import com.agentforge.core.model.ChatMessage;
import com.agentforge.core.model.WorkflowDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for runs. Selects the strategy for a workflow's pattern and hands back the
 * strategy's live event stream unchanged.
 * <p>
 * An unsupported pattern produces a stream with a single {@code ERROR} event; no strategy is
 * created and the agent directory is not consulted. Nothing thrown by a run escapes this
 * class; failures arrive as events.
 */
@Service
public class OrchestrationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationDispatcher.class);

    private final StrategyFactory factory;
    private final AgentDirectory directory;
    private final OrchestrationMetrics metrics;

    @Autowired
    public OrchestrationDispatcher(StrategyFactory factory, AgentDirectory directory,
                                   @Autowired(required = false) OrchestrationMetrics metrics) {
        this.factory = factory;
        this.directory = directory;
        this.metrics = metrics;
    }

    OrchestrationDispatcher(StrategyFactory factory, AgentDirectory directory) {
        this(factory, directory, null);
    }

    public EventStream run(WorkflowDescriptor workflow, String userId, String input) {
        if (!factory.isSupported(workflow.pattern())) {
            log.warn("Workflow {} uses unsupported pattern {}", workflow.name(), workflow.pattern());
            if (metrics != null) {
                metrics.recordUnsupportedPattern(String.valueOf(workflow.pattern()));
            }
            return EventStream.error(factory.runtime().nextRunId(),
                    UnsupportedPatternException.describe(workflow.pattern()));
        }

        log.info("Dispatching workflow {} [{}] for user {}", workflow.name(), workflow.pattern(), userId);
        return factory.createStrategy(workflow.pattern(), directory, workflow).process(userId, input);
    }

    /**
     * Runs over a conversation; the agents see the content of its last message.
     */
    public EventStream run(WorkflowDescriptor workflow, String userId, List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            log.warn("Workflow {} invoked with an empty conversation", workflow.name());
            return EventStream.error(factory.runtime().nextRunId(), "Conversation has no messages");
        }
        return run(workflow, userId, messages.get(messages.size() - 1).content());
    }

    public boolean isSupported(WorkflowDescriptor workflow) {
        return factory.isSupported(workflow.pattern());
    }
}
