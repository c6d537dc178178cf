package com.agentforge.core.orchestration;

import com.agentforge.core.events.EventStream;

/**
 * Execution semantics of one coordination pattern, bound to a single workflow.
 */
@FunctionalInterface
public interface OrchestrationStrategy {

    /**
     * Starts a run over {@code input} on behalf of {@code userId}. The returned stream is
     * produced live; every call gets its own run state.
     */
    EventStream process(String userId, String input);
}
