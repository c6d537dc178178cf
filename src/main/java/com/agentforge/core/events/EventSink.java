package com.agentforge.core.events;

/**
 * Write side of an {@link EventStream}. Strategies emit through it; the sink assigns the
 * sequence number and blocks until the consumer has room for the event.
 */
public interface EventSink {

    /**
     * Emits one event.
     *
     * @throws RunCancelledException if the consumer closed the stream
     */
    OrchestrationEvent emit(EventKind kind, String sourceAgent, String payload);

    default OrchestrationEvent progress(String sourceAgent, String payload) {
        return emit(EventKind.PROGRESS, sourceAgent, payload);
    }

    default OrchestrationEvent partial(String sourceAgent, String payload) {
        return emit(EventKind.PARTIAL, sourceAgent, payload);
    }

    default OrchestrationEvent warning(String sourceAgent, String payload) {
        return emit(EventKind.WARNING, sourceAgent, payload);
    }

    default OrchestrationEvent error(String payload) {
        return emit(EventKind.ERROR, null, payload);
    }

    default OrchestrationEvent complete(String payload) {
        return emit(EventKind.FINAL, null, payload);
    }
}
