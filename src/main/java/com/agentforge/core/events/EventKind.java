package com.agentforge.core.events;

/**
 * Kind of an {@link OrchestrationEvent}.
 */
public enum EventKind {
    /** A step started or a plan was announced. */
    PROGRESS,
    /** Intermediate result produced by one agent. */
    PARTIAL,
    /** Degraded but recoverable condition, e.g. a missing or failing agent. */
    WARNING,
    /** Terminal failure; nothing follows it. */
    ERROR,
    /** Final result of the run; always the last event of a successful run. */
    FINAL
}
