package com.agentforge.core.events;

/**
 * Thrown inside a producer when the consumer has closed the stream. Unwinds the strategy so
 * that no further events are produced or agents invoked.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String runId) {
        super("Run " + runId + " was cancelled by its consumer");
    }
}
