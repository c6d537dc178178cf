package com.agentforge.core.directory;

/**
 * Raised by an {@link AgentHandle} that could not produce output.
 */
public class AgentInvocationException extends Exception {

    public AgentInvocationException(String message) {
        super(message);
    }

    public AgentInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
