package com.agentforge.core.directory;

/**
 * Invocable agent supplied by an {@link AgentDirectory}. Implementations may block on
 * network or model latency and should respond to thread interruption.
 */
@FunctionalInterface
public interface AgentHandle {

    String invoke(String input) throws AgentInvocationException;
}
