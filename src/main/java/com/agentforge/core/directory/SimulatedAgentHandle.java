package com.agentforge.core.directory;

import com.agentforge.core.model.AgentDefinition;

/**
 * Placeholder handle for configured agents. Echoes its input tagged with the agent name;
 * model invocation is plugged in by registering a real {@link AgentHandle} instead.
 */
public class SimulatedAgentHandle implements AgentHandle {

    private final AgentDefinition definition;

    public SimulatedAgentHandle(AgentDefinition definition) {
        this.definition = definition;
    }

    @Override
    public String invoke(String input) {
        return "[" + definition.name() + " output]: Processed - " + input;
    }
}
