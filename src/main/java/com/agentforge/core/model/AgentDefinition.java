package com.agentforge.core.model;

import java.util.List;

/**
 * Named agent configuration held by the agent registry.
 *
 * @param name         unique agent name referenced by workflows
 * @param role         declared role
 * @param description  short human-readable description
 * @param instructions system instructions for the agent
 * @param modelId      model identifier; nullable, the runtime default applies
 * @param temperature  sampling temperature
 * @param maxTokens    response token cap; nullable for no cap
 * @param tools        tool names the agent may use
 */
public record AgentDefinition(
    String name,
    AgentRole role,
    String description,
    String instructions,
    String modelId,
    double temperature,
    Integer maxTokens,
    List<String> tools
) {
    public AgentDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name is required");
        }
        role = role != null ? role : AgentRole.CUSTOM;
        description = description != null ? description : "";
        instructions = instructions != null ? instructions : "";
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
