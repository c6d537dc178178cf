package com.agentforge.core.model;

/**
 * Predefined roles an agent definition can declare.
 */
public enum AgentRole {
    PLANNER,
    EXECUTOR,
    CRITIC,
    RESEARCHER,
    WRITER,
    ANALYZER,
    COORDINATOR,
    CUSTOM
}
