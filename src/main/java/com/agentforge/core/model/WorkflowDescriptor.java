package com.agentforge.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of a workflow: a coordination pattern plus an ordered list of agent
 * names. Agent names are not checked against the agent directory; a missing agent is a
 * run-time condition handled by each strategy.
 *
 * @param name                 workflow name
 * @param description          human-readable description
 * @param pattern              coordination pattern
 * @param agentNames           ordered agent names (for HIERARCHICAL the first is the coordinator)
 * @param maxIterations        iteration cap for iterative patterns, always positive
 * @param terminationCondition optional termination predicate expressed as text
 * @param metadata             free-form settings, e.g. {@code dynamic-pattern}
 */
public record WorkflowDescriptor(
    String name,
    String description,
    PatternKind pattern,
    List<String> agentNames,
    int maxIterations,
    Optional<String> terminationCondition,
    Map<String, String> metadata
) {
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public WorkflowDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name is required");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("Workflow " + name + " has no pattern");
        }
        if (agentNames == null) {
            throw new IllegalArgumentException("Workflow " + name + " has no agent list");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException(
                    "Workflow " + name + " maxIterations must be positive, was " + maxIterations);
        }
        description = description != null ? description : "";
        agentNames = List.copyOf(agentNames);
        terminationCondition = terminationCondition != null ? terminationCondition : Optional.empty();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static WorkflowDescriptor of(String name, PatternKind pattern, List<String> agentNames) {
        return new WorkflowDescriptor(name, "", pattern, agentNames,
                DEFAULT_MAX_ITERATIONS, Optional.empty(), Map.of());
    }

    /**
     * Returns a copy of this workflow running under a different pattern.
     */
    public WorkflowDescriptor withPattern(PatternKind newPattern) {
        return new WorkflowDescriptor(name, description, newPattern, agentNames,
                maxIterations, terminationCondition, metadata);
    }
}
