package com.agentforge.dispatch.api;

import com.agentforge.core.model.WorkflowDescriptor;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON entry of GET /api/v1/workflows.
 */
public record WorkflowSummary(
    String name,
    String description,
    String pattern,
    List<String> agents,
    @JsonProperty("max_iterations") int maxIterations,
    @JsonProperty("termination_condition") String terminationCondition,
    Map<String, String> metadata
) {

    public static WorkflowSummary from(WorkflowDescriptor workflow) {
        return new WorkflowSummary(workflow.name(), workflow.description(), workflow.pattern().tag(),
                workflow.agentNames(), workflow.maxIterations(),
                workflow.terminationCondition().orElse(null), workflow.metadata());
    }
}
