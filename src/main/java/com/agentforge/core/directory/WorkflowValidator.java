package com.agentforge.core.directory;

import com.agentforge.core.model.AgentDefinition;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Configuration checks for workflows and agent definitions. Every method returns the list of
 * problems found, empty when the input is valid.
 * <p>
 * Structural problems make a workflow unusable and the registries skip it. Agent names
 * missing from the directory are reported separately: at run time they are handled by each
 * strategy, so they are warnings rather than grounds for rejection.
 */
public final class WorkflowValidator {

    private WorkflowValidator() {}

    public static List<String> validateStructure(WorkflowDescriptor workflow) {
        List<String> errors = new ArrayList<>();
        if (workflow.agentNames().isEmpty()) {
            errors.add("Workflow must have at least one agent");
        }
        if (workflow.maxIterations() < 1) {
            errors.add("max_iterations must be at least 1");
        }
        if (workflow.pattern() == PatternKind.HIERARCHICAL && workflow.agentNames().size() < 2) {
            errors.add("Hierarchical pattern requires at least 2 agents (1 coordinator + workers)");
        }
        return errors;
    }

    public static List<String> missingAgents(WorkflowDescriptor workflow, Predicate<String> agentExists) {
        List<String> errors = new ArrayList<>();
        for (String agent : workflow.agentNames()) {
            if (!agentExists.test(agent)) {
                errors.add("Agent '" + agent + "' not found in registry");
            }
        }
        return errors;
    }

    /**
     * Structural problems followed by agent names the directory does not know.
     */
    public static List<String> validateWorkflow(WorkflowDescriptor workflow, AgentDirectory directory) {
        List<String> errors = validateStructure(workflow);
        errors.addAll(missingAgents(workflow, name -> directory.lookup(name).isPresent()));
        return errors;
    }

    public static List<String> validateAgent(AgentDefinition agent) {
        List<String> errors = new ArrayList<>();
        if (agent.description().isBlank()) {
            errors.add("Agent must have a description");
        }
        if (agent.instructions().isBlank()) {
            errors.add("Agent must have instructions");
        }
        if (agent.temperature() < 0.0 || agent.temperature() > 1.0) {
            errors.add("Temperature must be between 0 and 1");
        }
        if (agent.maxTokens() != null && agent.maxTokens() < 1) {
            errors.add("max_tokens must be positive");
        }
        return errors;
    }
}
