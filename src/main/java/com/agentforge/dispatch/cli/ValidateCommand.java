package com.agentforge.dispatch.cli;

import com.agentforge.core.config.AgentforgeProperties;
import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.directory.WorkflowValidator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: agentforge validate
 * <p>
 * Checks every configured agent and workflow, including entries the registries skipped at
 * startup. Exits with 1 when any problem is found.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate configured agents and workflows")
@Component
public class ValidateCommand implements Callable<Integer> {

    private final AgentforgeProperties properties;
    private final AgentDirectory agentDirectory;

    public ValidateCommand(AgentforgeProperties properties, AgentDirectory agentDirectory) {
        this.properties = properties;
        this.agentDirectory = agentDirectory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        int problems = 0;

        System.out.println("AGENTS:");
        for (AgentforgeProperties.Agent agent : properties.getAgents()) {
            List<String> errors;
            try {
                errors = WorkflowValidator.validateAgent(agent.toDefinition());
            } catch (IllegalArgumentException e) {
                errors = List.of(e.getMessage());
            }
            problems += report(agent.getName(), errors);
        }

        System.out.println("WORKFLOWS:");
        for (AgentforgeProperties.Workflow workflow : properties.getWorkflows()) {
            List<String> errors;
            try {
                errors = WorkflowValidator.validateWorkflow(workflow.toDescriptor(), agentDirectory);
            } catch (IllegalArgumentException e) {
                errors = List.of(e.getMessage());
            }
            problems += report(workflow.getName(), errors);
        }

        if (problems > 0) {
            ConsoleOutput.error(problems + " problem(s) found");
            return 1;
        }
        ConsoleOutput.info("Configuration is valid.");
        return 0;
    }

    private static int report(String name, List<String> errors) {
        if (errors.isEmpty()) {
            ConsoleOutput.success(name);
            return 0;
        }
        for (String error : errors) {
            ConsoleOutput.error(name + ": " + error);
        }
        return errors.size();
    }
}
