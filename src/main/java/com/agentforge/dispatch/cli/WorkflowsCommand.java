package com.agentforge.dispatch.cli;

import com.agentforge.core.directory.AgentRegistry;
import com.agentforge.core.directory.WorkflowRegistry;
import com.agentforge.core.model.AgentDefinition;
import com.agentforge.core.model.WorkflowDescriptor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: agentforge workflows
 * <p>
 * Lists configured workflows and flags agent names no agent is registered for.
 */
@Command(name = "workflows", mixinStandardHelpOptions = true, description = "List workflows and agents")
@Component
public class WorkflowsCommand implements Runnable {

    private final WorkflowRegistry workflowRegistry;
    private final AgentRegistry agentRegistry;

    public WorkflowsCommand(WorkflowRegistry workflowRegistry, AgentRegistry agentRegistry) {
        this.workflowRegistry = workflowRegistry;
        this.agentRegistry = agentRegistry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<WorkflowDescriptor> workflows = workflowRegistry.list();
        if (workflows.isEmpty()) {
            ConsoleOutput.info("No workflows configured.");
        } else {
            System.out.println("WORKFLOWS:");
            for (var workflow : workflows) {
                System.out.printf("  %-20s [%-12s] %s%n", workflow.name(), workflow.pattern(),
                        String.join(" -> ", workflow.agentNames()));
                for (String agent : workflow.agentNames()) {
                    if (agentRegistry.lookup(agent).isEmpty()) {
                        ConsoleOutput.error("  agent " + agent + " is not registered");
                    }
                }
            }
        }

        System.out.println();
        List<AgentDefinition> agents = agentRegistry.definitions();
        if (agents.isEmpty()) {
            ConsoleOutput.info("No agents registered.");
            return;
        }
        System.out.println("AGENTS:");
        for (var agent : agents) {
            System.out.printf("  %-20s [%-11s] %s%n", agent.name(), agent.role(), agent.description());
        }
    }
}
