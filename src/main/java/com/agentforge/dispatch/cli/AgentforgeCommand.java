package com.agentforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Agentforge.
 * Routes to subcommands: run, workflows, patterns, validate, serve.
 */
@Command(
        name = "agentforge",
        mixinStandardHelpOptions = true,
        version = "Agentforge 0.1.0",
        description = "Multi-agent workflow runner",
        subcommands = {
                RunCommand.class,
                WorkflowsCommand.class,
                PatternsCommand.class,
                ValidateCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
