package com.agentforge.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and hands its exit code to
 * {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * {@code serve} is only recognised as the first argument, so a workflow input such as
 * {@code run blog-pipeline serve} still runs the workflow.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final String SERVE = "serve";

    private final AgentforgeCommand agentforgeCommand;
    private final IFactory factory;
    private volatile int exitCode;

    public CliRunner(AgentforgeCommand agentforgeCommand, IFactory factory) {
        this.agentforgeCommand = agentforgeCommand;
        this.factory = factory;
    }

    /**
     * True when the arguments start the HTTP server rather than a one-shot command.
     * {@code serve --help} stays a CLI invocation.
     */
    public static boolean isServeMode(String... args) {
        if (args == null || args.length == 0 || !SERVE.equals(args[0])) {
            return false;
        }
        for (int i = 1; i < args.length; i++) {
            if ("-h".equals(args[i]) || "--help".equals(args[i]) || "-V".equals(args[i]) || "--version".equals(args[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            // The web server keeps the JVM alive; ServeCommand prints the banner once it is up.
            log.debug("Serve mode, skipping command execution");
            return;
        }
        exitCode = new CommandLine(agentforgeCommand, factory).execute(args);
        log.debug("Command finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
