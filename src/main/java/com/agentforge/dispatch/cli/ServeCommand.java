package com.agentforge.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentforge serve
 * <p>
 * Starts Agentforge as an HTTP server exposing the REST API and SSE run streaming. The web
 * server is enabled when {@link CliRunner#isServeMode} sees "serve" as the first argument,
 * and picocli is skipped.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Agentforge HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Agentforge server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Run stream: POST http://localhost:" + port + "/api/v1/workflows/{name}/runs");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
