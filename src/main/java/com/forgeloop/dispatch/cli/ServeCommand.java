package com.forgeloop.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: forgeloop serve
 * <p>
 * Starts Forgeloop as a long-running HTTP server exposing the REST API and SSE event
 * stream. The web server is enabled by {@code ForgeloopApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Forgeloop HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Forgeloop server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/project");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/project/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
