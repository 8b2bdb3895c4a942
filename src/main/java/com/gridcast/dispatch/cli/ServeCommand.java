package com.gridcast.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gridcast serve
 * <p>
 * Starts Gridcast as a long-running HTTP server exposing the session REST API.
 * The web server is enabled by {@link com.gridcast.GridcastApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli and the
 * banner is printed once the embedded server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 gridcast serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Gridcast HTTP server")
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
        ConsoleOutput.info("Gridcast server running on port " + port);
        System.out.println();
        System.out.println("  Sessions:  http://localhost:" + port + "/api/v1/sessions");
        System.out.println("  Health:    http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
