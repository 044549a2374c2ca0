package com.stemtutor.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: stemtutor serve
 * <p>
 * Starts the HTTP API. The web server is enabled by
 * {@link com.stemtutor.StemTutorApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli so Tomcat keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 stemtutor serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the tutoring HTTP server")
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
        ConsoleOutput.info("STEM Tutor server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/v1");
        System.out.println("  Health:  http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
