package com.lineage.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: lineage serve
 * <p>
 * Runs the HTTP server with the WebSocket endpoints. The web server is
 * enabled by {@link com.lineage.LineageApplication#main} when "serve" is
 * among the arguments; {@link CliRunner} then skips picocli, so the banner
 * is printed once Tomcat reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP and WebSocket server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Reached only through picocli, e.g. from tests; kept for --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Lineage server running on port " + port);
        System.out.println();
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println("  Test:       ws://localhost:" + port + "/ws");
        System.out.println("  Agents:     ws://localhost:" + port + "/ws/agents/{agentId}");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
