package com.qmb.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: qmb serve
 * <p>
 * Starts the model builder as a long-running HTTP server exposing the REST API and the MCP
 * tool endpoint. The web server is enabled by {@link com.qmb.QmbApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli, and the banner is printed once the
 * server is initialized.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the model builder HTTP server (REST API and MCP)")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli for serve.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Model builder server running on port " + port);
        System.out.println();
        System.out.println("  API:  http://localhost:" + port + "/api/v1/model-builder");
        System.out.println("  MCP:  http://localhost:" + port + "/sse");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
