package com.chimera.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: chimera serve
 * <p>
 * Runs the engine as a long-lived HTTP server: the agent beacon protocol,
 * the operator REST API and SSE event streams. The web server is enabled by
 * {@link com.chimera.ChimeraApplication#main} detecting "serve" in the arguments.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Chimera server")
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
        ConsoleOutput.info("Chimera server running on port " + port);
        System.out.println();
        System.out.println("  Beacon:  http://localhost:" + port + "/beacon");
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
