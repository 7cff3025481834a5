package com.forecastmind.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: forecastmind serve
 * <p>
 * Runs the REST API and SSE streams. The web server is switched on by
 * {@link com.forecastmind.ForecastmindApplication#main} when "serve" is among the arguments,
 * and {@link CliRunner} skips picocli in that mode. The banner is printed once the
 * server reports its port.
 * <p>
 * Port: {@code SERVER_PORT=9090 forecastmind serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Forecastmind HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Forecastmind server running on port " + port);
        System.out.println();
        System.out.println("  Forecasts:  http://localhost:" + port + "/api/v1/forecasts");
        System.out.println("  Agents:     http://localhost:" + port + "/api/v1/agents");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
