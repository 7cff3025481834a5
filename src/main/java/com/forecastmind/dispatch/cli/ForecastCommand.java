package com.forecastmind.dispatch.cli;

import com.forecastmind.core.events.EventBus;
import com.forecastmind.core.events.ForecastEvent;
import com.forecastmind.core.model.ForecastIds;
import com.forecastmind.core.model.Matchup;
import com.forecastmind.core.model.UnknownPresetException;
import com.forecastmind.core.pipeline.ForecastStatus;
import com.forecastmind.core.pipeline.PipelineOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CLI command: forecastmind forecast &lt;gameId&gt; &lt;homeTeam&gt; &lt;awayTeam&gt;
 * <p>
 * Runs one forecast in-process, streams its events to the terminal and prints the
 * final analysis. Exit codes: 0 completed, 1 failed or cancelled, 2 bad input,
 * 3 timed out.
 */
@Command(name = "forecast", mixinStandardHelpOptions = true, description = "Forecast a single matchup")
@Component
public class ForecastCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Game identifier")
    private String gameId;

    @Parameters(index = "1", description = "Home team (the side whose win probability is forecast)")
    private String homeTeam;

    @Parameters(index = "2", description = "Away team")
    private String awayTeam;

    @Option(names = {"--preset", "-p"}, description = "Pipeline preset: quick, balanced, deep")
    private String preset;

    @Option(names = "--game-time", description = "Scheduled start, ISO-8601 instant")
    private String gameTime;

    @Option(names = {"--timeout", "-t"}, description = "Maximum wait, ISO-8601 duration", defaultValue = "PT10M")
    private Duration timeout;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final analysis")
    private boolean quiet;

    private final PipelineOrchestrator orchestrator;
    private final EventBus eventBus;

    public ForecastCommand(PipelineOrchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Instant kickoff = null;
        if (gameTime != null) {
            try {
                kickoff = Instant.parse(gameTime);
            } catch (DateTimeParseException e) {
                ConsoleOutput.error("Invalid --game-time: " + gameTime);
                return 2;
            }
        }

        String forecastId = ForecastIds.newForecastId();
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<ForecastEvent> terminal = new AtomicReference<>();
        EventBus.Subscription subscription = eventBus.subscribe(forecastId, event -> {
            if (!quiet) {
                ConsoleOutput.event(event);
            }
            if (event.isTerminal()) {
                terminal.set(event);
                finished.countDown();
            }
        });

        try {
            try {
                orchestrator.start(forecastId, new Matchup(gameId, homeTeam, awayTeam, kickoff), preset);
            } catch (UnknownPresetException e) {
                ConsoleOutput.error(e.getMessage());
                return 2;
            }
            ConsoleOutput.info("Forecast " + forecastId + ": " + awayTeam + " @ " + homeTeam);

            if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                ConsoleOutput.error("Timed out after " + timeout + "; cancelling " + forecastId);
                orchestrator.cancel(forecastId);
                return 3;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for " + forecastId);
            orchestrator.cancel(forecastId);
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        ForecastEvent outcome = terminal.get();
        if (!ForecastEvent.PIPELINE_COMPLETED.equals(outcome.eventType())) {
            ConsoleOutput.error("Forecast did not complete: " + outcome.eventType());
            return 1;
        }
        orchestrator.getStatus(forecastId)
                .map(ForecastStatus::context)
                .ifPresent(ConsoleOutput::forecastSummary);
        ConsoleOutput.success("Forecast complete.");
        return 0;
    }
}
