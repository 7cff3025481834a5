package com.forecastmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to forecast, agents, presets, health and serve.
 */
@Command(
        name = "forecastmind",
        mixinStandardHelpOptions = true,
        version = "Forecastmind 0.1.0",
        description = "Multi-stage probabilistic forecasting pipeline",
        subcommands = {
                ForecastCommand.class,
                AgentsCommand.class,
                PresetsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForecastmindCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // reuse the parsed CommandLine so subcommands keep the injecting factory
        spec.commandLine().usage(System.out);
    }
}
