package com.forecastmind.dispatch.cli;

import com.forecastmind.core.pipeline.PresetCatalog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: forecastmind presets
 */
@Command(name = "presets", mixinStandardHelpOptions = true, description = "List pipeline presets")
@Component
public class PresetsCommand implements Runnable {

    private final PresetCatalog presetCatalog;

    public PresetsCommand(PresetCatalog presetCatalog) {
        this.presetCatalog = presetCatalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        presetCatalog.presets().forEach(ConsoleOutput::preset);
    }
}
