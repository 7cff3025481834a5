package com.forecastmind.dispatch.cli;

import com.forecastmind.core.agents.AgentCard;
import com.forecastmind.core.agents.AgentRegistry;
import com.forecastmind.core.model.ForecastStage;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: forecastmind agents [--stage STAGE]
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List registered agents")
@Component
public class AgentsCommand implements Callable<Integer> {

    @Option(names = {"--stage", "-s"}, description = "Only agents supporting this stage, e.g. evidence_gathering")
    private String stage;

    private final AgentRegistry registry;

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<AgentCard> agents;
        if (stage != null) {
            ForecastStage resolved;
            try {
                resolved = ForecastStage.fromWire(stage);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return 2;
            }
            agents = registry.getByStage(resolved);
        } else {
            agents = registry.getAll();
        }

        if (agents.isEmpty()) {
            ConsoleOutput.info("No agents registered" + (stage != null ? " for " + stage : ""));
            return 0;
        }
        ConsoleOutput.info(agents.size() + " agent" + (agents.size() != 1 ? "s" : ""));
        agents.forEach(ConsoleOutput::agent);
        return 0;
    }
}
