package com.forecastmind.dispatch.cli;

import com.forecastmind.core.agents.AgentCard;
import com.forecastmind.core.events.ForecastEvent;
import com.forecastmind.core.model.ConfidenceInterval;
import com.forecastmind.core.model.ForecastContext;
import com.forecastmind.core.model.PresetDefinition;
import picocli.CommandLine;

import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FORECASTMIND v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FORECAST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** One line per pipeline event, prefixed by its family. */
    public static void event(ForecastEvent event) {
        Map<String, Object> p = event.payload() != null ? event.payload() : Map.of();
        String line = switch (event.eventType()) {
            case ForecastEvent.STAGE_STARTED -> "@|fg(blue) [STAGE]|@ " + p.get("stageName")
                    + " started with " + p.get("agents");
            case ForecastEvent.STAGE_COMPLETED -> {
                String status = String.valueOf(p.get("status"));
                String color = "failed".equals(status) ? "fg(red)" : "partial".equals(status) ? "fg(yellow)" : "fg(green)";
                yield "@|fg(blue) [STAGE]|@ " + p.get("stage") + " @|" + color + " " + status + "|@"
                        + " (" + p.get("agentCount") + " agents, " + p.get("processingTimeMs") + "ms)"
                        + (p.containsKey("error") ? " " + p.get("error") : "");
            }
            case ForecastEvent.PROGRESS_UPDATED -> "@|fg(cyan) [PROGRESS]|@ " + p.get("progress") + "%";
            case ForecastEvent.TASK_QUEUED, ForecastEvent.TASK_STARTED, ForecastEvent.TASK_COMPLETED,
                 ForecastEvent.TASK_FAILED -> "@|fg(magenta) [TASK]|@ " + event.eventType().substring(5)
                    + " " + event.taskId();
            case ForecastEvent.TASK_CANCELLED -> "@|fg(yellow),bold [CANCELLED]|@ " + p.get("reason");
            case ForecastEvent.PIPELINE_COMPLETED -> "@|fg(green),bold [COMPLETE]|@ p="
                    + percent(p.get("finalProbability"));
            case ForecastEvent.PIPELINE_ERROR -> "@|fg(red),bold [FAILED]|@ " + p.get("error");
            default -> "@|fg(white) [" + event.eventType() + "]|@ " + p;
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    public static void forecastSummary(ForecastContext context) {
        rule();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + context.matchup().awayTeam() + " @ " + context.matchup().homeTeam() + "|@"));
        line("Base rate", percent(context.baseRate()));
        if (context.structuralEstimate() != null) {
            line("Structural", percent(context.structuralEstimate()));
        }
        line("Posterior", percent(context.posteriorProbability()));
        line("Final", percent(context.finalProbability()) + interval(context.finalConfidenceInterval()));
        line("Pick", context.recommendation() != null ? context.recommendation() : "n/a");
        for (String driver : context.keyDrivers()) {
            System.out.println("    - " + driver);
        }
        if (!context.concerns().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) Concerns:|@ " + context.concerns().size()));
            for (String concern : context.concerns()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(yellow) -|@ " + concern));
            }
        }
        var times = context.processingTimes();
        if (!times.isEmpty()) {
            long total = times.values().stream().mapToLong(Long::longValue).sum();
            line("Duration", formatDuration(total));
        }
    }

    public static void agent(AgentCard card) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|bold %-30s|@ %-22s %s", card.id(), card.capabilities().supportedStages(),
                card.coherenceProfile().semanticDomain())));
        System.out.println("      " + card.description());
    }

    public static void preset(PresetDefinition preset) {
        String marker = preset.recommended() ? " @|fg(green) (recommended)|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + preset.id() + "|@ " + preset.name() + marker));
        System.out.println("      " + preset.description());
        System.out.println("      agents: " + preset.agentCount() + ", priority: " + preset.priority()
                + ", ~" + preset.estimatedTimeSeconds() + "s");
    }

    private static void line(String label, String value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  @|faint %-11s|@ %s", label + ":", value)));
    }

    static String percent(Object value) {
        if (value instanceof Number n) {
            return String.format(Locale.ROOT, "%.1f%%", n.doubleValue() * 100);
        }
        return "n/a";
    }

    private static String interval(ConfidenceInterval ci) {
        if (ci == null) {
            return "";
        }
        return " [" + percent(ci.lower()) + ", " + percent(ci.upper()) + "]";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
