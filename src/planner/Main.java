package planner;

import planner.config.ConfigurationException;
import planner.core.ConferenceAssigner;
import planner.core.SchedulerComparison;
import planner.core.SchedulerStrategy;
import planner.export.ScheduleExporter;
import planner.io.JsonConfigLoader;
import planner.model.Config;
import planner.scoring.ScheduleMetrics;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class Main {

    static final int OK = 0;
    static final int USAGE = 2;
    static final int CONFIG_ERROR = 3;
    static final int IO_ERROR = 4;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        if (args.length < 1 || args.length > 3) {
            out.println("Usage: planner.Main <config.json> [strategy|all] [outputDir]");
            out.println("Strategies: " + Arrays.toString(SchedulerStrategy.values()).toLowerCase(Locale.ROOT));
            return USAGE;
        }

        List<SchedulerStrategy> strategies;
        try {
            strategies = args.length >= 2 && !args[1].equalsIgnoreCase("all")
                    ? List.of(SchedulerStrategy.fromString(args[1]))
                    : Arrays.asList(SchedulerStrategy.values());
        } catch (IllegalArgumentException e) {
            out.println("Unknown strategy: " + args[1]);
            return USAGE;
        }

        try {
            Config config = ConferenceAssigner.assign(JsonConfigLoader.load(Path.of(args[0])));
            out.println("Submissions: " + config.getSubmissions().size()
                    + ", conferences: " + config.getConferences().size()
                    + ", window: " + config.getSchedulingWindowStart() + " to " + config.getSchedulingWindowEnd());

            Map<SchedulerStrategy, SchedulerComparison.Result> results =
                    new SchedulerComparison(Math.min(strategies.size(), Runtime.getRuntime().availableProcessors()))
                            .compare(config, strategies);

            for (SchedulerComparison.Result r : results.values()) {
                print(r, out);
                if (args.length == 3) {
                    String prefix = results.size() > 1 ? r.getStrategy().name().toLowerCase(Locale.ROOT) + "_" : "";
                    for (Path p : ScheduleExporter.exportAll(r.getSchedule(), config, Path.of(args[2]), prefix)) {
                        out.println("  wrote " + p);
                    }
                }
            }
            SchedulerComparison.best(results.values())
                    .ifPresent(b -> out.println("Best: " + b.getStrategy()));
            return OK;
        } catch (ConfigurationException e) {
            out.println("Configuration Error:");
            for (String err : e.getErrors()) {
                out.println("  - " + err);
            }
            return CONFIG_ERROR;
        } catch (IOException e) {
            out.println("I/O Error: " + e.getMessage());
            return IO_ERROR;
        }
    }

    private static void print(SchedulerComparison.Result r, PrintStream out) {
        ScheduleMetrics m = r.getMetrics();
        out.println();
        out.println("== " + r.getStrategy() + " (" + r.getElapsedMillis() + " ms) ==");
        out.println(m);
        out.printf(Locale.ROOT, "  compliance %.1f%%, completion %.1f%%, peak load %d, utilization %.1f%%%n",
                m.getComplianceRate(), m.getCompletionRate(), m.getPeakLoad(), m.getUtilizationRate());
        m.getStartDate().ifPresent(s -> out.println("  from " + s + " to " + m.getEndDate().get()));
        for (Map.Entry<String, Double> e : m.getPenalties().getCategories().entrySet()) {
            if (e.getValue() > 0) {
                out.printf(Locale.ROOT, "  penalty %-26s %.1f%n", e.getKey(), e.getValue());
            }
        }
        for (Map.Entry<String, String> e : r.getUnscheduledReasons().entrySet()) {
            out.println("  [UNSCHEDULED] " + e.getKey() + ": " + e.getValue());
        }
    }
}
