package planner.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planner.model.Config;
import planner.model.Schedule;
import planner.scoring.ScheduleAnalyzer;
import planner.scoring.ScheduleMetrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BiFunction;

/**
 * Runs several strategies against the same config on a fixed thread pool and scores each result.
 * Config is immutable, so the tasks share it; each task owns its scheduler instance.
 */
public class SchedulerComparison {

    private static final Logger LOG = LoggerFactory.getLogger(SchedulerComparison.class);

    public static final class Result {
        private final SchedulerStrategy strategy;
        private final Schedule schedule;
        private final Map<String, String> unscheduledReasons;
        private final ScheduleMetrics metrics;
        private final long elapsedMillis;

        Result(SchedulerStrategy strategy, Schedule schedule, Map<String, String> unscheduledReasons,
               ScheduleMetrics metrics, long elapsedMillis) {
            this.strategy = strategy;
            this.schedule = schedule;
            this.unscheduledReasons = Collections.unmodifiableMap(new LinkedHashMap<>(unscheduledReasons));
            this.metrics = metrics;
            this.elapsedMillis = elapsedMillis;
        }

        public SchedulerStrategy getStrategy() { return strategy; }
        public Schedule getSchedule() { return schedule; }
        public Map<String, String> getUnscheduledReasons() { return unscheduledReasons; }
        public ScheduleMetrics getMetrics() { return metrics; }
        public long getElapsedMillis() { return elapsedMillis; }
    }

    private final int threads;
    private final BiFunction<SchedulerStrategy, Config, SubmissionScheduler> factory;

    public SchedulerComparison(int threads) {
        this(threads, SchedulerFactory::create);
    }

    SchedulerComparison(int threads, BiFunction<SchedulerStrategy, Config, SubmissionScheduler> factory) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive");
        }
        this.threads = threads;
        this.factory = factory;
    }

    /**
     * Results in the order of {@code strategies}. A strategy that throws is logged and left out.
     */
    public Map<SchedulerStrategy, Result> compare(Config config, Collection<SchedulerStrategy> strategies) {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        Map<SchedulerStrategy, Future<Result>> futures = new LinkedHashMap<>();
        try {
            for (SchedulerStrategy strategy : strategies) {
                futures.put(strategy, pool.submit(task(strategy, config)));
            }
            Map<SchedulerStrategy, Result> results = new LinkedHashMap<>();
            List<SchedulerStrategy> failed = new ArrayList<>();
            for (Map.Entry<SchedulerStrategy, Future<Result>> e : futures.entrySet()) {
                try {
                    results.put(e.getKey(), e.getValue().get());
                } catch (ExecutionException ex) {
                    LOG.error("{} failed", e.getKey(), ex.getCause());
                    failed.add(e.getKey());
                }
            }
            LOG.info("Compared {} strategies, {} failed", futures.size(), failed.size());
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Comparison interrupted", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private Callable<Result> task(SchedulerStrategy strategy, Config config) {
        return () -> {
            long t0 = System.currentTimeMillis();
            SubmissionScheduler scheduler = factory.apply(strategy, config);
            Schedule schedule = scheduler.schedule(config);
            ScheduleMetrics metrics = ScheduleAnalyzer.analyze(schedule, config);
            return new Result(strategy, schedule, scheduler.getUnscheduledReasons(), metrics,
                    System.currentTimeMillis() - t0);
        };
    }

    /**
     * Most submissions placed, then lowest total penalty, then shortest makespan.
     */
    public static Optional<Result> best(Collection<Result> results) {
        return results.stream().min(Comparator
                .comparingInt((Result r) -> -r.getMetrics().getScheduledCount())
                .thenComparingDouble(r -> r.getMetrics().getTotalPenalty())
                .thenComparingLong(r -> r.getMetrics().getMakespanDays()));
    }
}
