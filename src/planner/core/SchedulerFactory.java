package planner.core;

import planner.config.ConfigurationException;
import planner.config.SchedulingOptions;
import planner.core.optimal.OptimalScheduler;
import planner.model.Config;

import java.util.Optional;

/**
 * Creates a strategy configured from the config's scheduling options.
 */
public final class SchedulerFactory {

    private SchedulerFactory() {
    }

    public static SubmissionScheduler create(SchedulerStrategy strategy, Config config) {
        switch (strategy) {
            case GREEDY:
                return new GreedyScheduler();
            case STOCHASTIC:
                return new StochasticScheduler(config.getLongOption(SchedulingOptions.RANDOM_SEED,
                        config.getSchedulingConstants().getRandomSeed()));
            case LOOKAHEAD:
                return new LookaheadScheduler(config.getIntOption(SchedulingOptions.LOOKAHEAD_DAYS, 0));
            case BACKTRACKING:
                return new BacktrackingScheduler(config.getIntOption(SchedulingOptions.MAX_BACKTRACKS,
                        config.getSchedulingConstants().getMaxBacktracks()));
            case OPTIMAL:
                return new OptimalScheduler();
            case HEURISTIC:
                return new HeuristicScheduler(heuristicRule(config));
            default:
                throw new IllegalArgumentException("Unsupported strategy: " + strategy);
        }
    }

    static HeuristicRule heuristicRule(Config config) {
        Optional<String> raw = config.getStringOption(SchedulingOptions.HEURISTIC_RULE);
        if (raw.isEmpty()) {
            return HeuristicRule.EARLIEST_DEADLINE;
        }
        try {
            return HeuristicRule.fromString(raw.get());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown heuristic_rule: " + raw.get(), e);
        }
    }
}
