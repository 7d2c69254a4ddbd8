package planner.config;

/**
 * Keys understood in the scheduling_options map.
 */
public final class SchedulingOptions {
    public static final String ENABLE_BLACKOUT_PERIODS = "enable_blackout_periods";
    public static final String ENABLE_WORKING_DAYS_ONLY = "enable_working_days_only";
    public static final String ENFORCE_SOFT_BLOCK_WINDOW = "enforce_soft_block_window";
    public static final String RANDOM_SEED = "random_seed";
    public static final String MAX_BACKTRACKS = "max_backtracks";
    public static final String LOOKAHEAD_DAYS = "lookahead_days";
    public static final String HEURISTIC_RULE = "heuristic_rule";
    public static final String SOLVER_TIME_LIMIT_SECONDS = "solver_time_limit_seconds";

    private SchedulingOptions() {
    }
}
