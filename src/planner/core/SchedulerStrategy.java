package planner.core;

import java.util.Locale;

public enum SchedulerStrategy {
    GREEDY,
    STOCHASTIC,
    LOOKAHEAD,
    BACKTRACKING,
    OPTIMAL,
    HEURISTIC;

    public static SchedulerStrategy fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("strategy is null");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
