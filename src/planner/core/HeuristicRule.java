package planner.core;

import java.util.Locale;

public enum HeuristicRule {
    EARLIEST_DEADLINE,
    LATEST_START,
    SHORTEST_PROCESSING_TIME,
    LONGEST_PROCESSING_TIME,
    CRITICAL_PATH;

    public static HeuristicRule fromString(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
