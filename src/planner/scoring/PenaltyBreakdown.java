package planner.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Penalty per category plus the total. Built by {@link PenaltyCalculator}.
 */
public class PenaltyBreakdown {

    public static final String DEADLINE = "deadline";
    public static final String DEPENDENCY = "dependency";
    public static final String RESOURCE = "resource";
    public static final String CONFERENCE_COMPATIBILITY = "conference_compatibility";
    public static final String ABSTRACT_PAPER_DEPENDENCY = "abstract_paper_dependency";
    public static final String BLACKOUT = "blackout";
    public static final String SOFT_BLOCK = "soft_block";
    public static final String SINGLE_CONFERENCE = "single_conference";
    public static final String LEAD_TIME = "lead_time";
    public static final String SLACK_COST = "slack_cost";

    private final Map<String, Double> categories;

    PenaltyBreakdown(Map<String, Double> categories) {
        this.categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public static PenaltyBreakdown zero() {
        Map<String, Double> m = new LinkedHashMap<>();
        for (String key : new String[]{DEADLINE, DEPENDENCY, RESOURCE, CONFERENCE_COMPATIBILITY,
                ABSTRACT_PAPER_DEPENDENCY, BLACKOUT, SOFT_BLOCK, SINGLE_CONFERENCE, LEAD_TIME, SLACK_COST}) {
            m.put(key, 0.0);
        }
        return new PenaltyBreakdown(m);
    }

    public double get(String category) {
        Double v = categories.get(category);
        return v == null ? 0.0 : v;
    }

    public double getTotal() {
        double sum = 0;
        for (double v : categories.values()) {
            sum += v;
        }
        return sum;
    }

    public Map<String, Double> getCategories() {
        return categories;
    }

    @Override
    public String toString() {
        return "PenaltyBreakdown{total=" + getTotal() + ", " + categories + "}";
    }
}
