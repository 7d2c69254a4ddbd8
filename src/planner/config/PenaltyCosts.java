package planner.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keys of the penalty_costs map and their default prices.
 */
public final class PenaltyCosts {
    public static final String MOD_PENALTY_PER_DAY = "default_mod_penalty_per_day";
    public static final String PAPER_PENALTY_PER_DAY = "default_paper_penalty_per_day";
    public static final String DEPENDENCY_VIOLATION = "default_dependency_violation_penalty";
    public static final String MONTHLY_SLIP = "default_monthly_slip_penalty";
    public static final String FULL_YEAR_DEFERRAL = "default_full_year_deferral_penalty";
    public static final String MISSED_ABSTRACT = "missed_abstract_penalty";
    public static final String MISSED_POSTER = "missed_poster_penalty";
    public static final String MISSED_ABSTRACT_PAPER = "missed_abstract_paper_penalty";
    public static final String RESOURCE_VIOLATION = "resource_violation_penalty";
    public static final String SOFT_BLOCK_VIOLATION = "soft_block_violation_penalty";
    public static final String SINGLE_CONFERENCE_VIOLATION = "single_conference_violation_penalty";
    public static final String LEAD_TIME_VIOLATION = "lead_time_violation_penalty";
    public static final String CONFERENCE_COMPATIBILITY = "conference_compatibility_penalty";
    public static final String ABSTRACT_PAPER_DEPENDENCY = "abstract_paper_dependency_penalty";
    public static final String BLACKOUT_VIOLATION = "blackout_violation_penalty";

    // Multipliers and factors, also overridable through penalty_costs
    public static final String MISSING_DEPENDENCY_MULTIPLIER = "missing_dependency_multiplier";
    public static final String SUBMISSION_TYPE_MISMATCH_MULTIPLIER = "submission_type_mismatch_multiplier";
    public static final String ABSTRACT_MISSING_MULTIPLIER = "abstract_missing_multiplier";
    public static final String ABSTRACT_TIMING_MULTIPLIER = "abstract_timing_multiplier";
    public static final String TOP_TIER_MULTIPLIER = "top_tier_multiplier";
    public static final String BLACKOUT_HIGH_SEVERITY_MULTIPLIER = "blackout_high_severity_multiplier";
    public static final String BLACKOUT_LOW_SEVERITY_MULTIPLIER = "blackout_low_severity_multiplier";
    public static final String LEAD_TIME_SHORTFALL_FACTOR = "lead_time_shortfall_factor";

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(MOD_PENALTY_PER_DAY, 1000.0);
        m.put(PAPER_PENALTY_PER_DAY, 2000.0);
        m.put(DEPENDENCY_VIOLATION, 200.0);
        m.put(MONTHLY_SLIP, 1000.0);
        m.put(FULL_YEAR_DEFERRAL, 5000.0);
        m.put(MISSED_ABSTRACT, 3000.0);
        m.put(MISSED_POSTER, 2000.0);
        m.put(MISSED_ABSTRACT_PAPER, 4000.0);
        m.put(RESOURCE_VIOLATION, 200.0);
        m.put(SOFT_BLOCK_VIOLATION, 200.0);
        m.put(SINGLE_CONFERENCE_VIOLATION, 500.0);
        m.put(LEAD_TIME_VIOLATION, 150.0);
        m.put(CONFERENCE_COMPATIBILITY, 300.0);
        m.put(ABSTRACT_PAPER_DEPENDENCY, 400.0);
        m.put(BLACKOUT_VIOLATION, 100.0);
        m.put(MISSING_DEPENDENCY_MULTIPLIER, 2.0);
        m.put(SUBMISSION_TYPE_MISMATCH_MULTIPLIER, 1.5);
        m.put(ABSTRACT_MISSING_MULTIPLIER, 2.0);
        m.put(ABSTRACT_TIMING_MULTIPLIER, 1.5);
        m.put(TOP_TIER_MULTIPLIER, 1.5);
        m.put(BLACKOUT_HIGH_SEVERITY_MULTIPLIER, 2.0);
        m.put(BLACKOUT_LOW_SEVERITY_MULTIPLIER, 0.5);
        m.put(LEAD_TIME_SHORTFALL_FACTOR, 0.2);
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private PenaltyCosts() {
    }

    public static Map<String, Double> defaults() {
        return DEFAULTS;
    }

    // Defaults overlaid with the given prices
    public static Map<String, Double> merge(Map<String, Double> overrides) {
        Map<String, Double> m = new LinkedHashMap<>(DEFAULTS);
        if (overrides != null) {
            m.putAll(overrides);
        }
        return Collections.unmodifiableMap(m);
    }
}
