package planner.config;

/**
 * Scheduling tunables. Threaded through {@link planner.model.Config} instead of read from globals.
 */
public class SchedulingConstants {
    public static final int DAYS_PER_MONTH = 30;
    public static final int POSTER_DURATION_DAYS = 30;
    public static final int CONFERENCE_RESPONSE_TIME_DAYS = 90;
    public static final int REFERENCE_PERIOD_DAYS = 365;
    public static final int SOFT_BLOCK_WINDOW_DAYS = 60;
    public static final int SINGLE_CONFERENCE_CYCLE_DAYS = 365;
    public static final int LOOKAHEAD_WINDOW_DAYS = 30;
    public static final double LOOKAHEAD_BONUS_INCREMENT = 0.5;
    public static final double RANDOMNESS_FACTOR = 0.1;
    public static final int STOCHASTIC_JITTER_DAYS = 7;
    public static final int MAX_BACKTRACKS = 5;
    public static final int SOLVER_TIME_LIMIT_SECONDS = 60;
    public static final long RANDOM_SEED = 42L;

    // Month thresholds for slack-cost penalties
    public static final int FULL_YEAR_DEFERRAL_MONTHS = 12;
    public static final int ABSTRACT_PAPER_MISSED_MONTHS = 6;
    public static final int PAPER_MISSED_MONTHS = 4;
    public static final int ABSTRACT_MISSED_MONTHS = 3;
    public static final int UNASSIGNED_PAPER_MISSED_MONTHS = 6;

    // Lateness severity thresholds, days
    public static final int HIGH_SEVERITY_DAYS = 7;
    public static final int MEDIUM_SEVERITY_DAYS = 1;

    private final int daysPerMonth;
    private final int posterDurationDays;
    private final int conferenceResponseTimeDays;
    private final int referencePeriodDays;
    private final int softBlockWindowDays;
    private final int singleConferenceCycleDays;
    private final int lookaheadWindowDays;
    private final double lookaheadBonusIncrement;
    private final double randomnessFactor;
    private final int stochasticJitterDays;
    private final int maxBacktracks;
    private final int solverTimeLimitSeconds;
    private final long randomSeed;
    private final int fullYearDeferralMonths;
    private final int abstractPaperMissedMonths;
    private final int paperMissedMonths;
    private final int abstractMissedMonths;
    private final int unassignedPaperMissedMonths;
    private final int highSeverityDays;
    private final int mediumSeverityDays;

    private SchedulingConstants(Builder b) {
        this.daysPerMonth = b.daysPerMonth;
        this.posterDurationDays = b.posterDurationDays;
        this.conferenceResponseTimeDays = b.conferenceResponseTimeDays;
        this.referencePeriodDays = b.referencePeriodDays;
        this.softBlockWindowDays = b.softBlockWindowDays;
        this.singleConferenceCycleDays = b.singleConferenceCycleDays;
        this.lookaheadWindowDays = b.lookaheadWindowDays;
        this.lookaheadBonusIncrement = b.lookaheadBonusIncrement;
        this.randomnessFactor = b.randomnessFactor;
        this.stochasticJitterDays = b.stochasticJitterDays;
        this.maxBacktracks = b.maxBacktracks;
        this.solverTimeLimitSeconds = b.solverTimeLimitSeconds;
        this.randomSeed = b.randomSeed;
        this.fullYearDeferralMonths = b.fullYearDeferralMonths;
        this.abstractPaperMissedMonths = b.abstractPaperMissedMonths;
        this.paperMissedMonths = b.paperMissedMonths;
        this.abstractMissedMonths = b.abstractMissedMonths;
        this.unassignedPaperMissedMonths = b.unassignedPaperMissedMonths;
        this.highSeverityDays = b.highSeverityDays;
        this.mediumSeverityDays = b.mediumSeverityDays;
    }

    public static SchedulingConstants defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getDaysPerMonth() { return daysPerMonth; }
    public int getPosterDurationDays() { return posterDurationDays; }
    public int getConferenceResponseTimeDays() { return conferenceResponseTimeDays; }
    public int getReferencePeriodDays() { return referencePeriodDays; }
    public int getSoftBlockWindowDays() { return softBlockWindowDays; }
    public int getSingleConferenceCycleDays() { return singleConferenceCycleDays; }
    public int getLookaheadWindowDays() { return lookaheadWindowDays; }
    public double getLookaheadBonusIncrement() { return lookaheadBonusIncrement; }
    public double getRandomnessFactor() { return randomnessFactor; }
    public int getStochasticJitterDays() { return stochasticJitterDays; }
    public int getMaxBacktracks() { return maxBacktracks; }
    public int getSolverTimeLimitSeconds() { return solverTimeLimitSeconds; }
    public long getRandomSeed() { return randomSeed; }
    public int getFullYearDeferralMonths() { return fullYearDeferralMonths; }
    public int getAbstractPaperMissedMonths() { return abstractPaperMissedMonths; }
    public int getPaperMissedMonths() { return paperMissedMonths; }
    public int getAbstractMissedMonths() { return abstractMissedMonths; }
    public int getUnassignedPaperMissedMonths() { return unassignedPaperMissedMonths; }
    public int getHighSeverityDays() { return highSeverityDays; }
    public int getMediumSeverityDays() { return mediumSeverityDays; }

    public static class Builder {
        private int daysPerMonth = DAYS_PER_MONTH;
        private int posterDurationDays = POSTER_DURATION_DAYS;
        private int conferenceResponseTimeDays = CONFERENCE_RESPONSE_TIME_DAYS;
        private int referencePeriodDays = REFERENCE_PERIOD_DAYS;
        private int softBlockWindowDays = SOFT_BLOCK_WINDOW_DAYS;
        private int singleConferenceCycleDays = SINGLE_CONFERENCE_CYCLE_DAYS;
        private int lookaheadWindowDays = LOOKAHEAD_WINDOW_DAYS;
        private double lookaheadBonusIncrement = LOOKAHEAD_BONUS_INCREMENT;
        private double randomnessFactor = RANDOMNESS_FACTOR;
        private int stochasticJitterDays = STOCHASTIC_JITTER_DAYS;
        private int maxBacktracks = MAX_BACKTRACKS;
        private int solverTimeLimitSeconds = SOLVER_TIME_LIMIT_SECONDS;
        private long randomSeed = RANDOM_SEED;
        private int fullYearDeferralMonths = FULL_YEAR_DEFERRAL_MONTHS;
        private int abstractPaperMissedMonths = ABSTRACT_PAPER_MISSED_MONTHS;
        private int paperMissedMonths = PAPER_MISSED_MONTHS;
        private int abstractMissedMonths = ABSTRACT_MISSED_MONTHS;
        private int unassignedPaperMissedMonths = UNASSIGNED_PAPER_MISSED_MONTHS;
        private int highSeverityDays = HIGH_SEVERITY_DAYS;
        private int mediumSeverityDays = MEDIUM_SEVERITY_DAYS;

        public Builder daysPerMonth(int v) { this.daysPerMonth = v; return this; }
        public Builder posterDurationDays(int v) { this.posterDurationDays = v; return this; }
        public Builder conferenceResponseTimeDays(int v) { this.conferenceResponseTimeDays = v; return this; }
        public Builder referencePeriodDays(int v) { this.referencePeriodDays = v; return this; }
        public Builder softBlockWindowDays(int v) { this.softBlockWindowDays = v; return this; }
        public Builder singleConferenceCycleDays(int v) { this.singleConferenceCycleDays = v; return this; }
        public Builder lookaheadWindowDays(int v) { this.lookaheadWindowDays = v; return this; }
        public Builder lookaheadBonusIncrement(double v) { this.lookaheadBonusIncrement = v; return this; }
        public Builder randomnessFactor(double v) { this.randomnessFactor = v; return this; }
        public Builder stochasticJitterDays(int v) { this.stochasticJitterDays = v; return this; }
        public Builder maxBacktracks(int v) { this.maxBacktracks = v; return this; }
        public Builder solverTimeLimitSeconds(int v) { this.solverTimeLimitSeconds = v; return this; }
        public Builder randomSeed(long v) { this.randomSeed = v; return this; }
        public Builder fullYearDeferralMonths(int v) { this.fullYearDeferralMonths = v; return this; }
        public Builder abstractPaperMissedMonths(int v) { this.abstractPaperMissedMonths = v; return this; }
        public Builder paperMissedMonths(int v) { this.paperMissedMonths = v; return this; }
        public Builder abstractMissedMonths(int v) { this.abstractMissedMonths = v; return this; }
        public Builder unassignedPaperMissedMonths(int v) { this.unassignedPaperMissedMonths = v; return this; }
        public Builder highSeverityDays(int v) { this.highSeverityDays = v; return this; }
        public Builder mediumSeverityDays(int v) { this.mediumSeverityDays = v; return this; }

        public SchedulingConstants build() {
            if (daysPerMonth <= 0 || posterDurationDays < 0 || referencePeriodDays <= 0
                    || conferenceResponseTimeDays < 0 || softBlockWindowDays < 0
                    || lookaheadWindowDays < 0 || maxBacktracks < 0 || solverTimeLimitSeconds <= 0
                    || randomnessFactor < 0 || stochasticJitterDays < 0) {
                throw new ConfigurationException("Scheduling constants out of range");
            }
            return new SchedulingConstants(this);
        }
    }
}
