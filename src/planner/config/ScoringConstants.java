package planner.config;

/**
 * Weights and scales used by the quality and efficiency scores.
 */
public class ScoringConstants {
    public static final double DEADLINE_COMPLIANCE_WEIGHT = 0.4;
    public static final double DEPENDENCY_SATISFACTION_WEIGHT = 0.3;
    public static final double RESOURCE_COMPLIANCE_WEIGHT = 0.3;
    public static final double ROBUSTNESS_WEIGHT = 0.15;
    public static final double BALANCE_WEIGHT = 0.15;
    public static final double ROBUSTNESS_SCALE = 10.0;
    public static final double BALANCE_VARIANCE_FACTOR = 10.0;
    public static final double SINGLE_SUBMISSION_SCORE = 100.0;
    public static final double RESOURCE_FALLBACK_SCORE = 50.0;

    public static final double OPTIMAL_UTILIZATION_RATE = 0.8;
    public static final double UTILIZATION_DEVIATION_PENALTY = 100.0;
    public static final int IDEAL_DAYS_PER_SUBMISSION = 30;
    public static final double TIMELINE_SHORT_PENALTY = 0.5;
    public static final double TIMELINE_LONG_PENALTY = 0.8;
    public static final double RESOURCE_EFFICIENCY_WEIGHT = 0.6;
    public static final double TIMELINE_EFFICIENCY_WEIGHT = 0.4;

    // Objective weights of the exact model
    public static final int SOLVER_MAKESPAN_WEIGHT = 1;
    public static final int SOLVER_PENALTY_WEIGHT = 1;

    private final double deadlineComplianceWeight;
    private final double dependencySatisfactionWeight;
    private final double resourceComplianceWeight;
    private final double robustnessWeight;
    private final double balanceWeight;
    private final double robustnessScale;
    private final double balanceVarianceFactor;
    private final double singleSubmissionScore;
    private final double resourceFallbackScore;
    private final double optimalUtilizationRate;
    private final double utilizationDeviationPenalty;
    private final int idealDaysPerSubmission;
    private final double timelineShortPenalty;
    private final double timelineLongPenalty;
    private final double resourceEfficiencyWeight;
    private final double timelineEfficiencyWeight;
    private final int solverMakespanWeight;
    private final int solverPenaltyWeight;

    private ScoringConstants(Builder b) {
        this.deadlineComplianceWeight = b.deadlineComplianceWeight;
        this.dependencySatisfactionWeight = b.dependencySatisfactionWeight;
        this.resourceComplianceWeight = b.resourceComplianceWeight;
        this.robustnessWeight = b.robustnessWeight;
        this.balanceWeight = b.balanceWeight;
        this.robustnessScale = b.robustnessScale;
        this.balanceVarianceFactor = b.balanceVarianceFactor;
        this.singleSubmissionScore = b.singleSubmissionScore;
        this.resourceFallbackScore = b.resourceFallbackScore;
        this.optimalUtilizationRate = b.optimalUtilizationRate;
        this.utilizationDeviationPenalty = b.utilizationDeviationPenalty;
        this.idealDaysPerSubmission = b.idealDaysPerSubmission;
        this.timelineShortPenalty = b.timelineShortPenalty;
        this.timelineLongPenalty = b.timelineLongPenalty;
        this.resourceEfficiencyWeight = b.resourceEfficiencyWeight;
        this.timelineEfficiencyWeight = b.timelineEfficiencyWeight;
        this.solverMakespanWeight = b.solverMakespanWeight;
        this.solverPenaltyWeight = b.solverPenaltyWeight;
    }

    public static ScoringConstants defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getDeadlineComplianceWeight() { return deadlineComplianceWeight; }
    public double getDependencySatisfactionWeight() { return dependencySatisfactionWeight; }
    public double getResourceComplianceWeight() { return resourceComplianceWeight; }
    public double getRobustnessWeight() { return robustnessWeight; }
    public double getBalanceWeight() { return balanceWeight; }
    public double getRobustnessScale() { return robustnessScale; }
    public double getBalanceVarianceFactor() { return balanceVarianceFactor; }
    public double getSingleSubmissionScore() { return singleSubmissionScore; }
    public double getResourceFallbackScore() { return resourceFallbackScore; }
    public double getOptimalUtilizationRate() { return optimalUtilizationRate; }
    public double getUtilizationDeviationPenalty() { return utilizationDeviationPenalty; }
    public int getIdealDaysPerSubmission() { return idealDaysPerSubmission; }
    public double getTimelineShortPenalty() { return timelineShortPenalty; }
    public double getTimelineLongPenalty() { return timelineLongPenalty; }
    public double getResourceEfficiencyWeight() { return resourceEfficiencyWeight; }
    public double getTimelineEfficiencyWeight() { return timelineEfficiencyWeight; }
    public int getSolverMakespanWeight() { return solverMakespanWeight; }
    public int getSolverPenaltyWeight() { return solverPenaltyWeight; }

    public static class Builder {
        private double deadlineComplianceWeight = DEADLINE_COMPLIANCE_WEIGHT;
        private double dependencySatisfactionWeight = DEPENDENCY_SATISFACTION_WEIGHT;
        private double resourceComplianceWeight = RESOURCE_COMPLIANCE_WEIGHT;
        private double robustnessWeight = ROBUSTNESS_WEIGHT;
        private double balanceWeight = BALANCE_WEIGHT;
        private double robustnessScale = ROBUSTNESS_SCALE;
        private double balanceVarianceFactor = BALANCE_VARIANCE_FACTOR;
        private double singleSubmissionScore = SINGLE_SUBMISSION_SCORE;
        private double resourceFallbackScore = RESOURCE_FALLBACK_SCORE;
        private double optimalUtilizationRate = OPTIMAL_UTILIZATION_RATE;
        private double utilizationDeviationPenalty = UTILIZATION_DEVIATION_PENALTY;
        private int idealDaysPerSubmission = IDEAL_DAYS_PER_SUBMISSION;
        private double timelineShortPenalty = TIMELINE_SHORT_PENALTY;
        private double timelineLongPenalty = TIMELINE_LONG_PENALTY;
        private double resourceEfficiencyWeight = RESOURCE_EFFICIENCY_WEIGHT;
        private double timelineEfficiencyWeight = TIMELINE_EFFICIENCY_WEIGHT;
        private int solverMakespanWeight = SOLVER_MAKESPAN_WEIGHT;
        private int solverPenaltyWeight = SOLVER_PENALTY_WEIGHT;

        public Builder complianceWeights(double deadline, double dependency, double resource) {
            this.deadlineComplianceWeight = deadline;
            this.dependencySatisfactionWeight = dependency;
            this.resourceComplianceWeight = resource;
            return this;
        }

        public Builder robustnessWeight(double v) { this.robustnessWeight = v; return this; }
        public Builder balanceWeight(double v) { this.balanceWeight = v; return this; }
        public Builder robustnessScale(double v) { this.robustnessScale = v; return this; }
        public Builder balanceVarianceFactor(double v) { this.balanceVarianceFactor = v; return this; }
        public Builder singleSubmissionScore(double v) { this.singleSubmissionScore = v; return this; }
        public Builder resourceFallbackScore(double v) { this.resourceFallbackScore = v; return this; }
        public Builder optimalUtilizationRate(double v) { this.optimalUtilizationRate = v; return this; }
        public Builder utilizationDeviationPenalty(double v) { this.utilizationDeviationPenalty = v; return this; }
        public Builder idealDaysPerSubmission(int v) { this.idealDaysPerSubmission = v; return this; }
        public Builder timelineShortPenalty(double v) { this.timelineShortPenalty = v; return this; }
        public Builder timelineLongPenalty(double v) { this.timelineLongPenalty = v; return this; }

        public Builder efficiencyWeights(double resource, double timeline) {
            this.resourceEfficiencyWeight = resource;
            this.timelineEfficiencyWeight = timeline;
            return this;
        }

        public Builder solverWeights(int makespan, int penalty) {
            this.solverMakespanWeight = makespan;
            this.solverPenaltyWeight = penalty;
            return this;
        }

        public ScoringConstants build() {
            if (robustnessWeight + balanceWeight > 1.0 || robustnessWeight < 0 || balanceWeight < 0
                    || optimalUtilizationRate <= 0 || idealDaysPerSubmission <= 0
                    || solverMakespanWeight < 0 || solverPenaltyWeight < 0) {
                throw new ConfigurationException("Scoring constants out of range");
            }
            return new ScoringConstants(this);
        }
    }
}
