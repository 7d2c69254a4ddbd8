package planner.scoring;

import planner.model.SubmissionKind;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything known about one schedule after scoring. Produced by {@link ScheduleAnalyzer}.
 */
public class ScheduleMetrics {

    private final long makespanDays;
    private final PenaltyBreakdown penalties;
    private final double complianceRate;
    private final double qualityScore;
    private final double efficiencyScore;
    private final double averageLoad;
    private final int peakLoad;
    private final double utilizationRate;
    private final double averageDailyLoad;
    private final double timelineEfficiency;
    private final int submissionCount;
    private final int scheduledCount;
    private final Map<SubmissionKind, Integer> kindCounts;
    private final Map<YearMonth, Integer> monthlyDistribution;
    private final List<String> missingSubmissions;
    private final LocalDate startDate;
    private final LocalDate endDate;

    private ScheduleMetrics(Builder b) {
        this.makespanDays = b.makespanDays;
        this.penalties = b.penalties;
        this.complianceRate = b.complianceRate;
        this.qualityScore = b.qualityScore;
        this.efficiencyScore = b.efficiencyScore;
        this.averageLoad = b.averageLoad;
        this.peakLoad = b.peakLoad;
        this.utilizationRate = b.utilizationRate;
        this.averageDailyLoad = b.averageDailyLoad;
        this.timelineEfficiency = b.timelineEfficiency;
        this.submissionCount = b.submissionCount;
        this.scheduledCount = b.scheduledCount;
        this.kindCounts = Collections.unmodifiableMap(b.kindCounts);
        this.monthlyDistribution = Collections.unmodifiableMap(b.monthlyDistribution);
        this.missingSubmissions = Collections.unmodifiableList(b.missingSubmissions);
        this.startDate = b.startDate;
        this.endDate = b.endDate;
    }

    public long getMakespanDays() { return makespanDays; }
    public PenaltyBreakdown getPenalties() { return penalties; }
    public double getTotalPenalty() { return penalties.getTotal(); }
    public double getComplianceRate() { return complianceRate; }
    public double getQualityScore() { return qualityScore; }
    public double getEfficiencyScore() { return efficiencyScore; }
    public double getAverageLoad() { return averageLoad; }
    public int getPeakLoad() { return peakLoad; }
    public double getUtilizationRate() { return utilizationRate; }
    public double getAverageDailyLoad() { return averageDailyLoad; }
    public double getTimelineEfficiency() { return timelineEfficiency; }
    public int getSubmissionCount() { return submissionCount; }
    public int getScheduledCount() { return scheduledCount; }
    public Map<SubmissionKind, Integer> getKindCounts() { return kindCounts; }
    public Map<YearMonth, Integer> getMonthlyDistribution() { return monthlyDistribution; }
    public List<String> getMissingSubmissions() { return missingSubmissions; }
    public Optional<LocalDate> getStartDate() { return Optional.ofNullable(startDate); }
    public Optional<LocalDate> getEndDate() { return Optional.ofNullable(endDate); }

    public double getCompletionRate() {
        return submissionCount == 0 ? 0.0 : scheduledCount * 100.0 / submissionCount;
    }

    public double getKindPercentage(SubmissionKind kind) {
        Integer n = kindCounts.get(kind);
        return n == null || scheduledCount == 0 ? 0.0 : n * 100.0 / scheduledCount;
    }

    @Override
    public String toString() {
        return String.format("scheduled %d/%d, makespan %d days, penalty %.1f, quality %.1f, efficiency %.1f",
                scheduledCount, submissionCount, makespanDays, getTotalPenalty(), qualityScore, efficiencyScore);
    }

    static class Builder {
        private long makespanDays;
        private PenaltyBreakdown penalties = PenaltyBreakdown.zero();
        private double complianceRate;
        private double qualityScore;
        private double efficiencyScore;
        private double averageLoad;
        private int peakLoad;
        private double utilizationRate;
        private double averageDailyLoad;
        private double timelineEfficiency;
        private int submissionCount;
        private int scheduledCount;
        private Map<SubmissionKind, Integer> kindCounts = Collections.emptyMap();
        private Map<YearMonth, Integer> monthlyDistribution = Collections.emptyMap();
        private List<String> missingSubmissions = Collections.emptyList();
        private LocalDate startDate;
        private LocalDate endDate;

        Builder makespanDays(long v) { this.makespanDays = v; return this; }
        Builder penalties(PenaltyBreakdown v) { this.penalties = v; return this; }
        Builder complianceRate(double v) { this.complianceRate = v; return this; }
        Builder qualityScore(double v) { this.qualityScore = v; return this; }
        Builder efficiencyScore(double v) { this.efficiencyScore = v; return this; }
        Builder averageLoad(double v) { this.averageLoad = v; return this; }
        Builder peakLoad(int v) { this.peakLoad = v; return this; }
        Builder utilizationRate(double v) { this.utilizationRate = v; return this; }
        Builder averageDailyLoad(double v) { this.averageDailyLoad = v; return this; }
        Builder timelineEfficiency(double v) { this.timelineEfficiency = v; return this; }
        Builder submissionCount(int v) { this.submissionCount = v; return this; }
        Builder scheduledCount(int v) { this.scheduledCount = v; return this; }
        Builder kindCounts(Map<SubmissionKind, Integer> v) { this.kindCounts = v; return this; }
        Builder monthlyDistribution(Map<YearMonth, Integer> v) { this.monthlyDistribution = v; return this; }
        Builder missingSubmissions(List<String> v) { this.missingSubmissions = v; return this; }
        Builder startDate(LocalDate v) { this.startDate = v; return this; }
        Builder endDate(LocalDate v) { this.endDate = v; return this; }

        ScheduleMetrics build() {
            return new ScheduleMetrics(this);
        }
    }
}
