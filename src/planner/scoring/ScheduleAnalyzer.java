package planner.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.validation.LoadProfile;
import planner.validation.ResourceValidator;
import planner.validation.ScheduleConstraints;
import planner.validation.ValidationReport;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs validation once and derives every metric of a schedule from it.
 */
public final class ScheduleAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleAnalyzer.class);

    private ScheduleAnalyzer() {
    }

    public static ScheduleMetrics analyze(ScheduleView schedule, Config config) {
        ScheduleMetrics.Builder b = new ScheduleMetrics.Builder()
                .submissionCount(config.getSubmissions().size())
                .scheduledCount(schedule.size())
                .missingSubmissions(missing(schedule, config));
        if (schedule.isEmpty()) {
            return b.build();
        }

        ValidationReport report = ScheduleConstraints.validateScheduleConstraints(schedule, config);
        LoadProfile profile = ResourceValidator.sweep(schedule.getIntervals());
        EfficiencyCalculator efficiency = new EfficiencyCalculator(config);
        long span = EfficiencyCalculator.spanDays(schedule);

        LocalDate start = null;
        LocalDate end = null;
        Map<SubmissionKind, Integer> kinds = new EnumMap<>(SubmissionKind.class);
        Map<YearMonth, Integer> monthly = new TreeMap<>();
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            Interval iv = e.getValue();
            if (start == null || iv.getStartDate().isBefore(start)) start = iv.getStartDate();
            if (end == null || iv.getEndDate().isAfter(end)) end = iv.getEndDate();
            monthly.merge(YearMonth.from(iv.getStartDate()), 1, Integer::sum);
            config.getSubmission(e.getKey()).ifPresent(s -> kinds.merge(s.getKind(), 1, Integer::sum));
        }

        int limit = config.getMaxConcurrentSubmissions();
        ScheduleMetrics metrics = b.makespanDays(span)
                .penalties(new PenaltyCalculator(config).calculate(schedule, report))
                .complianceRate(report.getComplianceRate())
                .qualityScore(new QualityCalculator(config).calculate(schedule, report))
                .efficiencyScore(efficiency.calculate(schedule))
                .averageLoad(profile.getAverageLoad())
                .peakLoad(profile.getPeakLoad())
                .utilizationRate(limit > 0 ? profile.getAverageLoad() / limit * 100.0 : 0.0)
                .averageDailyLoad(span > 0 ? (double) profile.getTotalLoadDays() / span : 0.0)
                .timelineEfficiency(efficiency.timelineEfficiency(schedule))
                .kindCounts(kinds)
                .monthlyDistribution(monthly)
                .startDate(start)
                .endDate(end)
                .build();
        LOG.debug("Analyzed schedule: {}", metrics);
        return metrics;
    }

    private static List<String> missing(ScheduleView schedule, Config config) {
        List<String> out = new ArrayList<>();
        for (Submission s : config.getSubmissions()) {
            if (!schedule.contains(s.getId())) {
                out.add(s.getId());
            }
        }
        return out;
    }
}
