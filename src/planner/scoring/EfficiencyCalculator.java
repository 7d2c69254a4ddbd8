package planner.scoring;

import planner.config.ScoringConstants;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.validation.LoadProfile;
import planner.validation.ResourceValidator;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Efficiency on a 0..100 scale: how close the average load sits to the target utilization,
 * and how the overall span compares to an ideal of a fixed number of days per submission.
 */
public class EfficiencyCalculator {

    private final Config config;
    private final ScoringConstants k;

    public EfficiencyCalculator(Config config) {
        this.config = config;
        this.k = config.getScoringConstants();
    }

    public double calculate(ScheduleView schedule) {
        if (schedule.isEmpty()) {
            return 0.0;
        }
        return QualityCalculator.clamp(resourceEfficiency(schedule) * k.getResourceEfficiencyWeight()
                + timelineEfficiency(schedule) * k.getTimelineEfficiencyWeight());
    }

    public double resourceEfficiency(ScheduleView schedule) {
        LoadProfile profile = ResourceValidator.sweep(schedule.getIntervals());
        double target = config.getMaxConcurrentSubmissions() * k.getOptimalUtilizationRate();
        if (profile.getActiveDays() == 0 || target <= 0) {
            return 0.0;
        }
        double deviation = Math.abs(profile.getAverageLoad() - target) / target;
        return QualityCalculator.clamp(100.0 - deviation * k.getUtilizationDeviationPenalty());
    }

    public double timelineEfficiency(ScheduleView schedule) {
        long span = spanDays(schedule);
        double ideal = (double) config.getSubmissions().size() * k.getIdealDaysPerSubmission();
        if (span <= 0 || ideal <= 0) {
            return 0.0;
        }
        double ratio = span / ideal;
        double score = ratio <= 1.0
                ? 100.0 * (1.0 - (1.0 - ratio) * k.getTimelineShortPenalty())
                : 100.0 * (1.0 - (ratio - 1.0) * k.getTimelineLongPenalty());
        return QualityCalculator.clamp(score);
    }

    // First start to last end
    static long spanDays(ScheduleView schedule) {
        LocalDate first = null;
        LocalDate last = null;
        for (Interval iv : schedule.getIntervals().values()) {
            if (first == null || iv.getStartDate().isBefore(first)) first = iv.getStartDate();
            if (last == null || iv.getEndDate().isAfter(last)) last = iv.getEndDate();
        }
        return first == null ? 0 : ChronoUnit.DAYS.between(first, last);
    }
}
