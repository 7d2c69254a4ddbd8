package planner.scoring;

import planner.config.ScoringConstants;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.validation.ConstraintFamily;
import planner.validation.LoadProfile;
import planner.validation.ResourceValidator;
import planner.validation.ValidationReport;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Quality on a 0..100 scale: constraint compliance blended with robustness and load balance.
 */
public class QualityCalculator {

    private final Config config;
    private final ScoringConstants k;

    public QualityCalculator(Config config) {
        this.config = config;
        this.k = config.getScoringConstants();
    }

    public double calculate(ScheduleView schedule, ValidationReport report) {
        if (schedule.isEmpty()) {
            return 0.0;
        }
        double base = complianceScore(report);
        double robustness = schedule.size() == 1 ? k.getSingleSubmissionScore() : robustness(schedule);
        double balance = schedule.size() == 1 ? k.getSingleSubmissionScore() : balance(schedule);
        double score = base * (1 - k.getRobustnessWeight() - k.getBalanceWeight())
                + robustness * k.getRobustnessWeight()
                + balance * k.getBalanceWeight();
        return clamp(score);
    }

    public double complianceScore(ValidationReport report) {
        double deadline = report.get(ConstraintFamily.DEADLINE).getComplianceRate();
        double dependency = report.get(ConstraintFamily.DEPENDENCY).getComplianceRate();
        double resource = report.get(ConstraintFamily.RESOURCE).isValid() ? 100.0 : k.getResourceFallbackScore();
        return deadline * k.getDeadlineComplianceWeight()
                + dependency * k.getDependencySatisfactionWeight()
                + resource * k.getResourceComplianceWeight();
    }

    /**
     * Mean days of buffer, scaled and capped at 100. The buffer is the time left before the deadline,
     * or for submissions without one, the gap to the next interval.
     */
    public double robustness(ScheduleView schedule) {
        List<Map.Entry<String, Interval>> byStart = new ArrayList<>(schedule.getIntervals().entrySet());
        byStart.sort(Comparator.comparing((Map.Entry<String, Interval> e) -> e.getValue().getStartDate())
                .thenComparing(Map.Entry::getKey));

        double sum = 0;
        for (int i = 0; i < byStart.size(); i++) {
            Interval iv = byStart.get(i).getValue();
            Optional<LocalDate> dl = config.getSubmission(byStart.get(i).getKey()).flatMap(config::deadlineOf);
            long buffer;
            if (dl.isPresent()) {
                buffer = ChronoUnit.DAYS.between(iv.getEndDate(), dl.get());
            } else if (i + 1 < byStart.size()) {
                buffer = ChronoUnit.DAYS.between(iv.getEndDate(), byStart.get(i + 1).getValue().getStartDate());
            } else {
                buffer = 0;
            }
            sum += Math.max(0, buffer);
        }
        double mean = sum / byStart.size();
        return Math.min(100.0, mean * k.getRobustnessScale());
    }

    // Lower relative variance of the daily load is better
    public double balance(ScheduleView schedule) {
        LoadProfile profile = ResourceValidator.sweep(schedule.getIntervals());
        double mean = profile.getAverageLoad();
        if (mean == 0) {
            return 0.0;
        }
        return clamp(100.0 - profile.getLoadVariance() / mean * k.getBalanceVarianceFactor());
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
