package planner.scoring;

import planner.model.Config;
import planner.model.ScheduleView;
import planner.validation.ScheduleConstraints;
import planner.validation.ValidationReport;

/**
 * Entry points for scoring a finished schedule.
 */
public final class Scoring {

    private Scoring() {
    }

    public static PenaltyBreakdown calculatePenaltyScore(ScheduleView schedule, Config config) {
        return new PenaltyCalculator(config).calculate(schedule, validate(schedule, config));
    }

    public static double calculateQualityScore(ScheduleView schedule, Config config) {
        return new QualityCalculator(config).calculate(schedule, validate(schedule, config));
    }

    public static double calculateEfficiencyScore(ScheduleView schedule, Config config) {
        return new EfficiencyCalculator(config).calculate(schedule);
    }

    private static ValidationReport validate(ScheduleView schedule, Config config) {
        return ScheduleConstraints.validateScheduleConstraints(schedule, config);
    }
}
