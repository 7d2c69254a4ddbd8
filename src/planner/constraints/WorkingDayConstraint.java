package planner.constraints;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Start days must be weekdays that are not blackout dates. Added to the oracle when
 * enable_working_days_only is set.
 */
public class WorkingDayConstraint implements Constraint {

    @Override
    public boolean test(PartialSchedule state, Candidate candidate) {
        return isWorkingDay(candidate.start) && !state.getConfig().isBlackout(candidate.start);
    }

    @Override
    public String getViolationMessage() {
        return "Start day is a weekend or blackout date";
    }

    public static boolean isWorkingDay(LocalDate day) {
        DayOfWeek d = day.getDayOfWeek();
        return d != DayOfWeek.SATURDAY && d != DayOfWeek.SUNDAY;
    }
}
