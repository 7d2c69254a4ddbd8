package planner.validation;

import planner.config.SchedulingConstants;
import planner.config.SchedulingOptions;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deadlines, lead times before the deadline, lower bounds on the start date and blackout days.
 */
public class DeadlineValidator extends AbstractValidator {

    @Override
    public ConstraintFamily getFamily() {
        return ConstraintFamily.DEADLINE;
    }

    @Override
    public String getViolationMessage() {
        return "Deadline, lead time, start bound or blackout violated";
    }

    @Override
    public ValidationResult validate(ScheduleView schedule, Config config) {
        List<Violation> violations = new ArrayList<>();
        int total = 0;
        int compliant = 0;
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            Optional<Submission> s = config.getSubmission(e.getKey());
            if (s.isEmpty() || !isApplicable(s.get(), config)) {
                continue;
            }
            total++;
            List<Violation> found = evaluate(s.get(), e.getValue(), schedule, config);
            if (found.isEmpty()) {
                compliant++;
            }
            violations.addAll(found);
        }
        return new ValidationResult(getFamily(), violations, total, compliant);
    }

    // No conference deadline, no lower bound and no blackout rule: not applicable
    boolean isApplicable(Submission s, Config config) {
        return config.deadlineOf(s).isPresent()
                || s.getEarliestStartDate().isPresent()
                || s.getEngineeringReadyDate().isPresent()
                || (blackoutsEnabled(config) && !config.getBlackoutDates().isEmpty());
    }

    @Override
    protected List<Violation> evaluate(Submission s, Interval interval, ScheduleView schedule, Config config) {
        List<Violation> out = new ArrayList<>();
        SchedulingConstants k = config.getSchedulingConstants();

        Optional<LocalDate> deadline = config.deadlineOf(s);
        if (deadline.isPresent()) {
            LocalDate dl = deadline.get();
            long daysLate = ChronoUnit.DAYS.between(dl, interval.getEndDate());
            if (daysLate > 0) {
                out.add(new Violation(s.getId(), ViolationType.DEADLINE_MISSED,
                        "Ends " + interval.getEndDate() + ", " + daysLate + " day(s) after deadline " + dl,
                        Severity.ofDays(daysLate, k.getHighSeverityDays(), k.getMediumSeverityDays()),
                        daysLate, s.getConferenceId().orElse(null), dl));
            } else {
                int lead = requiredLeadDays(s.getKind(), config);
                long shortfall = ChronoUnit.DAYS.between(dl.minusDays(lead), interval.getEndDate());
                if (lead > 0 && shortfall > 0) {
                    out.add(new Violation(s.getId(), ViolationType.LEAD_TIME,
                            "Needs to finish " + lead + " day(s) before " + dl + ", short by " + shortfall,
                            Severity.ofDays(shortfall, k.getHighSeverityDays(), k.getMediumSeverityDays()),
                            shortfall, s.getConferenceId().orElse(null), dl));
                }
            }
        }

        checkLowerBound(s, interval, s.getEarliestStartDate(), "earliest start date", out);
        checkLowerBound(s, interval, s.getEngineeringReadyDate(), "engineering ready date", out);

        if (blackoutsEnabled(config)) {
            // [start, end) active days that fall on a blackout date
            int hits = config.getBlackoutDates()
                    .subSet(interval.getStartDate(), true, interval.getEndDate(), false)
                    .size();
            if (hits > 0) {
                out.add(new Violation(s.getId(), ViolationType.BLACKOUT,
                        hits + " active day(s) fall on blackout dates",
                        Severity.ofDays(hits, k.getHighSeverityDays(), k.getMediumSeverityDays()),
                        hits, null, config.getBlackoutDates().ceiling(interval.getStartDate())));
            }
        }
        return out;
    }

    private void checkLowerBound(Submission s, Interval interval, Optional<LocalDate> bound, String label,
                                 List<Violation> out) {
        if (bound.isEmpty() || !interval.getStartDate().isBefore(bound.get())) {
            return;
        }
        long early = ChronoUnit.DAYS.between(interval.getStartDate(), bound.get());
        out.add(new Violation(s.getId(), ViolationType.EARLIEST_START,
                "Starts " + interval.getStartDate() + ", before its " + label + " " + bound.get(),
                Severity.MEDIUM, early, null, bound.get()));
    }

    /**
     * Days a submission of this kind must finish before its deadline.
     */
    public static int requiredLeadDays(SubmissionKind kind, Config config) {
        switch (kind) {
            case ABSTRACT:
                return config.getMinAbstractLeadTimeDays();
            case PAPER:
                return config.getMinPaperLeadTimeDays();
            default:
                return 0;
        }
    }

    public static boolean blackoutsEnabled(Config config) {
        return config.getBooleanOption(SchedulingOptions.ENABLE_BLACKOUT_PERIODS, false);
    }
}
