package planner.validation;

import planner.config.SchedulingOptions;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A submission with an earliest start date should start within the soft-block window around it.
 */
public class SoftBlockValidator extends AbstractValidator {

    @Override
    public ConstraintFamily getFamily() {
        return ConstraintFamily.SOFT_BLOCK;
    }

    @Override
    public String getViolationMessage() {
        return "Start is outside the preferred window";
    }

    public static boolean isEnforced(Config config) {
        return config.getBooleanOption(SchedulingOptions.ENFORCE_SOFT_BLOCK_WINDOW, true);
    }

    @Override
    public ValidationResult validate(ScheduleView schedule, Config config) {
        List<Violation> violations = new ArrayList<>();
        int total = 0;
        int compliant = 0;
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            Optional<Submission> s = config.getSubmission(e.getKey());
            if (s.isEmpty() || s.get().getEarliestStartDate().isEmpty()) {
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

    @Override
    protected List<Violation> evaluate(Submission s, Interval interval, ScheduleView schedule, Config config) {
        List<Violation> out = new ArrayList<>();
        if (s.getEarliestStartDate().isEmpty()) {
            return out;
        }
        LocalDate anchor = s.getEarliestStartDate().get();
        int window = config.getSchedulingConstants().getSoftBlockWindowDays();
        long offset = Math.abs(ChronoUnit.DAYS.between(anchor, interval.getStartDate()));
        if (offset > window) {
            long beyond = offset - window;
            out.add(new Violation(s.getId(), ViolationType.SOFT_BLOCK,
                    "Starts " + offset + " day(s) from " + anchor + ", " + beyond + " beyond the window",
                    Severity.MEDIUM, beyond, null, anchor));
        }
        return out;
    }
}
