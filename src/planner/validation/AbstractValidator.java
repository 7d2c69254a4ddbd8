package planner.validation;

import planner.constraints.Candidate;
import planner.constraints.Constraint;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;

import java.util.List;
import java.util.Optional;

/**
 * Base for validators that judge one submission at a time. The same {@link #evaluate} backs both the
 * whole-schedule pass and the placement oracle, so strategies and scorers never disagree.
 */
public abstract class AbstractValidator implements ScheduleValidator, Constraint {

    /**
     * Violations of a single submission placed on {@code interval}, against everything else in {@code schedule}.
     */
    protected abstract List<Violation> evaluate(Submission submission, Interval interval,
                                                ScheduleView schedule, Config config);

    @Override
    public boolean test(PartialSchedule state, Candidate candidate) {
        Config config = state.getConfig();
        Optional<Submission> s = config.getSubmission(candidate.submissionId);
        if (s.isEmpty()) {
            return false;
        }
        Interval interval = Interval.of(s.get(), candidate.start, config);
        for (Violation v : evaluate(s.get(), interval, state, config)) {
            if (v.getType().isBlocking()) {
                return false;
            }
        }
        return true;
    }
}
