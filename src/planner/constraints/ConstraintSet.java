package planner.constraints;

import planner.config.SchedulingOptions;
import planner.model.Config;
import planner.validation.DeadlineValidator;
import planner.validation.DependencyValidator;
import planner.validation.ResourceValidator;
import planner.validation.SingleConferenceValidator;
import planner.validation.SoftBlockValidator;
import planner.validation.VenueValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * Placement oracle: a candidate is legal when every constraint accepts it.
 */
public class ConstraintSet {
    private final List<Constraint> list = new ArrayList<>();

    /**
     * The oracle every strategy shares, built from the validators run in single-submission mode.
     */
    public static ConstraintSet standard(Config config) {
        ConstraintSet set = new ConstraintSet()
                .add(new VenueValidator())
                .add(new DeadlineValidator())
                .add(new DependencyValidator())
                .add(new SingleConferenceValidator())
                .add(new ResourceValidator());
        if (SoftBlockValidator.isEnforced(config)) {
            set.add(new SoftBlockValidator());
        }
        if (config.getBooleanOption(SchedulingOptions.ENABLE_WORKING_DAYS_ONLY, false)) {
            set.add(new WorkingDayConstraint());
        }
        return set;
    }

    public ConstraintSet add(Constraint c) {
        list.add(c);
        return this;
    }

    public List<Constraint> getConstraints() {
        return List.copyOf(list);
    }

    public boolean ok(PartialSchedule s, Candidate c) {
        for (Constraint k : list) {
            if (!k.test(s, c))
                return false;
        }
        return true;
    }

    public List<String> explain(PartialSchedule s, Candidate c) {
        List<String> reasons = new ArrayList<>();
        for (Constraint k : list) {
            if (!k.test(s, c)) {
                reasons.add(k.getViolationMessage());
            }
        }
        return reasons;
    }
}
