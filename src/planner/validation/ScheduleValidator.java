package planner.validation;

import planner.model.Config;
import planner.model.ScheduleView;

/**
 * Whole-schedule check of one constraint family. Pure: never mutates its inputs.
 */
public interface ScheduleValidator {

    ConstraintFamily getFamily();

    ValidationResult validate(ScheduleView schedule, Config config);
}
