package planner.validation;

import planner.model.Config;
import planner.model.ScheduleView;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every constraint family over a schedule. The sanctioned way for outer layers to read legality.
 */
public final class ScheduleConstraints {

    private static final List<ScheduleValidator> VALIDATORS = List.of(
            new DeadlineValidator(),
            new DependencyValidator(),
            new ResourceValidator(),
            new VenueValidator(),
            new SoftBlockValidator(),
            new SingleConferenceValidator());

    private ScheduleConstraints() {
    }

    public static ValidationReport validateScheduleConstraints(ScheduleView schedule, Config config) {
        Map<ConstraintFamily, ValidationResult> results = new EnumMap<>(ConstraintFamily.class);
        for (ScheduleValidator v : VALIDATORS) {
            results.put(v.getFamily(), v.validate(schedule, config));
        }
        return new ValidationReport(results);
    }

    public static List<ScheduleValidator> validators() {
        return VALIDATORS;
    }
}
