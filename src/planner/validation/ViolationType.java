package planner.validation;

/**
 * Every kind of violation a validator can report.
 * Blocking types make the placement oracle reject a candidate; the others only lower the score.
 */
public enum ViolationType {
    DEADLINE_MISSED(ConstraintFamily.DEADLINE, true),
    LEAD_TIME(ConstraintFamily.DEADLINE, true),
    EARLIEST_START(ConstraintFamily.DEADLINE, true),
    BLACKOUT(ConstraintFamily.DEADLINE, true),

    INVALID_DEPENDENCY(ConstraintFamily.DEPENDENCY, true),
    MISSING_DEPENDENCY(ConstraintFamily.DEPENDENCY, true),
    DEPENDENCY_TIMING(ConstraintFamily.DEPENDENCY, true),
    ABSTRACT_UNRESOLVED(ConstraintFamily.DEPENDENCY, false),
    ABSTRACT_MISSING(ConstraintFamily.DEPENDENCY, true),
    ABSTRACT_TIMING(ConstraintFamily.DEPENDENCY, true),
    ABSTRACT_NOT_DECLARED(ConstraintFamily.DEPENDENCY, false),

    RESOURCE_OVERLOAD(ConstraintFamily.RESOURCE, true),

    UNKNOWN_CONFERENCE(ConstraintFamily.VENUE, true),
    SUBMISSION_TYPE_NOT_ACCEPTED(ConstraintFamily.VENUE, true),
    CONFERENCE_TYPE_MISMATCH(ConstraintFamily.VENUE, true),

    SOFT_BLOCK(ConstraintFamily.SOFT_BLOCK, true),

    SINGLE_CONFERENCE(ConstraintFamily.SINGLE_CONFERENCE, true);

    private final ConstraintFamily family;
    private final boolean blocking;

    ViolationType(ConstraintFamily family, boolean blocking) {
        this.family = family;
        this.blocking = blocking;
    }

    public ConstraintFamily getFamily() {
        return family;
    }

    public boolean isBlocking() {
        return blocking;
    }
}
