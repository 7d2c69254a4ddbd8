package planner.validation;

public enum ConstraintFamily {
    DEADLINE,
    DEPENDENCY,
    RESOURCE,
    VENUE,
    SOFT_BLOCK,
    SINGLE_CONFERENCE
}
