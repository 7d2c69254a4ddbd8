package planner.constraints;

public interface Constraint {
    // Can the candidate start on its day, given what is already placed?
    boolean test(PartialSchedule state, Candidate candidate);

    // Message reported when the rule rejects a candidate
    String getViolationMessage();
}
