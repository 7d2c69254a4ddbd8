package planner.core.optimal;

public enum SolverStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    MODEL_INVALID,
    TIMED_OUT,
    ERROR;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
