package planner.core.optimal;

/**
 * Exact solver behind {@link OptimalScheduler}. Implementations report failures through
 * {@link SolverResult#getStatus()} rather than by throwing.
 */
public interface SolverBackend {

    SolverResult solve(ScheduleModel model, int timeLimitSeconds);
}
