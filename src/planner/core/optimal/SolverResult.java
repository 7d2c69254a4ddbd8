package planner.core.optimal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one solver call. Start offsets are present only when {@link SolverStatus#hasSolution()}.
 */
public final class SolverResult {

    private final SolverStatus status;
    private final Map<String, Integer> starts;
    private final double objective;
    private final String message;

    private SolverResult(SolverStatus status, Map<String, Integer> starts, double objective, String message) {
        this.status = status;
        this.starts = Collections.unmodifiableMap(new LinkedHashMap<>(starts));
        this.objective = objective;
        this.message = message;
    }

    public static SolverResult solved(SolverStatus status, Map<String, Integer> starts, double objective) {
        if (!status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " carries no solution");
        }
        return new SolverResult(status, starts, objective, "");
    }

    public static SolverResult failed(SolverStatus status, String message) {
        if (status.hasSolution()) {
            throw new IllegalArgumentException("Status " + status + " requires a solution");
        }
        return new SolverResult(status, Collections.emptyMap(), Double.NaN, message == null ? "" : message);
    }

    public SolverStatus getStatus() { return status; }
    public Map<String, Integer> getStarts() { return starts; }
    public double getObjective() { return objective; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return status + (message.isEmpty() ? "" : ": " + message);
    }
}
