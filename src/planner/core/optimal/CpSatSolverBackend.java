package planner.core.optimal;

import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.CumulativeConstraint;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.IntervalVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.util.Domain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OR-Tools CP-SAT backend. One start variable per task over its allowed days, fixed-size intervals
 * under a cumulative capacity, precedence and separation rows, and a weighted makespan plus delay objective.
 */
public class CpSatSolverBackend implements SolverBackend {

    private static final Logger LOG = LoggerFactory.getLogger(CpSatSolverBackend.class);

    private static boolean nativeLoaded;

    private static synchronized void loadNative() {
        if (!nativeLoaded) {
            Loader.loadNativeLibraries();
            nativeLoaded = true;
        }
    }

    @Override
    public SolverResult solve(ScheduleModel model, int timeLimitSeconds) {
        try {
            loadNative();
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            LOG.error("Could not load OR-Tools native libraries", e);
            return SolverResult.failed(SolverStatus.ERROR, "native libraries unavailable: " + e.getMessage());
        }

        try {
            return solveLoaded(model, timeLimitSeconds);
        } catch (RuntimeException e) {
            LOG.error("CP-SAT solve failed", e);
            return SolverResult.failed(SolverStatus.ERROR, e.getMessage());
        }
    }

    private SolverResult solveLoaded(ScheduleModel model, int timeLimitSeconds) {
        CpModel cp = new CpModel();
        Map<String, IntVar> starts = new LinkedHashMap<>();
        CumulativeConstraint capacity = cp.addCumulative(model.getCapacity());

        int maxEnd = model.getHorizon();
        for (ScheduleModel.Task t : model.getTasks().values()) {
            long[] allowed = t.allowedStarts();
            if (allowed.length == 0) {
                return SolverResult.failed(SolverStatus.INFEASIBLE, "no start day for " + t.getId());
            }
            IntVar start = cp.newIntVarFromDomain(Domain.fromValues(allowed), "start_" + t.getId());
            IntervalVar interval = cp.newFixedSizeIntervalVar(start, t.getDuration(), "interval_" + t.getId());
            capacity.addDemand(interval, 1);
            starts.put(t.getId(), start);
            maxEnd = Math.max(maxEnd, t.getUpperBound() + t.getDuration());
        }

        for (ScheduleModel.Precedence p : model.getPrecedences()) {
            cp.addGreaterOrEqual(
                    LinearExpr.weightedSum(new IntVar[]{starts.get(p.getAfter()), starts.get(p.getBefore())}, new long[]{1, -1}),
                    p.getLag());
        }

        for (ScheduleModel.Separation sep : model.getSeparations()) {
            IntVar a = starts.get(sep.getFirst());
            IntVar b = starts.get(sep.getSecond());
            BoolVar firstEarlier = cp.newBoolVar("order_" + sep.getFirst() + "_" + sep.getSecond());
            cp.addGreaterOrEqual(LinearExpr.weightedSum(new IntVar[]{b, a}, new long[]{1, -1}), sep.getMinGap())
                    .onlyEnforceIf(firstEarlier);
            cp.addGreaterOrEqual(LinearExpr.weightedSum(new IntVar[]{a, b}, new long[]{1, -1}), sep.getMinGap())
                    .onlyEnforceIf(firstEarlier.not());
        }

        IntVar makespan = cp.newIntVar(0, maxEnd, "makespan");
        LinearExprBuilder objective = LinearExpr.newBuilder();
        objective.addTerm(makespan, model.getMakespanWeight());
        for (ScheduleModel.Task t : model.getTasks().values()) {
            IntVar start = starts.get(t.getId());
            cp.addGreaterOrEqual(makespan, LinearExpr.affine(start, 1, t.getDuration()));
            // delay past the lower bound; the constant part is dropped
            objective.addTerm(start, (long) model.getPenaltyWeight() * t.getDailyDelayCost());
        }
        cp.minimize(objective);

        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(timeLimitSeconds);
        solver.getParameters().setNumSearchWorkers(1);
        LOG.debug("CP-SAT: {} tasks, {} precedences, {} separations, capacity {}", starts.size(),
                model.getPrecedences().size(), model.getSeparations().size(), model.getCapacity());

        CpSolverStatus status = solver.solve(cp);
        LOG.info("CP-SAT finished with {} in {}s", status, solver.wallTime());
        switch (status) {
            case OPTIMAL:
            case FEASIBLE:
                Map<String, Integer> out = new LinkedHashMap<>();
                for (Map.Entry<String, IntVar> e : starts.entrySet()) {
                    out.put(e.getKey(), (int) solver.value(e.getValue()));
                }
                return SolverResult.solved(status == CpSolverStatus.OPTIMAL ? SolverStatus.OPTIMAL : SolverStatus.FEASIBLE,
                        out, solver.objectiveValue());
            case INFEASIBLE:
                return SolverResult.failed(SolverStatus.INFEASIBLE, "model is infeasible");
            case MODEL_INVALID:
                return SolverResult.failed(SolverStatus.MODEL_INVALID, solver.response().getSolutionInfo());
            case UNKNOWN:
                return SolverResult.failed(SolverStatus.TIMED_OUT, "no solution within " + timeLimitSeconds + "s");
            default:
                return SolverResult.failed(SolverStatus.ERROR, "unexpected status " + status);
        }
    }
}
