package planner.core.optimal;

import planner.config.SchedulingOptions;
import planner.constraints.Candidate;
import planner.constraints.ConstraintSet;
import planner.constraints.PartialSchedule;
import planner.core.AbstractScheduler;
import planner.model.Config;
import planner.model.Submission;
import planner.validation.VenueValidator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Exact strategy. Builds a {@link ScheduleModel}, hands it to a {@link SolverBackend} and decodes the starts.
 * Anything short of an optimal or feasible answer yields an empty schedule; the reason is kept in
 * {@link #getLastStatus()}.
 */
public class OptimalScheduler extends AbstractScheduler {

    private final SolverBackend backend;
    private SolverStatus lastStatus;

    public OptimalScheduler() {
        this(new CpSatSolverBackend());
    }

    public OptimalScheduler(SolverBackend backend) {
        this.backend = backend;
    }

    public SolverStatus getLastStatus() {
        return lastStatus;
    }

    @Override
    protected PartialSchedule run(Config config, ConstraintSet constraints) {
        PartialSchedule state = new PartialSchedule(config);
        List<Submission> modelled = modelledSubmissions(config, state);

        ScheduleModel model = ScheduleModel.build(config, modelled);
        Optional<String> stuck = model.findEmptyDomain();
        SolverResult result;
        if (stuck.isPresent()) {
            result = SolverResult.failed(SolverStatus.INFEASIBLE, "no start day for " + stuck.get());
        } else {
            int limit = config.getIntOption(SchedulingOptions.SOLVER_TIME_LIMIT_SECONDS,
                    config.getSchedulingConstants().getSolverTimeLimitSeconds());
            result = backend.solve(model, limit);
        }
        lastStatus = result.getStatus();

        if (!result.getStatus().hasSolution()) {
            log.warn("{}: solver returned {}", name(), result);
            for (Submission s : modelled) {
                logError(s.getId(), "Solver Error: " + result);
            }
            return state;
        }

        for (Map.Entry<String, Integer> e : result.getStarts().entrySet()) {
            state.place(e.getKey(), model.toDate(e.getValue()));
        }
        log.info("{}: {} solution, objective {}", name(), result.getStatus(), result.getObjective());
        return state;
    }

    /**
     * Submissions the conference can take, minus every submission that depends on one it cannot.
     */
    private List<Submission> modelledSubmissions(Config config, PartialSchedule empty) {
        VenueValidator venue = new VenueValidator();
        Set<String> excluded = new LinkedHashSet<>();
        for (Submission s : config.getSubmissions()) {
            if (!venue.test(empty, new Candidate(s.getId(), config.getSchedulingWindowStart()))) {
                excluded.add(s.getId());
                logError(s.getId(), "Constraint Error: " + venue.getViolationMessage());
            }
        }
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Submission s : config.getSubmissions()) {
                if (excluded.contains(s.getId())) continue;
                for (String dep : s.getDependsOn()) {
                    if (excluded.contains(dep)) {
                        excluded.add(s.getId());
                        logError(s.getId(), "Dependency Error: " + dep + " was not scheduled");
                        grew = true;
                        break;
                    }
                }
            }
        }
        List<Submission> out = new ArrayList<>();
        for (Submission s : config.getSubmissions()) {
            if (!excluded.contains(s.getId())) out.add(s);
        }
        return out;
    }
}
