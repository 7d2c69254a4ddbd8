package planner.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planner.constraints.Candidate;
import planner.constraints.ConstraintSet;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Interval;
import planner.model.Schedule;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.validation.DeadlineValidator;
import planner.validation.DependencyValidator;
import planner.validation.SoftBlockValidator;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * Shared skeleton of the constructive strategies: dependency-respecting priority order,
 * a forward day scan checked by the placement oracle, and failure analysis.
 */
public abstract class AbstractScheduler implements SubmissionScheduler {

    public static final String ENGINEERING_WEIGHT_KEY = "engineering_paper";
    public static final double DEFAULT_ENGINEERING_WEIGHT = 2.0;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final Map<String, String> unscheduledReasons = new LinkedHashMap<>();

    @Override
    public Map<String, String> getUnscheduledReasons() {
        return Collections.unmodifiableMap(unscheduledReasons);
    }

    @Override
    public Schedule schedule(Config config) {
        unscheduledReasons.clear();
        if (config.getSubmissions().isEmpty()) {
            log.info("{}: no submissions to schedule", name());
            return Schedule.empty();
        }
        log.info("{} started: {} submission(s), window {} to {}", name(), config.getSubmissions().size(),
                config.getSchedulingWindowStart(), config.getSchedulingWindowEnd());

        prepare(config);
        ConstraintSet constraints = ConstraintSet.standard(config);
        PartialSchedule result = run(config, constraints);

        markUnknownFailures(config, result);
        log.info("{} finished: placed {}/{}", name(), result.size(), config.getSubmissions().size());
        return result.toSchedule();
    }

    // Per-run setup before ordering, e.g. reseeding
    protected void prepare(Config config) {
    }

    /**
     * Single pass in priority order; never revisits a placement.
     */
    protected PartialSchedule run(Config config, ConstraintSet constraints) {
        PartialSchedule state = new PartialSchedule(config);
        for (Submission s : sortSubmissions(config)) {
            if (!attemptPlace(s, state, constraints)) {
                analyzeFailure(s, state, constraints);
            }
        }
        return state;
    }

    protected String name() {
        return getClass().getSimpleName();
    }

    // --- ordering ---

    /**
     * Topological order over depends_on; among ready submissions the comparator decides.
     */
    protected List<Submission> sortSubmissions(Config config) {
        Comparator<Submission> cmp = orderComparator(config);
        Map<String, Integer> pending = new HashMap<>();
        PriorityQueue<Submission> ready = new PriorityQueue<>(cmp);
        for (Submission s : config.getSubmissions()) {
            int n = 0;
            for (String dep : s.getDependsOn()) {
                if (config.getSubmission(dep).isPresent()) n++;
            }
            pending.put(s.getId(), n);
            if (n == 0) ready.add(s);
        }

        List<Submission> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            Submission s = ready.poll();
            ordered.add(s);
            for (String child : config.getDependents(s.getId())) {
                int left = pending.merge(child, -1, Integer::sum);
                if (left == 0) {
                    ready.add(config.getSubmission(child).get());
                }
            }
        }
        return ordered;
    }

    // Highest priority first, then earliest deadline, then id
    protected Comparator<Submission> orderComparator(Config config) {
        Map<String, Double> prio = new HashMap<>();
        for (Submission s : config.getSubmissions()) {
            prio.put(s.getId(), priority(s, config));
        }
        return Comparator.comparingDouble((Submission s) -> prio.get(s.getId())).reversed()
                .thenComparing(s -> deadlineKey(s, config))
                .thenComparing(Submission::getId);
    }

    protected double priority(Submission s, Config config) {
        return basePriority(s, config);
    }

    /**
     * Weight from priority_weights by kind. An abstract that a paper waits on takes the paper weight;
     * engineering work is multiplied by the engineering_paper weight.
     */
    public static double basePriority(Submission s, Config config) {
        String key = s.getKind().getKey();
        if (s.getKind() == SubmissionKind.ABSTRACT && isRequiredByPaper(s, config)) {
            key = SubmissionKind.PAPER.getKey();
        }
        double w = config.getPriorityWeight(key, 1.0);
        if (s.isEngineering()) {
            w *= config.getPriorityWeight(ENGINEERING_WEIGHT_KEY, DEFAULT_ENGINEERING_WEIGHT);
        }
        return w;
    }

    private static boolean isRequiredByPaper(Submission s, Config config) {
        for (String child : config.getDependents(s.getId())) {
            Optional<Submission> c = config.getSubmission(child);
            if (c.isPresent() && c.get().getKind() == SubmissionKind.PAPER) {
                return true;
            }
        }
        return false;
    }

    protected static LocalDate deadlineKey(Submission s, Config config) {
        return config.deadlineOf(s).orElse(LocalDate.MAX);
    }

    // --- day range ---

    /**
     * First day worth trying: window start, the submission's own lower bounds, and the
     * end of every placed dependency minus the allowed overlap.
     */
    protected LocalDate earliestStart(Submission s, PartialSchedule state) {
        Config config = state.getConfig();
        LocalDate d = config.getSchedulingWindowStart();
        d = later(d, s.getEarliestStartDate());
        d = later(d, s.getEngineeringReadyDate());
        for (String dep : s.getDependsOn()) {
            Optional<Interval> iv = state.getInterval(dep);
            if (iv.isPresent()) {
                d = later(d, Optional.of(iv.get().getEndDate().minusDays(s.getLeadTimeFromParents())));
            }
        }
        if (DependencyValidator.requiresAbstract(s, config)) {
            Optional<Interval> abs = DependencyValidator.expectedAbstractId(s, config).flatMap(state::getInterval);
            if (abs.isPresent()) {
                d = later(d, Optional.of(abs.get().getEndDate()));
            }
        }
        return d;
    }

    /**
     * Last day worth trying: window end, the deadline less lead time and duration, and the soft-block window.
     */
    protected LocalDate latestStart(Submission s, Config config) {
        LocalDate last = config.getSchedulingWindowEnd().minusDays(1);
        Optional<LocalDate> dl = config.deadlineOf(s);
        if (dl.isPresent()) {
            int lead = DeadlineValidator.requiredLeadDays(s.getKind(), config);
            last = earlier(last, dl.get().minusDays(lead).minusDays(s.durationDays(config)));
        }
        if (SoftBlockValidator.isEnforced(config) && s.getEarliestStartDate().isPresent()) {
            int window = config.getSchedulingConstants().getSoftBlockWindowDays();
            last = earlier(last, s.getEarliestStartDate().get().plusDays(window));
        }
        return last;
    }

    protected List<LocalDate> candidateDays(Submission s, PartialSchedule state) {
        List<LocalDate> days = new ArrayList<>();
        LocalDate last = latestStart(s, state.getConfig());
        for (LocalDate d = earliestStart(s, state); !d.isAfter(last); d = d.plusDays(1)) {
            days.add(d);
        }
        return days;
    }

    // --- placement ---

    protected boolean attemptPlace(Submission s, PartialSchedule state, ConstraintSet constraints) {
        for (LocalDate day : candidateDays(s, state)) {
            if (constraints.ok(state, new Candidate(s.getId(), day))) {
                state.place(s.getId(), day);
                return true;
            }
        }
        return false;
    }

    /**
     * Records the most frequent rejection reason over the candidate days.
     */
    protected void analyzeFailure(Submission s, PartialSchedule state, ConstraintSet constraints) {
        for (String dep : s.getDependsOn()) {
            if (!state.contains(dep)) {
                logError(s.getId(), "Dependency Error: " + dep + " was not scheduled");
                return;
            }
        }

        List<LocalDate> days = candidateDays(s, state);
        if (days.isEmpty()) {
            LocalDate earliest = earliestStart(s, state);
            List<String> why = constraints.explain(state, new Candidate(s.getId(), earliest));
            logError(s.getId(), "Configuration Error: No start day between " + earliest + " and "
                    + latestStart(s, state.getConfig()) + (why.isEmpty() ? "" : " (" + String.join(", ", why) + ")"));
            return;
        }

        Map<String, Integer> reasons = new TreeMap<>();
        for (LocalDate day : days) {
            constraints.explain(state, new Candidate(s.getId(), day))
                    .forEach(r -> reasons.merge(r, 1, Integer::sum));
        }
        String msg = reasons.isEmpty() ? "Constraint Error: no legal day"
                : "Constraint Error: " + reasons.entrySet().stream()
                .max(Map.Entry.comparingByValue()).get().getKey();
        logError(s.getId(), msg);
    }

    protected void markUnknownFailures(Config config, PartialSchedule schedule) {
        for (Submission s : config.getSubmissions()) {
            if (!schedule.contains(s.getId()) && !unscheduledReasons.containsKey(s.getId())) {
                unscheduledReasons.put(s.getId(), "Skipped (Unknown Reason)");
            }
        }
        // placed after an earlier failure, e.g. by a backtracking retry
        unscheduledReasons.keySet().removeIf(schedule::contains);
    }

    protected void logError(String submissionId, String msg) {
        unscheduledReasons.put(submissionId, msg);
        log.debug("{}: {} not placed: {}", name(), submissionId, msg);
    }

    protected static LocalDate later(LocalDate d, Optional<LocalDate> other) {
        return other.isPresent() && other.get().isAfter(d) ? other.get() : d;
    }

    protected static LocalDate earlier(LocalDate a, LocalDate b) {
        return b.isBefore(a) ? b : a;
    }
}
