package planner.core.optimal;

import planner.config.PenaltyCosts;
import planner.config.SchedulingOptions;
import planner.constraints.WorkingDayConstraint;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.validation.DeadlineValidator;
import planner.validation.DependencyValidator;
import planner.validation.SingleConferenceValidator;
import planner.validation.SoftBlockValidator;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Solver-neutral scheduling model. Days are integer offsets from {@link #getOrigin()}.
 * Keeps the model independent from any particular solver library.
 */
public class ScheduleModel {

    public static final class Task {
        private final String id;
        private final int lowerBound;
        private final int upperBound;
        private final int duration;
        private final Set<Integer> forbiddenStarts;
        private final long dailyDelayCost;

        Task(String id, int lowerBound, int upperBound, int duration, Set<Integer> forbiddenStarts, long dailyDelayCost) {
            this.id = id;
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
            this.duration = duration;
            this.forbiddenStarts = Collections.unmodifiableSet(forbiddenStarts);
            this.dailyDelayCost = dailyDelayCost;
        }

        public String getId() { return id; }
        public int getLowerBound() { return lowerBound; }
        public int getUpperBound() { return upperBound; }
        public int getDuration() { return duration; }
        public Set<Integer> getForbiddenStarts() { return forbiddenStarts; }
        // Cost per day the start is pushed past its lower bound
        public long getDailyDelayCost() { return dailyDelayCost; }

        public long[] allowedStarts() {
            List<Long> out = new ArrayList<>();
            for (int d = lowerBound; d <= upperBound; d++) {
                if (!forbiddenStarts.contains(d)) out.add((long) d);
            }
            long[] arr = new long[out.size()];
            for (int i = 0; i < arr.length; i++) arr[i] = out.get(i);
            return arr;
        }
    }

    // start(after) >= start(before) + lag
    public static final class Precedence {
        private final String before;
        private final String after;
        private final int lag;

        Precedence(String before, String after, int lag) {
            this.before = before;
            this.after = after;
            this.lag = lag;
        }

        public String getBefore() { return before; }
        public String getAfter() { return after; }
        public int getLag() { return lag; }
    }

    // |start(first) - start(second)| >= minGap
    public static final class Separation {
        private final String first;
        private final String second;
        private final int minGap;

        Separation(String first, String second, int minGap) {
            this.first = first;
            this.second = second;
            this.minGap = minGap;
        }

        public String getFirst() { return first; }
        public String getSecond() { return second; }
        public int getMinGap() { return minGap; }
    }

    private final LocalDate origin;
    private final int horizon;
    private final int capacity;
    private final Map<String, Task> tasks;
    private final List<Precedence> precedences;
    private final List<Separation> separations;
    private final int makespanWeight;
    private final int penaltyWeight;

    private ScheduleModel(LocalDate origin, int horizon, int capacity, Map<String, Task> tasks,
                          List<Precedence> precedences, List<Separation> separations,
                          int makespanWeight, int penaltyWeight) {
        this.origin = origin;
        this.horizon = horizon;
        this.capacity = capacity;
        this.tasks = Collections.unmodifiableMap(tasks);
        this.precedences = Collections.unmodifiableList(precedences);
        this.separations = Collections.unmodifiableList(separations);
        this.makespanWeight = makespanWeight;
        this.penaltyWeight = penaltyWeight;
    }

    public LocalDate getOrigin() { return origin; }
    public int getHorizon() { return horizon; }
    public int getCapacity() { return capacity; }
    public Map<String, Task> getTasks() { return tasks; }
    public List<Precedence> getPrecedences() { return precedences; }
    public List<Separation> getSeparations() { return separations; }
    public int getMakespanWeight() { return makespanWeight; }
    public int getPenaltyWeight() { return penaltyWeight; }

    /**
     * Task whose start domain is empty, if any. Such a model is infeasible without asking a solver.
     */
    public Optional<String> findEmptyDomain() {
        for (Task t : tasks.values()) {
            if (t.allowedStarts().length == 0) {
                return Optional.of(t.id);
            }
        }
        return Optional.empty();
    }

    public LocalDate toDate(long offset) {
        return origin.plusDays(offset);
    }

    /**
     * Builds the model for the given submissions, which must be closed under depends_on.
     */
    public static ScheduleModel build(Config config, Collection<Submission> submissions) {
        LocalDate origin = config.getSchedulingWindowStart();
        int horizon = (int) ChronoUnit.DAYS.between(origin, config.getSchedulingWindowEnd());
        boolean blackouts = DeadlineValidator.blackoutsEnabled(config);
        boolean workingDaysOnly = config.getBooleanOption(SchedulingOptions.ENABLE_WORKING_DAYS_ONLY, false);
        boolean softBlock = SoftBlockValidator.isEnforced(config);
        int softWindow = config.getSchedulingConstants().getSoftBlockWindowDays();

        Map<String, Task> tasks = new LinkedHashMap<>();
        for (Submission s : submissions) {
            int duration = s.durationDays(config);
            int lb = 0;
            lb = Math.max(lb, offset(origin, s.getEarliestStartDate()));
            lb = Math.max(lb, offset(origin, s.getEngineeringReadyDate()));

            int ub = horizon - 1;
            Optional<LocalDate> dl = config.deadlineOf(s);
            if (dl.isPresent()) {
                int lead = DeadlineValidator.requiredLeadDays(s.getKind(), config);
                ub = Math.min(ub, (int) ChronoUnit.DAYS.between(origin, dl.get()) - lead - duration);
            }
            if (softBlock && s.getEarliestStartDate().isPresent()) {
                ub = Math.min(ub, offset(origin, s.getEarliestStartDate()) + softWindow);
            }

            Set<Integer> forbidden = new TreeSet<>();
            for (int d = lb; d <= ub; d++) {
                LocalDate day = origin.plusDays(d);
                if (workingDaysOnly && (!WorkingDayConstraint.isWorkingDay(day) || config.isBlackout(day))) {
                    forbidden.add(d);
                } else if (blackouts && !config.getBlackoutDates()
                        .subSet(day, true, day.plusDays(duration), false).isEmpty()) {
                    forbidden.add(d);
                }
            }
            tasks.put(s.getId(), new Task(s.getId(), lb, ub, duration, forbidden, dailyCost(s, config)));
        }

        List<Precedence> precedences = new ArrayList<>();
        for (Submission s : submissions) {
            for (String dep : s.getDependsOn()) {
                Task before = tasks.get(dep);
                if (before != null) {
                    precedences.add(new Precedence(dep, s.getId(), before.duration - s.getLeadTimeFromParents()));
                }
            }
            if (DependencyValidator.requiresAbstract(s, config)) {
                Optional<String> abs = DependencyValidator.expectedAbstractId(s, config);
                if (abs.isPresent() && tasks.containsKey(abs.get())) {
                    precedences.add(new Precedence(abs.get(), s.getId(), tasks.get(abs.get()).duration));
                }
            }
        }

        List<Separation> separations = new ArrayList<>();
        List<Submission> papers = new ArrayList<>();
        for (Submission s : submissions) {
            if (s.getKind() == SubmissionKind.PAPER && s.getConferenceId().isPresent()) papers.add(s);
        }
        int cycle = config.getSchedulingConstants().getSingleConferenceCycleDays();
        for (int i = 0; i < papers.size(); i++) {
            for (int j = i + 1; j < papers.size(); j++) {
                Submission a = papers.get(i);
                Submission b = papers.get(j);
                if (a.getConferenceId().equals(b.getConferenceId())
                        && SingleConferenceValidator.workKey(a.getId()).equals(SingleConferenceValidator.workKey(b.getId()))) {
                    separations.add(new Separation(a.getId(), b.getId(), cycle));
                }
            }
        }

        return new ScheduleModel(origin, horizon, config.getMaxConcurrentSubmissions(), tasks, precedences,
                separations, config.getScoringConstants().getSolverMakespanWeight(),
                config.getScoringConstants().getSolverPenaltyWeight());
    }

    private static int offset(LocalDate origin, Optional<LocalDate> day) {
        return day.map(d -> (int) ChronoUnit.DAYS.between(origin, d)).orElse(0);
    }

    private static long dailyCost(Submission s, Config config) {
        if (s.getPenaltyCostPerDay().isPresent()) {
            return Math.round(s.getPenaltyCostPerDay().getAsDouble());
        }
        String key = s.getKind() == SubmissionKind.PAPER ? PenaltyCosts.PAPER_PENALTY_PER_DAY : PenaltyCosts.MOD_PENALTY_PER_DAY;
        return Math.round(config.getPenaltyCost(key));
    }
}
