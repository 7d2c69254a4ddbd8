package planner.core;

import planner.constraints.Candidate;
import planner.constraints.ConstraintSet;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Interval;
import planner.model.Submission;
import planner.validation.ResourceValidator;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Greedy that looks a bounded window ahead. Every legal day in the window is scored, and the best
 * score wins (earliest day on ties). The score rewards slack left for dependents not yet placed,
 * free capacity on the day they could start, and a buffer before the deadline.
 */
public class LookaheadScheduler extends AbstractScheduler {

    private final int lookaheadDays; // <= 0: use the configured window
    private int window;
    private double increment;

    public LookaheadScheduler() {
        this(0);
    }

    public LookaheadScheduler(int lookaheadDays) {
        this.lookaheadDays = lookaheadDays;
    }

    @Override
    protected void prepare(Config config) {
        this.window = Math.max(1, lookaheadDays > 0 ? lookaheadDays : config.getSchedulingConstants().getLookaheadWindowDays());
        this.increment = config.getSchedulingConstants().getLookaheadBonusIncrement();
    }

    // Submissions that block others go earlier
    @Override
    protected double priority(Submission s, Config config) {
        return basePriority(s, config) + increment * config.getDependents(s.getId()).size();
    }

    @Override
    protected boolean attemptPlace(Submission s, PartialSchedule state, ConstraintSet constraints) {
        List<LocalDate> days = candidateDays(s, state);
        if (days.isEmpty()) {
            return false;
        }
        LocalDate horizon = days.get(0).plusDays(window);
        LocalDate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (LocalDate day : days) {
            if (day.isAfter(horizon)) break;
            if (!constraints.ok(state, new Candidate(s.getId(), day))) continue;
            double score = 1.0 + bonus(s, day, state);
            if (score > bestScore) {
                bestScore = score;
                best = day;
            }
        }
        if (best == null) {
            // nothing legal inside the window; plain forward scan beyond it
            return super.attemptPlace(s, state, constraints);
        }
        state.place(s.getId(), best);
        return true;
    }

    double bonus(Submission s, LocalDate day, PartialSchedule state) {
        Config config = state.getConfig();
        Interval mine = Interval.of(s, day, config);
        double sum = 0;

        Optional<LocalDate> dl = config.deadlineOf(s);
        if (dl.isPresent() && !mine.getEndDate().isAfter(dl.get().minusDays(window))) {
            sum += increment;
        }

        for (String childId : config.getDependents(s.getId())) {
            if (state.contains(childId)) continue;
            Submission child = config.getSubmission(childId).get();
            LocalDate childStart = mine.getEndDate().minusDays(child.getLeadTimeFromParents());
            long headroom = ChronoUnit.DAYS.between(childStart, latestStart(child, config));
            sum += increment * Math.max(0, Math.min(headroom, window)) / window;
            if (hasRoomFor(child, childStart, state, s.getId(), mine)) {
                sum += increment;
            }
        }
        return sum;
    }

    // Would the dependent fit under the concurrency cap on the day it could start?
    private boolean hasRoomFor(Submission child, LocalDate childStart, PartialSchedule state,
                               String selfId, Interval self) {
        Config config = state.getConfig();
        Interval childInterval = Interval.of(child, childStart, config);
        Map<String, Interval> overlapping = new LinkedHashMap<>();
        for (Map.Entry<String, Interval> e : state.getIntervals().entrySet()) {
            if (e.getValue().overlaps(childInterval)) {
                overlapping.put(e.getKey(), e.getValue());
            }
        }
        if (self.overlaps(childInterval)) {
            overlapping.put(selfId, self);
        }
        overlapping.put(child.getId(), childInterval);
        return ResourceValidator.sweep(overlapping).getPeakLoad() <= config.getMaxConcurrentSubmissions();
    }
}
