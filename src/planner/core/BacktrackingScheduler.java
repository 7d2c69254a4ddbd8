package planner.core;

import planner.config.SchedulingOptions;
import planner.constraints.Candidate;
import planner.constraints.ConstraintSet;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Submission;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Greedy with undo. Every placement is pushed on a decision stack; when a submission cannot be placed,
 * the most recent decision is popped, undone, and retried from its next day. At most
 * {@code maxBacktracks} pops are made per run, after which failing submissions are skipped.
 * Returns the schedule with the most placements seen.
 */
public class BacktrackingScheduler extends AbstractScheduler {

    static final class Decision {
        final String submissionId;
        final LocalDate start;
        final int orderIndex;

        Decision(String submissionId, LocalDate start, int orderIndex) {
            this.submissionId = submissionId;
            this.start = start;
            this.orderIndex = orderIndex;
        }
    }

    private final int maxBacktracksOverride; // < 0: from config
    private int backtracksUsed;

    public BacktrackingScheduler() {
        this(-1);
    }

    public BacktrackingScheduler(int maxBacktracks) {
        this.maxBacktracksOverride = maxBacktracks;
    }

    public int getBacktracksUsed() {
        return backtracksUsed;
    }

    int maxBacktracks(Config config) {
        if (maxBacktracksOverride >= 0) {
            return maxBacktracksOverride;
        }
        return config.getIntOption(SchedulingOptions.MAX_BACKTRACKS, config.getSchedulingConstants().getMaxBacktracks());
    }

    @Override
    protected PartialSchedule run(Config config, ConstraintSet constraints) {
        List<Submission> order = sortSubmissions(config);
        int limit = maxBacktracks(config);
        backtracksUsed = 0;

        PartialSchedule state = new PartialSchedule(config);
        PartialSchedule best = state.copy();
        Deque<Decision> stack = new ArrayDeque<>();
        Map<String, LocalDate> resumeFrom = new HashMap<>();

        int i = 0;
        while (i < order.size()) {
            Submission s = order.get(i);
            Optional<LocalDate> day = findDay(s, state, constraints, resumeFrom.remove(s.getId()));
            if (day.isPresent()) {
                state.place(s.getId(), day.get());
                stack.push(new Decision(s.getId(), day.get(), i));
                if (state.size() > best.size()) {
                    best = state.copy();
                }
                i++;
                continue;
            }

            if (backtracksUsed < limit && !stack.isEmpty()) {
                Decision undo = stack.pop();
                backtracksUsed++;
                state.removePlacement(undo.submissionId);
                // everything after the undone decision starts over from its earliest day
                for (int j = undo.orderIndex + 1; j < order.size(); j++) {
                    resumeFrom.remove(order.get(j).getId());
                }
                resumeFrom.put(undo.submissionId, undo.start.plusDays(1));
                log.debug("Backtrack {}/{}: undo {} at {}", backtracksUsed, limit, undo.submissionId, undo.start);
                i = undo.orderIndex;
                continue;
            }

            analyzeFailure(s, state, constraints);
            i++;
        }

        log.debug("Backtracking used {} of {} pops", backtracksUsed, limit);
        return state.size() >= best.size() ? state : best;
    }

    private Optional<LocalDate> findDay(Submission s, PartialSchedule state, ConstraintSet constraints,
                                        LocalDate from) {
        for (LocalDate day : candidateDays(s, state)) {
            if (from != null && day.isBefore(from)) continue;
            if (constraints.ok(state, new Candidate(s.getId(), day))) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }
}
