package planner.core;

import planner.model.Config;
import planner.model.Submission;
import planner.validation.DeadlineValidator;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Greedy day scan with the ready set ordered by a classic dispatching rule instead of priority weights.
 */
public class HeuristicScheduler extends AbstractScheduler {

    private final HeuristicRule rule;

    public HeuristicScheduler(HeuristicRule rule) {
        this.rule = rule;
    }

    public HeuristicRule getRule() {
        return rule;
    }

    @Override
    protected String name() {
        return "HeuristicScheduler[" + rule + "]";
    }

    @Override
    protected Comparator<Submission> orderComparator(Config config) {
        Comparator<Submission> primary;
        switch (rule) {
            case EARLIEST_DEADLINE:
                primary = Comparator.comparing(s -> deadlineKey(s, config));
                break;
            case LATEST_START:
                // latest possible start first; no deadline sorts last
                primary = Comparator.comparing((Submission s) -> latestStartKey(s, config)).reversed();
                break;
            case SHORTEST_PROCESSING_TIME:
                primary = Comparator.comparingInt(s -> s.durationDays(config));
                break;
            case LONGEST_PROCESSING_TIME:
                primary = Comparator.comparingInt((Submission s) -> s.durationDays(config)).reversed();
                break;
            case CRITICAL_PATH:
                primary = Comparator.comparingInt((Submission s) -> config.getDependents(s.getId()).size()).reversed();
                break;
            default:
                throw new IllegalStateException("Unhandled rule " + rule);
        }
        return primary.thenComparing(super.orderComparator(config));
    }

    private static LocalDate latestStartKey(Submission s, Config config) {
        return config.deadlineOf(s)
                .map(dl -> dl.minusDays(DeadlineValidator.requiredLeadDays(s.getKind(), config)))
                .orElse(LocalDate.MIN);
    }
}
