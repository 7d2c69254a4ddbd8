package planner.config;

import planner.model.Conference;
import planner.model.Config;
import planner.model.Submission;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a configuration once, before any scheduler runs.
 * Everything downstream assumes these checks passed.
 */
public final class ConfigValidator {

    private ConfigValidator() {
    }

    public static List<String> validate(Config config) {
        List<String> errors = new ArrayList<>();
        checkIds(config, errors);
        checkReferences(config, errors);
        checkNumbers(config, errors);
        findCycle(config).ifPresent(cycle ->
                errors.add("Circular dependency: " + String.join(" -> ", cycle)));
        return errors;
    }

    private static void checkIds(Config config, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (Submission s : config.getSubmissions()) {
            if (!seen.add(s.getId())) {
                errors.add("Duplicate submission id: " + s.getId());
            }
        }
        seen.clear();
        for (Conference c : config.getConferences()) {
            if (!seen.add(c.getId())) {
                errors.add("Duplicate conference id: " + c.getId());
            }
        }
    }

    private static void checkReferences(Config config, List<String> errors) {
        for (Submission s : config.getSubmissions()) {
            s.getConferenceId().ifPresent(cid -> {
                if (config.getConference(cid).isEmpty()) {
                    errors.add("Submission " + s.getId() + " references unknown conference " + cid);
                }
            });
            for (String cid : s.getCandidateConferences()) {
                if (config.getConference(cid).isEmpty()) {
                    errors.add("Submission " + s.getId() + " lists unknown candidate conference " + cid);
                }
            }
            for (String dep : s.getDependsOn()) {
                if (config.getSubmission(dep).isEmpty()) {
                    errors.add("Submission " + s.getId() + " depends on unknown submission " + dep);
                }
            }
        }
    }

    private static void checkNumbers(Config config, List<String> errors) {
        if (config.getMaxConcurrentSubmissions() <= 0) {
            errors.add("max_concurrent_submissions must be > 0, got " + config.getMaxConcurrentSubmissions());
        }
        if (config.getMinAbstractLeadTimeDays() < 0) {
            errors.add("min_abstract_lead_time_days must be >= 0");
        }
        if (config.getMinPaperLeadTimeDays() < 0) {
            errors.add("min_paper_lead_time_days must be >= 0");
        }
        if (config.getDefaultPaperLeadTimeMonths() <= 0) {
            errors.add("default_paper_lead_time_months must be > 0");
        }
        if (config.getWorkItemDurationDays() <= 0) {
            errors.add("work_item_duration_days must be > 0");
        }
        for (Map.Entry<String, Double> e : config.getPenaltyCosts().entrySet()) {
            if (e.getValue() == null || e.getValue() < 0 || e.getValue().isNaN()) {
                errors.add("Penalty cost " + e.getKey() + " must be >= 0");
            }
        }
        for (Map.Entry<String, Double> e : config.getPriorityWeights().entrySet()) {
            if (e.getValue() == null || e.getValue() < 0 || e.getValue().isNaN()) {
                errors.add("Priority weight " + e.getKey() + " must be >= 0");
            }
        }
    }

    /**
     * Iterative three-colour DFS over depends_on edges. Unknown ids are skipped; they are reported elsewhere.
     */
    static Optional<List<String>> findCycle(Config config) {
        Map<String, Integer> colour = new HashMap<>(); // 0 white, 1 grey, 2 black
        Map<String, String> parent = new HashMap<>();

        for (Submission root : config.getSubmissions()) {
            if (colour.getOrDefault(root.getId(), 0) != 0) continue;

            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> iters = new ArrayDeque<>();
            colour.put(root.getId(), 1);
            path.push(root.getId());
            iters.push(root.getDependsOn().iterator());

            while (!path.isEmpty()) {
                Iterator<String> it = iters.peek();
                if (!it.hasNext()) {
                    colour.put(path.pop(), 2);
                    iters.pop();
                    continue;
                }
                String next = it.next();
                if (config.getSubmission(next).isEmpty()) continue;

                int c = colour.getOrDefault(next, 0);
                if (c == 1) {
                    // back edge: rebuild the loop from the grey path
                    List<String> cycle = new ArrayList<>();
                    cycle.add(next);
                    String cur = path.peek();
                    while (cur != null && !cur.equals(next)) {
                        cycle.add(cur);
                        cur = parent.get(cur);
                    }
                    cycle.add(next);
                    Collections.reverse(cycle);
                    return Optional.of(cycle);
                }
                if (c == 0) {
                    colour.put(next, 1);
                    parent.put(next, path.peek());
                    path.push(next);
                    iters.push(config.getSubmission(next).get().getDependsOn().iterator());
                }
            }
        }
        return Optional.empty();
    }
}
