package planner.validation;

import planner.constraints.Candidate;
import planner.constraints.Constraint;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Daily concurrency cap. Load is computed with an event sweep over interval boundaries,
 * so the cost depends on the number of intervals, not on the length of the horizon.
 */
public class ResourceValidator implements ScheduleValidator, Constraint {

    @Override
    public ConstraintFamily getFamily() {
        return ConstraintFamily.RESOURCE;
    }

    @Override
    public String getViolationMessage() {
        return "Concurrency limit exceeded";
    }

    @Override
    public ValidationResult validate(ScheduleView schedule, Config config) {
        int limit = config.getMaxConcurrentSubmissions();
        LoadProfile profile = sweep(schedule.getIntervals());

        List<Violation> violations = new ArrayList<>();
        for (LoadProfile.Segment seg : profile.getSegments()) {
            if (seg.load <= limit) continue;
            int excess = seg.load - limit;
            String ids = String.join(", ", seg.activeIds);
            for (LocalDate day = seg.start; day.isBefore(seg.end); day = day.plusDays(1)) {
                violations.add(new Violation(ids, ViolationType.RESOURCE_OVERLOAD,
                        "Load " + seg.load + " exceeds limit " + limit + " on " + day,
                        excess > 1 ? Severity.HIGH : Severity.MEDIUM, excess, null, day));
            }
        }
        int activeDays = profile.getActiveDays();
        int compliantDays = activeDays - violations.size();
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("max_concurrent", profile.getPeakLoad());
        meta.put("active_days", activeDays);
        meta.put("limit", limit);
        return new ValidationResult(getFamily(), violations, activeDays, compliantDays, meta);
    }

    /**
     * Rejects a candidate if any day of its interval would go over the limit.
     */
    @Override
    public boolean test(PartialSchedule state, Candidate candidate) {
        Config config = state.getConfig();
        Optional<Submission> s = config.getSubmission(candidate.submissionId);
        if (s.isEmpty()) {
            return false;
        }
        Interval mine = Interval.of(s.get(), candidate.start, config);
        Map<String, Interval> overlapping = new LinkedHashMap<>();
        for (Map.Entry<String, Interval> e : state.getIntervals().entrySet()) {
            if (e.getValue().overlaps(mine)) {
                overlapping.put(e.getKey(), e.getValue());
            }
        }
        if (overlapping.size() < config.getMaxConcurrentSubmissions()) {
            return true;
        }
        overlapping.put(candidate.submissionId, mine);
        return sweep(overlapping).getPeakLoad() <= config.getMaxConcurrentSubmissions();
    }

    /**
     * +1 at every start, -1 at every end, processed in date order.
     */
    public static LoadProfile sweep(Map<String, Interval> intervals) {
        TreeMap<LocalDate, List<String>> starts = new TreeMap<>();
        TreeMap<LocalDate, List<String>> ends = new TreeMap<>();
        for (Map.Entry<String, Interval> e : intervals.entrySet()) {
            Interval iv = e.getValue();
            if (!iv.getEndDate().isAfter(iv.getStartDate())) continue;
            starts.computeIfAbsent(iv.getStartDate(), k -> new ArrayList<>()).add(e.getKey());
            ends.computeIfAbsent(iv.getEndDate(), k -> new ArrayList<>()).add(e.getKey());
        }
        TreeSet<LocalDate> events = new TreeSet<>(starts.keySet());
        events.addAll(ends.keySet());

        List<LoadProfile.Segment> segments = new ArrayList<>();
        TreeSet<String> active = new TreeSet<>();
        LocalDate prev = null;
        for (LocalDate day : events) {
            if (prev != null && !active.isEmpty()) {
                segments.add(new LoadProfile.Segment(prev, day, active.size(), new ArrayList<>(active)));
            }
            // half-open: ends leave before starts join
            ends.getOrDefault(day, List.of()).forEach(active::remove);
            active.addAll(starts.getOrDefault(day, List.of()));
            prev = day;
        }
        return new LoadProfile(segments);
    }
}
