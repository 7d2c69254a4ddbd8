package planner.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable assignment of submissions to intervals, in placement order.
 */
public final class Schedule implements ScheduleView {

    private static final Schedule EMPTY = new Schedule(Collections.emptyMap());

    private final Map<String, Interval> intervals;

    private Schedule(Map<String, Interval> intervals) {
        this.intervals = Collections.unmodifiableMap(new LinkedHashMap<>(intervals));
    }

    public static Schedule empty() {
        return EMPTY;
    }

    /**
     * Builds a schedule from start dates, deriving every end date from the submission's duration.
     *
     * @throws IllegalArgumentException if a key is not a submission of the config
     */
    public static Schedule fromStartDates(Map<String, LocalDate> starts, Config config) {
        Map<String, Interval> out = new LinkedHashMap<>();
        for (Map.Entry<String, LocalDate> e : starts.entrySet()) {
            Submission s = config.getSubmission(e.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown submission " + e.getKey()));
            out.put(e.getKey(), Interval.of(s, e.getValue(), config));
        }
        return new Schedule(out);
    }

    /**
     * Copies already derived intervals.
     *
     * @throws IllegalArgumentException if a key is not a submission of the config, or an interval
     *                                  does not last exactly the submission's duration
     */
    public static Schedule of(Map<String, Interval> intervals, Config config) {
        for (Map.Entry<String, Interval> e : intervals.entrySet()) {
            Submission s = config.getSubmission(e.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown submission " + e.getKey()));
            long expected = s.durationDays(config);
            if (e.getValue().getDurationDays() != expected) {
                throw new IllegalArgumentException("Interval of " + e.getKey() + " lasts "
                        + e.getValue().getDurationDays() + " day(s), expected " + expected);
            }
        }
        return new Schedule(intervals);
    }

    @Override
    public Map<String, Interval> getIntervals() {
        return intervals;
    }

    public Optional<LocalDate> startDate() {
        return intervals.values().stream().map(Interval::getStartDate).min(LocalDate::compareTo);
    }

    public Optional<LocalDate> endDate() {
        return intervals.values().stream().map(Interval::getEndDate).max(LocalDate::compareTo);
    }

    // Span from first start to last end, 0 for an empty schedule
    public long calculateDurationDays() {
        if (intervals.isEmpty()) {
            return 0;
        }
        return ChronoUnit.DAYS.between(startDate().get(), endDate().get());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schedule)) return false;
        return intervals.equals(((Schedule) o).intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    @Override
    public String toString() {
        return "Schedule" + intervals;
    }
}
