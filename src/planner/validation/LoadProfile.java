package planner.validation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily load as runs of days with a constant set of active submissions.
 */
public class LoadProfile {

    public static final class Segment {
        public final LocalDate start;
        public final LocalDate end; // exclusive
        public final int load;
        public final List<String> activeIds;

        Segment(LocalDate start, LocalDate end, int load, List<String> activeIds) {
            this.start = start;
            this.end = end;
            this.load = load;
            this.activeIds = Collections.unmodifiableList(activeIds);
        }

        public long days() {
            return ChronoUnit.DAYS.between(start, end);
        }
    }

    private final List<Segment> segments;

    LoadProfile(List<Segment> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public int getPeakLoad() {
        return segments.stream().mapToInt(s -> s.load).max().orElse(0);
    }

    // Days with at least one active submission
    public int getActiveDays() {
        return (int) segments.stream().mapToLong(Segment::days).sum();
    }

    public long getTotalLoadDays() {
        return segments.stream().mapToLong(s -> s.load * s.days()).sum();
    }

    public double getAverageLoad() {
        int days = getActiveDays();
        return days == 0 ? 0.0 : (double) getTotalLoadDays() / days;
    }

    public double getLoadVariance() {
        int days = getActiveDays();
        if (days == 0) {
            return 0.0;
        }
        double mean = getAverageLoad();
        double sum = 0;
        for (Segment s : segments) {
            double d = s.load - mean;
            sum += d * d * s.days();
        }
        return sum / days;
    }

    public int loadOn(LocalDate day) {
        for (Segment s : segments) {
            if (!day.isBefore(s.start) && day.isBefore(s.end)) {
                return s.load;
            }
        }
        return 0;
    }

    // Per-day expansion, for reports
    public Map<LocalDate, Integer> toDailyLoad() {
        Map<LocalDate, Integer> out = new LinkedHashMap<>();
        for (Segment s : segments) {
            for (LocalDate d = s.start; d.isBefore(s.end); d = d.plusDays(1)) {
                out.put(d, s.load);
            }
        }
        return out;
    }
}
