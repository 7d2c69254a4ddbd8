package planner.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Active span of a submission, [start, end).
 */
public class Interval {
    private final LocalDate startDate;
    private final LocalDate endDate;

    public Interval(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null)
            throw new IllegalArgumentException("null date");
        if (endDate.isBefore(startDate))
            throw new IllegalArgumentException("end must not be before start: " + startDate + " > " + endDate);
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * Interval of a submission starting on the given day, end derived from its duration.
     */
    public static Interval of(Submission submission, LocalDate start, Config config) {
        return new Interval(start, start.plusDays(submission.durationDays(config)));
    }

    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }

    public long getDurationDays() {
        return ChronoUnit.DAYS.between(startDate, endDate);
    }

    public boolean covers(LocalDate day) {
        return !day.isBefore(startDate) && day.isBefore(endDate);
    }

    public boolean overlaps(Interval other) {
        return startDate.isBefore(other.endDate) && other.startDate.isBefore(endDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;
        Interval that = (Interval) o;
        return startDate.equals(that.startDate) && endDate.equals(that.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, endDate);
    }

    @Override
    public String toString() {
        return "[" + startDate + ", " + endDate + ")";
    }
}
