package planner.model;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to placements, shared by the finished {@link Schedule} and the working copy a strategy grows.
 */
public interface ScheduleView {

    Map<String, Interval> getIntervals();

    default Optional<Interval> getInterval(String submissionId) {
        return Optional.ofNullable(getIntervals().get(submissionId));
    }

    default boolean contains(String submissionId) {
        return getIntervals().containsKey(submissionId);
    }

    default int size() {
        return getIntervals().size();
    }

    default boolean isEmpty() {
        return getIntervals().isEmpty();
    }
}
