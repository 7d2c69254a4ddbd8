package planner.constraints;

import planner.model.Config;
import planner.model.Interval;
import planner.model.Schedule;
import planner.model.ScheduleView;
import planner.model.Submission;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Working copy a strategy grows one placement at a time. Owned by a single strategy run.
 */
public class PartialSchedule implements ScheduleView {
    private final Config config;
    // submissionId -> interval, in placement order
    private final Map<String, Interval> placements = new LinkedHashMap<>();

    public PartialSchedule(Config config) {
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    @Override
    public Map<String, Interval> getIntervals() {
        return Collections.unmodifiableMap(placements);
    }

    /**
     * Places a submission; the end date is derived from its duration.
     */
    public Interval place(String submissionId, LocalDate start) {
        Submission s = config.getSubmission(submissionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown submission " + submissionId));
        if (placements.containsKey(submissionId)) {
            throw new IllegalStateException(submissionId + " is already placed");
        }
        Interval interval = Interval.of(s, start, config);
        placements.put(submissionId, interval);
        return interval;
    }

    // Undo; returns the removed interval or null
    public Interval removePlacement(String submissionId) {
        return placements.remove(submissionId);
    }

    public PartialSchedule copy() {
        PartialSchedule c = new PartialSchedule(config);
        c.placements.putAll(placements);
        return c;
    }

    public Schedule toSchedule() {
        return Schedule.of(placements, config);
    }
}
