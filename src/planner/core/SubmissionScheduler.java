package planner.core;

import planner.model.Config;
import planner.model.Schedule;

import java.util.Map;

/**
 * A scheduling strategy. Never throws on empty input or on failure to place;
 * submissions that could not be placed are simply absent from the result.
 */
public interface SubmissionScheduler {

    Schedule schedule(Config config);

    // submissionId -> why it was left out of the last schedule
    Map<String, String> getUnscheduledReasons();
}
