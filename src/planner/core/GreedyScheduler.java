package planner.core;

/**
 * Places each submission, in priority order, on the first day the oracle accepts.
 * Deterministic: the same config always yields the same schedule.
 */
public class GreedyScheduler extends AbstractScheduler {
}
