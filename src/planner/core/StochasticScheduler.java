package planner.core;

import planner.config.SchedulingConstants;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Submission;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Greedy with seeded noise: priorities get a uniform jitter and the first few candidate days
 * are tried in shuffled order. The same seed reproduces the same schedule.
 */
public class StochasticScheduler extends AbstractScheduler {

    private final long seed;
    private Random random;
    private double randomnessFactor;
    private int jitterDays;

    public StochasticScheduler() {
        this(SchedulingConstants.RANDOM_SEED);
    }

    public StochasticScheduler(long seed) {
        this.seed = seed;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    protected void prepare(Config config) {
        this.random = new Random(seed);
        this.randomnessFactor = config.getSchedulingConstants().getRandomnessFactor();
        this.jitterDays = config.getSchedulingConstants().getStochasticJitterDays();
    }

    @Override
    protected double priority(Submission s, Config config) {
        double noise = (random.nextDouble() * 2 - 1) * randomnessFactor;
        return basePriority(s, config) + noise;
    }

    @Override
    protected List<LocalDate> candidateDays(Submission s, PartialSchedule state) {
        List<LocalDate> days = super.candidateDays(s, state);
        int n = Math.min(jitterDays, days.size());
        if (n > 1) {
            Collections.shuffle(days.subList(0, n), random);
        }
        return days;
    }
}
