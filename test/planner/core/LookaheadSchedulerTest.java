package planner.core;

import org.junit.Before;
import org.junit.Test;
import planner.TestConfigs;
import planner.constraints.PartialSchedule;
import planner.model.Config;
import planner.model.Schedule;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.validation.ScheduleConstraints;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;
import static planner.TestConfigs.paperOnly;

/**
 * Tests {@link LookaheadScheduler}
 */
public final class LookaheadSchedulerTest {
    private Config chain;

    @Before
    public void setUp() {
        // abstract a (14 days) unblocks paper p, due 2025-06-01 with 90 days of lead time
        chain = Config.builder()
                .addConference(paperOnly("C", "2025-06-01"))
                .addSubmission(Submission.builder("a", SubmissionKind.ABSTRACT).build())
                .addSubmission(Submission.builder("p", SubmissionKind.PAPER).conferenceId("C")
                        .draftWindowMonths(1).dependsOn("a").build())
                .build();
    }

    @Test
    public void placesEverythingLegally() {
        Schedule s = new LookaheadScheduler().schedule(chain);
        assertEquals(2, s.size());
        assertTrue(ScheduleConstraints.validateScheduleConstraints(s, chain).isValid());

        Config two = TestConfigs.twoSequentialPapers();
        Schedule t = new LookaheadScheduler(10).schedule(two);
        assertEquals(2, t.size());
        assertTrue(ScheduleConstraints.validateScheduleConstraints(t, two).isValid());
    }

    @Test
    public void bonusRewardsRoomForDependents() {
        LookaheadScheduler scheduler = new LookaheadScheduler();
        scheduler.prepare(chain);
        PartialSchedule state = new PartialSchedule(chain);
        Submission a = chain.getSubmission("a").get();

        // p could start 2025-03-03 at the latest
        assertEquals(1.0, scheduler.bonus(a, d("2024-06-01"), state), 1e-9);
        assertEquals(0.5, scheduler.bonus(a, d("2025-02-17"), state), 1e-9);
    }

    @Test
    public void bonusRewardsADeadlineBuffer() {
        Config two = TestConfigs.twoSequentialPapers();
        LookaheadScheduler scheduler = new LookaheadScheduler();
        scheduler.prepare(two);
        PartialSchedule state = new PartialSchedule(two);
        Submission p1 = two.getSubmission("P1").get();

        assertEquals(0.5, scheduler.bonus(p1, d("2024-06-01"), state), 1e-9);
        assertEquals(0.0, scheduler.bonus(p1, d("2025-02-10"), state), 1e-9);
    }

    @Test
    public void blockersGoFirst() {
        LookaheadScheduler scheduler = new LookaheadScheduler();
        scheduler.prepare(chain);
        assertTrue(scheduler.priority(chain.getSubmission("a").get(), chain)
                > scheduler.priority(chain.getSubmission("p").get(), chain));
    }
}
