package planner.core;

import org.junit.Before;
import org.junit.Test;
import planner.TestConfigs;
import planner.model.Conference;
import planner.model.ConferenceType;
import planner.model.Config;
import planner.model.Interval;
import planner.model.Schedule;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.model.SubmissionWorkflow;
import planner.validation.ScheduleConstraints;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;
import static planner.TestConfigs.paper;
import static planner.TestConfigs.paperOnly;

/**
 * Tests {@link GreedyScheduler}
 */
public final class GreedySchedulerTest {
    private GreedyScheduler scheduler;

    @Before
    public void setUp() {
        scheduler = new GreedyScheduler();
    }

    @Test
    public void oneSlotMeansBackToBack() {
        Config config = TestConfigs.twoSequentialPapers();
        Schedule s = scheduler.schedule(config);

        Interval p1 = s.getInterval("P1").get();
        Interval p2 = s.getInterval("P2").get();
        assertEquals(d("2024-06-01"), p1.getStartDate());
        assertEquals(p1.getEndDate(), p2.getStartDate());
        assertFalse(p1.getEndDate().isAfter(d("2025-06-01")));
        assertFalse(p2.getEndDate().isAfter(d("2025-08-01")));
        assertTrue(ScheduleConstraints.validateScheduleConstraints(s, config).isValid());
        assertTrue(scheduler.getUnscheduledReasons().isEmpty());
    }

    @Test
    public void sameConfigSameSchedule() {
        Config config = TestConfigs.twoSequentialPapers();
        assertEquals(scheduler.schedule(config), new GreedyScheduler().schedule(config));
    }

    @Test
    public void emptyConfigGivesEmptySchedule() {
        assertTrue(scheduler.schedule(Config.builder().build()).isEmpty());
        assertTrue(scheduler.getUnscheduledReasons().isEmpty());
    }

    @Test
    public void abstractIsPlacedBeforeItsPaper() {
        Conference miccai = Conference.builder("M", ConferenceType.MEDICAL)
                .name("M")
                .deadline(SubmissionKind.ABSTRACT, d("2025-05-01"))
                .deadline(SubmissionKind.PAPER, d("2025-06-01"))
                .submissionTypes(SubmissionWorkflow.ABSTRACT_THEN_PAPER)
                .build();
        Config config = Config.builder()
                .addConference(miccai)
                .addSubmission(Submission.builder("J1-pap-M", SubmissionKind.PAPER).conferenceId("M")
                        .draftWindowMonths(1).dependsOn("J1-abs-M").build())
                .addSubmission(Submission.builder("J1-abs-M", SubmissionKind.ABSTRACT).conferenceId("M").build())
                .build();

        Schedule s = scheduler.schedule(config);
        assertEquals(2, s.size());
        assertFalse(s.getInterval("J1-abs-M").get().getEndDate()
                .isAfter(s.getInterval("J1-pap-M").get().getStartDate()));
        assertTrue(ScheduleConstraints.validateScheduleConstraints(s, config).isValid());
    }

    @Test
    public void laterEarliestStartDoesNotHideAnEarlierDeadline() {
        Config config = Config.builder()
                .addConference(paperOnly("A", "2025-06-01"))
                .addConference(paperOnly("B", "2025-12-01"))
                .addSubmission(paper("early", "A", 3))
                .addSubmission(Submission.builder("late", SubmissionKind.PAPER).conferenceId("B")
                        .draftWindowMonths(3).earliestStartDate(d("2025-05-01")).build())
                .build();

        Schedule s = scheduler.schedule(config);
        assertEquals(2, s.size());
        assertTrue(scheduler.getUnscheduledReasons().isEmpty());
        assertEquals(d("2024-06-01"), s.getInterval("early").get().getStartDate());
        assertEquals(d("2025-05-01"), s.getInterval("late").get().getStartDate());
        assertTrue(ScheduleConstraints.validateScheduleConstraints(s, config).isValid());
    }

    @Test
    public void failuresCarryAReason() {
        Config config = Config.builder()
                .schedulingStartDate(d("2025-05-01"))
                .addConference(paperOnly("C", "2025-06-01"))
                .addConference(paperOnly("D", "2026-06-01"))
                .addSubmission(paper("tight", "C", 3))
                .addSubmission(Submission.builder("after", SubmissionKind.PAPER).conferenceId("D")
                        .draftWindowMonths(1).dependsOn("tight").build())
                .addSubmission(paper("fine", "D", 1))
                .build();

        Schedule s = scheduler.schedule(config);
        assertEquals(1, s.size());
        assertTrue(s.contains("fine"));
        assertTrue(scheduler.getUnscheduledReasons().get("tight").startsWith("Configuration Error: No start day"));
        assertEquals("Dependency Error: tight was not scheduled", scheduler.getUnscheduledReasons().get("after"));
    }

    @Test
    public void reasonsResetBetweenRuns() {
        Config broken = Config.builder()
                .schedulingStartDate(d("2025-05-01"))
                .addConference(paperOnly("C", "2025-06-01"))
                .addSubmission(paper("tight", "C", 3))
                .build();
        scheduler.schedule(broken);
        assertEquals(1, scheduler.getUnscheduledReasons().size());

        scheduler.schedule(TestConfigs.twoSequentialPapers());
        assertTrue(scheduler.getUnscheduledReasons().isEmpty());
    }
}
