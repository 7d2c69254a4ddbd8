package planner.core.optimal;

import org.junit.Test;
import planner.TestConfigs;
import planner.config.SchedulingOptions;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.util.List;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;
import static planner.TestConfigs.paper;
import static planner.TestConfigs.paperOnly;

/**
 * Tests {@link ScheduleModel}
 */
public final class ScheduleModelTest {

    @Test
    public void boundsComeFromWindowDeadlineAndLeadTime() {
        Config config = TestConfigs.twoSequentialPapers();
        ScheduleModel model = ScheduleModel.build(config, config.getSubmissions());

        assertEquals(d("2024-06-01"), model.getOrigin());
        // window ends 90 days after the last deadline, 2025-10-30
        assertEquals(516, model.getHorizon());
        assertEquals(1, model.getCapacity());

        ScheduleModel.Task p1 = model.getTasks().get("P1");
        assertEquals(0, p1.getLowerBound());
        assertEquals(365 - 90 - 90, p1.getUpperBound());
        assertEquals(90, p1.getDuration());
        assertEquals(2000, p1.getDailyDelayCost());
        assertEquals(186, p1.allowedStarts().length);
        assertFalse(model.findEmptyDomain().isPresent());
        assertEquals(d("2024-08-30"), model.toDate(90));
    }

    @Test
    public void dependenciesBecomePrecedences() {
        Config config = Config.builder()
                .addConference(paperOnly("C", "2025-06-01"))
                .addSubmission(Submission.builder("a", SubmissionKind.ABSTRACT).build())
                .addSubmission(Submission.builder("p", SubmissionKind.PAPER).conferenceId("C")
                        .dependsOn("a").leadTimeFromParents(4).penaltyCostPerDay(12.4).build())
                .build();
        ScheduleModel model = ScheduleModel.build(config, config.getSubmissions());

        assertEquals(1, model.getPrecedences().size());
        ScheduleModel.Precedence p = model.getPrecedences().get(0);
        assertEquals("a", p.getBefore());
        assertEquals("p", p.getAfter());
        assertEquals(14 - 4, p.getLag());
        assertEquals(12, model.getTasks().get("p").getDailyDelayCost());
        assertEquals(1000, model.getTasks().get("a").getDailyDelayCost());
    }

    @Test
    public void samePaperAtOneConferenceIsSeparated() {
        Config config = Config.builder()
                .addConference(paperOnly("M", "2026-06-01"))
                .addSubmission(paper("J1-pap-M", "M", 1))
                .addSubmission(paper("J1-pap", "M", 1))
                .addSubmission(paper("J2-pap-M", "M", 1))
                .build();
        List<ScheduleModel.Separation> seps = ScheduleModel.build(config, config.getSubmissions()).getSeparations();
        assertEquals(1, seps.size());
        assertEquals(365, seps.get(0).getMinGap());
    }

    @Test
    public void weekendsAreForbiddenStartsWhenWorkingDaysOnly() {
        Config config = TestConfigs.twoSequentialPapers().toBuilder()
                .option(SchedulingOptions.ENABLE_WORKING_DAYS_ONLY, true)
                .build();
        ScheduleModel.Task p1 = ScheduleModel.build(config, config.getSubmissions()).getTasks().get("P1");
        // 2024-06-01 and 06-02 are a weekend
        assertTrue(p1.getForbiddenStarts().contains(0));
        assertTrue(p1.getForbiddenStarts().contains(1));
        assertFalse(p1.getForbiddenStarts().contains(2));
        assertEquals(2, p1.allowedStarts()[0]);
    }

    @Test
    public void deadlineBeforeWindowLeavesAnEmptyDomain() {
        Config config = Config.builder()
                .schedulingStartDate(d("2025-05-01"))
                .addConference(paperOnly("C", "2025-06-01"))
                .addSubmission(paper("tight", "C", 3))
                .build();
        assertEquals("tight", ScheduleModel.build(config, config.getSubmissions()).findEmptyDomain().get());
    }
}
