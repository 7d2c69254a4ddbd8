package planner.validation;

import org.junit.Before;
import org.junit.Test;
import planner.config.SchedulingOptions;
import planner.model.Config;
import planner.model.Schedule;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;
import static planner.TestConfigs.paper;
import static planner.TestConfigs.paperOnly;

/**
 * Tests {@link DeadlineValidator}
 */
public final class DeadlineValidatorTest {
    private DeadlineValidator validator;
    private Config.Builder base;

    @Before
    public void setUp() {
        validator = new DeadlineValidator();
        // one 30-day paper due 2025-06-01, 20 days of lead time
        base = Config.builder()
                .minPaperLeadTimeDays(20)
                .addConference(paperOnly("C", "2025-06-01"))
                .addSubmission(paper("P", "C", 1));
    }

    private ValidationResult run(Config config, String start) {
        return validator.validate(Schedule.fromStartDates(Map.of("P", d(start)), config), config);
    }

    @Test
    public void onTimeWithLeadTimeIsClean() {
        // ends 2025-05-12, exactly 20 days early
        ValidationResult r = run(base.build(), "2025-04-12");
        assertTrue(r.isValid());
        assertEquals(1, r.getTotal());
    }

    @Test
    public void leadTimeShortfallIsReportedWhenOnTime() {
        ValidationResult r = run(base.build(), "2025-04-20");
        assertEquals(1, r.getViolations().size());
        Violation v = r.getViolations().get(0);
        assertEquals(ViolationType.LEAD_TIME, v.getType());
        assertEquals(8, v.getMagnitude());
        assertEquals(Severity.HIGH, v.getSeverity());
    }

    @Test
    public void lateSubmissionReportsOnlyTheMissedDeadline() {
        // ends 2025-06-04
        ValidationResult r = run(base.build(), "2025-05-05");
        assertEquals(1, r.getViolations().size());
        Violation v = r.getViolations().get(0);
        assertEquals(ViolationType.DEADLINE_MISSED, v.getType());
        assertEquals(3, v.getMagnitude());
        assertEquals(Severity.MEDIUM, v.getSeverity());
        assertEquals(d("2025-06-01"), v.getDate().get());
    }

    @Test
    public void endingOnTheDeadlineIsNotLate() {
        Config config = base.minPaperLeadTimeDays(0).build();
        assertTrue(run(config, "2025-05-02").isValid());
        assertFalse(run(config, "2025-05-03").isValid());
    }

    @Test
    public void startBeforeEarliestStartDate() {
        Config config = Config.builder()
                .addSubmission(Submission.builder("m", SubmissionKind.ABSTRACT)
                        .earliestStartDate(d("2025-03-01")).build())
                .build();
        ValidationResult r = validator.validate(Schedule.fromStartDates(Map.of("m", d("2025-02-25")), config), config);
        assertEquals(1, r.getViolations().size());
        assertEquals(ViolationType.EARLIEST_START, r.getViolations().get(0).getType());
        assertEquals(4, r.getViolations().get(0).getMagnitude());
    }

    @Test
    public void blackoutsOnlyCountWhenEnabled() {
        List<LocalDate> blackouts = List.of(d("2025-04-15"), d("2025-04-16"), d("2025-05-20"));
        Config off = base.blackoutDates(blackouts).build();
        assertTrue(run(off, "2025-04-12").isValid());

        Config on = base.option(SchedulingOptions.ENABLE_BLACKOUT_PERIODS, true).build();
        ValidationResult r = run(on, "2025-04-12");
        assertEquals(1, r.getViolations().size());
        assertEquals(ViolationType.BLACKOUT, r.getViolations().get(0).getType());
        assertEquals(2, r.getViolations().get(0).getMagnitude());
        assertEquals(Severity.MEDIUM, r.getViolations().get(0).getSeverity());
    }

    @Test
    public void submissionWithoutAnyRuleIsNotCounted() {
        Config config = Config.builder()
                .addSubmission(Submission.builder("m", SubmissionKind.ABSTRACT).build())
                .build();
        ValidationResult r = validator.validate(Schedule.fromStartDates(Map.of("m", d("2025-01-01")), config), config);
        assertEquals(0, r.getTotal());
        assertEquals(100.0, r.getComplianceRate(), 1e-9);
    }
}
