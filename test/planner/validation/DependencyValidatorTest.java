package planner.validation;

import org.junit.Before;
import org.junit.Test;
import planner.constraints.Candidate;
import planner.constraints.PartialSchedule;
import planner.model.Conference;
import planner.model.ConferenceType;
import planner.model.Config;
import planner.model.Schedule;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.model.SubmissionWorkflow;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;
import static planner.TestConfigs.paperOnly;

/**
 * Tests {@link DependencyValidator}
 */
public final class DependencyValidatorTest {
    private DependencyValidator validator;

    @Before
    public void setUp() {
        validator = new DependencyValidator();
    }

    private static Conference abstractThenPaper(String id) {
        return Conference.builder(id, ConferenceType.MEDICAL)
                .name(id)
                .deadline(SubmissionKind.ABSTRACT, d("2025-05-01"))
                .deadline(SubmissionKind.PAPER, d("2025-06-01"))
                .submissionTypes(SubmissionWorkflow.ABSTRACT_THEN_PAPER)
                .build();
    }

    private static Config abstractAndPaper(boolean declared) {
        Submission.Builder p = Submission.builder("P", SubmissionKind.PAPER).conferenceId("M").draftWindowMonths(1);
        if (declared) {
            p.dependsOn("A");
        }
        return Config.builder()
                .addConference(abstractThenPaper("M"))
                .addSubmission(Submission.builder("A", SubmissionKind.ABSTRACT).conferenceId("M").build())
                .addSubmission(p.build())
                .build();
    }

    private static Schedule at(Config config, String aStart, String pStart) {
        Map<String, LocalDate> starts = new LinkedHashMap<>();
        starts.put("A", d(aStart));
        starts.put("P", d(pStart));
        return Schedule.fromStartDates(starts, config);
    }

    private static List<ViolationType> types(ValidationResult r) {
        return r.getViolations().stream().map(Violation::getType).collect(Collectors.toList());
    }

    @Test
    public void abstractFinishedAndDeclaredIsClean() {
        Config config = abstractAndPaper(true);
        // abstract runs 14 days: [01-01, 01-15)
        ValidationResult r = validator.validate(at(config, "2025-01-01", "2025-01-15"), config);
        assertTrue(r.isValid());
        assertEquals(2, r.getTotal());
        assertEquals(100.0, r.getComplianceRate(), 1e-9);
    }

    @Test
    public void abstractStillRunningWhenPaperStarts() {
        Config config = abstractAndPaper(true);
        ValidationResult r = validator.validate(at(config, "2025-01-01", "2025-01-10"), config);
        assertEquals(List.of(ViolationType.DEPENDENCY_TIMING, ViolationType.ABSTRACT_TIMING), types(r));
        assertEquals(5, r.getViolations().get(0).getMagnitude());
        assertEquals(5, r.getViolations().get(1).getMagnitude());
        assertEquals(0, r.getCompliant());
    }

    @Test
    public void abstractBeforePaperButNotDeclared() {
        Config config = abstractAndPaper(false);
        ValidationResult r = validator.validate(at(config, "2025-01-01", "2025-02-01"), config);
        assertEquals(List.of(ViolationType.ABSTRACT_NOT_DECLARED), types(r));
        assertFalse(r.isValid());
        assertEquals("A", r.getViolations().get(0).getRelatedId().get());
    }

    @Test
    public void unscheduledAbstractIsMissing() {
        Config config = abstractAndPaper(true);
        Schedule s = Schedule.fromStartDates(Map.of("P", d("2025-02-01")), config);
        assertEquals(List.of(ViolationType.MISSING_DEPENDENCY, ViolationType.ABSTRACT_MISSING),
                types(validator.validate(s, config)));
    }

    @Test
    public void leadTimeFromParentsAllowsOverlap() {
        Config config = Config.builder()
                .addConference(paperOnly("C", "2025-09-01"))
                .addSubmission(Submission.builder("w", SubmissionKind.ABSTRACT).build())
                .addSubmission(Submission.builder("q", SubmissionKind.PAPER).conferenceId("C")
                        .dependsOn("w").leadTimeFromParents(5).build())
                .build();
        Map<String, LocalDate> starts = new LinkedHashMap<>();
        starts.put("w", d("2025-01-01"));
        starts.put("q", d("2025-01-10"));
        assertTrue(validator.validate(Schedule.fromStartDates(starts, config), config).isValid());

        starts.put("q", d("2025-01-09"));
        ValidationResult late = validator.validate(Schedule.fromStartDates(starts, config), config);
        assertEquals(1, late.getViolations().size());
        assertEquals(1, late.getViolations().get(0).getMagnitude());
    }

    @Test
    public void siblingAbstractIsFoundByName() {
        Config config = Config.builder()
                .addConference(abstractThenPaper("M"))
                .addSubmission(Submission.builder("J1-abs-M", SubmissionKind.ABSTRACT).conferenceId("M").build())
                .addSubmission(Submission.builder("J2-abs-M", SubmissionKind.ABSTRACT).conferenceId("M").build())
                .addSubmission(Submission.builder("J1-pap-M", SubmissionKind.PAPER).conferenceId("M").build())
                .addSubmission(Submission.builder("X", SubmissionKind.PAPER).conferenceId("M").build())
                .build();
        assertEquals("J1-abs-M", DependencyValidator.expectedAbstractId(config.getSubmission("J1-pap-M").get(), config).get());
        // two abstracts at M and no hint: unresolved
        assertFalse(DependencyValidator.expectedAbstractId(config.getSubmission("X").get(), config).isPresent());

        Schedule s = Schedule.fromStartDates(Map.of("X", d("2025-02-01")), config);
        assertEquals(List.of(ViolationType.ABSTRACT_UNRESOLVED), types(validator.validate(s, config)));
    }

    @Test
    public void oracleRejectsPaperBeforeItsAbstractIsPlaced() {
        Config config = abstractAndPaper(true);
        PartialSchedule state = new PartialSchedule(config);
        assertFalse(validator.test(state, new Candidate("P", d("2025-02-01"))));

        state.place("A", d("2025-01-01"));
        assertFalse(validator.test(state, new Candidate("P", d("2025-01-14"))));
        assertTrue(validator.test(state, new Candidate("P", d("2025-01-15"))));
    }

    @Test
    public void validationIsIdempotent() {
        Config config = abstractAndPaper(true);
        Schedule s = at(config, "2025-01-01", "2025-01-10");
        assertEquals(validator.validate(s, config), validator.validate(s, config));
    }
}
