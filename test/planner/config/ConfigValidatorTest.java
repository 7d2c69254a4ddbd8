package planner.config;

import org.junit.Test;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;
import static planner.TestConfigs.paper;
import static planner.TestConfigs.paperOnly;

/**
 * Tests {@link ConfigValidator}
 */
public final class ConfigValidatorTest {

    private static Submission abs(String id, String... deps) {
        return Submission.builder(id, SubmissionKind.ABSTRACT).dependsOn(deps).build();
    }

    @Test
    public void validConfigHasNoErrors() {
        Config.builder()
                .addConference(paperOnly("C", "2025-06-01"))
                .addSubmission(abs("a"))
                .addSubmission(paper("p", "C", 3))
                .build();
    }

    @Test
    public void cycleIsReportedWithItsPath() {
        try {
            Config.builder()
                    .addSubmission(abs("a", "c"))
                    .addSubmission(abs("b", "a"))
                    .addSubmission(abs("c", "b"))
                    .build();
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(1, e.getErrors().size());
            assertEquals("Circular dependency: a -> c -> b -> a", e.getErrors().get(0));
        }
    }

    @Test
    public void acyclicGraphHasNoCycle() {
        Config c = Config.builder()
                .addSubmission(abs("a"))
                .addSubmission(abs("b", "a"))
                .addSubmission(abs("c", "a", "b"))
                .build();
        assertEquals(Optional.empty(), ConfigValidator.findCycle(c));
    }

    @Test
    public void everyProblemIsReportedAtOnce() {
        try {
            Config.builder()
                    .maxConcurrentSubmissions(0)
                    .addConference(paperOnly("C", "2025-06-01"))
                    .addConference(paperOnly("C", "2025-07-01"))
                    .addSubmission(abs("a", "ghost"))
                    .addSubmission(abs("a"))
                    .addSubmission(paper("p", "NOPE", 3))
                    .penaltyCost(PenaltyCosts.RESOURCE_VIOLATION, -1)
                    .build();
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            List<String> errors = e.getErrors();
            assertTrue(errors.contains("Duplicate submission id: a"));
            assertTrue(errors.contains("Duplicate conference id: C"));
            assertTrue(errors.contains("Submission a depends on unknown submission ghost"));
            assertTrue(errors.contains("Submission p references unknown conference NOPE"));
            assertTrue(errors.contains("max_concurrent_submissions must be > 0, got 0"));
            assertTrue(errors.contains("Penalty cost " + PenaltyCosts.RESOURCE_VIOLATION + " must be >= 0"));
        }
    }
}
