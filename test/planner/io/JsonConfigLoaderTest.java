package planner.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import planner.config.ConfigurationException;
import planner.config.PenaltyCosts;
import planner.config.SchedulingOptions;
import planner.model.Conference;
import planner.model.ConferenceRecurrence;
import planner.model.ConferenceType;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.model.SubmissionWorkflow;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;

/**
 * Tests {@link JsonConfigLoader}
 */
public final class JsonConfigLoaderTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(JsonConfigLoaderTest.class.getResource("/" + name).toURI());
    }

    private Path write(String json) throws IOException {
        File f = tmp.newFile();
        Files.write(f.toPath(), json.getBytes(StandardCharsets.UTF_8));
        return f.toPath();
    }

    @Test
    public void sampleConfigLoads() throws Exception {
        Config config = JsonConfigLoader.load(resource("sample_config.json"));

        assertEquals(0, config.getMinAbstractLeadTimeDays());
        assertEquals(30, config.getMinPaperLeadTimeDays());
        assertEquals(2, config.getMaxConcurrentSubmissions());
        assertEquals(d("2025-01-01"), config.getSchedulingWindowStart());
        assertEquals(4, config.getSubmissions().size());
        assertEquals(2, config.getConferences().size());

        assertEquals(500.0, config.getPenaltyCost(PenaltyCosts.PAPER_PENALTY_PER_DAY), 0.0);
        assertEquals(250.0, config.getPenaltyCost(PenaltyCosts.RESOURCE_VIOLATION), 0.0);
        // untouched defaults are still there
        assertEquals(1000.0, config.getPenaltyCost(PenaltyCosts.MOD_PENALTY_PER_DAY), 0.0);
        assertEquals(2.0, config.getPriorityWeight("paper", 1.0), 0.0);

        assertEquals(7L, config.getLongOption(SchedulingOptions.RANDOM_SEED, 42));
        assertEquals(3, config.getIntOption(SchedulingOptions.MAX_BACKTRACKS, 5));
        assertFalse(config.getBooleanOption(SchedulingOptions.ENABLE_BLACKOUT_PERIODS, true));
        assertEquals("critical_path", config.getStringOption(SchedulingOptions.HEURISTIC_RULE).get());
    }

    @Test
    public void conferenceFieldsAndDeadlineForms() throws Exception {
        Config config = JsonConfigLoader.load(resource("sample_config.json"));

        Conference miccai = config.getConference("MICCAI").get();
        assertEquals("Medical Image Computing", miccai.getName());
        assertEquals(ConferenceRecurrence.ANNUAL, miccai.getRecurrence());
        assertTrue(miccai.isTopTier());
        assertEquals(d("2025-09-01"), miccai.getDeadline(SubmissionKind.PAPER).get());
        assertEquals(SubmissionWorkflow.ABSTRACT_OR_PAPER, miccai.getWorkflow());

        Conference spie = config.getConference("SPIE").get();
        assertEquals(ConferenceType.ENGINEERING, spie.getConfType());
        assertEquals(d("2025-07-15"), spie.getDeadline(SubmissionKind.ABSTRACT).get());
        assertEquals(d("2025-11-01"), spie.getDeadline(SubmissionKind.PAPER).get());
        assertFalse(spie.isTopTier());
    }

    @Test
    public void submissionFields() throws Exception {
        Config config = JsonConfigLoader.load(resource("sample_config.json"));

        Submission paper = config.getSubmission("J1-pap-MICCAI").get();
        assertEquals(SubmissionKind.PAPER, paper.getKind());
        assertEquals("MICCAI", paper.getConferenceId().get());
        assertEquals(List.of("J1-abs-MICCAI"), paper.getDependsOn());
        assertEquals(2, paper.getDraftWindowMonths());
        assertEquals(800.0, paper.getPenaltyCostPerDay().getAsDouble(), 0.0);

        Submission open = config.getSubmission("J2-pap").get();
        assertTrue(open.isEngineering());
        assertFalse(open.getConferenceId().isPresent());
        assertEquals(List.of("SPIE", "MICCAI"), open.getCandidateConferences());
        assertEquals(List.of(SubmissionKind.PAPER), open.getCandidateKinds());

        assertEquals(d("2025-01-01"), config.getSubmission("mod1-wrk").get().getEarliestStartDate().get());
    }

    @Test
    public void blackoutPeriodsAreExpandedInclusively() throws Exception {
        Config config = JsonConfigLoader.load(resource("sample_config.json"));
        assertEquals(4, config.getBlackoutDates().size());
        assertTrue(config.isBlackout(d("2025-08-01")));
        assertTrue(config.isBlackout(d("2025-08-03")));
        assertFalse(config.isBlackout(d("2025-08-04")));
        assertTrue(config.isBlackout(d("2025-12-25")));
    }

    @Test
    public void dataFilesAreResolvedAgainstTheConfig() throws Exception {
        Config config = JsonConfigLoader.load(resource("split/config.json"));
        assertEquals(1, config.getMaxConcurrentSubmissions());
        assertEquals(1, config.getConferences().size());
        assertEquals(SubmissionWorkflow.PAPER_ONLY, config.getConference("ISBI").get().getWorkflow());
        assertEquals(2, config.getSubmissions().size());
        assertEquals(List.of("P1-pap"), config.getSubmission("P2-pap").get().getDependsOn());
        assertEquals(2, config.getBlackoutDates().size());
        assertTrue(config.isBlackout(d("2025-07-04")));
    }

    @Test
    public void sectionFileMayWrapTheArray() throws Exception {
        Files.write(tmp.newFile("subs.json").toPath(),
                "{\"submissions\": [{\"id\": \"a\", \"kind\": \"abstract\"}]}".getBytes(StandardCharsets.UTF_8));
        Config config = JsonConfigLoader.load(write("{\"data_files\": {\"submissions\": \"subs.json\"}}"));
        assertEquals(SubmissionKind.ABSTRACT, config.getSubmission("a").get().getKind());
    }

    @Test(expected = ConfigurationException.class)
    public void invalidDateIsAConfigurationError() throws Exception {
        JsonConfigLoader.load(resource("malformed_config.json"));
    }

    @Test(expected = ConfigurationException.class)
    public void brokenJsonIsAConfigurationError() throws Exception {
        JsonConfigLoader.load(write("{\"submissions\": ["));
    }

    @Test(expected = ConfigurationException.class)
    public void topLevelArrayIsRejected() throws Exception {
        JsonConfigLoader.load(write("[]"));
    }

    @Test(expected = ConfigurationException.class)
    public void reversedBlackoutPeriodIsRejected() throws Exception {
        JsonConfigLoader.load(write("{\"blackout_dates\": {\"custom_blackout_periods\": "
                + "[{\"start\": \"2025-08-03\", \"end\": \"2025-08-01\"}]}}"));
    }

    @Test
    public void everyModelProblemIsReported() throws Exception {
        Path p = write("{\"max_concurrent_submissions\": 0, \"submissions\": ["
                + "{\"id\": \"a\", \"kind\": \"abstract\", \"depends_on\": [\"b\"]},"
                + "{\"id\": \"b\", \"kind\": \"abstract\", \"depends_on\": [\"a\"]}]}");
        try {
            JsonConfigLoader.load(p);
            fail("expected a configuration error");
        } catch (ConfigurationException e) {
            assertTrue(e.getErrors().size() >= 2);
            assertTrue(e.getErrors().stream().anyMatch(s -> s.startsWith("Circular dependency: ")));
            assertTrue(e.getErrors().stream().anyMatch(s -> s.startsWith("max_concurrent_submissions")));
        }
    }

    @Test(expected = NoSuchFileException.class)
    public void missingFileIsAnIoError() throws Exception {
        JsonConfigLoader.load(tmp.getRoot().toPath().resolve("nope.json"));
    }
}
