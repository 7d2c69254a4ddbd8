package planner.core;

import org.junit.Test;
import planner.model.Conference;
import planner.model.ConferenceType;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.util.List;

import static org.junit.Assert.*;
import static planner.TestConfigs.d;
import static planner.TestConfigs.paperOnly;

/**
 * Tests {@link ConferenceAssigner}
 */
public final class ConferenceAssignerTest {

    private static final Conference ENG = Conference.builder("ENG", ConferenceType.ENGINEERING)
            .name("ENG")
            .deadline(SubmissionKind.PAPER, d("2025-11-01"))
            .deadline(SubmissionKind.ABSTRACT, d("2025-07-15"))
            .build();

    private static Submission.Builder floating(String id, String... candidates) {
        return Submission.builder(id, SubmissionKind.PAPER).candidateConferences(List.of(candidates));
    }

    @Test
    public void firstCompatibleCandidateWins() {
        Config config = Config.builder()
                .addConference(ENG)
                .addConference(paperOnly("MED", "2025-09-01"))
                .addSubmission(floating("eng", "ENG", "MED").engineering(true).build())
                .addSubmission(floating("med", "ENG", "MED").build())
                .build();

        Config assigned = ConferenceAssigner.assign(config);
        assertEquals("ENG", assigned.getSubmission("eng").get().getConferenceId().get());
        assertEquals("MED", assigned.getSubmission("med").get().getConferenceId().get());
        assertFalse(config.getSubmission("eng").get().getConferenceId().isPresent());
    }

    @Test
    public void candidateKindsPickTheFirstAcceptedKind() {
        Config config = Config.builder()
                .addConference(ENG)
                .addSubmission(floating("w", "ENG").engineering(true)
                        .candidateKinds(List.of(SubmissionKind.POSTER, SubmissionKind.ABSTRACT)).build())
                .build();
        Submission bound = ConferenceAssigner.assign(config).getSubmission("w").get();
        assertEquals(SubmissionKind.ABSTRACT, bound.getKind());
        assertEquals("ENG", bound.getConferenceId().get());
    }

    @Test
    public void nothingToAssignReturnsTheSameConfig() {
        Config config = Config.builder()
                .addConference(ENG)
                .addSubmission(floating("med", "ENG").build())
                .build();
        assertSame(config, ConferenceAssigner.assign(config));
        assertFalse(ConferenceAssigner.bind(config.getSubmission("med").get(), config).isPresent());
    }
}
