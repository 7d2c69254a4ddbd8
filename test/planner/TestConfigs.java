package planner;

import planner.model.Conference;
import planner.model.ConferenceType;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.time.LocalDate;

/**
 * Small configurations shared by the tests.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static LocalDate d(String iso) {
        return LocalDate.parse(iso);
    }

    public static Conference paperOnly(String id, String paperDeadline) {
        return Conference.builder(id, ConferenceType.MEDICAL)
                .name(id)
                .deadline(SubmissionKind.PAPER, d(paperDeadline))
                .build();
    }

    public static Submission paper(String id, String conferenceId, int months) {
        return Submission.builder(id, SubmissionKind.PAPER)
                .conferenceId(conferenceId)
                .draftWindowMonths(months)
                .build();
    }

    /**
     * Two independent 90-day papers due 2025-06-01 and 2025-08-01, one slot per day.
     */
    public static Config twoSequentialPapers() {
        return Config.builder()
                .maxConcurrentSubmissions(1)
                .addConference(paperOnly("C1", "2025-06-01"))
                .addConference(paperOnly("C2", "2025-08-01"))
                .addSubmission(paper("P1", "C1", 3))
                .addSubmission(paper("P2", "C2", 3))
                .build();
    }

    /**
     * Five 90-day papers all due 2025-06-01 with one slot per day: only four fit before the deadline.
     */
    public static Config overbooked() {
        Config.Builder b = Config.builder()
                .maxConcurrentSubmissions(1)
                .minPaperLeadTimeDays(0);
        for (int i = 1; i <= 5; i++) {
            b.addConference(paperOnly("C" + i, "2025-06-01"));
            b.addSubmission(paper("P" + i, "C" + i, 3));
        }
        return b.build();
    }
}
