package planner.constraints;

import java.time.LocalDate;

public class Candidate {
    public final String submissionId;
    public final LocalDate start; // proposed start day

    public Candidate(String submissionId, LocalDate start) {
        this.submissionId = submissionId;
        this.start = start;
    }

    @Override
    public String toString() {
        return submissionId + "@" + start;
    }
}
