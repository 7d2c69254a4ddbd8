package planner.validation;

import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two papers of the same work may not go to the same conference within one cycle.
 */
public class SingleConferenceValidator extends AbstractValidator {

    @Override
    public ConstraintFamily getFamily() {
        return ConstraintFamily.SINGLE_CONFERENCE;
    }

    @Override
    public String getViolationMessage() {
        return "Same work already submitted to this conference within the cycle";
    }

    @Override
    public ValidationResult validate(ScheduleView schedule, Config config) {
        List<Violation> violations = new ArrayList<>();
        int total = 0;
        int compliant = 0;
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            Optional<Submission> s = config.getSubmission(e.getKey());
            if (s.isEmpty() || !isCandidate(s.get())) {
                continue;
            }
            total++;
            List<Violation> mine = new ArrayList<>();
            // each conflicting pair is reported once, on the later paper
            for (Violation v : evaluate(s.get(), e.getValue(), schedule, config)) {
                Interval other = schedule.getInterval(v.getRelatedId().get()).get();
                if (isLater(e.getKey(), e.getValue(), v.getRelatedId().get(), other)) {
                    mine.add(v);
                }
            }
            if (mine.isEmpty()) {
                compliant++;
            }
            violations.addAll(mine);
        }
        return new ValidationResult(getFamily(), violations, total, compliant);
    }

    @Override
    protected List<Violation> evaluate(Submission s, Interval interval, ScheduleView schedule, Config config) {
        List<Violation> out = new ArrayList<>();
        if (!isCandidate(s)) {
            return out;
        }
        String confId = s.getConferenceId().get();
        String work = workKey(s.getId());
        int cycle = config.getSchedulingConstants().getSingleConferenceCycleDays();
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            if (e.getKey().equals(s.getId())) continue;
            Optional<Submission> other = config.getSubmission(e.getKey());
            if (other.isEmpty() || !isCandidate(other.get())) continue;
            if (!confId.equals(other.get().getConferenceId().get())) continue;
            if (!work.equals(workKey(other.get().getId()))) continue;

            long apart = Math.abs(ChronoUnit.DAYS.between(e.getValue().getStartDate(), interval.getStartDate()));
            if (apart < cycle) {
                out.add(new Violation(s.getId(), ViolationType.SINGLE_CONFERENCE,
                        "Same work as " + e.getKey() + " at " + confId + ", only " + apart + " day(s) apart",
                        Severity.MEDIUM, apart, e.getKey(), interval.getStartDate()));
            }
        }
        return out;
    }

    private static boolean isCandidate(Submission s) {
        return s.getKind() == SubmissionKind.PAPER && s.getConferenceId().isPresent();
    }

    private static boolean isLater(String id, Interval iv, String otherId, Interval other) {
        int c = iv.getStartDate().compareTo(other.getStartDate());
        return c > 0 || (c == 0 && id.compareTo(otherId) > 0);
    }

    /**
     * The underlying work of a paper: its id without a trailing {@code -pap-<conf>} or {@code -pap}.
     */
    public static String workKey(String submissionId) {
        int i = submissionId.lastIndexOf("-pap-");
        if (i > 0) {
            return submissionId.substring(0, i);
        }
        if (submissionId.endsWith("-pap") && submissionId.length() > 4) {
            return submissionId.substring(0, submissionId.length() - 4);
        }
        return submissionId;
    }
}
