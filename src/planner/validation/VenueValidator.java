package planner.validation;

import planner.model.Conference;
import planner.model.ConferenceType;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conference exists, takes this kind of submission, and matches the medical/engineering rule.
 * The one-paper-per-cycle rule lives in {@link SingleConferenceValidator}.
 */
public class VenueValidator extends AbstractValidator {

    @Override
    public ConstraintFamily getFamily() {
        return ConstraintFamily.VENUE;
    }

    @Override
    public String getViolationMessage() {
        return "Conference does not accept this submission";
    }

    @Override
    public ValidationResult validate(ScheduleView schedule, Config config) {
        List<Violation> violations = new ArrayList<>();
        int total = 0;
        int compliant = 0;
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            Optional<Submission> s = config.getSubmission(e.getKey());
            if (s.isEmpty() || s.get().getConferenceId().isEmpty()) {
                continue;
            }
            total++;
            List<Violation> found = evaluate(s.get(), e.getValue(), schedule, config);
            if (found.isEmpty()) {
                compliant++;
            }
            violations.addAll(found);
        }
        return new ValidationResult(getFamily(), violations, total, compliant);
    }

    @Override
    protected List<Violation> evaluate(Submission s, Interval interval, ScheduleView schedule, Config config) {
        List<Violation> out = new ArrayList<>();
        if (s.getConferenceId().isEmpty()) {
            return out;
        }
        String confId = s.getConferenceId().get();
        Optional<Conference> conf = config.getConference(confId);
        if (conf.isEmpty()) {
            out.add(new Violation(s.getId(), ViolationType.UNKNOWN_CONFERENCE,
                    "Unknown conference " + confId, Severity.HIGH, 0, confId, null));
            return out;
        }
        Conference c = conf.get();
        if (!c.accepts(s.getKind())) {
            out.add(new Violation(s.getId(), ViolationType.SUBMISSION_TYPE_NOT_ACCEPTED,
                    c.getId() + " (" + c.getWorkflow() + ") does not accept " + s.getKind().getKey(),
                    Severity.HIGH, 0, confId, null));
        } else if (!s.getCandidateKinds().isEmpty() && noneAccepted(s.getCandidateKinds(), c)) {
            out.add(new Violation(s.getId(), ViolationType.SUBMISSION_TYPE_NOT_ACCEPTED,
                    c.getId() + " accepts none of " + s.getCandidateKinds(), Severity.MEDIUM, 0, confId, null));
        }
        if (!s.isEngineering() && c.getConfType() == ConferenceType.ENGINEERING) {
            out.add(new Violation(s.getId(), ViolationType.CONFERENCE_TYPE_MISMATCH,
                    "Non-engineering submission at engineering conference " + c.getId(),
                    Severity.MEDIUM, 0, confId, null));
        }
        return out;
    }

    private static boolean noneAccepted(List<SubmissionKind> kinds, Conference c) {
        for (SubmissionKind k : kinds) {
            if (c.accepts(k)) return false;
        }
        return true;
    }

    /**
     * Engineering submissions may go anywhere; the rest only to medical conferences.
     */
    public static boolean typeCompatible(Submission s, Conference c) {
        return s.isEngineering() || c.getConfType() != ConferenceType.ENGINEERING;
    }
}
