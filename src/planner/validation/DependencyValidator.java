package planner.validation;

import planner.model.Conference;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;
import planner.model.SubmissionKind;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * depends_on edges and abstract-before-paper chains.
 */
public class DependencyValidator extends AbstractValidator {

    private static final String PAPER_MARKER = "-pap-";
    private static final String ABSTRACT_MARKER = "-abs-";

    @Override
    public ConstraintFamily getFamily() {
        return ConstraintFamily.DEPENDENCY;
    }

    @Override
    public String getViolationMessage() {
        return "Dependency not scheduled or not finished in time";
    }

    @Override
    public ValidationResult validate(ScheduleView schedule, Config config) {
        List<Violation> violations = new ArrayList<>();
        int total = 0;
        int satisfied = 0;
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            Optional<Submission> maybe = config.getSubmission(e.getKey());
            if (maybe.isEmpty()) continue;
            Submission s = maybe.get();

            for (String dep : s.getDependsOn()) {
                total++;
                Optional<Violation> v = checkEdge(s, e.getValue(), dep, schedule, config);
                if (v.isPresent()) {
                    violations.add(v.get());
                } else {
                    satisfied++;
                }
            }
            if (requiresAbstract(s, config)) {
                total++;
                List<Violation> chain = checkAbstractChain(s, e.getValue(), schedule, config);
                if (chain.isEmpty()) {
                    satisfied++;
                }
                violations.addAll(chain);
            }
        }
        Map<String, Object> meta = Map.of("satisfaction_rate", total == 0 ? 100.0 : satisfied * 100.0 / total);
        return new ValidationResult(getFamily(), violations, total, satisfied, meta);
    }

    @Override
    protected List<Violation> evaluate(Submission s, Interval interval, ScheduleView schedule, Config config) {
        List<Violation> out = new ArrayList<>();
        for (String dep : s.getDependsOn()) {
            checkEdge(s, interval, dep, schedule, config).ifPresent(out::add);
        }
        if (requiresAbstract(s, config)) {
            out.addAll(checkAbstractChain(s, interval, schedule, config));
        }
        return out;
    }

    private Optional<Violation> checkEdge(Submission s, Interval interval, String dep,
                                          ScheduleView schedule, Config config) {
        if (config.getSubmission(dep).isEmpty()) {
            return Optional.of(new Violation(s.getId(), ViolationType.INVALID_DEPENDENCY,
                    "Depends on unknown submission " + dep, Severity.HIGH, 0, dep, null));
        }
        Optional<Interval> depInterval = schedule.getInterval(dep);
        if (depInterval.isEmpty()) {
            return Optional.of(new Violation(s.getId(), ViolationType.MISSING_DEPENDENCY,
                    "Dependency " + dep + " is not scheduled", Severity.HIGH, 0, dep, null));
        }
        LocalDate allowedEnd = interval.getStartDate().plusDays(s.getLeadTimeFromParents());
        LocalDate depEnd = depInterval.get().getEndDate();
        if (depEnd.isAfter(allowedEnd)) {
            long days = ChronoUnit.DAYS.between(allowedEnd, depEnd);
            return Optional.of(new Violation(s.getId(), ViolationType.DEPENDENCY_TIMING,
                    "Dependency " + dep + " ends " + depEnd + ", " + days + " day(s) too late",
                    Severity.ofDays(days, config.getSchedulingConstants().getHighSeverityDays(),
                            config.getSchedulingConstants().getMediumSeverityDays()),
                    days, dep, depEnd));
        }
        return Optional.empty();
    }

    private List<Violation> checkAbstractChain(Submission paper, Interval interval,
                                               ScheduleView schedule, Config config) {
        List<Violation> out = new ArrayList<>();
        String confId = paper.getConferenceId().orElse("?");
        Optional<String> abstractId = expectedAbstractId(paper, config);
        if (abstractId.isEmpty()) {
            out.add(new Violation(paper.getId(), ViolationType.ABSTRACT_UNRESOLVED,
                    "No abstract found for paper at " + confId, Severity.HIGH, 0, confId, null));
            return out;
        }
        String absId = abstractId.get();
        Optional<Interval> absInterval = schedule.getInterval(absId);
        if (absInterval.isEmpty()) {
            out.add(new Violation(paper.getId(), ViolationType.ABSTRACT_MISSING,
                    "Required abstract " + absId + " is not scheduled", Severity.HIGH, 0, absId, null));
        } else if (absInterval.get().getEndDate().isAfter(interval.getStartDate())) {
            long days = ChronoUnit.DAYS.between(interval.getStartDate(), absInterval.get().getEndDate());
            out.add(new Violation(paper.getId(), ViolationType.ABSTRACT_TIMING,
                    "Abstract " + absId + " ends " + days + " day(s) after the paper starts",
                    Severity.HIGH, days, absId, absInterval.get().getEndDate()));
        }
        if (!paper.getDependsOn().contains(absId)) {
            out.add(new Violation(paper.getId(), ViolationType.ABSTRACT_NOT_DECLARED,
                    "Abstract " + absId + " is missing from depends_on", Severity.MEDIUM, 0, absId, null));
        }
        return out;
    }

    /**
     * True for a paper bound to a conference whose workflow is abstract-then-paper.
     */
    public static boolean requiresAbstract(Submission s, Config config) {
        if (s.getKind() != SubmissionKind.PAPER) {
            return false;
        }
        return config.conferenceOf(s).map(Conference::requiresAbstractBeforePaper).orElse(false);
    }

    /**
     * Abstract a paper needs at its conference: the {@code <base>-abs-<conf>} sibling if it exists,
     * otherwise a same-conference abstract from depends_on, otherwise the only abstract at that conference.
     */
    public static Optional<String> expectedAbstractId(Submission paper, Config config) {
        Optional<String> confId = paper.getConferenceId();
        if (confId.isEmpty()) {
            return Optional.empty();
        }
        String id = paper.getId();
        int i = id.lastIndexOf(PAPER_MARKER);
        if (i >= 0) {
            String candidate = id.substring(0, i) + ABSTRACT_MARKER + id.substring(i + PAPER_MARKER.length());
            if (config.getSubmission(candidate).isPresent()) {
                return Optional.of(candidate);
            }
        }
        for (String dep : paper.getDependsOn()) {
            Optional<Submission> d = config.getSubmission(dep);
            if (d.isPresent() && isAbstractAt(d.get(), confId.get())) {
                return Optional.of(dep);
            }
        }
        List<String> atConference = config.getSubmissions().stream()
                .filter(s -> isAbstractAt(s, confId.get()))
                .map(Submission::getId)
                .collect(Collectors.toList());
        return atConference.size() == 1 ? Optional.of(atConference.get(0)) : Optional.empty();
    }

    private static boolean isAbstractAt(Submission s, String conferenceId) {
        return s.getKind() == SubmissionKind.ABSTRACT && s.getConferenceId().map(conferenceId::equals).orElse(false);
    }
}
