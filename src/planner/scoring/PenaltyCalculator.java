package planner.scoring;

import planner.config.PenaltyCosts;
import planner.config.SchedulingConstants;
import planner.model.Conference;
import planner.model.Config;
import planner.model.Interval;
import planner.model.ScheduleView;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.validation.ConstraintFamily;
import planner.validation.Severity;
import planner.validation.ValidationReport;
import planner.validation.Violation;
import planner.validation.ViolationType;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prices the violations of a schedule. Every category has its own method so it can be checked alone;
 * all prices come from {@link Config#getPenaltyCost(String)}.
 */
public class PenaltyCalculator {

    private final Config config;

    public PenaltyCalculator(Config config) {
        this.config = config;
    }

    public PenaltyBreakdown calculate(ScheduleView schedule, ValidationReport report) {
        if (schedule.isEmpty()) {
            return PenaltyBreakdown.zero();
        }
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(PenaltyBreakdown.DEADLINE, deadlinePenalty(report));
        m.put(PenaltyBreakdown.DEPENDENCY, dependencyPenalty(report));
        m.put(PenaltyBreakdown.RESOURCE, resourcePenalty(report));
        m.put(PenaltyBreakdown.CONFERENCE_COMPATIBILITY, conferenceCompatibilityPenalty(report));
        m.put(PenaltyBreakdown.ABSTRACT_PAPER_DEPENDENCY, abstractPaperDependencyPenalty(report));
        m.put(PenaltyBreakdown.BLACKOUT, blackoutPenalty(report));
        m.put(PenaltyBreakdown.SOFT_BLOCK, softBlockPenalty(report));
        m.put(PenaltyBreakdown.SINGLE_CONFERENCE, singleConferencePenalty(report));
        m.put(PenaltyBreakdown.LEAD_TIME, leadTimePenalty(report));
        m.put(PenaltyBreakdown.SLACK_COST, slackCostPenalty(schedule));
        return new PenaltyBreakdown(m);
    }

    // days late x the submission's daily cost
    public double deadlinePenalty(ValidationReport report) {
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.DEADLINE)) {
            if (v.getType() != ViolationType.DEADLINE_MISSED) continue;
            Optional<Submission> s = config.getSubmission(v.getSubmissionId());
            if (s.isPresent()) {
                total += v.getMagnitude() * dailyCost(s.get());
            }
        }
        return total;
    }

    public double dependencyPenalty(ValidationReport report) {
        double base = config.getPenaltyCost(PenaltyCosts.DEPENDENCY_VIOLATION);
        double multiplier = config.getPenaltyCost(PenaltyCosts.MISSING_DEPENDENCY_MULTIPLIER);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.DEPENDENCY)) {
            switch (v.getType()) {
                case DEPENDENCY_TIMING:
                    total += base;
                    break;
                case MISSING_DEPENDENCY:
                case INVALID_DEPENDENCY:
                    total += base * multiplier;
                    break;
                default:
                    break;
            }
        }
        return total;
    }

    public double resourcePenalty(ValidationReport report) {
        double cost = config.getPenaltyCost(PenaltyCosts.RESOURCE_VIOLATION);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.RESOURCE)) {
            total += v.getMagnitude() * cost;
        }
        return total;
    }

    public double conferenceCompatibilityPenalty(ValidationReport report) {
        double cost = config.getPenaltyCost(PenaltyCosts.CONFERENCE_COMPATIBILITY);
        double mismatch = config.getPenaltyCost(PenaltyCosts.SUBMISSION_TYPE_MISMATCH_MULTIPLIER);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.VENUE)) {
            total += cost;
            if (v.getType() == ViolationType.SUBMISSION_TYPE_NOT_ACCEPTED) {
                total += cost * mismatch;
            }
        }
        return total;
    }

    public double abstractPaperDependencyPenalty(ValidationReport report) {
        double cost = config.getPenaltyCost(PenaltyCosts.ABSTRACT_PAPER_DEPENDENCY);
        double missing = config.getPenaltyCost(PenaltyCosts.ABSTRACT_MISSING_MULTIPLIER);
        double timing = config.getPenaltyCost(PenaltyCosts.ABSTRACT_TIMING_MULTIPLIER);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.DEPENDENCY)) {
            switch (v.getType()) {
                case ABSTRACT_UNRESOLVED:
                    total += cost;
                    break;
                case ABSTRACT_MISSING:
                    total += cost + cost * missing;
                    break;
                case ABSTRACT_TIMING:
                case ABSTRACT_NOT_DECLARED:
                    total += cost + cost * timing;
                    break;
                default:
                    break;
            }
        }
        return total;
    }

    public double blackoutPenalty(ValidationReport report) {
        double cost = config.getPenaltyCost(PenaltyCosts.BLACKOUT_VIOLATION);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.DEADLINE)) {
            if (v.getType() != ViolationType.BLACKOUT) continue;
            total += cost;
            if (v.getSeverity() == Severity.HIGH) {
                total += cost * config.getPenaltyCost(PenaltyCosts.BLACKOUT_HIGH_SEVERITY_MULTIPLIER);
            } else if (v.getSeverity() == Severity.LOW) {
                total += cost * config.getPenaltyCost(PenaltyCosts.BLACKOUT_LOW_SEVERITY_MULTIPLIER);
            }
        }
        return total;
    }

    public double softBlockPenalty(ValidationReport report) {
        double cost = config.getPenaltyCost(PenaltyCosts.SOFT_BLOCK_VIOLATION);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.SOFT_BLOCK)) {
            total += v.getMagnitude() * cost;
        }
        return total;
    }

    public double singleConferencePenalty(ValidationReport report) {
        double cost = config.getPenaltyCost(PenaltyCosts.SINGLE_CONFERENCE_VIOLATION);
        double topTier = config.getPenaltyCost(PenaltyCosts.TOP_TIER_MULTIPLIER);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.SINGLE_CONFERENCE)) {
            total += cost;
            Optional<Conference> conf = config.getSubmission(v.getSubmissionId()).flatMap(config::conferenceOf);
            if (conf.isPresent() && conf.get().isTopTier()) {
                total += cost * topTier;
            }
        }
        return total;
    }

    public double leadTimePenalty(ValidationReport report) {
        double cost = config.getPenaltyCost(PenaltyCosts.LEAD_TIME_VIOLATION);
        double factor = config.getPenaltyCost(PenaltyCosts.LEAD_TIME_SHORTFALL_FACTOR);
        double total = 0;
        for (Violation v : violations(report, ConstraintFamily.DEADLINE)) {
            if (v.getType() != ViolationType.LEAD_TIME) continue;
            total += cost + v.getMagnitude() * cost * factor;
        }
        return total;
    }

    /**
     * Opportunity cost of starting later than the earliest start date: a monthly slip, a one-time
     * full-year deferral charge, and a missed-venue charge once the slip passes a per-kind threshold.
     */
    public double slackCostPenalty(ScheduleView schedule) {
        SchedulingConstants k = config.getSchedulingConstants();
        double slip = config.getPenaltyCost(PenaltyCosts.MONTHLY_SLIP);
        double deferral = config.getPenaltyCost(PenaltyCosts.FULL_YEAR_DEFERRAL);
        double total = 0;
        for (Map.Entry<String, Interval> e : schedule.getIntervals().entrySet()) {
            Optional<Submission> sub = config.getSubmission(e.getKey());
            if (sub.isEmpty() || sub.get().getEarliestStartDate().isEmpty()) continue;
            Submission s = sub.get();
            int months = Math.max(0, monthsBetween(s.getEarliestStartDate().get(), e.getValue().getStartDate()));

            total += slip * months;
            if (months >= k.getFullYearDeferralMonths()) {
                total += deferral;
            }
            total += missedOpportunity(s, months, k);
        }
        return total;
    }

    private double missedOpportunity(Submission s, int months, SchedulingConstants k) {
        Optional<Conference> conf = config.conferenceOf(s);
        if (s.getKind() == SubmissionKind.ABSTRACT) {
            return months >= k.getAbstractMissedMonths() ? config.getPenaltyCost(PenaltyCosts.MISSED_POSTER) : 0;
        }
        if (s.getKind() != SubmissionKind.PAPER) {
            return 0;
        }
        if (conf.isEmpty()) {
            return months >= k.getUnassignedPaperMissedMonths() ? config.getPenaltyCost(PenaltyCosts.MISSED_ABSTRACT) : 0;
        }
        if (conf.get().requiresAbstractBeforePaper()) {
            return months >= k.getAbstractPaperMissedMonths() ? config.getPenaltyCost(PenaltyCosts.MISSED_ABSTRACT_PAPER) : 0;
        }
        return months >= k.getPaperMissedMonths() ? config.getPenaltyCost(PenaltyCosts.MISSED_POSTER) : 0;
    }

    // calendar months, ignoring the day of month
    static int monthsBetween(LocalDate from, LocalDate to) {
        return (to.getYear() - from.getYear()) * 12 + (to.getMonthValue() - from.getMonthValue());
    }

    double dailyCost(Submission s) {
        if (s.getPenaltyCostPerDay().isPresent()) {
            return s.getPenaltyCostPerDay().getAsDouble();
        }
        return s.getKind() == SubmissionKind.PAPER
                ? config.getPenaltyCost(PenaltyCosts.PAPER_PENALTY_PER_DAY)
                : config.getPenaltyCost(PenaltyCosts.MOD_PENALTY_PER_DAY);
    }

    private static List<Violation> violations(ValidationReport report, ConstraintFamily family) {
        return report.get(family).getViolations();
    }
}
