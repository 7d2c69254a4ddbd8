package planner.model;

import java.util.Locale;
import java.util.Set;

/**
 * Which submission kinds a conference takes, and in which order.
 */
public enum SubmissionWorkflow {
    ABSTRACT_ONLY,
    PAPER_ONLY,
    POSTER_ONLY,
    ABSTRACT_THEN_PAPER,
    ABSTRACT_OR_PAPER,
    ALL_TYPES;

    public boolean accepts(SubmissionKind kind) {
        switch (this) {
            case ALL_TYPES:
                return true;
            case ABSTRACT_ONLY:
                return kind == SubmissionKind.ABSTRACT;
            case PAPER_ONLY:
                return kind == SubmissionKind.PAPER;
            case POSTER_ONLY:
                return kind == SubmissionKind.POSTER;
            case ABSTRACT_THEN_PAPER:
            case ABSTRACT_OR_PAPER:
                return kind == SubmissionKind.ABSTRACT || kind == SubmissionKind.PAPER;
            default:
                throw new IllegalStateException("Unhandled workflow " + this);
        }
    }

    /**
     * Infers the workflow from the kinds that carry a deadline.
     */
    public static SubmissionWorkflow infer(Set<SubmissionKind> kindsWithDeadline) {
        boolean a = kindsWithDeadline.contains(SubmissionKind.ABSTRACT);
        boolean p = kindsWithDeadline.contains(SubmissionKind.PAPER);
        boolean o = kindsWithDeadline.contains(SubmissionKind.POSTER);

        if (a && p && o) return ALL_TYPES;
        if (a && p) return ABSTRACT_OR_PAPER;
        if (a && !o) return ABSTRACT_ONLY;
        if (p && !o) return PAPER_ONLY;
        if (o && !a && !p) return POSTER_ONLY;
        return ABSTRACT_OR_PAPER;
    }

    public static SubmissionWorkflow fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("workflow is null");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
    }
}
