package planner.validation;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * A constraint violation. A value, never thrown.
 */
public class Violation {
    private final String submissionId;
    private final ViolationType type;
    private final String description;
    private final Severity severity;
    private final long magnitude;
    private final String relatedId;
    private final LocalDate date;

    public Violation(String submissionId, ViolationType type, String description,
                     Severity severity, long magnitude, String relatedId, LocalDate date) {
        this.submissionId = Objects.requireNonNull(submissionId);
        this.type = Objects.requireNonNull(type);
        this.description = description;
        this.severity = Objects.requireNonNull(severity);
        this.magnitude = magnitude;
        this.relatedId = relatedId;
        this.date = date;
    }

    public Violation(String submissionId, ViolationType type, String description, Severity severity, long magnitude) {
        this(submissionId, type, description, severity, magnitude, null, null);
    }

    public String getSubmissionId() { return submissionId; }
    public ViolationType getType() { return type; }
    public ConstraintFamily getFamily() { return type.getFamily(); }
    public String getDescription() { return description; }
    public Severity getSeverity() { return severity; }
    // Days late, excess load, days beyond the window or shortfall, depending on the type
    public long getMagnitude() { return magnitude; }
    public Optional<String> getRelatedId() { return Optional.ofNullable(relatedId); }
    public Optional<LocalDate> getDate() { return Optional.ofNullable(date); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Violation)) return false;
        Violation v = (Violation) o;
        return magnitude == v.magnitude
                && submissionId.equals(v.submissionId)
                && type == v.type
                && Objects.equals(description, v.description)
                && severity == v.severity
                && Objects.equals(relatedId, v.relatedId)
                && Objects.equals(date, v.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(submissionId, type, description, severity, magnitude, relatedId, date);
    }

    @Override
    public String toString() {
        return type + "[" + submissionId + ", " + severity + "]: " + description;
    }
}
