package planner.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one constraint family over a schedule.
 */
public class ValidationResult {
    private final ConstraintFamily family;
    private final List<Violation> violations;
    private final int total;
    private final int compliant;
    private final Map<String, Object> metadata;

    public ValidationResult(ConstraintFamily family, List<Violation> violations, int total, int compliant) {
        this(family, violations, total, compliant, Collections.emptyMap());
    }

    public ValidationResult(ConstraintFamily family, List<Violation> violations, int total, int compliant,
                            Map<String, Object> metadata) {
        if (compliant < 0 || compliant > total) {
            throw new IllegalArgumentException("compliant must be in [0, total]: " + compliant + "/" + total);
        }
        this.family = family;
        this.violations = List.copyOf(violations);
        this.total = total;
        this.compliant = compliant;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ConstraintFamily getFamily() { return family; }
    public List<Violation> getViolations() { return violations; }
    public int getTotal() { return total; }
    public int getCompliant() { return compliant; }
    public Map<String, Object> getMetadata() { return metadata; }

    public boolean isValid() {
        return violations.isEmpty();
    }

    // 100 when nothing was applicable
    public double getComplianceRate() {
        if (total == 0) {
            return 100.0;
        }
        return compliant * 100.0 / total;
    }

    public String getSummary() {
        return String.format("%s: %d/%d compliant (%.1f%%), %d violation(s)",
                family, compliant, total, getComplianceRate(), violations.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult)) return false;
        ValidationResult r = (ValidationResult) o;
        return total == r.total && compliant == r.compliant && family == r.family
                && violations.equals(r.violations) && metadata.equals(r.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, violations, total, compliant, metadata);
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
