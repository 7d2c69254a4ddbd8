package planner.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One {@link ValidationResult} per constraint family plus the aggregate view.
 */
public class ValidationReport {
    private final Map<ConstraintFamily, ValidationResult> results;

    public ValidationReport(Map<ConstraintFamily, ValidationResult> results) {
        this.results = Collections.unmodifiableMap(new EnumMap<>(results));
    }

    public Map<ConstraintFamily, ValidationResult> getResults() {
        return results;
    }

    public ValidationResult get(ConstraintFamily family) {
        ValidationResult r = results.get(family);
        if (r == null) {
            throw new IllegalArgumentException("No result for " + family);
        }
        return r;
    }

    public boolean isValid() {
        return results.values().stream().allMatch(ValidationResult::isValid);
    }

    // Mean of the family rates
    public double getComplianceRate() {
        return results.values().stream()
                .mapToDouble(ValidationResult::getComplianceRate)
                .average()
                .orElse(100.0);
    }

    public List<Violation> getAllViolations() {
        List<Violation> all = new ArrayList<>();
        for (ValidationResult r : results.values()) {
            all.addAll(r.getViolations());
        }
        return all;
    }

    public int getViolationCount() {
        return results.values().stream().mapToInt(r -> r.getViolations().size()).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationReport)) return false;
        return results.equals(((ValidationReport) o).results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(results);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(isValid() ? "VALID" : "INVALID")
                .append(String.format(" (%.1f%% compliant)", getComplianceRate()));
        for (ValidationResult r : results.values()) {
            sb.append("\n  ").append(r.getSummary());
        }
        return sb.toString();
    }
}
