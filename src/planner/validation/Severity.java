package planner.validation;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    // >high days -> HIGH, >medium days -> MEDIUM, else LOW
    public static Severity ofDays(long days, int highThreshold, int mediumThreshold) {
        if (days > highThreshold) return HIGH;
        if (days > mediumThreshold) return MEDIUM;
        return LOW;
    }
}
