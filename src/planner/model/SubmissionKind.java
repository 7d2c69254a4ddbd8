package planner.model;

import java.util.Locale;

public enum SubmissionKind {
    ABSTRACT("abstract"),
    PAPER("paper"),
    POSTER("poster");

    private final String key;

    SubmissionKind(String key) {
        this.key = key;
    }

    // Key used in priority_weights and JSON input
    public String getKey() {
        return key;
    }

    public static SubmissionKind fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("submission kind is null");
        }
        String t = raw.trim().toLowerCase(Locale.ROOT);
        switch (t) {
            case "abstract":
                return ABSTRACT;
            case "paper":
            case "full_paper":
                return PAPER;
            case "poster":
                return POSTER;
            default:
                throw new IllegalArgumentException("Unknown submission kind: " + raw);
        }
    }
}
