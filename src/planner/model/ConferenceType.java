package planner.model;

import java.util.Locale;

public enum ConferenceType {
    MEDICAL,
    ENGINEERING;

    public static ConferenceType fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("conference type is null");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
