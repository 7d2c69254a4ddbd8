package planner.model;

import java.util.Locale;

public enum ConferenceRecurrence {
    ANNUAL,
    BIENNIAL,
    QUARTERLY;

    public static ConferenceRecurrence fromString(String raw) {
        if (raw == null) {
            return ANNUAL;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
