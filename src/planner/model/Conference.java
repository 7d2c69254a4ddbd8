package planner.model;

import planner.config.ConfigurationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A venue with per-kind deadlines and an acceptance workflow.
 */
public class Conference {
    private final String id;
    private final String name;
    private final ConferenceType confType;
    private final ConferenceRecurrence recurrence;
    private final Map<SubmissionKind, LocalDate> deadlines;
    private final SubmissionWorkflow submissionTypes; // null = infer from deadlines
    private final boolean topTier;

    private Conference(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.confType = b.confType;
        this.recurrence = b.recurrence;
        this.deadlines = Collections.unmodifiableMap(new EnumMap<>(b.deadlines));
        this.submissionTypes = b.submissionTypes;
        this.topTier = b.topTier;
    }

    public static Builder builder(String id, ConferenceType confType) {
        return new Builder(id, confType);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public ConferenceType getConfType() { return confType; }
    public ConferenceRecurrence getRecurrence() { return recurrence; }
    public Map<SubmissionKind, LocalDate> getDeadlines() { return deadlines; }
    public boolean isTopTier() { return topTier; }

    public Optional<LocalDate> getDeadline(SubmissionKind kind) {
        return Optional.ofNullable(deadlines.get(kind));
    }

    // Explicit workflow if configured, otherwise inferred
    public SubmissionWorkflow getWorkflow() {
        if (submissionTypes != null) {
            return submissionTypes;
        }
        return SubmissionWorkflow.infer(deadlines.keySet());
    }

    public boolean accepts(SubmissionKind kind) {
        return getWorkflow().accepts(kind);
    }

    public boolean requiresAbstractBeforePaper() {
        return getWorkflow() == SubmissionWorkflow.ABSTRACT_THEN_PAPER;
    }

    public Optional<LocalDate> getLatestDeadline() {
        return deadlines.values().stream().max(LocalDate::compareTo);
    }

    public Optional<LocalDate> getEarliestDeadline() {
        return deadlines.values().stream().min(LocalDate::compareTo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Conference)) return false;
        return id.equals(((Conference) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id + " [" + confType + ", " + getWorkflow() + "]";
    }

    public static class Builder {
        private final String id;
        private final ConferenceType confType;
        private String name;
        private ConferenceRecurrence recurrence = ConferenceRecurrence.ANNUAL;
        private final Map<SubmissionKind, LocalDate> deadlines = new EnumMap<>(SubmissionKind.class);
        private SubmissionWorkflow submissionTypes;
        private boolean topTier;

        private Builder(String id, ConferenceType confType) {
            this.id = id;
            this.confType = confType;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder recurrence(ConferenceRecurrence r) { this.recurrence = r; return this; }
        public Builder submissionTypes(SubmissionWorkflow w) { this.submissionTypes = w; return this; }
        public Builder topTier(boolean topTier) { this.topTier = topTier; return this; }

        public Builder deadline(SubmissionKind kind, LocalDate date) {
            if (date != null) {
                deadlines.put(kind, date);
            }
            return this;
        }

        public Conference build() {
            List<String> errors = new ArrayList<>();
            if (id == null || id.isBlank()) {
                errors.add("Conference id must not be blank");
            }
            String label = id == null ? "<null>" : id;
            if (name == null || name.isBlank()) {
                errors.add("Conference " + label + ": name must not be blank");
            }
            if (confType == null) {
                errors.add("Conference " + label + ": conf_type is required");
            }
            if (recurrence == null) {
                recurrence = ConferenceRecurrence.ANNUAL;
            }
            if (deadlines.isEmpty()) {
                errors.add("Conference " + label + " has no deadlines");
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationException(errors);
            }
            return new Conference(this);
        }
    }
}
