package planner.model;

import planner.config.ConfigurationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A unit of work to be scheduled: an abstract, a paper or a poster.
 * Instances are immutable and only obtainable through {@link Builder#build()}.
 */
public class Submission {
    private final String id;
    private final String title;
    private final SubmissionKind kind;
    private final String conferenceId; // null = not assigned yet
    private final List<String> dependsOn;
    private final int draftWindowMonths;
    private final int leadTimeFromParents; // days
    private final LocalDate earliestStartDate;
    private final LocalDate engineeringReadyDate;
    private final Double penaltyCostPerDay;
    private final boolean engineering;
    private final List<String> candidateConferences;
    private final List<SubmissionKind> candidateKinds;

    private Submission(Builder b) {
        this.id = b.id;
        this.title = b.title;
        this.kind = b.kind;
        this.conferenceId = b.conferenceId;
        this.dependsOn = List.copyOf(b.dependsOn);
        this.draftWindowMonths = b.draftWindowMonths;
        this.leadTimeFromParents = b.leadTimeFromParents;
        this.earliestStartDate = b.earliestStartDate;
        this.engineeringReadyDate = b.engineeringReadyDate;
        this.penaltyCostPerDay = b.penaltyCostPerDay;
        this.engineering = b.engineering;
        this.candidateConferences = List.copyOf(b.candidateConferences);
        this.candidateKinds = List.copyOf(b.candidateKinds);
    }

    public static Builder builder(String id, SubmissionKind kind) {
        return new Builder(id, kind);
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public SubmissionKind getKind() { return kind; }
    public Optional<String> getConferenceId() { return Optional.ofNullable(conferenceId); }
    public List<String> getDependsOn() { return dependsOn; }
    public int getDraftWindowMonths() { return draftWindowMonths; }
    public int getLeadTimeFromParents() { return leadTimeFromParents; }
    public Optional<LocalDate> getEarliestStartDate() { return Optional.ofNullable(earliestStartDate); }
    public Optional<LocalDate> getEngineeringReadyDate() { return Optional.ofNullable(engineeringReadyDate); }
    public boolean isEngineering() { return engineering; }
    public List<String> getCandidateConferences() { return candidateConferences; }
    public List<SubmissionKind> getCandidateKinds() { return candidateKinds; }

    public OptionalDouble getPenaltyCostPerDay() {
        return penaltyCostPerDay == null ? OptionalDouble.empty() : OptionalDouble.of(penaltyCostPerDay);
    }

    /**
     * Number of active days. The draft window wins when set, otherwise the per-kind default applies.
     */
    public int durationDays(Config config) {
        int daysPerMonth = config.getSchedulingConstants().getDaysPerMonth();
        if (draftWindowMonths > 0) {
            return draftWindowMonths * daysPerMonth;
        }
        switch (kind) {
            case ABSTRACT:
                return config.getWorkItemDurationDays();
            case POSTER:
                return config.getSchedulingConstants().getPosterDurationDays();
            case PAPER:
                return config.getDefaultPaperLeadTimeMonths() * daysPerMonth;
            default:
                throw new IllegalStateException("Unhandled kind " + kind);
        }
    }

    /**
     * Copy of this submission bound to a conference (and possibly a different kind).
     * Used when resolving candidate conferences.
     */
    public Submission withConference(String newConferenceId, SubmissionKind newKind) {
        return toBuilder()
                .kind(newKind)
                .conferenceId(newConferenceId)
                .build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(id, kind)
                .title(title)
                .conferenceId(conferenceId)
                .dependsOn(dependsOn)
                .draftWindowMonths(draftWindowMonths)
                .leadTimeFromParents(leadTimeFromParents)
                .earliestStartDate(earliestStartDate)
                .engineeringReadyDate(engineeringReadyDate)
                .engineering(engineering)
                .candidateConferences(candidateConferences)
                .candidateKinds(candidateKinds);
        b.penaltyCostPerDay = penaltyCostPerDay;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Submission)) return false;
        return id.equals(((Submission) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id + "(" + kind.getKey() + (conferenceId == null ? "" : "@" + conferenceId) + ")";
    }

    public static class Builder {
        private final String id;
        private SubmissionKind kind;
        private String title;
        private String conferenceId;
        private List<String> dependsOn = new ArrayList<>();
        private int draftWindowMonths;
        private int leadTimeFromParents;
        private LocalDate earliestStartDate;
        private LocalDate engineeringReadyDate;
        private Double penaltyCostPerDay;
        private boolean engineering;
        private List<String> candidateConferences = new ArrayList<>();
        private List<SubmissionKind> candidateKinds = new ArrayList<>();

        private Builder(String id, SubmissionKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder kind(SubmissionKind kind) { this.kind = kind; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder conferenceId(String conferenceId) { this.conferenceId = conferenceId; return this; }
        public Builder draftWindowMonths(int months) { this.draftWindowMonths = months; return this; }
        public Builder leadTimeFromParents(int days) { this.leadTimeFromParents = days; return this; }
        public Builder earliestStartDate(LocalDate d) { this.earliestStartDate = d; return this; }
        public Builder engineeringReadyDate(LocalDate d) { this.engineeringReadyDate = d; return this; }
        public Builder engineering(boolean engineering) { this.engineering = engineering; return this; }

        public Builder penaltyCostPerDay(double cost) {
            this.penaltyCostPerDay = cost;
            return this;
        }

        public Builder dependsOn(List<String> ids) {
            this.dependsOn = ids == null ? new ArrayList<>() : new ArrayList<>(ids);
            return this;
        }

        public Builder dependsOn(String... ids) {
            return dependsOn(List.of(ids));
        }

        public Builder candidateConferences(List<String> ids) {
            this.candidateConferences = ids == null ? new ArrayList<>() : new ArrayList<>(ids);
            return this;
        }

        public Builder candidateKinds(List<SubmissionKind> kinds) {
            this.candidateKinds = kinds == null ? new ArrayList<>() : new ArrayList<>(kinds);
            return this;
        }

        public Submission build() {
            List<String> errors = new ArrayList<>();
            if (id == null || id.isBlank()) {
                errors.add("Submission id must not be blank");
            }
            String label = id == null ? "<null>" : id;
            if (kind == null) {
                errors.add("Submission " + label + ": kind is required");
            }
            if (title == null || title.isBlank()) {
                title = id;
                if (title == null || title.isBlank()) {
                    errors.add("Submission " + label + ": title must not be blank");
                }
            }
            if (conferenceId != null && conferenceId.isBlank()) {
                conferenceId = null;
            }
            if (kind == SubmissionKind.PAPER && conferenceId == null && candidateConferences.isEmpty()) {
                errors.add("Paper " + label + " needs a conference_id or candidate_conferences");
            }
            if (draftWindowMonths < 0) {
                errors.add("Submission " + label + ": draft_window_months must be >= 0");
            }
            if (leadTimeFromParents < 0) {
                errors.add("Submission " + label + ": lead_time_from_parents must be >= 0");
            }
            if (penaltyCostPerDay != null && (penaltyCostPerDay < 0 || penaltyCostPerDay.isNaN())) {
                errors.add("Submission " + label + ": penalty_cost_per_day must be >= 0");
            }
            if (dependsOn.stream().anyMatch(Objects::isNull)) {
                errors.add("Submission " + label + ": depends_on contains null");
            }
            if (id != null && dependsOn.contains(id)) {
                errors.add("Submission " + label + " depends on itself");
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationException(errors);
            }
            return new Submission(this);
        }
    }
}
