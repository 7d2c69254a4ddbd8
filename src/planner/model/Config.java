package planner.model;

import planner.config.ConfigValidator;
import planner.config.ConfigurationException;
import planner.config.PenaltyCosts;
import planner.config.SchedulingConstants;
import planner.config.ScoringConstants;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Read-only input to every scheduler, validator and scorer.
 * Built once through {@link Builder#build()}, which runs {@link ConfigValidator}.
 */
public class Config {
    public static final int DEFAULT_MIN_ABSTRACT_LEAD_TIME_DAYS = 30;
    public static final int DEFAULT_MIN_PAPER_LEAD_TIME_DAYS = 90;
    public static final int DEFAULT_MAX_CONCURRENT_SUBMISSIONS = 3;
    public static final int DEFAULT_PAPER_LEAD_TIME_MONTHS = 3;
    public static final int DEFAULT_WORK_ITEM_DURATION_DAYS = 14;

    private final List<Submission> submissions;
    private final List<Conference> conferences;
    private final Map<String, Submission> submissionsById;
    private final Map<String, Conference> conferencesById;
    private final Map<String, List<String>> dependents;
    private final int minAbstractLeadTimeDays;
    private final int minPaperLeadTimeDays;
    private final int maxConcurrentSubmissions;
    private final int defaultPaperLeadTimeMonths;
    private final int workItemDurationDays;
    private final NavigableSet<LocalDate> blackoutDates;
    private final Map<String, Double> penaltyCosts;
    private final Map<String, Double> priorityWeights;
    private final Map<String, Object> schedulingOptions;
    private final LocalDate schedulingStartDate;
    private final SchedulingConstants schedulingConstants;
    private final ScoringConstants scoringConstants;

    private Config(Builder b) {
        this.submissions = List.copyOf(b.submissions);
        this.conferences = List.copyOf(b.conferences);
        Map<String, Submission> sById = new LinkedHashMap<>();
        for (Submission s : submissions) {
            sById.putIfAbsent(s.getId(), s);
        }
        this.submissionsById = Collections.unmodifiableMap(sById);
        Map<String, Conference> cById = new LinkedHashMap<>();
        for (Conference c : conferences) {
            cById.putIfAbsent(c.getId(), c);
        }
        this.conferencesById = Collections.unmodifiableMap(cById);

        Map<String, List<String>> deps = new LinkedHashMap<>();
        for (Submission s : submissions) {
            for (String parent : s.getDependsOn()) {
                deps.computeIfAbsent(parent, k -> new ArrayList<>()).add(s.getId());
            }
        }
        this.dependents = deps;

        this.minAbstractLeadTimeDays = b.minAbstractLeadTimeDays;
        this.minPaperLeadTimeDays = b.minPaperLeadTimeDays;
        this.maxConcurrentSubmissions = b.maxConcurrentSubmissions;
        this.defaultPaperLeadTimeMonths = b.defaultPaperLeadTimeMonths;
        this.workItemDurationDays = b.workItemDurationDays;
        this.blackoutDates = Collections.unmodifiableNavigableSet(new TreeSet<>(b.blackoutDates));
        this.penaltyCosts = PenaltyCosts.merge(b.penaltyCosts);
        this.priorityWeights = Collections.unmodifiableMap(new LinkedHashMap<>(b.priorityWeights));
        this.schedulingOptions = Collections.unmodifiableMap(new LinkedHashMap<>(b.schedulingOptions));
        this.schedulingStartDate = b.schedulingStartDate;
        this.schedulingConstants = b.schedulingConstants;
        this.scoringConstants = b.scoringConstants;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Submission> getSubmissions() { return submissions; }
    public List<Conference> getConferences() { return conferences; }
    public int getMinAbstractLeadTimeDays() { return minAbstractLeadTimeDays; }
    public int getMinPaperLeadTimeDays() { return minPaperLeadTimeDays; }
    public int getMaxConcurrentSubmissions() { return maxConcurrentSubmissions; }
    public int getDefaultPaperLeadTimeMonths() { return defaultPaperLeadTimeMonths; }
    public int getWorkItemDurationDays() { return workItemDurationDays; }
    public NavigableSet<LocalDate> getBlackoutDates() { return blackoutDates; }
    public Map<String, Double> getPenaltyCosts() { return penaltyCosts; }
    public Map<String, Double> getPriorityWeights() { return priorityWeights; }
    public Map<String, Object> getSchedulingOptions() { return schedulingOptions; }
    public Optional<LocalDate> getSchedulingStartDate() { return Optional.ofNullable(schedulingStartDate); }
    public SchedulingConstants getSchedulingConstants() { return schedulingConstants; }
    public ScoringConstants getScoringConstants() { return scoringConstants; }

    public Optional<Submission> getSubmission(String id) {
        return Optional.ofNullable(submissionsById.get(id));
    }

    public Optional<Conference> getConference(String id) {
        return Optional.ofNullable(conferencesById.get(id));
    }

    public Map<String, Submission> getSubmissionsById() {
        return submissionsById;
    }

    // Ids of submissions listing the given one in depends_on
    public List<String> getDependents(String submissionId) {
        return Collections.unmodifiableList(dependents.getOrDefault(submissionId, Collections.emptyList()));
    }

    public Optional<Conference> conferenceOf(Submission s) {
        return s.getConferenceId().flatMap(this::getConference);
    }

    public Optional<LocalDate> deadlineOf(Submission s) {
        return conferenceOf(s).flatMap(c -> c.getDeadline(s.getKind()));
    }

    public boolean isBlackout(LocalDate day) {
        return blackoutDates.contains(day);
    }

    // Price from penalty_costs; defaults are always merged in
    public double getPenaltyCost(String key) {
        Double v = penaltyCosts.get(key);
        return v == null ? 0.0 : v;
    }

    public double getPriorityWeight(String key, double defaultValue) {
        Double v = priorityWeights.get(key);
        return v == null ? defaultValue : v;
    }

    public boolean getBooleanOption(String key, boolean defaultValue) {
        Object v = schedulingOptions.get(key);
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof String) return Boolean.parseBoolean(((String) v).trim());
        return defaultValue;
    }

    public long getLongOption(String key, long defaultValue) {
        Object v = schedulingOptions.get(key);
        if (v instanceof Number) return ((Number) v).longValue();
        if (v instanceof String) {
            try {
                return Long.parseLong(((String) v).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Option " + key + " is not a number: " + v, e);
            }
        }
        return defaultValue;
    }

    public int getIntOption(String key, int defaultValue) {
        return (int) getLongOption(key, defaultValue);
    }

    public Optional<String> getStringOption(String key) {
        Object v = schedulingOptions.get(key);
        return v == null ? Optional.empty() : Optional.of(v.toString());
    }

    /**
     * First day any strategy may place a submission on. Never depends on the current date.
     * <p>
     * Without an explicit start date this is the earliest of: any submission's earliest start,
     * the earliest deadline minus the reference period, and any engineering-ready date.
     * With none of these it is 1970-01-01.
     */
    public LocalDate getSchedulingWindowStart() {
        if (schedulingStartDate != null) {
            return schedulingStartDate;
        }
        Stream<LocalDate> earliestStarts = submissions.stream()
                .map(Submission::getEarliestStartDate)
                .flatMap(Optional::stream);
        Stream<LocalDate> beforeDeadline = allDeadlines().min(LocalDate::compareTo)
                .map(dl -> dl.minusDays(schedulingConstants.getReferencePeriodDays()))
                .stream();
        Stream<LocalDate> engineeringReady = submissions.stream()
                .map(Submission::getEngineeringReadyDate)
                .flatMap(Optional::stream);
        return Stream.of(earliestStarts, beforeDeadline, engineeringReady)
                .flatMap(x -> x)
                .min(LocalDate::compareTo)
                .orElse(LocalDate.EPOCH);
    }

    /**
     * Last day (exclusive) any strategy scans to.
     */
    public LocalDate getSchedulingWindowEnd() {
        LocalDate start = getSchedulingWindowStart();
        LocalDate byReference = start.plusDays(schedulingConstants.getReferencePeriodDays());
        Optional<LocalDate> latestDeadline = allDeadlines().max(LocalDate::compareTo);
        if (latestDeadline.isEmpty()) {
            return byReference;
        }
        LocalDate byDeadline = latestDeadline.get().plusDays(schedulingConstants.getConferenceResponseTimeDays());
        return byDeadline.isAfter(byReference) ? byDeadline : byReference;
    }

    private Stream<LocalDate> allDeadlines() {
        return conferences.stream().flatMap(c -> c.getDeadlines().values().stream());
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.submissions = new ArrayList<>(submissions);
        b.conferences = new ArrayList<>(conferences);
        b.minAbstractLeadTimeDays = minAbstractLeadTimeDays;
        b.minPaperLeadTimeDays = minPaperLeadTimeDays;
        b.maxConcurrentSubmissions = maxConcurrentSubmissions;
        b.defaultPaperLeadTimeMonths = defaultPaperLeadTimeMonths;
        b.workItemDurationDays = workItemDurationDays;
        b.blackoutDates = new TreeSet<>(blackoutDates);
        b.penaltyCosts = new LinkedHashMap<>(penaltyCosts);
        b.priorityWeights = new LinkedHashMap<>(priorityWeights);
        b.schedulingOptions = new LinkedHashMap<>(schedulingOptions);
        b.schedulingStartDate = schedulingStartDate;
        b.schedulingConstants = schedulingConstants;
        b.scoringConstants = scoringConstants;
        return b;
    }

    public static class Builder {
        private List<Submission> submissions = new ArrayList<>();
        private List<Conference> conferences = new ArrayList<>();
        private int minAbstractLeadTimeDays = DEFAULT_MIN_ABSTRACT_LEAD_TIME_DAYS;
        private int minPaperLeadTimeDays = DEFAULT_MIN_PAPER_LEAD_TIME_DAYS;
        private int maxConcurrentSubmissions = DEFAULT_MAX_CONCURRENT_SUBMISSIONS;
        private int defaultPaperLeadTimeMonths = DEFAULT_PAPER_LEAD_TIME_MONTHS;
        private int workItemDurationDays = DEFAULT_WORK_ITEM_DURATION_DAYS;
        private Collection<LocalDate> blackoutDates = new TreeSet<>();
        private Map<String, Double> penaltyCosts = new LinkedHashMap<>();
        private Map<String, Double> priorityWeights = new LinkedHashMap<>();
        private Map<String, Object> schedulingOptions = new LinkedHashMap<>();
        private LocalDate schedulingStartDate;
        private SchedulingConstants schedulingConstants = SchedulingConstants.defaults();
        private ScoringConstants scoringConstants = ScoringConstants.defaults();

        public Builder submissions(List<Submission> list) {
            this.submissions = new ArrayList<>(list);
            return this;
        }

        public Builder addSubmission(Submission s) {
            this.submissions.add(s);
            return this;
        }

        public Builder conferences(List<Conference> list) {
            this.conferences = new ArrayList<>(list);
            return this;
        }

        public Builder addConference(Conference c) {
            this.conferences.add(c);
            return this;
        }

        public Builder minAbstractLeadTimeDays(int days) { this.minAbstractLeadTimeDays = days; return this; }
        public Builder minPaperLeadTimeDays(int days) { this.minPaperLeadTimeDays = days; return this; }
        public Builder maxConcurrentSubmissions(int n) { this.maxConcurrentSubmissions = n; return this; }
        public Builder defaultPaperLeadTimeMonths(int months) { this.defaultPaperLeadTimeMonths = months; return this; }
        public Builder workItemDurationDays(int days) { this.workItemDurationDays = days; return this; }
        public Builder schedulingStartDate(LocalDate d) { this.schedulingStartDate = d; return this; }
        public Builder schedulingConstants(SchedulingConstants c) { this.schedulingConstants = c; return this; }
        public Builder scoringConstants(ScoringConstants c) { this.scoringConstants = c; return this; }

        public Builder blackoutDates(Collection<LocalDate> dates) {
            this.blackoutDates = new TreeSet<>(dates);
            return this;
        }

        public Builder penaltyCosts(Map<String, Double> costs) {
            this.penaltyCosts = new LinkedHashMap<>(costs);
            return this;
        }

        public Builder penaltyCost(String key, double value) {
            this.penaltyCosts.put(key, value);
            return this;
        }

        public Builder priorityWeights(Map<String, Double> weights) {
            this.priorityWeights = new LinkedHashMap<>(weights);
            return this;
        }

        public Builder priorityWeight(String key, double value) {
            this.priorityWeights.put(key, value);
            return this;
        }

        public Builder schedulingOptions(Map<String, Object> options) {
            this.schedulingOptions = new LinkedHashMap<>(options);
            return this;
        }

        public Builder option(String key, Object value) {
            this.schedulingOptions.put(key, value);
            return this;
        }

        /**
         * @throws ConfigurationException listing every problem found
         */
        public Config build() {
            if (schedulingConstants == null) schedulingConstants = SchedulingConstants.defaults();
            if (scoringConstants == null) scoringConstants = ScoringConstants.defaults();
            Config config = new Config(this);
            List<String> errors = ConfigValidator.validate(config);
            if (!errors.isEmpty()) {
                throw new ConfigurationException(errors);
            }
            return config;
        }
    }
}
