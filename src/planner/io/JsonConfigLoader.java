package planner.io;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planner.config.ConfigurationException;
import planner.model.Conference;
import planner.model.ConferenceRecurrence;
import planner.model.ConferenceType;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.model.SubmissionWorkflow;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link Config} from a JSON file. Conferences, submissions and blackouts are either inline
 * or in separate files listed under {@code data_files}, resolved against the config's directory.
 */
public class JsonConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(JsonConfigLoader.class);

    public static Config load(Path path) throws IOException {
        JSONObject root = readObject(path);
        Path baseDir = path.toAbsolutePath().getParent();
        try {
            Config config = parse(root, baseDir);
            LOG.info("Loaded config {}: {} submission(s), {} conference(s), {} blackout date(s)", path,
                    config.getSubmissions().size(), config.getConferences().size(), config.getBlackoutDates().size());
            return config;
        } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
            throw new ConfigurationException("Malformed config " + path + ": " + e.getMessage(), e);
        }
    }

    static Config parse(JSONObject root, Path baseDir) throws IOException {
        Config.Builder b = Config.builder();
        if (root.has("min_abstract_lead_time_days")) b.minAbstractLeadTimeDays(root.getInt("min_abstract_lead_time_days"));
        if (root.has("min_paper_lead_time_days")) b.minPaperLeadTimeDays(root.getInt("min_paper_lead_time_days"));
        if (root.has("max_concurrent_submissions")) b.maxConcurrentSubmissions(root.getInt("max_concurrent_submissions"));
        if (root.has("default_paper_lead_time_months")) b.defaultPaperLeadTimeMonths(root.getInt("default_paper_lead_time_months"));
        if (root.has("work_item_duration_days")) b.workItemDurationDays(root.getInt("work_item_duration_days"));
        if (has(root, "scheduling_start_date")) b.schedulingStartDate(date(root.getString("scheduling_start_date")));

        if (root.has("penalty_costs")) b.penaltyCosts(doubles(root.getJSONObject("penalty_costs")));
        if (root.has("priority_weights")) b.priorityWeights(doubles(root.getJSONObject("priority_weights")));
        if (root.has("scheduling_options")) b.schedulingOptions(root.getJSONObject("scheduling_options").toMap());

        JSONObject files = root.optJSONObject("data_files");

        JSONArray conferences = section(root, files, "conferences", baseDir);
        for (int i = 0; i < conferences.length(); i++) {
            b.addConference(conference(conferences.getJSONObject(i)));
        }

        JSONArray submissions = section(root, files, "submissions", baseDir);
        for (int i = 0; i < submissions.length(); i++) {
            b.addSubmission(submission(submissions.getJSONObject(i)));
        }

        Object blackouts = root.opt("blackout_dates");
        if (blackouts == null && files != null && files.has("blackouts")) {
            blackouts = readValue(baseDir.resolve(files.getString("blackouts")));
        }
        if (blackouts != null) {
            b.blackoutDates(blackouts(blackouts));
        }
        return b.build();
    }

    // Inline array, or a file named under data_files
    private static JSONArray section(JSONObject root, JSONObject files, String key, Path baseDir) throws IOException {
        if (root.has(key)) {
            return root.getJSONArray(key);
        }
        if (files != null && files.has(key)) {
            Object v = readValue(baseDir.resolve(files.getString(key)));
            if (v instanceof JSONArray) {
                return (JSONArray) v;
            }
            if (v instanceof JSONObject && ((JSONObject) v).has(key)) {
                return ((JSONObject) v).getJSONArray(key);
            }
            throw new ConfigurationException("File for " + key + " must hold a JSON array");
        }
        return new JSONArray();
    }

    static Conference conference(JSONObject j) {
        String id = j.getString("id");
        Conference.Builder b = Conference.builder(id, ConferenceType.fromString(j.optString("conf_type", "MEDICAL")))
                .name(j.optString("name", id))
                .recurrence(ConferenceRecurrence.fromString(j.optString("recurrence", null)))
                .topTier(j.optBoolean("top_tier", false));
        if (has(j, "submission_types")) {
            b.submissionTypes(SubmissionWorkflow.fromString(j.getString("submission_types")));
        }
        if (j.has("deadlines")) {
            JSONObject d = j.getJSONObject("deadlines");
            for (String kind : d.keySet()) {
                if (!d.isNull(kind)) b.deadline(SubmissionKind.fromString(kind), date(d.getString(kind)));
            }
        }
        if (has(j, "abstract_deadline")) b.deadline(SubmissionKind.ABSTRACT, date(j.getString("abstract_deadline")));
        if (has(j, "full_paper_deadline")) b.deadline(SubmissionKind.PAPER, date(j.getString("full_paper_deadline")));
        if (has(j, "poster_deadline")) b.deadline(SubmissionKind.POSTER, date(j.getString("poster_deadline")));
        return b.build();
    }

    static Submission submission(JSONObject j) {
        Submission.Builder b = Submission.builder(j.getString("id"), SubmissionKind.fromString(j.getString("kind")))
                .title(j.optString("title", ""))
                .draftWindowMonths(j.optInt("draft_window_months", 0))
                .leadTimeFromParents(j.optInt("lead_time_from_parents", 0))
                .engineering(j.optBoolean("engineering", false));
        if (has(j, "conference_id")) b.conferenceId(j.getString("conference_id"));
        if (has(j, "earliest_start_date")) b.earliestStartDate(date(j.getString("earliest_start_date")));
        if (has(j, "engineering_ready_date")) b.engineeringReadyDate(date(j.getString("engineering_ready_date")));
        if (has(j, "penalty_cost_per_day")) b.penaltyCostPerDay(j.getDouble("penalty_cost_per_day"));
        if (has(j, "depends_on")) b.dependsOn(strings(j.getJSONArray("depends_on")));
        if (has(j, "candidate_conferences")) b.candidateConferences(strings(j.getJSONArray("candidate_conferences")));
        if (has(j, "candidate_kinds")) {
            List<SubmissionKind> kinds = new ArrayList<>();
            for (String k : strings(j.getJSONArray("candidate_kinds"))) {
                kinds.add(SubmissionKind.fromString(k));
            }
            b.candidateKinds(kinds);
        }
        return b.build();
    }

    /**
     * Either a plain date array, or {"dates": [...], "custom_blackout_periods": [{"start", "end"}]}
     * with both period ends inclusive.
     */
    static List<LocalDate> blackouts(Object raw) {
        List<LocalDate> out = new ArrayList<>();
        if (raw instanceof JSONArray) {
            for (String s : strings((JSONArray) raw)) out.add(date(s));
            return out;
        }
        if (!(raw instanceof JSONObject)) {
            throw new ConfigurationException("blackout_dates must be an array or an object");
        }
        JSONObject o = (JSONObject) raw;
        if (o.has("dates")) {
            for (String s : strings(o.getJSONArray("dates"))) out.add(date(s));
        }
        if (o.has("custom_blackout_periods")) {
            JSONArray periods = o.getJSONArray("custom_blackout_periods");
            for (int i = 0; i < periods.length(); i++) {
                JSONObject p = periods.getJSONObject(i);
                LocalDate start = date(p.getString("start"));
                LocalDate end = date(p.getString("end"));
                if (end.isBefore(start)) {
                    throw new ConfigurationException("Blackout period ends before it starts: " + start + " to " + end);
                }
                for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) out.add(d);
            }
        }
        return out;
    }

    private static JSONObject readObject(Path path) throws IOException {
        Object v = readValue(path);
        if (!(v instanceof JSONObject)) {
            throw new ConfigurationException("Config " + path + " must hold a JSON object");
        }
        return (JSONObject) v;
    }

    private static Object readValue(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new JSONTokener(br).nextValue();
        } catch (JSONException e) {
            throw new ConfigurationException("Invalid JSON in " + path + ": " + e.getMessage(), e);
        }
    }

    private static boolean has(JSONObject j, String key) {
        return j.has(key) && !j.isNull(key);
    }

    private static LocalDate date(String raw) {
        return LocalDate.parse(raw.trim());
    }

    private static List<String> strings(JSONArray a) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < a.length(); i++) {
            out.add(a.getString(i));
        }
        return out;
    }

    private static Map<String, Double> doubles(JSONObject o) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String key : o.keySet()) {
            out.put(key, o.getDouble(key));
        }
        return out;
    }
}
