package planner.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planner.model.Conference;
import planner.model.Config;
import planner.model.Submission;
import planner.model.SubmissionKind;
import planner.validation.VenueValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binds submissions without a conference_id to the first suitable candidate conference.
 * Runs at the config boundary and returns a new {@link Config}; the input is left untouched.
 */
public final class ConferenceAssigner {

    private static final Logger LOG = LoggerFactory.getLogger(ConferenceAssigner.class);

    private ConferenceAssigner() {
    }

    public static Config assign(Config config) {
        List<Submission> out = new ArrayList<>();
        int assigned = 0;
        for (Submission s : config.getSubmissions()) {
            if (s.getConferenceId().isPresent() || s.getCandidateConferences().isEmpty()) {
                out.add(s);
                continue;
            }
            Optional<Submission> bound = bind(s, config);
            if (bound.isPresent()) {
                out.add(bound.get());
                assigned++;
                LOG.debug("Assigned {} to {}", s.getId(), bound.get().getConferenceId().get());
            } else {
                out.add(s);
                LOG.debug("No candidate conference fits {}", s.getId());
            }
        }
        if (assigned == 0) {
            return config;
        }
        LOG.info("Assigned {} submission(s) to candidate conferences", assigned);
        return config.toBuilder().submissions(out).build();
    }

    static Optional<Submission> bind(Submission s, Config config) {
        List<SubmissionKind> kinds = s.getCandidateKinds().isEmpty() ? List.of(s.getKind()) : s.getCandidateKinds();
        for (String confId : s.getCandidateConferences()) {
            Optional<Conference> conf = config.getConference(confId);
            if (conf.isEmpty() || !VenueValidator.typeCompatible(s, conf.get())) {
                continue;
            }
            for (SubmissionKind k : kinds) {
                if (conf.get().accepts(k) && conf.get().getDeadline(k).isPresent()) {
                    return Optional.of(s.withConference(confId, k));
                }
            }
        }
        return Optional.empty();
    }
}
