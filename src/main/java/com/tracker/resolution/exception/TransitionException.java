package com.tracker.resolution.exception;

import com.tracker.resolution.core.model.Candidate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a status change is not permitted by the tracker's workflow.
 */
public final class TransitionException extends ResolutionException {

    private final int trackerId;
    private final String trackerName;
    private final Candidate from;
    private final Candidate to;
    private final List<Candidate> allowed;

    public TransitionException(int trackerId, String trackerName, Candidate from, Candidate to,
                               List<Candidate> allowed) {
        super(ErrorKind.TRANSITION, buildMessage(trackerName, from, to, allowed));
        this.trackerId = trackerId;
        this.trackerName = trackerName;
        this.from = from;
        this.to = to;
        this.allowed = List.copyOf(allowed);
    }

    private static String buildMessage(String trackerName, Candidate from, Candidate to,
                                       List<Candidate> allowed) {
        if (allowed.isEmpty()) {
            return String.format("cannot change %s from '%s' to '%s': no transitions allowed from '%s'",
                    trackerName, from.name(), to.name(), from.name());
        }
        return String.format("cannot change %s from '%s' to '%s'. Allowed: %s",
                trackerName, from.name(), to.name(),
                allowed.stream().map(Candidate::name).collect(Collectors.joining(", ")));
    }

    public int getTrackerId() {
        return trackerId;
    }

    public String getTrackerName() {
        return trackerName;
    }

    public Candidate getFrom() {
        return from;
    }

    public Candidate getTo() {
        return to;
    }

    public List<Candidate> getAllowed() {
        return allowed;
    }
}
