package com.phillippitts.transcriptionagent.service.session.event;

import com.phillippitts.transcriptionagent.domain.TrackId;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a track session ends with an error.
 *
 * @param trackId     the failed session's track
 * @param participant speaker identity
 * @param reason      short description of the failure
 * @param cause       the underlying exception
 * @param at          when the session failed
 */
public record SessionFailedEvent(TrackId trackId, String participant, String reason, Throwable cause, Instant at) {

    public SessionFailedEvent {
        Objects.requireNonNull(trackId, "trackId");
        Objects.requireNonNull(participant, "participant");
        Objects.requireNonNull(at, "at");
        reason = reason == null ? "unknown" : reason;
    }
}
