package com.phillippitts.transcriptionagent.domain;

import java.util.Objects;

/**
 * Identity of one transcribable audio source: the participant that publishes it and the track itself.
 *
 * @param participantSid server-assigned participant identifier
 * @param trackSid       server-assigned track identifier
 */
public record TrackId(String participantSid, String trackSid) {

    public TrackId {
        Objects.requireNonNull(participantSid, "participantSid");
        Objects.requireNonNull(trackSid, "trackSid");
    }

    public static TrackId of(String participantSid, String trackSid) {
        return new TrackId(participantSid, trackSid);
    }

    @Override
    public String toString() {
        return participantSid + "_" + trackSid;
    }
}
