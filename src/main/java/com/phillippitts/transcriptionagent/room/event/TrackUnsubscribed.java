package com.phillippitts.transcriptionagent.room.event;

import com.phillippitts.transcriptionagent.room.RemoteParticipant;
import com.phillippitts.transcriptionagent.room.RemoteTrack;

import java.util.Objects;

/**
 * A track the agent was subscribed to went away.
 *
 * @param track       unsubscribed track
 * @param participant owner of the track
 */
public record TrackUnsubscribed(RemoteTrack track, RemoteParticipant participant) implements RoomEvent {

    public TrackUnsubscribed {
        Objects.requireNonNull(track, "track");
        Objects.requireNonNull(participant, "participant");
    }
}
