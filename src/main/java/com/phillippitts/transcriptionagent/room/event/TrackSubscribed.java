package com.phillippitts.transcriptionagent.room.event;

import com.phillippitts.transcriptionagent.room.RemoteParticipant;
import com.phillippitts.transcriptionagent.room.RemoteTrack;

import java.util.Objects;

/**
 * The agent subscribed to a participant's track.
 *
 * @param track       subscribed track
 * @param participant owner of the track
 */
public record TrackSubscribed(RemoteTrack track, RemoteParticipant participant) implements RoomEvent {

    public TrackSubscribed {
        Objects.requireNonNull(track, "track");
        Objects.requireNonNull(participant, "participant");
    }
}
