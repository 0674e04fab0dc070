package com.phillippitts.transcriptionagent.room.event;

import com.phillippitts.transcriptionagent.room.RemoteParticipant;

import java.util.Objects;

/**
 * A participant joined the room.
 *
 * @param participant the new participant
 */
public record ParticipantConnected(RemoteParticipant participant) implements RoomEvent {

    public ParticipantConnected {
        Objects.requireNonNull(participant, "participant");
    }
}
