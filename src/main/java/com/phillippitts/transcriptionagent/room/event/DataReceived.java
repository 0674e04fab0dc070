package com.phillippitts.transcriptionagent.room.event;

import com.phillippitts.transcriptionagent.room.RemoteParticipant;

import java.util.Objects;

/**
 * A data packet arrived on the room's data channel.
 *
 * @param topic       packet topic, may be empty
 * @param payload     raw bytes
 * @param participant sender, or {@code null} when sent by the server
 */
public record DataReceived(String topic, byte[] payload, RemoteParticipant participant) implements RoomEvent {

    public DataReceived {
        topic = topic == null ? "" : topic;
        Objects.requireNonNull(payload, "payload");
    }
}
