package com.phillippitts.transcriptionagent.room.event;

/**
 * The connection to the room ended. No further events follow.
 *
 * @param reason transport-provided reason, may be empty
 */
public record RoomDisconnected(String reason) implements RoomEvent {
}
