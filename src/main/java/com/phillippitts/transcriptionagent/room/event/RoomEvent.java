package com.phillippitts.transcriptionagent.room.event;

/**
 * Marker for notifications delivered by a {@link com.phillippitts.transcriptionagent.room.RoomEventStream}.
 */
public interface RoomEvent {
}
