package com.phillippitts.transcriptionagent.room;

/**
 * Transport-specific entry point. Provide an implementation as a Spring bean to attach the
 * agent to a real room.
 */
public interface RoomConnector {

    /**
     * Connects the agent to a room.
     *
     * @param roomName requested room, or {@code null} to let the transport assign one
     * @return the connected room
     * @throws RuntimeException if the connection cannot be established
     */
    Room connect(String roomName);
}
