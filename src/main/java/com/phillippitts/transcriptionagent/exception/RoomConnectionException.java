package com.phillippitts.transcriptionagent.exception;

/**
 * Thrown when the agent cannot attach to its room at startup.
 * This is the only failure treated as fatal for the process.
 */
public class RoomConnectionException extends TranscriptionAgentException {

    private final String roomName;

    public RoomConnectionException(String roomName, Throwable cause) {
        super("Failed to connect to room '" + roomName + "'", cause);
        this.roomName = roomName;
    }

    public String getRoomName() {
        return roomName;
    }
}
