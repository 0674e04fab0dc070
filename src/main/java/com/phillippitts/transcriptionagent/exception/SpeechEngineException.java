package com.phillippitts.transcriptionagent.exception;

/**
 * Thrown when a speech engine conversation fails.
 * This may occur while connecting, while sending audio, or when the engine reports an error.
 */
public class SpeechEngineException extends TranscriptionAgentException {

    private final String engineName;

    public SpeechEngineException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public SpeechEngineException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public SpeechEngineException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public SpeechEngineException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
