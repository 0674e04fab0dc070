package com.phillippitts.transcriptionagent.exception;

/**
 * Base exception for all transcription agent application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TranscriptionAgentException extends RuntimeException {

    public TranscriptionAgentException(String message) {
        super(message);
    }

    public TranscriptionAgentException(String message, Throwable cause) {
        super(message, cause);
    }

    public TranscriptionAgentException(Throwable cause) {
        super(cause);
    }
}
