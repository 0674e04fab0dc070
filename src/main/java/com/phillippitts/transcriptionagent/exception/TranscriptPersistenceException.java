package com.phillippitts.transcriptionagent.exception;

import java.nio.file.Path;

/**
 * Thrown when a transcript file cannot be written.
 */
public class TranscriptPersistenceException extends TranscriptionAgentException {

    private final Path file;

    public TranscriptPersistenceException(Path file, Throwable cause) {
        super("Failed to write transcript file " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
