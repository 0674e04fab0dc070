package com.phillippitts.transcriptionagent.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Durable entry of a final transcript. Records are only ever appended, never rewritten.
 *
 * @param timestamp   when the transcript was finalized
 * @param participant human-readable label of the speaker
 * @param text        transcribed text (never blank)
 * @param room        name of the room the transcript belongs to
 */
public record TranscriptRecord(
        LocalDateTime timestamp,
        String participant,
        String text,
        String room
) {

    public TranscriptRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(participant, "participant");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(room, "room");
    }
}
