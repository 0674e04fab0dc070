package com.phillippitts.transcriptionagent.domain;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Outbound, fire-and-forget transcript broadcast to every room participant.
 *
 * @param text                transcribed text (never blank)
 * @param isFinal             {@code true} for a confirmed utterance, {@code false} for a provisional one
 * @param participantIdentity human-readable label of the speaker
 * @param timestamp           when the message was produced
 * @param confidence          engine confidence, or {@code null} when the engine supplied none
 */
public record TranscriptMessage(
        String text,
        boolean isFinal,
        String participantIdentity,
        LocalDateTime timestamp,
        Double confidence
) {

    public TranscriptMessage {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(participantIdentity, "participantIdentity");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public OptionalDouble confidenceScore() {
        return confidence == null ? OptionalDouble.empty() : OptionalDouble.of(confidence);
    }
}
