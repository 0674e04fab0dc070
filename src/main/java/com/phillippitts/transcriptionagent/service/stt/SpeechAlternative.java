package com.phillippitts.transcriptionagent.service.stt;

import java.util.Objects;

/**
 * One ranked hypothesis of a transcript event.
 *
 * @param text       hypothesis text, may be empty
 * @param confidence engine confidence, or {@code null} when the engine does not report one
 */
public record SpeechAlternative(String text, Double confidence) {

    public SpeechAlternative {
        Objects.requireNonNull(text, "text");
    }
}
