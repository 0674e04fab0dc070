package com.phillippitts.transcriptionagent.service.stt;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Event emitted by a {@link SpeechStream}.
 *
 * @param type         event kind
 * @param alternatives ranked hypotheses, best first; empty for {@link SpeechEventType#END_OF_SPEECH}
 */
public record SpeechEvent(SpeechEventType type, List<SpeechAlternative> alternatives) {

    public SpeechEvent {
        Objects.requireNonNull(type, "type");
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static SpeechEvent interim(String text, Double confidence) {
        return new SpeechEvent(SpeechEventType.INTERIM_TRANSCRIPT, List.of(new SpeechAlternative(text, confidence)));
    }

    public static SpeechEvent finalTranscript(String text, Double confidence) {
        return new SpeechEvent(SpeechEventType.FINAL_TRANSCRIPT, List.of(new SpeechAlternative(text, confidence)));
    }

    public static SpeechEvent endOfSpeech() {
        return new SpeechEvent(SpeechEventType.END_OF_SPEECH, List.of());
    }

    /** Best hypothesis, if the event carries any. */
    public Optional<SpeechAlternative> primary() {
        return alternatives.isEmpty() ? Optional.empty() : Optional.of(alternatives.get(0));
    }
}
