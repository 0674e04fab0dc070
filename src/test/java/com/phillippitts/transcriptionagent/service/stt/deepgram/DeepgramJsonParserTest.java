package com.phillippitts.transcriptionagent.service.stt.deepgram;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.service.stt.SpeechEvent;
import com.phillippitts.transcriptionagent.service.stt.SpeechEventType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeepgramJsonParserTest {

    @Test
    void interimResult() {
        List<SpeechEvent> events = DeepgramJsonParser.parse(results("hel", 0.61, false, false));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(SpeechEventType.INTERIM_TRANSCRIPT);
            assertThat(e.primary()).get().satisfies(a -> {
                assertThat(a.text()).isEqualTo("hel");
                assertThat(a.confidence()).isEqualTo(0.61);
            });
        });
    }

    @Test
    void finalResultWithoutEndpoint() {
        List<SpeechEvent> events = DeepgramJsonParser.parse(results("hello world", 0.98, true, false));

        assertThat(events).extracting(SpeechEvent::type).containsExactly(SpeechEventType.FINAL_TRANSCRIPT);
    }

    @Test
    void speechFinalAddsEndOfSpeechAfterFinal() {
        List<SpeechEvent> events = DeepgramJsonParser.parse(results("hello world", 0.98, true, true));

        assertThat(events).extracting(SpeechEvent::type)
                .containsExactly(SpeechEventType.FINAL_TRANSCRIPT, SpeechEventType.END_OF_SPEECH);
    }

    @Test
    void utteranceEndIsEndOfSpeech() {
        List<SpeechEvent> events = DeepgramJsonParser.parse("{\"type\":\"UtteranceEnd\",\"channel\":[0,1],\"last_word_end\":2.4}");

        assertThat(events).extracting(SpeechEvent::type).containsExactly(SpeechEventType.END_OF_SPEECH);
    }

    @Test
    void missingConfidenceStaysAbsent() {
        String json = "{\"type\":\"Results\",\"is_final\":true,"
                + "\"channel\":{\"alternatives\":[{\"transcript\":\"no score\"}]}}";

        assertThat(DeepgramJsonParser.parse(json).get(0).primary()).get()
                .satisfies(a -> assertThat(a.confidence()).isNull());
    }

    @Test
    void emptyTranscriptIsPassedThrough() {
        // Blank text is filtered by the session, not here
        List<SpeechEvent> events = DeepgramJsonParser.parse(results("", 0.0, false, false));

        assertThat(events).singleElement().satisfies(e -> assertThat(e.primary()).get()
                .satisfies(a -> assertThat(a.text()).isEmpty()));
    }

    @Test
    void metadataAndSpeechStartedAreIgnored() {
        assertThat(DeepgramJsonParser.parse("{\"type\":\"Metadata\",\"request_id\":\"abc\"}")).isEmpty();
        assertThat(DeepgramJsonParser.parse("{\"type\":\"SpeechStarted\",\"timestamp\":0.5}")).isEmpty();
    }

    @Test
    void malformedJsonIsIgnored() {
        assertThat(DeepgramJsonParser.parse("{\"type\":\"Results\",")).isEmpty();
        assertThat(DeepgramJsonParser.parse("")).isEmpty();
        assertThat(DeepgramJsonParser.parse(null)).isEmpty();
    }

    @Test
    void errorMessageRaisesEngineException() {
        assertThatThrownBy(() -> DeepgramJsonParser.parse(
                "{\"type\":\"Error\",\"description\":\"Invalid credentials\",\"message\":\"AUTH\"}"))
                .isInstanceOf(SpeechEngineException.class)
                .hasMessageContaining("Invalid credentials")
                .satisfies(e -> assertThat(((SpeechEngineException) e).getEngineName()).isEqualTo("deepgram"));
    }

    private static String results(String transcript, double confidence, boolean isFinal, boolean speechFinal) {
        return "{\"type\":\"Results\",\"is_final\":" + isFinal + ",\"speech_final\":" + speechFinal
                + ",\"channel\":{\"alternatives\":[{\"transcript\":\"" + transcript + "\",\"confidence\":"
                + confidence + "}]}}";
    }
}
