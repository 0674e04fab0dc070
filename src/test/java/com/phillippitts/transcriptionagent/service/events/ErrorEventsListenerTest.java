package com.phillippitts.transcriptionagent.service.events;

import com.phillippitts.transcriptionagent.domain.TrackId;
import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.exception.TranscriptPersistenceException;
import com.phillippitts.transcriptionagent.service.session.event.SessionFailedEvent;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        assertThat(l.shouldLog("speech-engine-deepgram")).isTrue();
        assertThat(l.shouldLog("speech-engine-deepgram")).isFalse();
        assertThat(l.shouldLog("persistence")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();
        TrackId id = TrackId.of("PA_1", "TR_1");

        assertThatCode(() -> {
            l.onSessionFailed(new SessionFailedEvent(id, "alice", "auth",
                    new SpeechEngineException("401", "deepgram"), Instant.now()));
            l.onSessionFailed(new SessionFailedEvent(id, "alice", "disk full",
                    new TranscriptPersistenceException(Path.of("transcripts/x.json"), new IOException("full")),
                    Instant.now()));
            l.onSessionFailed(new SessionFailedEvent(id, "alice", null, null, Instant.now()));
        }).doesNotThrowAnyException();
    }

    @Test
    void failureEventDefaultsMissingReason() {
        SessionFailedEvent e = new SessionFailedEvent(TrackId.of("PA_1", "TR_1"), "alice", null, null, Instant.now());

        assertThat(e.reason()).isEqualTo("unknown");
    }
}
