package com.phillippitts.transcriptionagent.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsShareUncheckedBase() {
        assertThat(new SpeechEngineException("x")).isInstanceOf(TranscriptionAgentException.class);
        assertThat(new RoomConnectionException("standup", null)).isInstanceOf(TranscriptionAgentException.class);
        assertThat(new TranscriptPersistenceException(Path.of("t.json"), null))
                .isInstanceOf(TranscriptionAgentException.class);
        assertThat(new TranscriptionAgentException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void speechEngineExceptionCarriesEngineName() {
        SpeechEngineException named = new SpeechEngineException("closed with 1011", "deepgram");
        SpeechEngineException unnamed = new SpeechEngineException("boom", new IOException("reset"));

        assertThat(named.getEngineName()).isEqualTo("deepgram");
        assertThat(named.getMessage()).contains("closed with 1011").contains("deepgram");
        assertThat(unnamed.getEngineName()).isEqualTo("unknown");
        assertThat(unnamed.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    void persistenceAndConnectionExceptionsKeepContext() {
        Path file = Path.of("transcripts", "standup_2024-03-15.json");
        TranscriptPersistenceException tpe = new TranscriptPersistenceException(file, new IOException("disk full"));
        RoomConnectionException rce = new RoomConnectionException("standup", new IllegalStateException("401"));

        assertThat(tpe.getFile()).isEqualTo(file);
        assertThat(tpe.getMessage()).contains("standup_2024-03-15.json");
        assertThat(rce.getRoomName()).isEqualTo("standup");
        assertThat(rce.getCause()).hasMessage("401");
    }
}
