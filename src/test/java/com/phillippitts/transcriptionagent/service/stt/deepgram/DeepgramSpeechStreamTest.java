package com.phillippitts.transcriptionagent.service.stt.deepgram;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.room.AudioFrame;
import com.phillippitts.transcriptionagent.service.stt.SpeechEvent;
import com.phillippitts.transcriptionagent.service.stt.SpeechEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeepgramSpeechStreamTest {

    private static final String FINAL = "{\"type\":\"Results\",\"is_final\":true,\"speech_final\":true,"
            + "\"channel\":{\"alternatives\":[{\"transcript\":\"hello world\",\"confidence\":0.9}]}}";

    private WebSocket webSocket;
    private DeepgramSpeechStream stream;

    @BeforeEach
    void setUp() {
        webSocket = mock(WebSocket.class);
        when(webSocket.sendBinary(any(ByteBuffer.class), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(webSocket));
        when(webSocket.sendText(any(CharSequence.class), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(webSocket));
        stream = new DeepgramSpeechStream("deepgram", 48_000, 1);
        stream.onOpen(webSocket);
    }

    @Test
    void deliversParsedEventsUntilNormalClose() {
        stream.onText(webSocket, FINAL.substring(0, 20), false);
        stream.onText(webSocket, FINAL.substring(20), true);
        stream.onClose(webSocket, WebSocket.NORMAL_CLOSURE, "");

        assertThat(drain(stream.events())).extracting(SpeechEvent::type)
                .containsExactly(SpeechEventType.FINAL_TRANSCRIPT, SpeechEventType.END_OF_SPEECH);
    }

    @Test
    void sendsAudioAsBinaryAndEndsWithCloseStream() {
        stream.pushFrame(new AudioFrame(new byte[]{1, 2, 3, 4}, 48_000, 1, 2));
        stream.endInput();
        stream.endInput();

        verify(webSocket).sendBinary(any(ByteBuffer.class), eq(true));
        verify(webSocket).sendText(DeepgramSpeechStream.CLOSE_STREAM_MESSAGE, true);
    }

    @Test
    void abnormalCloseFailsIteration() {
        stream.onClose(webSocket, 1011, "internal error");

        Iterator<SpeechEvent> events = stream.events();
        assertThatThrownBy(events::hasNext)
                .isInstanceOf(SpeechEngineException.class)
                .hasMessageContaining("1011");
    }

    @Test
    void engineErrorMessageFailsIteration() {
        stream.onText(webSocket, "{\"type\":\"Error\",\"description\":\"bad audio\"}", true);

        assertThatThrownBy(() -> stream.events().hasNext()).isInstanceOf(SpeechEngineException.class);
    }

    @Test
    void closeEndsIterationAndSilencesSends() {
        stream.close();
        stream.close();

        assertThat(stream.events().hasNext()).isFalse();
        stream.pushFrame(new AudioFrame(new byte[2], 48_000, 1, 1));
        stream.endInput();

        verify(webSocket).abort();
        verify(webSocket, never()).sendBinary(any(ByteBuffer.class), anyBoolean());
        verify(webSocket, never()).sendText(any(CharSequence.class), anyBoolean());
    }

    @Test
    void frameInOtherFormatIsRejectedWithoutSending() {
        AudioFrame stereo16k = new AudioFrame(new byte[8], 16_000, 2, 2);

        assertThatThrownBy(() -> stream.pushFrame(stereo16k))
                .isInstanceOf(SpeechEngineException.class)
                .hasMessageContaining("16000 Hz/2 ch")
                .hasMessageContaining("48000 Hz/1 ch");
        verify(webSocket, never()).sendBinary(any(ByteBuffer.class), anyBoolean());
    }

    @Test
    void failedSendRaisesEngineException() {
        when(webSocket.sendBinary(any(ByteBuffer.class), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("broken pipe")));

        assertThatThrownBy(() -> stream.pushFrame(new AudioFrame(new byte[2], 48_000, 1, 1)))
                .isInstanceOf(SpeechEngineException.class)
                .hasRootCauseMessage("broken pipe");
    }

    private static List<SpeechEvent> drain(Iterator<SpeechEvent> events) {
        List<SpeechEvent> out = new ArrayList<>();
        events.forEachRemaining(out::add);
        return out;
    }
}
