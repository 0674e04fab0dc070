package com.phillippitts.transcriptionagent.service.stt.deepgram;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.room.AudioFrame;
import com.phillippitts.transcriptionagent.service.stt.SpeechEvent;
import com.phillippitts.transcriptionagent.service.stt.SpeechStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One Deepgram live conversation over a WebSocket.
 *
 * <p>The WebSocket listener callbacks feed an inbox queue; {@link #events()} drains it on the
 * session's draining thread. Sends happen only on the forwarding thread and are awaited one by
 * one, so at most one outgoing message is in flight.
 *
 * <p>The connection is opened for one PCM format ({@code sample_rate}, {@code channels}). A frame
 * in any other format is rejected with a {@link SpeechEngineException} instead of being sent.
 */
final class DeepgramSpeechStream implements SpeechStream, WebSocket.Listener {

    private static final Logger LOG = LogManager.getLogger(DeepgramSpeechStream.class);

    static final String CLOSE_STREAM_MESSAGE = "{\"type\":\"CloseStream\"}";

    private static final Object END = new Object();

    private final String engineName;
    private final int sampleRate;
    private final int channels;
    private final BlockingQueue<Object> inbox = new LinkedBlockingQueue<>();
    private final StringBuilder partialText = new StringBuilder();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean inputEnded = new AtomicBoolean(false);
    private final Iterator<SpeechEvent> events = new InboxIterator();

    private volatile WebSocket webSocket;

    DeepgramSpeechStream(String engineName, int sampleRate, int channels) {
        this.engineName = engineName;
        this.sampleRate = sampleRate;
        this.channels = channels;
    }

    void attach(WebSocket webSocket) {
        this.webSocket = webSocket;
    }

    @Override
    public void pushFrame(AudioFrame frame) {
        if (closed.get() || inputEnded.get()) {
            return;
        }
        if (frame.sampleRate() != sampleRate || frame.numChannels() != channels) {
            throw new SpeechEngineException("Audio frame format " + frame.sampleRate() + " Hz/"
                    + frame.numChannels() + " ch does not match stream format " + sampleRate + " Hz/"
                    + channels + " ch", engineName);
        }
        await(webSocket.sendBinary(ByteBuffer.wrap(frame.data()), true), "send audio");
    }

    @Override
    public void endInput() {
        if (closed.get() || !inputEnded.compareAndSet(false, true)) {
            return;
        }
        await(webSocket.sendText(CLOSE_STREAM_MESSAGE, true), "finalize stream");
    }

    @Override
    public Iterator<SpeechEvent> events() {
        return events;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        WebSocket ws = webSocket;
        if (ws != null) {
            ws.abort();
        }
        inbox.offer(END);
    }

    // WebSocket.Listener

    @Override
    public void onOpen(WebSocket webSocket) {
        this.webSocket = webSocket;
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        partialText.append(data);
        if (last) {
            String message = partialText.toString();
            partialText.setLength(0);
            try {
                DeepgramJsonParser.parse(message).forEach(inbox::offer);
            } catch (SpeechEngineException e) {
                inbox.offer(e);
            }
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        LOG.debug("Deepgram connection closed: status={}, reason={}", statusCode, reason);
        if (statusCode != WebSocket.NORMAL_CLOSURE && !closed.get()) {
            inbox.offer(new SpeechEngineException(
                    "Connection closed with status " + statusCode + " " + reason, engineName));
        }
        inbox.offer(END);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        if (!closed.get()) {
            inbox.offer(new SpeechEngineException("Connection failed", engineName, error));
        }
        inbox.offer(END);
    }

    private void await(CompletableFuture<WebSocket> send, String action) {
        try {
            send.join();
        } catch (CompletionException e) {
            if (closed.get()) {
                return;
            }
            throw new SpeechEngineException("Failed to " + action, engineName, e.getCause());
        }
    }

    private final class InboxIterator implements Iterator<SpeechEvent> {
        private SpeechEvent next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished || closed.get()) {
                finished = true;
                return false;
            }
            Object item;
            try {
                item = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finished = true;
                return false;
            }
            if (item == END || closed.get()) {
                finished = true;
                return false;
            }
            if (item instanceof SpeechEngineException failure) {
                finished = true;
                throw failure;
            }
            next = (SpeechEvent) item;
            return true;
        }

        @Override
        public SpeechEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SpeechEvent current = next;
            next = null;
            return current;
        }
    }
}
