package com.phillippitts.transcriptionagent.service.stt.deepgram;

import com.phillippitts.transcriptionagent.config.stt.DeepgramProperties;
import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.service.stt.AbstractSpeechEngine;
import com.phillippitts.transcriptionagent.service.stt.SpeechStream;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Speech engine backed by the Deepgram live streaming API.
 *
 * <p>Each {@link #openStream()} opens one WebSocket to the configured listen endpoint. Audio is
 * sent as raw 16-bit little-endian PCM ({@code encoding=linear16}) in binary frames; results
 * arrive as JSON text frames and are translated by {@link DeepgramJsonParser}.
 *
 * <p>Without an API key the engine logs a warning at startup and stays unhealthy; every
 * session then fails fast when it tries to open a stream.
 */
@Component
public class DeepgramSpeechEngine extends AbstractSpeechEngine {

    private static final Logger LOG = LogManager.getLogger(DeepgramSpeechEngine.class);

    public static final String ENGINE_NAME = "deepgram";

    private final DeepgramProperties props;
    private final HttpClient httpClient;

    @Autowired
    public DeepgramSpeechEngine(DeepgramProperties props) {
        this(props, HttpClient.newBuilder().connectTimeout(props.getConnectTimeout()).build());
    }

    DeepgramSpeechEngine(DeepgramProperties props, HttpClient httpClient) {
        this.props = Objects.requireNonNull(props, "props");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @PostConstruct
    void initializeAtStartup() {
        try {
            initialize();
        } catch (SpeechEngineException e) {
            LOG.warn("Deepgram engine unavailable: {}. Set DEEPGRAM_API_KEY to enable transcription.",
                    e.getMessage());
        }
    }

    @Override
    protected void doInitialize() {
        LOG.info("Initializing Deepgram engine: url={}, model={}, language={}, sampleRate={}, channels={}",
                props.getUrl(), props.getModel(), props.getLanguage(), props.getSampleRate(), props.getChannels());
        if (!props.hasApiKey()) {
            throw new SpeechEngineException("No API key configured (stt.deepgram.api-key)", ENGINE_NAME);
        }
        LOG.info("Deepgram engine initialized");
    }

    @Override
    protected void doClose() {
        LOG.info("Deepgram engine closed");
    }

    @Override
    public SpeechStream openStream() {
        ensureInitialized();
        URI uri = buildUri();
        DeepgramSpeechStream stream = new DeepgramSpeechStream(ENGINE_NAME, props.getSampleRate(), props.getChannels());
        long timeoutMs = props.getConnectTimeout().toMillis();
        CompletableFuture<WebSocket> connecting = httpClient.newWebSocketBuilder()
                .header("Authorization", "Token " + props.getApiKey())
                .connectTimeout(props.getConnectTimeout())
                .buildAsync(uri, stream);
        try {
            WebSocket webSocket = connecting.get(timeoutMs, TimeUnit.MILLISECONDS);
            stream.attach(webSocket);
            LOG.debug("Opened Deepgram stream to {}", uri.getHost());
            return stream;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortWhenConnected(connecting);
            throw new SpeechEngineException("Interrupted while connecting", ENGINE_NAME, e);
        } catch (ExecutionException e) {
            throw new SpeechEngineException("Failed to connect: " + e.getCause(), ENGINE_NAME, e.getCause());
        } catch (TimeoutException e) {
            abortWhenConnected(connecting);
            throw new SpeechEngineException("Connection timed out after " + timeoutMs + "ms", ENGINE_NAME, e);
        }
    }

    // A handshake that completes after we gave up must not leave the socket open
    private static void abortWhenConnected(CompletableFuture<WebSocket> connecting) {
        connecting.whenComplete((ws, failure) -> {
            if (ws != null) {
                ws.abort();
            }
        });
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    /** Visible for tests */
    URI buildUri() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("model", props.getModel());
        params.put("language", props.getLanguage());
        params.put("punctuate", Boolean.toString(props.isPunctuate()));
        params.put("interim_results", Boolean.toString(props.isInterimResults()));
        params.put("encoding", "linear16");
        params.put("sample_rate", Integer.toString(props.getSampleRate()));
        params.put("channels", Integer.toString(props.getChannels()));
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return URI.create(props.getUrl() + "?" + query);
    }
}
