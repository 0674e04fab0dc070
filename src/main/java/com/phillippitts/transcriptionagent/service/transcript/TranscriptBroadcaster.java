package com.phillippitts.transcriptionagent.service.transcript;

import com.phillippitts.transcriptionagent.domain.HeartbeatMessage;
import com.phillippitts.transcriptionagent.domain.TranscriptMessage;
import com.phillippitts.transcriptionagent.room.DistributionSink;
import com.phillippitts.transcriptionagent.service.metrics.TranscriptionMetrics;
import com.phillippitts.transcriptionagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Serializes agent messages and broadcasts them reliably to every participant of a room.
 *
 * <p>Delivery is fire-and-forget: a rejected publish is logged and counted, never rethrown,
 * so a flaky data channel cannot end a track session or stop the heartbeat.
 */
public class TranscriptBroadcaster {

    private static final Logger LOG = LogManager.getLogger(TranscriptBroadcaster.class);

    private final DistributionSink sink;
    private final TranscriptionMetrics metrics;

    public TranscriptBroadcaster(DistributionSink sink, TranscriptionMetrics metrics) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Broadcasts an interim or final transcript.
     *
     * @return {@code true} if the room accepted the message
     */
    public boolean publishTranscript(TranscriptMessage message) {
        boolean sent = publish(TranscriptJson.toJson(message), TranscriptJson.TYPE_TRANSCRIPTION);
        if (!sent) {
            return false;
        }
        metrics.incrementTranscriptPublished(message.isFinal());
        if (message.isFinal()) {
            LOG.info("[{}]: {}", message.participantIdentity(), LogSanitizer.preview(message.text()));
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("[{}] (interim): {}", message.participantIdentity(), LogSanitizer.preview(message.text()));
        }
        return true;
    }

    /**
     * Broadcasts a status heartbeat.
     *
     * @return {@code true} if the room accepted the message
     */
    public boolean publishHeartbeat(HeartbeatMessage message) {
        return publish(TranscriptJson.toJson(message), TranscriptJson.TYPE_AGENT_STATUS);
    }

    private boolean publish(JSONObject json, String messageType) {
        byte[] payload = json.toString().getBytes(StandardCharsets.UTF_8);
        try {
            sink.publish(payload, true);
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish {} message ({} bytes): {}", messageType, payload.length, e.toString());
            metrics.incrementPublishFailure(messageType);
            return false;
        }
    }
}
