package com.phillippitts.transcriptionagent.service.transcript;

import com.phillippitts.transcriptionagent.domain.HeartbeatMessage;
import com.phillippitts.transcriptionagent.domain.TranscriptMessage;
import org.json.JSONObject;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * JSON wire format of the agent's room messages.
 *
 * <p>Room messages are flat objects discriminated by {@code type}:
 * <ul>
 *   <li>{@code {"type":"transcription","text":..,"isFinal":..,"participant":..,"timestamp":..,"confidence":..}}</li>
 *   <li>{@code {"type":"agent_status","status":"active","processing_tracks":..,"timestamp":..}}</li>
 * </ul>
 * Timestamps are ISO-8601 local date-times.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class TranscriptJson {

    public static final String TYPE_TRANSCRIPTION = "transcription";
    public static final String TYPE_AGENT_STATUS = "agent_status";

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private TranscriptJson() {
        // Utility class - prevent instantiation
    }

    public static JSONObject toJson(TranscriptMessage message) {
        JSONObject obj = new JSONObject();
        obj.put("type", TYPE_TRANSCRIPTION);
        obj.put("text", message.text());
        obj.put("isFinal", message.isFinal());
        obj.put("participant", message.participantIdentity());
        obj.put("timestamp", format(message.timestamp()));
        // Absent confidence is sent as an explicit null
        obj.put("confidence", message.confidence() == null ? JSONObject.NULL : message.confidence());
        return obj;
    }

    public static JSONObject toJson(HeartbeatMessage message) {
        JSONObject obj = new JSONObject();
        obj.put("type", TYPE_AGENT_STATUS);
        obj.put("status", "active");
        obj.put("processing_tracks", message.activeSessionCount());
        obj.put("timestamp", format(message.timestamp()));
        return obj;
    }

    static String format(LocalDateTime timestamp) {
        return TIMESTAMP_FORMAT.format(timestamp);
    }
}
