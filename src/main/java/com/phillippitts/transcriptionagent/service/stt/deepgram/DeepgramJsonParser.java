package com.phillippitts.transcriptionagent.service.stt.deepgram;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.service.stt.SpeechAlternative;
import com.phillippitts.transcriptionagent.service.stt.SpeechEvent;
import com.phillippitts.transcriptionagent.service.stt.SpeechEventType;
import com.phillippitts.transcriptionagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates Deepgram live-streaming JSON messages into {@link SpeechEvent}s.
 *
 * <p>Message mapping:
 * <ul>
 *   <li>{@code Results} with {@code is_final=false} - interim transcript</li>
 *   <li>{@code Results} with {@code is_final=true} - final transcript, followed by end of speech
 *       when {@code speech_final=true}</li>
 *   <li>{@code UtteranceEnd} - end of speech</li>
 *   <li>{@code Error} - {@link SpeechEngineException}</li>
 *   <li>anything else ({@code Metadata}, {@code SpeechStarted}) - ignored</li>
 * </ul>
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
final class DeepgramJsonParser {

    private static final Logger LOG = LogManager.getLogger(DeepgramJsonParser.class);

    private DeepgramJsonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one text frame.
     *
     * @return events in the order they must be delivered; empty for ignored or malformed messages
     * @throws SpeechEngineException if the message reports an engine error
     */
    static List<SpeechEvent> parse(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed Deepgram message: {}", LogSanitizer.truncate(json, 200));
            return List.of();
        }

        String type = obj.optString("type", "");
        return switch (type) {
            case "Results" -> parseResults(obj);
            case "UtteranceEnd" -> List.of(SpeechEvent.endOfSpeech());
            case "Error" -> throw new SpeechEngineException(
                    "Engine reported error: " + obj.optString("description", obj.optString("message", "unknown")),
                    DeepgramSpeechEngine.ENGINE_NAME);
            default -> {
                LOG.debug("Ignoring Deepgram message of type '{}'", type);
                yield List.of();
            }
        };
    }

    private static List<SpeechEvent> parseResults(JSONObject obj) {
        List<SpeechAlternative> alternatives = new ArrayList<>();
        JSONObject channel = obj.optJSONObject("channel");
        JSONArray alts = channel == null ? null : channel.optJSONArray("alternatives");
        if (alts != null) {
            for (int i = 0; i < alts.length(); i++) {
                JSONObject alt = alts.optJSONObject(i);
                if (alt == null) {
                    continue;
                }
                Double confidence = alt.has("confidence") && !alt.isNull("confidence")
                        ? alt.getDouble("confidence")
                        : null;
                alternatives.add(new SpeechAlternative(alt.optString("transcript", ""), confidence));
            }
        }

        List<SpeechEvent> events = new ArrayList<>(2);
        boolean isFinal = obj.optBoolean("is_final", false);
        if (!alternatives.isEmpty()) {
            SpeechEventType kind = isFinal ? SpeechEventType.FINAL_TRANSCRIPT : SpeechEventType.INTERIM_TRANSCRIPT;
            events.add(new SpeechEvent(kind, alternatives));
        }
        if (isFinal && obj.optBoolean("speech_final", false)) {
            events.add(SpeechEvent.endOfSpeech());
        }
        return events;
    }
}
