package com.phillippitts.transcriptionagent.service.events;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.exception.TranscriptPersistenceException;
import com.phillippitts.transcriptionagent.service.session.event.SessionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns session failures into operator hints. Throttled per failure kind to avoid log spam when
 * every track of a room fails for the same reason.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSessionFailed(SessionFailedEvent e) {
        Throwable cause = e.cause();
        if (cause instanceof SpeechEngineException see) {
            if (shouldLog("speech-engine-" + see.getEngineName())) {
                LOG.warn("Speech engine '{}' failed for track {}. Check DEEPGRAM_API_KEY and network access "
                        + "to the recognition service.", see.getEngineName(), e.trackId());
            }
        } else if (cause instanceof TranscriptPersistenceException tpe) {
            if (shouldLog("persistence")) {
                LOG.warn("Cannot write transcript file {}. Check agent.transcript-dir permissions and free disk space.",
                        tpe.getFile());
            }
        } else {
            String kind = cause == null ? "unknown" : cause.getClass().getSimpleName();
            if (shouldLog("session-" + kind)) {
                LOG.warn("Track session {} of {} failed: {}", e.trackId(), e.participant(), e.reason());
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
