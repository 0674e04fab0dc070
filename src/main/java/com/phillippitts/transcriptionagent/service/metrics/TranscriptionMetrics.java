package com.phillippitts.transcriptionagent.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the transcription pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Track session starts, failures and lifetime</li>
 *   <li>Transcripts broadcast to the room, split by interim/final</li>
 *   <li>Transcript records persisted</li>
 *   <li>Broadcast failures per message type</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranscriptionMetrics {

    private static final String METRIC_PREFIX = "agent";

    private final MeterRegistry registry;

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementSessionStarted() {
        Counter.builder(METRIC_PREFIX + ".sessions.started")
                .description("Number of track sessions started")
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for track sessions.
     *
     * @param reason simple class name of the failure cause
     */
    public void incrementSessionFailed(String reason) {
        Counter.builder(METRIC_PREFIX + ".sessions.failed")
                .description("Number of track sessions that ended with an error")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a track session lived.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordSessionDuration(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".sessions.duration")
                .description("Lifetime of track sessions")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTranscriptPublished(boolean isFinal) {
        Counter.builder(METRIC_PREFIX + ".transcripts.published")
                .description("Number of transcript messages broadcast to the room")
                .tag("final", Boolean.toString(isFinal))
                .register(registry)
                .increment();
    }

    public void incrementRecordPersisted() {
        Counter.builder(METRIC_PREFIX + ".transcripts.persisted")
                .description("Number of final transcripts appended to transcript files")
                .register(registry)
                .increment();
    }

    /**
     * Increments the broadcast failure counter.
     *
     * @param messageType wire type of the dropped message (transcription, agent_status)
     */
    public void incrementPublishFailure(String messageType) {
        Counter.builder(METRIC_PREFIX + ".publish.failure")
                .description("Number of messages dropped because the room rejected them")
                .tag("type", messageType)
                .register(registry)
                .increment();
    }
}
