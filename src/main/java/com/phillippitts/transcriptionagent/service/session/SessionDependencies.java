package com.phillippitts.transcriptionagent.service.session;

import com.phillippitts.transcriptionagent.service.metrics.TranscriptionMetrics;
import com.phillippitts.transcriptionagent.service.stt.SpeechEngine;
import com.phillippitts.transcriptionagent.service.transcript.TranscriptStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Groups the shared collaborators every track session needs, so room-level classes
 * pass one object instead of seven.
 */
@Component
public final class SessionDependencies {
    private final SpeechEngine speechEngine;
    private final TranscriptStore transcriptStore;
    private final SessionRegistry sessionRegistry;
    private final Executor sessionExecutor;
    private final TranscriptionMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public SessionDependencies(SpeechEngine speechEngine,
                               TranscriptStore transcriptStore,
                               SessionRegistry sessionRegistry,
                               @Qualifier("sessionExecutor") Executor sessionExecutor,
                               TranscriptionMetrics metrics,
                               ApplicationEventPublisher eventPublisher,
                               Clock clock) {
        this.speechEngine = Objects.requireNonNull(speechEngine, "speechEngine");
        this.transcriptStore = Objects.requireNonNull(transcriptStore, "transcriptStore");
        this.sessionRegistry = Objects.requireNonNull(sessionRegistry, "sessionRegistry");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SpeechEngine getSpeechEngine() {
        return speechEngine;
    }

    public TranscriptStore getTranscriptStore() {
        return transcriptStore;
    }

    public SessionRegistry getSessionRegistry() {
        return sessionRegistry;
    }

    public Executor getSessionExecutor() {
        return sessionExecutor;
    }

    public TranscriptionMetrics getMetrics() {
        return metrics;
    }

    public ApplicationEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    public Clock getClock() {
        return clock;
    }
}
