package com.phillippitts.transcriptionagent.testutil;

import com.phillippitts.transcriptionagent.service.metrics.TranscriptionMetrics;
import com.phillippitts.transcriptionagent.service.session.SessionDependencies;
import com.phillippitts.transcriptionagent.service.session.SessionRegistry;
import com.phillippitts.transcriptionagent.service.stt.SpeechEngine;
import com.phillippitts.transcriptionagent.service.transcript.TranscriptStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executor;

/**
 * Builds SessionDependencies wired to test doubles and an in-memory meter registry.
 */
public final class TestSessionDependencies {

    /** 2024-03-15T10:15:30 UTC */
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:15:30Z"), ZoneOffset.UTC);

    private TestSessionDependencies() {
    }

    public static SessionDependencies create(SpeechEngine engine,
                                             TranscriptStore store,
                                             SessionRegistry registry,
                                             Executor sessionExecutor,
                                             EventCapturingPublisher publisher) {
        return new SessionDependencies(engine, store, registry, sessionExecutor,
                new TranscriptionMetrics(new SimpleMeterRegistry()), publisher, FIXED_CLOCK);
    }
}
