package com.phillippitts.transcriptionagent.service.transcript;

import com.phillippitts.transcriptionagent.domain.HeartbeatMessage;
import com.phillippitts.transcriptionagent.domain.TranscriptMessage;
import com.phillippitts.transcriptionagent.room.DistributionSink;
import com.phillippitts.transcriptionagent.service.metrics.TranscriptionMetrics;
import com.phillippitts.transcriptionagent.testutil.FakeRoom;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TranscriptBroadcasterTest {

    private static final LocalDateTime AT = LocalDateTime.of(2024, 3, 15, 10, 15, 30);

    private MeterRegistry registry;
    private TranscriptionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TranscriptionMetrics(registry);
    }

    @Test
    void publishesReliablyAsUtf8Json() {
        DistributionSink sink = mock(DistributionSink.class);
        TranscriptBroadcaster broadcaster = new TranscriptBroadcaster(sink, metrics);

        boolean sent = broadcaster.publishTranscript(new TranscriptMessage("grüß dich", true, "jörg", AT, null));

        assertThat(sent).isTrue();
        verify(sink).publish(any(byte[].class), eq(true));
    }

    @Test
    void countsPublishedTranscriptsByFinality() {
        FakeRoom room = new FakeRoom("standup");
        TranscriptBroadcaster broadcaster = new TranscriptBroadcaster(room, metrics);

        broadcaster.publishTranscript(new TranscriptMessage("hel", false, "alice", AT, null));
        broadcaster.publishTranscript(new TranscriptMessage("hello", true, "alice", AT, 0.9));

        assertThat(room.publishedJson()).hasSize(2);
        assertThat(registry.find("agent.transcripts.published").tag("final", "true").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("agent.transcripts.published").tag("final", "false").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void rejectedPublishIsSwallowedAndCounted() {
        FakeRoom room = new FakeRoom("standup");
        room.failPublish = true;
        TranscriptBroadcaster broadcaster = new TranscriptBroadcaster(room, metrics);

        boolean transcriptSent = broadcaster.publishTranscript(new TranscriptMessage("hi", true, "alice", AT, null));
        boolean heartbeatSent = broadcaster.publishHeartbeat(new HeartbeatMessage(1, AT));

        assertThat(transcriptSent).isFalse();
        assertThat(heartbeatSent).isFalse();
        Counter transcriptFailures = registry.find("agent.publish.failure").tag("type", "transcription").counter();
        Counter heartbeatFailures = registry.find("agent.publish.failure").tag("type", "agent_status").counter();
        assertThat(transcriptFailures.count()).isEqualTo(1.0);
        assertThat(heartbeatFailures.count()).isEqualTo(1.0);
    }

    @Test
    void payloadDecodesToSameText() {
        byte[][] captured = new byte[1][];
        TranscriptBroadcaster broadcaster = new TranscriptBroadcaster((payload, reliable) -> captured[0] = payload, metrics);

        broadcaster.publishTranscript(new TranscriptMessage("naïve café", true, "zoë", AT, null));

        assertThat(new String(captured[0], StandardCharsets.UTF_8)).contains("naïve café").contains("zoë");
    }
}
