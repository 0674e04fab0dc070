package com.phillippitts.transcriptionagent.service.health;

import com.phillippitts.transcriptionagent.domain.TrackId;
import com.phillippitts.transcriptionagent.service.room.RoomAgent;
import com.phillippitts.transcriptionagent.service.session.SessionRegistry;
import com.phillippitts.transcriptionagent.service.stt.SpeechEngine;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TranscriptionAgentHealthIndicatorTest {

    @Test
    void shouldReportUpWhenConnectedAndEngineReady() {
        RoomAgent agent = mock(RoomAgent.class);
        SpeechEngine engine = mock(SpeechEngine.class);
        SessionRegistry registry = new SessionRegistry();
        registry.tryAcquire(TrackId.of("PA_1", "TR_1"));

        when(agent.isConnected()).thenReturn(true);
        when(agent.roomName()).thenReturn(Optional.of("standup"));
        when(engine.isHealthy()).thenReturn(true);
        when(engine.getEngineName()).thenReturn("deepgram");

        Health health = new TranscriptionAgentHealthIndicator(agent, engine, registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("room", "standup");
        assertThat(health.getDetails()).containsEntry("activeSessions", 1);
        assertThat(health.getDetails()).containsEntry("engine", "deepgram: ready");
    }

    @Test
    void shouldReportDownWhenEngineUnhealthy() {
        RoomAgent agent = mock(RoomAgent.class);
        SpeechEngine engine = mock(SpeechEngine.class);

        when(agent.isConnected()).thenReturn(true);
        when(agent.roomName()).thenReturn(Optional.of("standup"));
        when(engine.isHealthy()).thenReturn(false);
        when(engine.getEngineName()).thenReturn("deepgram");

        Health health = new TranscriptionAgentHealthIndicator(agent, engine, new SessionRegistry()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("engine", "deepgram: unhealthy");
    }

    @Test
    void shouldReportDownWhenNotConnected() {
        RoomAgent agent = mock(RoomAgent.class);
        SpeechEngine engine = mock(SpeechEngine.class);

        when(agent.isConnected()).thenReturn(false);
        when(agent.roomName()).thenReturn(Optional.empty());
        when(engine.isHealthy()).thenReturn(true);
        when(engine.getEngineName()).thenReturn("deepgram");

        Health health = new TranscriptionAgentHealthIndicator(agent, engine, new SessionRegistry()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("room", "not connected");
        assertThat(health.getDetails()).containsEntry("activeSessions", 0);
    }
}
