package com.phillippitts.transcriptionagent.service.health;

import com.phillippitts.transcriptionagent.service.room.RoomAgent;
import com.phillippitts.transcriptionagent.service.session.SessionRegistry;
import com.phillippitts.transcriptionagent.service.stt.SpeechEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the room transcription agent.
 *
 * <ul>
 *   <li>UP: Connected to a room and the speech engine can open conversations</li>
 *   <li>DOWN: No room connection, or the speech engine is unhealthy</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint as {@code transcriptionAgent}.
 */
@Component
public class TranscriptionAgentHealthIndicator implements HealthIndicator {

    private final RoomAgent roomAgent;
    private final SpeechEngine speechEngine;
    private final SessionRegistry sessionRegistry;

    public TranscriptionAgentHealthIndicator(RoomAgent roomAgent,
                                             SpeechEngine speechEngine,
                                             SessionRegistry sessionRegistry) {
        this.roomAgent = roomAgent;
        this.speechEngine = speechEngine;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    public Health health() {
        boolean connected = roomAgent.isConnected();
        boolean engineHealthy = speechEngine.isHealthy();

        Health.Builder builder = connected && engineHealthy ? Health.up() : Health.down();
        return builder
                .withDetail("room", roomAgent.roomName().orElse("not connected"))
                .withDetail("activeSessions", sessionRegistry.size())
                .withDetail("engine", speechEngine.getEngineName() + ": " + (engineHealthy ? "ready" : "unhealthy"))
                .build();
    }
}
