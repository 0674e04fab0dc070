package com.phillippitts.transcriptionagent.service.heartbeat;

import com.phillippitts.transcriptionagent.domain.HeartbeatMessage;
import com.phillippitts.transcriptionagent.service.session.SessionRegistry;
import com.phillippitts.transcriptionagent.service.transcript.TranscriptBroadcaster;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Broadcasts the agent's status to the room on every scheduler tick.
 *
 * <p>A tick never throws: a failure is logged and the next tick runs as scheduled.
 */
public class HeartbeatEmitter implements Runnable {

    private static final Logger LOG = LogManager.getLogger(HeartbeatEmitter.class);

    private final SessionRegistry registry;
    private final TranscriptBroadcaster broadcaster;
    private final Clock clock;

    public HeartbeatEmitter(SessionRegistry registry, TranscriptBroadcaster broadcaster, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void run() {
        emit();
    }

    /**
     * Sends one heartbeat.
     *
     * @return {@code true} if the room accepted it
     */
    public boolean emit() {
        try {
            int tracks = registry.size();
            boolean sent = broadcaster.publishHeartbeat(new HeartbeatMessage(tracks, LocalDateTime.now(clock)));
            if (sent) {
                LOG.info("Status update sent: {} tracks processing", tracks);
            }
            return sent;
        } catch (RuntimeException e) {
            LOG.error("Heartbeat failed: {}", e.toString(), e);
            return false;
        }
    }
}
