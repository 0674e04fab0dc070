package com.phillippitts.transcriptionagent.service.room;

import com.phillippitts.transcriptionagent.config.properties.AgentProperties;
import com.phillippitts.transcriptionagent.exception.RoomConnectionException;
import com.phillippitts.transcriptionagent.room.Room;
import com.phillippitts.transcriptionagent.room.RoomConnector;
import com.phillippitts.transcriptionagent.service.heartbeat.HeartbeatEmitter;
import com.phillippitts.transcriptionagent.service.session.SessionDependencies;
import com.phillippitts.transcriptionagent.service.transcript.TranscriptBroadcaster;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Attaches the agent to its room for the lifetime of the application.
 *
 * <p>On start it connects through the {@link RoomConnector} bean, scans the participants already
 * present, schedules the status heartbeat (first tick one interval after connecting) and starts the
 * {@code room-events} dispatch thread. Failing to connect is the one fatal error of the agent: the
 * {@link RoomConnectionException} aborts application startup.
 *
 * <p>Without a connector bean the agent stays idle; the HTTP status endpoints still answer.
 */
@Service
public class RoomAgent implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(RoomAgent.class);

    static final String MDC_ROOM = "room";
    private static final long EVENT_THREAD_JOIN_MS = 2_000;

    private final ObjectProvider<RoomConnector> connectorProvider;
    private final SessionDependencies deps;
    private final AgentProperties props;
    private final Executor eventExecutor;
    private final TaskScheduler heartbeatScheduler;

    private volatile boolean running;
    private volatile Room room;
    private volatile Thread eventThread;
    private volatile ScheduledFuture<?> heartbeat;

    public RoomAgent(ObjectProvider<RoomConnector> connectorProvider,
                     SessionDependencies deps,
                     AgentProperties props,
                     @Qualifier("eventExecutor") Executor eventExecutor,
                     @Qualifier("heartbeatScheduler") TaskScheduler heartbeatScheduler) {
        this.connectorProvider = connectorProvider;
        this.deps = deps;
        this.props = props;
        this.eventExecutor = eventExecutor;
        this.heartbeatScheduler = heartbeatScheduler;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        RoomConnector connector = connectorProvider.getIfAvailable();
        if (connector == null) {
            LOG.warn("No RoomConnector bean configured; transcription agent is idle");
            running = true;
            return;
        }

        String requestedRoom = props.getRoomName() == null || props.getRoomName().isBlank()
                ? null : props.getRoomName();
        Room connected;
        try {
            connected = connector.connect(requestedRoom);
        } catch (RuntimeException e) {
            throw new RoomConnectionException(requestedRoom == null ? "<assigned>" : requestedRoom, e);
        }
        room = connected;

        ThreadContext.put(MDC_ROOM, connected.name());
        try {
            LOG.info("Agent connected to room: {}", connected.name());
            LOG.info("Room has {} participants", connected.remoteParticipants().size());

            TranscriptBroadcaster broadcaster = new TranscriptBroadcaster(connected, deps.getMetrics());
            RoomEventDispatcher dispatcher = new RoomEventDispatcher(
                    connected, broadcaster, deps, eventExecutor, props.getChatTopic());

            dispatcher.discoverExisting();

            Duration interval = props.getHeartbeatInterval();
            HeartbeatEmitter emitter = new HeartbeatEmitter(deps.getSessionRegistry(), broadcaster, deps.getClock());
            heartbeat = heartbeatScheduler.scheduleAtFixedRate(emitter, deps.getClock().instant().plus(interval), interval);

            Thread t = new Thread(() -> {
                ThreadContext.put(MDC_ROOM, connected.name());
                dispatcher.run();
            }, "room-events");
            t.setDaemon(true);
            eventThread = t;
            t.start();
        } finally {
            ThreadContext.remove(MDC_ROOM);
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        ScheduledFuture<?> hb = heartbeat;
        if (hb != null) {
            hb.cancel(false);
            heartbeat = null;
        }
        Thread t = eventThread;
        if (t != null) {
            t.interrupt();
            joinThread(t, EVENT_THREAD_JOIN_MS);
            eventThread = null;
        }
        Room r = room;
        if (r != null) {
            try {
                r.disconnect();
            } catch (RuntimeException e) {
                LOG.warn("Error while leaving room {}: {}", r.name(), e.toString());
            }
            room = null;
        }
        running = false;
        LOG.info("Transcription agent stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** {@code true} while the agent holds a room connection and its dispatch loop is alive. */
    public boolean isConnected() {
        Thread t = eventThread;
        return room != null && t != null && t.isAlive();
    }

    public Optional<String> roomName() {
        Room r = room;
        return r == null ? Optional.empty() : Optional.of(r.name());
    }

    private static void joinThread(Thread thread, long timeoutMs) {
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Event thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for event thread to terminate");
        }
    }
}
