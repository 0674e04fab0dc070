package com.phillippitts.transcriptionagent.service.room;

import com.phillippitts.transcriptionagent.domain.TrackId;
import com.phillippitts.transcriptionagent.room.RemoteParticipant;
import com.phillippitts.transcriptionagent.room.RemoteTrack;
import com.phillippitts.transcriptionagent.room.Room;
import com.phillippitts.transcriptionagent.room.TrackKind;
import com.phillippitts.transcriptionagent.room.TrackPublication;
import com.phillippitts.transcriptionagent.room.event.DataReceived;
import com.phillippitts.transcriptionagent.room.event.ParticipantConnected;
import com.phillippitts.transcriptionagent.room.event.RoomDisconnected;
import com.phillippitts.transcriptionagent.room.event.RoomEvent;
import com.phillippitts.transcriptionagent.room.event.TrackSubscribed;
import com.phillippitts.transcriptionagent.room.event.TrackUnsubscribed;
import com.phillippitts.transcriptionagent.service.session.SessionDependencies;
import com.phillippitts.transcriptionagent.service.session.SessionRegistry;
import com.phillippitts.transcriptionagent.service.session.TrackSession;
import com.phillippitts.transcriptionagent.service.transcript.TranscriptBroadcaster;
import com.phillippitts.transcriptionagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Discovers the audio tracks of a room and keeps one {@link TrackSession} per track.
 *
 * <p>Tracks are found two ways: a scan of the participants already present at startup, and the
 * room's notification stream afterwards. The {@link SessionRegistry} makes both paths idempotent,
 * so a track seen by the scan and by a subscription notification is transcribed once.
 *
 * <p>{@link #run()} is the dispatch loop: it takes notifications one by one and hands each to the
 * event executor, so a slow discovery never delays the next notification.
 */
public class RoomEventDispatcher implements Runnable {

    private static final Logger LOG = LogManager.getLogger(RoomEventDispatcher.class);

    private final Room room;
    private final TranscriptBroadcaster broadcaster;
    private final SessionDependencies deps;
    private final Executor eventExecutor;
    private final String chatTopic;

    public RoomEventDispatcher(Room room,
                               TranscriptBroadcaster broadcaster,
                               SessionDependencies deps,
                               Executor eventExecutor,
                               String chatTopic) {
        this.room = Objects.requireNonNull(room, "room");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.deps = Objects.requireNonNull(deps, "deps");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
        this.chatTopic = Objects.requireNonNull(chatTopic, "chatTopic");
    }

    /**
     * Starts sessions for every subscribed audio track of the participants already in the room.
     *
     * @return futures of the sessions started by the scan
     */
    public List<CompletableFuture<Void>> discoverExisting() {
        Collection<RemoteParticipant> participants = room.remoteParticipants();
        LOG.info("Scanning {} existing participants in room {}", participants.size(), room.name());
        List<CompletableFuture<Void>> started = new ArrayList<>();
        for (RemoteParticipant participant : participants) {
            started.addAll(processParticipantTracks(participant));
        }
        return started;
    }

    /**
     * Starts sessions for the participant's published audio tracks that are already subscribed.
     */
    public List<CompletableFuture<Void>> processParticipantTracks(RemoteParticipant participant) {
        List<CompletableFuture<Void>> started = new ArrayList<>();
        for (TrackPublication publication : participant.trackPublications()) {
            if (publication.kind() != TrackKind.AUDIO) {
                continue;
            }
            publication.track().ifPresent(track -> started.add(startSession(track, participant)));
        }
        return started;
    }

    /**
     * Starts transcribing a track unless it is not audio or already has a live session.
     *
     * @return future completing when the session ends; already complete if no session was started
     */
    public CompletableFuture<Void> startSession(RemoteTrack track, RemoteParticipant participant) {
        if (track.kind() != TrackKind.AUDIO) {
            return CompletableFuture.completedFuture(null);
        }
        TrackId id = TrackId.of(participant.sid(), track.sid());
        Optional<SessionRegistry.Lease> lease = deps.getSessionRegistry().tryAcquireLease(id);
        if (lease.isEmpty()) {
            LOG.info("Already processing track {}", id);
            return CompletableFuture.completedFuture(null);
        }
        TrackSession session = new TrackSession(
                lease.get(), participant.identity(), room.name(), track, broadcaster, deps);
        return session.start();
    }

    /**
     * Handles one notification on the event executor.
     *
     * @return {@code false} once the room has disconnected and no further events will follow
     */
    public boolean dispatch(RoomEvent event) {
        if (event instanceof RoomDisconnected disconnected) {
            LOG.warn("Room {} disconnected: {}", room.name(), disconnected.reason());
            return false;
        }
        eventExecutor.execute(() -> handle(event));
        return true;
    }

    @Override
    public void run() {
        LOG.info("Listening for events in room {}", room.name());
        try {
            boolean connected = true;
            while (connected && !Thread.currentThread().isInterrupted()) {
                connected = dispatch(room.events().take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Event loop for room {} interrupted", room.name());
        }
        LOG.info("Stopped listening for events in room {}", room.name());
    }

    void handle(RoomEvent event) {
        try {
            if (event instanceof ParticipantConnected connected) {
                LOG.info("New participant joined: {}", connected.participant().identity());
                processParticipantTracks(connected.participant());
            } else if (event instanceof TrackSubscribed subscribed) {
                if (subscribed.track().kind() == TrackKind.AUDIO) {
                    LOG.info("New audio track from {}", subscribed.participant().identity());
                    startSession(subscribed.track(), subscribed.participant());
                }
            } else if (event instanceof TrackUnsubscribed unsubscribed) {
                if (unsubscribed.track().kind() == TrackKind.AUDIO) {
                    TrackId id = TrackId.of(unsubscribed.participant().sid(), unsubscribed.track().sid());
                    LOG.info("Audio track removed from {}", unsubscribed.participant().identity());
                    deps.getSessionRegistry().release(id);
                }
            } else if (event instanceof DataReceived data) {
                if (chatTopic.equals(data.topic())) {
                    String message = new String(data.payload(), StandardCharsets.UTF_8);
                    LOG.info("Chat message received: {}", LogSanitizer.preview(message));
                }
            } else {
                LOG.debug("Ignoring room event {}", event.getClass().getSimpleName());
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to handle {}: {}", event.getClass().getSimpleName(), e.toString(), e);
        }
    }
}
