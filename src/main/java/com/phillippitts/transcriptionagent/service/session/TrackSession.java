package com.phillippitts.transcriptionagent.service.session;

import com.phillippitts.transcriptionagent.domain.SessionStatus;
import com.phillippitts.transcriptionagent.domain.TrackId;
import com.phillippitts.transcriptionagent.domain.TranscriptMessage;
import com.phillippitts.transcriptionagent.domain.TranscriptRecord;
import com.phillippitts.transcriptionagent.room.AudioFrameStream;
import com.phillippitts.transcriptionagent.room.RemoteTrack;
import com.phillippitts.transcriptionagent.service.session.event.SessionFailedEvent;
import com.phillippitts.transcriptionagent.service.stt.SpeechAlternative;
import com.phillippitts.transcriptionagent.service.stt.SpeechEvent;
import com.phillippitts.transcriptionagent.service.stt.SpeechStream;
import com.phillippitts.transcriptionagent.service.transcript.TranscriptBroadcaster;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transcribes one audio track until its audio ends or the session fails.
 *
 * <p>A session runs two flows on the session executor:
 * <ul>
 *   <li><b>Forwarding:</b> pushes every audio frame into the speech stream in arrival order,
 *       then signals end of input</li>
 *   <li><b>Draining:</b> reads speech events; interim and final transcripts are broadcast to the
 *       room, and each final transcript is then appended to the transcript store</li>
 * </ul>
 * The flows are joined with {@link CompletableFuture#allOf}. If either flow fails, both streams
 * are closed so the sibling flow ends too. Teardown always gives back the session's
 * {@link SessionRegistry.Lease}, whatever the outcome; an id the track has meanwhile been
 * re-acquired under stays held.
 */
public class TrackSession {

    private static final Logger LOG = LogManager.getLogger(TrackSession.class);

    static final String MDC_PARTICIPANT = "participant";
    static final String MDC_TRACK_ID = "trackId";

    private final SessionRegistry.Lease lease;
    private final TrackId id;
    private final String participantIdentity;
    private final String roomName;
    private final RemoteTrack track;
    private final TranscriptBroadcaster broadcaster;
    private final SessionDependencies deps;

    private final AtomicReference<SessionStatus> status = new AtomicReference<>(SessionStatus.ACTIVE);
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);

    private volatile SpeechStream speech;
    private volatile AudioFrameStream audio;
    private long startedNanos;

    public TrackSession(SessionRegistry.Lease lease,
                        String participantIdentity,
                        String roomName,
                        RemoteTrack track,
                        TranscriptBroadcaster broadcaster,
                        SessionDependencies deps) {
        this.lease = Objects.requireNonNull(lease, "lease");
        this.id = lease.id();
        this.participantIdentity = Objects.requireNonNull(participantIdentity, "participantIdentity");
        this.roomName = Objects.requireNonNull(roomName, "roomName");
        this.track = Objects.requireNonNull(track, "track");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.deps = Objects.requireNonNull(deps, "deps");
    }

    /**
     * Opens the speech and audio streams and launches both flows.
     *
     * @return future completing after teardown; it never completes exceptionally
     */
    public CompletableFuture<Void> start() {
        startedNanos = System.nanoTime();
        ThreadContext.put(MDC_PARTICIPANT, participantIdentity);
        ThreadContext.put(MDC_TRACK_ID, id.toString());
        try {
            LOG.info("Starting transcription for track {} of {}", id, participantIdentity);
            try {
                speech = deps.getSpeechEngine().openStream();
                audio = track.openAudioStream();
            } catch (RuntimeException e) {
                finish(e);
                return CompletableFuture.completedFuture(null);
            }
            deps.getMetrics().incrementSessionStarted();

            CompletableFuture<Void> forwarding = null;
            CompletableFuture<Void> draining;
            try {
                forwarding = CompletableFuture.runAsync(this::forwardAudio, deps.getSessionExecutor());
                draining = CompletableFuture.runAsync(this::drainEvents, deps.getSessionExecutor());
            } catch (RejectedExecutionException e) {
                LOG.warn("Session pool saturated, dropping track {}", id);
                abort();
                if (forwarding == null) {
                    finish(e);
                    return CompletableFuture.completedFuture(null);
                }
                return forwarding.handle((v, t) -> {
                    finish(e);
                    return null;
                });
            }

            forwarding.whenComplete((v, t) -> abortOnFailure(t));
            draining.whenComplete((v, t) -> abortOnFailure(t));
            return CompletableFuture.allOf(forwarding, draining).handle((v, t) -> {
                finish(t);
                return null;
            });
        } finally {
            ThreadContext.remove(MDC_PARTICIPANT);
            ThreadContext.remove(MDC_TRACK_ID);
        }
    }

    public TrackId id() {
        return id;
    }

    public SessionStatus status() {
        return status.get();
    }

    private void forwardAudio() {
        long frames = 0;
        while (audio.hasNext()) {
            speech.pushFrame(audio.next());
            frames++;
        }
        status.compareAndSet(SessionStatus.ACTIVE, SessionStatus.STOPPING);
        LOG.debug("Audio ended for track {} after {} frames", id, frames);
        if (!aborted.get()) {
            speech.endInput();
        }
    }

    private void drainEvents() {
        Iterator<SpeechEvent> events = speech.events();
        while (events.hasNext()) {
            SpeechEvent event = events.next();
            switch (event.type()) {
                case INTERIM_TRANSCRIPT -> emit(event, false);
                case FINAL_TRANSCRIPT -> {
                    String text = emit(event, true);
                    if (text != null) {
                        persist(text);
                    }
                }
                case END_OF_SPEECH -> LOG.debug("End of speech on track {}", id);
            }
        }
    }

    /**
     * Broadcasts the event's primary hypothesis.
     *
     * @return the broadcast text, or {@code null} when the event carried no usable text
     */
    private String emit(SpeechEvent event, boolean isFinal) {
        SpeechAlternative best = event.primary().orElse(null);
        if (best == null || best.text() == null || best.text().isBlank()) {
            return null;
        }
        LocalDateTime now = LocalDateTime.now(deps.getClock());
        broadcaster.publishTranscript(
                new TranscriptMessage(best.text(), isFinal, participantIdentity, now, best.confidence()));
        return best.text();
    }

    private void persist(String text) {
        LocalDateTime now = LocalDateTime.now(deps.getClock());
        deps.getTranscriptStore().append(new TranscriptRecord(now, participantIdentity, text, roomName));
        deps.getMetrics().incrementRecordPersisted();
    }

    private void abortOnFailure(Throwable failure) {
        if (failure != null) {
            abort();
        }
    }

    // Closing both streams unblocks whichever flow is still waiting
    private void abort() {
        aborted.set(true);
        closeStreams();
    }

    private void closeStreams() {
        AudioFrameStream a = audio;
        if (a != null) {
            a.close();
        }
        SpeechStream s = speech;
        if (s != null) {
            s.close();
        }
    }

    private void finish(Throwable failure) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            closeStreams();
            if (failure != null) {
                Throwable cause = unwrap(failure);
                LOG.error("Error processing track {} of {}: {}", id, participantIdentity, cause.toString(), cause);
                deps.getMetrics().incrementSessionFailed(cause.getClass().getSimpleName());
                deps.getEventPublisher().publishEvent(new SessionFailedEvent(
                        id, participantIdentity, cause.getMessage(), cause, deps.getClock().instant()));
            }
        } catch (RuntimeException e) {
            LOG.warn("Teardown of track {} did not complete cleanly: {}", id, e.toString());
        } finally {
            if (!deps.getSessionRegistry().release(lease)) {
                LOG.debug("Track {} was already released or re-acquired by a newer session", id);
            }
            status.set(SessionStatus.TERMINATED);
            deps.getMetrics().recordSessionDuration(System.nanoTime() - startedNanos);
            LOG.info("Stopped processing track {}", id);
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
