package com.phillippitts.transcriptionagent.service.session;

import com.phillippitts.transcriptionagent.domain.TrackId;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Set of track ids that currently have a live session.
 *
 * <p>Guarantees at most one session per track: {@link #tryAcquireLease(TrackId)} is an atomic
 * check-and-insert, so of two concurrent callers for the same id exactly one wins.
 * The registry is in-memory only and rebuilt by the startup scan after a restart.
 *
 * <p>Two ways to give an id back:
 * <ul>
 *   <li>{@link #release(TrackId)} drops whatever holds the id (track unsubscribed)</li>
 *   <li>{@link #release(Lease)} drops the id only while that lease still holds it, so a session
 *       ending after its track was re-subscribed leaves the new session's hold alone</li>
 * </ul>
 */
@Component
public class SessionRegistry {

    private final ConcurrentMap<TrackId, Lease> active = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    /**
     * Ownership of one track id, handed to the session that runs the track.
     *
     * @param id         the held track id
     * @param generation unique per acquisition
     */
    public record Lease(TrackId id, long generation) {
    }

    /**
     * Claims a track id.
     *
     * @return the lease if the caller now owns the id, empty if it was already held
     */
    public Optional<Lease> tryAcquireLease(TrackId id) {
        Objects.requireNonNull(id, "id");
        Lease lease = new Lease(id, generations.incrementAndGet());
        return active.putIfAbsent(id, lease) == null ? Optional.of(lease) : Optional.empty();
    }

    /**
     * Claims a track id without keeping the lease.
     *
     * @return {@code true} if the caller now owns the id, {@code false} if it was already held
     */
    public boolean tryAcquire(TrackId id) {
        return tryAcquireLease(id).isPresent();
    }

    /** Releases a track id whoever holds it. Releasing an id that is not held is a no-op. */
    public void release(TrackId id) {
        Objects.requireNonNull(id, "id");
        active.remove(id);
    }

    /**
     * Releases the lease's id if the lease still holds it.
     *
     * @return {@code false} if the id was already released or is now held by a newer lease
     */
    public boolean release(Lease lease) {
        Objects.requireNonNull(lease, "lease");
        return active.remove(lease.id(), lease);
    }

    public boolean isHeld(TrackId id) {
        return active.containsKey(id);
    }

    /** Number of held ids; approximate while sessions start or stop concurrently. */
    public int size() {
        return active.size();
    }

    public Set<TrackId> snapshot() {
        return Set.copyOf(active.keySet());
    }
}
