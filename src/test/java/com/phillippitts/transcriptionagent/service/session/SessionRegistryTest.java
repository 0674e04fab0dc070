package com.phillippitts.transcriptionagent.service.session;

import com.phillippitts.transcriptionagent.domain.TrackId;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void firstAcquireWinsSecondIsRejected() {
        TrackId id = TrackId.of("PA_1", "TR_1");

        assertThat(registry.tryAcquire(id)).isTrue();
        assertThat(registry.tryAcquire(id)).isFalse();
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.isHeld(id)).isTrue();
    }

    @Test
    void releaseIsIdempotent() {
        TrackId id = TrackId.of("PA_1", "TR_1");
        registry.tryAcquire(id);

        registry.release(id);
        registry.release(id);
        registry.release(TrackId.of("PA_2", "TR_9"));

        assertThat(registry.size()).isZero();
        assertThat(registry.isHeld(id)).isFalse();
    }

    @Test
    void releasedIdCanBeAcquiredAgain() {
        TrackId id = TrackId.of("PA_1", "TR_1");
        registry.tryAcquire(id);
        registry.release(id);

        assertThat(registry.tryAcquire(id)).isTrue();
    }

    @Test
    void concurrentAcquireHasExactlyOneWinner() throws InterruptedException {
        TrackId id = TrackId.of("PA_1", "TR_1");
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger winners = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                    if (registry.tryAcquire(id)) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdownNow();
        assertThat(winners.get()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void snapshotIsDetachedFromRegistry() {
        TrackId a = TrackId.of("PA_1", "TR_1");
        TrackId b = TrackId.of("PA_2", "TR_2");
        registry.tryAcquire(a);
        registry.tryAcquire(b);

        var snapshot = registry.snapshot();
        registry.release(a);

        assertThat(snapshot).containsExactlyInAnyOrder(a, b);
        assertThat(registry.snapshot()).containsExactly(b);
    }

    @Test
    void staleLeaseDoesNotReleaseNewerHold() {
        TrackId id = TrackId.of("PA_1", "TR_1");
        SessionRegistry.Lease first = registry.tryAcquireLease(id).orElseThrow();
        registry.release(id);
        SessionRegistry.Lease second = registry.tryAcquireLease(id).orElseThrow();

        assertThat(registry.release(first)).isFalse();
        assertThat(registry.isHeld(id)).isTrue();
        assertThat(registry.size()).isEqualTo(1);

        assertThat(registry.release(second)).isTrue();
        assertThat(registry.isHeld(id)).isFalse();
    }

    @Test
    void rejectedAcquireYieldsNoLease() {
        TrackId id = TrackId.of("PA_1", "TR_1");
        registry.tryAcquireLease(id);

        assertThat(registry.tryAcquireLease(id)).isEmpty();
    }

    @Test
    void trackIdRendersParticipantAndTrackSid() {
        assertThat(TrackId.of("PA_abc", "TR_xyz")).hasToString("PA_abc_TR_xyz");
    }
}
