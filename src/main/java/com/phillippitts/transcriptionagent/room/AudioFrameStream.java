package com.phillippitts.transcriptionagent.room;

import java.util.Iterator;

/**
 * Lazy, finite, non-restartable sequence of frames from one audio track.
 *
 * <p>{@link #hasNext()} blocks until the next frame arrives and returns {@code false} once the
 * source has ended. {@link #close()} is idempotent and must unblock a pending {@code hasNext()},
 * which then returns {@code false}. Iteration fails with an unchecked exception if the source errors.
 */
public interface AudioFrameStream extends Iterator<AudioFrame>, AutoCloseable {

    @Override
    void close();
}
