package com.phillippitts.transcriptionagent.room;

import com.phillippitts.transcriptionagent.room.event.RoomEvent;

/**
 * Channel of room notifications, consumed by a single dispatch loop.
 */
public interface RoomEventStream {

    /**
     * Waits for the next notification.
     *
     * @return next event; a {@link com.phillippitts.transcriptionagent.room.event.RoomDisconnected}
     *         is the last event the stream delivers
     * @throws InterruptedException if the waiting thread is interrupted
     */
    RoomEvent take() throws InterruptedException;
}
