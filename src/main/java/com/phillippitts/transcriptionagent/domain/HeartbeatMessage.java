package com.phillippitts.transcriptionagent.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Periodic agent status report.
 *
 * @param activeSessionCount number of tracks currently being transcribed
 * @param timestamp          when the tick fired
 */
public record HeartbeatMessage(int activeSessionCount, LocalDateTime timestamp) {

    public HeartbeatMessage {
        if (activeSessionCount < 0) {
            throw new IllegalArgumentException("activeSessionCount must not be negative, got: " + activeSessionCount);
        }
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
