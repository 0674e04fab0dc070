package com.phillippitts.transcriptionagent.domain;

/**
 * Lifecycle of a track session.
 *
 * <ul>
 *   <li>ACTIVE - audio is being forwarded and events drained</li>
 *   <li>STOPPING - audio input has ended; waiting for the engine to flush</li>
 *   <li>TERMINATED - both flows finished and the track id has been released</li>
 * </ul>
 */
public enum SessionStatus {
    ACTIVE,
    STOPPING,
    TERMINATED
}
