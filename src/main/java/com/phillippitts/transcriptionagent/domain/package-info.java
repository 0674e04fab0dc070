/**
 * Domain models of the transcription agent.
 *
 * <p>All domain models are immutable records that validate themselves in their compact
 * constructors and carry no transport or persistence concerns.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.transcriptionagent.domain.TrackId} - composite key of one audio source</li>
 *   <li>{@link com.phillippitts.transcriptionagent.domain.TranscriptMessage} - interim or final
 *       transcript broadcast to the room</li>
 *   <li>{@link com.phillippitts.transcriptionagent.domain.TranscriptRecord} - final transcript persisted
 *       to the per-room, per-day transcript file</li>
 *   <li>{@link com.phillippitts.transcriptionagent.domain.HeartbeatMessage} - periodic status report</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.transcriptionagent.domain;
