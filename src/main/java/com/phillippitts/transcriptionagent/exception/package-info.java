/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.transcriptionagent.exception.TranscriptionAgentException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.transcriptionagent.exception.SpeechEngineException} - Thrown when a
 *       speech engine conversation fails (connect, send, or engine-reported error)</li>
 *   <li>{@link com.phillippitts.transcriptionagent.exception.RoomConnectionException} - Thrown when
 *       the agent cannot attach to its room at startup (fatal)</li>
 *   <li>{@link com.phillippitts.transcriptionagent.exception.TranscriptPersistenceException} - Thrown
 *       when a transcript file cannot be written</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}. Apart from
 * {@code RoomConnectionException}, they are caught at the boundary of the component that produced
 * them (track session, broadcaster, heartbeat) and logged there.
 *
 * @since 1.0
 */
package com.phillippitts.transcriptionagent.exception;
