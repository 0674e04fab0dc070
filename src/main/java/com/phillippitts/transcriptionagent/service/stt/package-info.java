/**
 * Streaming speech-to-text engine abstraction.
 *
 * <p>{@link com.phillippitts.transcriptionagent.service.stt.SpeechEngine} opens one
 * {@link com.phillippitts.transcriptionagent.service.stt.SpeechStream} per transcribed track. The
 * stream accepts raw PCM frames and yields typed
 * {@link com.phillippitts.transcriptionagent.service.stt.SpeechEvent}s (interim, final, end of speech).
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code deepgram} - Deepgram live streaming API over WebSocket</li>
 * </ul>
 */
package com.phillippitts.transcriptionagent.service.stt;
