package com.phillippitts.transcriptionagent.service.stt;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import com.phillippitts.transcriptionagent.room.AudioFrame;

import java.util.Iterator;

/**
 * One recognition conversation. Audio goes in through {@link #pushFrame(AudioFrame)}, speech
 * events come out through {@link #events()}.
 *
 * <p>Input and output are used from two different threads: one thread pushes frames and finally
 * calls {@link #endInput()}, another drains {@link #events()}. After {@code endInput()} the engine
 * flushes its remaining results and the event iterator ends.
 *
 * <p>{@link #close()} is idempotent. It ends the event iterator (a blocked {@code hasNext()}
 * returns {@code false}) and turns later {@code pushFrame}/{@code endInput} calls into no-ops.
 */
public interface SpeechStream extends AutoCloseable {

    /**
     * Sends one audio frame. May block while the engine applies backpressure.
     *
     * @throws SpeechEngineException if the frame cannot be delivered
     */
    void pushFrame(AudioFrame frame);

    /**
     * Signals that no more audio will be pushed.
     *
     * @throws SpeechEngineException if the signal cannot be delivered
     */
    void endInput();

    /**
     * Blocking iterator over the events of this conversation. The same iterator is returned on
     * every call. Iteration throws {@link SpeechEngineException} if the engine fails mid-stream.
     */
    Iterator<SpeechEvent> events();

    @Override
    void close();
}
