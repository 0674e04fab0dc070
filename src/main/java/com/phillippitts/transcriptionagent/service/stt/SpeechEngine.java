package com.phillippitts.transcriptionagent.service.stt;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;

/**
 * Contract for streaming speech-to-text engine implementations.
 * Implementations wrap a concrete recognition service behind a conversation-per-track model.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with configuration (endpoint, model, credentials)</li>
 *   <li>{@link #initialize()} validates configuration and prepares shared resources</li>
 *   <li>{@link #openStream()} opens one conversation per audio track (may throw {@link SpeechEngineException})</li>
 *   <li>{@link #close()} releases shared resources when the engine is no longer needed</li>
 * </ol>
 *
 * <p>Thread Safety: {@link #openStream()} must be safe to call concurrently. Each returned
 * {@link SpeechStream} is owned by a single track session.
 *
 * @see SpeechStream
 * @see SpeechEvent
 */
public interface SpeechEngine extends AutoCloseable {

    /**
     * Prepares the engine. Called once at application startup.
     */
    void initialize();

    /**
     * Opens a new recognition conversation.
     *
     * @return a fresh stream accepting audio and yielding speech events
     * @throws SpeechEngineException if the conversation cannot be established
     */
    SpeechStream openStream();

    /**
     * Returns the name of this engine for logging and monitoring.
     *
     * @return engine name (e.g., "deepgram")
     */
    String getEngineName();

    /**
     * Checks if the engine is currently able to open conversations.
     *
     * @return true if the engine is operational, false otherwise
     */
    boolean isHealthy();

    @Override
    void close();
}
