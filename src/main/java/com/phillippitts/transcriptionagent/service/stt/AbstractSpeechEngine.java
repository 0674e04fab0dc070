package com.phillippitts.transcriptionagent.service.stt;

import com.phillippitts.transcriptionagent.exception.SpeechEngineException;
import jakarta.annotation.PreDestroy;

/**
 * Base class for speech engines providing common lifecycle and state management.
 *
 * <p><b>Thread Safety:</b> All state transitions are synchronized on an internal lock.
 * Subclass hooks {@link #doInitialize()} and {@link #doClose()} run inside that lock.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Uninitialized:</b> Engine created but not yet initialized</li>
 *   <li><b>Initialized:</b> {@link #initialize()} completed without error</li>
 *   <li><b>Closed:</b> {@link #close()} called, engine no longer opens streams</li>
 * </ol>
 *
 * <p>Both {@link #initialize()} and {@link #close()} are idempotent. An engine whose
 * initialization failed stays uninitialized and reports itself unhealthy.
 */
public abstract class AbstractSpeechEngine implements SpeechEngine {

    /** Guards {@link #initialized} and {@link #closed}. */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    /**
     * Initializes the engine once; later calls are no-ops until the engine is closed.
     *
     * @throws SpeechEngineException if initialization fails
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            closed = false;
            initialized = true;
        }
    }

    /**
     * Engine-specific initialization, called within the lock.
     *
     * @throws SpeechEngineException if the engine cannot be used
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup, called within the lock. Must not throw.
     */
    protected abstract void doClose();

    /**
     * @throws SpeechEngineException if the engine is not initialized or is closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new SpeechEngineException(getEngineName() + " engine not initialized or closed", getEngineName());
            }
        }
    }
}
