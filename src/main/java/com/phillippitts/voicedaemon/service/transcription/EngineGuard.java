package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.config.TranscriptionProperties;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Single-permit guard around the {@link SpeechEngine}.
 *
 * <p>The transcription worker holds the permit for each engine call; a restart takes it to prove
 * that no worker is still inside the engine before closing it.
 *
 * <pre>{@code
 * guard.acquire();
 * try {
 *     // ... call the engine ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
@Component
public class EngineGuard {

    private final Semaphore semaphore = new Semaphore(1);
    private final long timeoutMs;

    public EngineGuard(TranscriptionProperties properties) {
        this.timeoutMs = properties.getEngineAcquireTimeoutMs();
    }

    /**
     * Acquires the permit, blocking up to the configured timeout.
     *
     * @throws TranscriptionException if the permit cannot be acquired in time or the thread is
     *         interrupted while waiting
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TranscriptionException("Speech engine busy after " + timeoutMs + "ms wait");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Interrupted while waiting for the speech engine", e);
        }
    }

    /**
     * Acquires the permit with an explicit bound.
     *
     * @return false if the permit was not released in time
     */
    public boolean tryAcquire(Duration timeout) throws InterruptedException {
        return semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Releases a previously acquired permit. Must be called in a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
