package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Initializes the speech engine at startup and restarts it on request.
 *
 * <p>A restart first takes the {@link EngineGuard} permit, bounded by the cancellation timeout,
 * so the engine is never closed under a worker that is still transcribing.
 */
@Component
public class EngineLifecycle {

    private static final Logger LOG = LogManager.getLogger(EngineLifecycle.class);

    private final SpeechEngine engine;
    private final EngineGuard guard;
    private final AsyncTaskExecutor lifecycleExecutor;

    public EngineLifecycle(SpeechEngine engine,
                           EngineGuard guard,
                           @Qualifier("lifecycleExecutor") AsyncTaskExecutor lifecycleExecutor) {
        this.engine = engine;
        this.guard = guard;
        this.lifecycleExecutor = lifecycleExecutor;
    }

    @PostConstruct
    public void initializeEngine() {
        try {
            engine.initialize();
            LOG.info("Engine {} initialized successfully", engine.getEngineName());
        } catch (RuntimeException ex) {
            // The daemon still serves text commands; RESTART retries the initialization.
            LOG.warn("Failed to initialize engine {} at startup: {}", engine.getEngineName(), ex.getMessage());
        }
    }

    /**
     * Closes and re-initializes the engine on the lifecycle thread.
     *
     * @param releaseTimeout how long a cancelled worker may keep the engine
     * @return completes normally on success, exceptionally with {@link TranscriptionException}
     */
    public CompletableFuture<Void> restart(Duration releaseTimeout) {
        return CompletableFuture.runAsync(() -> restartNow(releaseTimeout), lifecycleExecutor);
    }

    void restartNow(Duration releaseTimeout) {
        boolean acquired;
        try {
            acquired = guard.tryAcquire(releaseTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Interrupted while waiting for the engine", engine.getEngineName(), e);
        }
        if (!acquired) {
            throw new TranscriptionException("Engine not released within " + releaseTimeout.toMillis() + " ms",
                    engine.getEngineName());
        }
        try {
            LOG.warn("Restarting engine {}", engine.getEngineName());
            try {
                engine.close();
            } catch (RuntimeException ex) {
                LOG.debug("Error during engine.close(): {}", ex.toString());
            }
            engine.initialize();
            LOG.info("Engine {} restarted successfully", engine.getEngineName());
        } finally {
            guard.release();
        }
    }

    @PreDestroy
    public void shutdown() {
        engine.close();
    }
}
