package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.exception.TranscriptionException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Handle to one queued or running transcription.
 *
 * <p>A cancelled task never completes its {@link #result()}.
 */
public final class TranscriptionTask {

    private final AudioInput input;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private volatile boolean cancelled;
    private volatile Future<?> future;

    TranscriptionTask(AudioInput input) {
        this.input = input;
    }

    /** Completes with the transcript, or exceptionally with a {@link TranscriptionException}. */
    public CompletableFuture<String> result() {
        return result;
    }

    /**
     * Stops the task: the worker is interrupted, the engine call aborted and the audio zeroed.
     */
    public void cancel() {
        cancelled = true;
        Future<?> running = future;
        if (running != null) {
            running.cancel(true);
        }
        input.discard();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    AudioInput input() {
        return input;
    }

    void attach(Future<?> running) {
        this.future = running;
        if (cancelled) {
            running.cancel(true);
        }
    }

    void complete(String text) {
        if (!cancelled) {
            result.complete(text);
        }
    }

    void fail(TranscriptionException failure) {
        if (!cancelled) {
            result.completeExceptionally(failure);
        }
    }
}
