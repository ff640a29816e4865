package com.phillippitts.voicedaemon.service.refinement;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Handle to one refinement loop. A cancelled task never completes its {@link #result()}.
 */
public final class RefinementTask {

    private final CompletableFuture<String> result = new CompletableFuture<>();
    private volatile boolean cancelled;
    private volatile Future<?> loop;

    /** Completes with the refined text, or exceptionally with a RefinementException. */
    public CompletableFuture<String> result() {
        return result;
    }

    /** Interrupts the retry loop and its in-flight attempt. */
    public void cancel() {
        cancelled = true;
        Future<?> running = loop;
        if (running != null) {
            running.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void attach(Future<?> running) {
        this.loop = running;
        if (cancelled) {
            running.cancel(true);
        }
    }

    void complete(String text) {
        if (!cancelled) {
            result.complete(text);
        }
    }

    void fail(RuntimeException failure) {
        if (!cancelled) {
            result.completeExceptionally(failure);
        }
    }
}
