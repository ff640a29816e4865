package com.phillippitts.voicedaemon.testutil;

import com.phillippitts.voicedaemon.domain.TranscriptionResult;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.service.transcription.SpeechEngine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link SpeechEngine}.
 *
 * <p>Each call returns the next scripted text (or {@link #defaultText} once the script is
 * exhausted), after failing {@link #failuresBeforeSuccess} times. With {@link #blockCalls} set,
 * calls wait until interrupted, which lets tests observe cancellation.
 */
public class FakeSpeechEngine implements SpeechEngine {

    public static final String NAME = "fake";

    private final Deque<String> script = new ArrayDeque<>();
    private final List<Integer> segmentLengths = new ArrayList<>();
    public volatile String defaultText = "";
    public volatile int failuresBeforeSuccess;
    public volatile boolean blockCalls;
    public volatile boolean failInitialize;
    public volatile boolean healthy = true;
    public final CountDownLatch entered = new CountDownLatch(1);
    public final AtomicInteger calls = new AtomicInteger();
    public final AtomicInteger initializations = new AtomicInteger();
    public final AtomicInteger closes = new AtomicInteger();

    public FakeSpeechEngine script(String... texts) {
        synchronized (script) {
            script.addAll(List.of(texts));
        }
        return this;
    }

    @Override
    public void initialize() {
        initializations.incrementAndGet();
        if (failInitialize) {
            throw new TranscriptionException("Model missing", NAME);
        }
    }

    @Override
    public TranscriptionResult transcribe(byte[] audioData) {
        calls.incrementAndGet();
        synchronized (segmentLengths) {
            segmentLengths.add(audioData.length);
        }
        entered.countDown();
        if (blockCalls) {
            try {
                Thread.sleep(Long.MAX_VALUE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TranscriptionException("Interrupted", NAME, e);
            }
        }
        if (failuresBeforeSuccess > 0) {
            failuresBeforeSuccess--;
            throw new TranscriptionException("Engine configured to fail", NAME);
        }
        String next;
        synchronized (script) {
            next = script.isEmpty() ? defaultText : script.poll();
        }
        return next.isEmpty() ? TranscriptionResult.noSpeech(NAME) : TranscriptionResult.of(next, 0.9, NAME);
    }

    public List<Integer> segmentLengths() {
        synchronized (segmentLengths) {
            return List.copyOf(segmentLengths);
        }
    }

    @Override
    public String getEngineName() {
        return NAME;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }
}
