package com.phillippitts.voicedaemon.domain;

import java.util.Arrays;

/**
 * Raw PCM16LE mono 16 kHz samples of one recording.
 *
 * <p>The buffer wraps the captured array without copying and has move semantics:
 * {@link #take()} hands the samples to exactly one new owner, {@link #release()} zeroes and
 * drops them. After either, every accessor fails. Thread-safe.
 */
public final class AudioBuffer {

    private byte[] pcm;

    private AudioBuffer(byte[] pcm) {
        this.pcm = pcm;
    }

    /**
     * Takes ownership of the given array. The caller must not touch it afterwards.
     */
    public static AudioBuffer adopt(byte[] pcm) {
        if (pcm == null) {
            throw new IllegalArgumentException("pcm must not be null");
        }
        return new AudioBuffer(pcm);
    }

    public synchronized int length() {
        return requireLive().length;
    }

    /**
     * Transfers the samples out of this buffer.
     *
     * @throws IllegalStateException if the samples were already taken or released
     */
    public synchronized byte[] take() {
        byte[] data = requireLive();
        pcm = null;
        return data;
    }

    /** Zeroes and drops the samples. Idempotent. */
    public synchronized void release() {
        if (pcm != null) {
            Arrays.fill(pcm, (byte) 0);
            pcm = null;
        }
    }

    public synchronized boolean isReleased() {
        return pcm == null;
    }

    private byte[] requireLive() {
        if (pcm == null) {
            throw new IllegalStateException("Audio buffer already taken or released");
        }
        return pcm;
    }
}
