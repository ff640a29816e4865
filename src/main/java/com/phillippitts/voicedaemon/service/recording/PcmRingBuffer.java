package com.phillippitts.voicedaemon.service.recording;

import java.util.Arrays;

/**
 * Bounded PCM accumulator for one recording. Thread-safe for one producer (capture thread)
 * and one consumer (transcription worker after stop).
 *
 * <p>Writes beyond capacity keep the newest bytes; the capture loop stops before that happens
 * so the recording is hard-capped at its maximum duration.
 */
final class PcmRingBuffer {

    private final byte[] buffer;
    private int writePos = 0;
    private int size = 0;

    PcmRingBuffer(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive");
        }
        this.buffer = new byte[capacityBytes];
    }

    int capacity() {
        return buffer.length;
    }

    synchronized int size() {
        return size;
    }

    synchronized boolean isFull() {
        return size == buffer.length;
    }

    synchronized void write(byte[] src, int off, int len) {
        if (len <= 0) {
            return;
        }
        if (len >= buffer.length) {
            System.arraycopy(src, off + (len - buffer.length), buffer, 0, buffer.length);
            writePos = 0;
            size = buffer.length;
            return;
        }
        // toByteArray() derives the start from (writePos - size), so shrinking size drops oldest
        int space = buffer.length - size;
        if (len > space) {
            size -= len - space;
        }
        int first = Math.min(len, buffer.length - writePos);
        System.arraycopy(src, off, buffer, writePos, first);
        int remaining = len - first;
        if (remaining > 0) {
            System.arraycopy(src, off + first, buffer, 0, remaining);
            writePos = remaining;
        } else {
            writePos = (writePos + first) % buffer.length;
        }
        size = Math.min(size + len, buffer.length);
    }

    synchronized byte[] toByteArray() {
        if (size == 0) {
            return new byte[0];
        }
        byte[] out = new byte[size];
        int start = (writePos - size + buffer.length) % buffer.length;
        int first = Math.min(size, buffer.length - start);
        System.arraycopy(buffer, start, out, 0, first);
        if (first < size) {
            System.arraycopy(buffer, 0, out, first, size - first);
        }
        return out;
    }

    /** Copies the contents out and zeroes the buffer. */
    synchronized byte[] drain() {
        byte[] out = toByteArray();
        clear();
        return out;
    }

    synchronized void clear() {
        Arrays.fill(buffer, (byte) 0);
        writePos = 0;
        size = 0;
    }
}
