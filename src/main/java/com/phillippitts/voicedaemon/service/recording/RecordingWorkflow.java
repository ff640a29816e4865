package com.phillippitts.voicedaemon.service.recording;

import com.phillippitts.voicedaemon.config.AudioCaptureProperties;
import com.phillippitts.voicedaemon.exception.AudioDeviceException;
import com.phillippitts.voicedaemon.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Owns the microphone for the duration of one recording.
 *
 * <p>{@link #start(CaptureListener)} opens the device synchronously and starts the
 * {@code audio-capture} thread. {@link #stop()} only signals that thread and hands the samples
 * over as a {@link PendingCapture}; joining it is left to the transcription worker so the
 * control thread never waits on audio hardware.
 *
 * <p>{@link #cancel()} and the next {@link #start(CaptureListener)} wait at most one chunk plus
 * {@link #RELEASE_MARGIN_MS} for the previous capture thread to close the device. A device still
 * held after that is reported as {@code MIC_BUSY}.
 */
@Component
public class RecordingWorkflow {

    private static final Logger LOG = LogManager.getLogger(RecordingWorkflow.class);

    static final long RELEASE_MARGIN_MS = 250;

    private final AudioCaptureSource source;
    private final AudioCaptureProperties props;

    private final Object lock = new Object();
    private Capture active;
    private Thread lastThread;

    public RecordingWorkflow(AudioCaptureSource source, AudioCaptureProperties props) {
        this.source = Objects.requireNonNull(source);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Opens the capture source and begins accumulating audio.
     *
     * @param listener notified if capture fails while recording
     * @throws AudioDeviceException if the device cannot be opened; nothing is started
     */
    public void start(CaptureListener listener) {
        synchronized (lock) {
            if (active != null) {
                throw new IllegalStateException("A recording is already active");
            }
            awaitRelease(lastThread);
            source.open();
            Capture capture = new Capture(new PcmRingBuffer(AudioFormat.bytesFor(props.maxDurationMs())), listener);
            Thread thread = new Thread(() -> doCapture(capture), "audio-capture");
            thread.setDaemon(true);
            capture.thread = thread;
            active = capture;
            lastThread = thread;
            thread.start();
        }
    }

    /**
     * Signals the capture thread to finish and returns the pending samples.
     *
     * @throws IllegalStateException if no recording is active
     */
    public PendingCapture stop() {
        Capture capture;
        synchronized (lock) {
            capture = active;
            if (capture == null) {
                throw new IllegalStateException("No active recording");
            }
            active = null;
        }
        capture.running = false;
        return new PendingCapture(capture.thread, capture.buffer);
    }

    /**
     * Stops the active recording and discards its audio.
     *
     * @return true if a recording was cancelled
     */
    public boolean cancel() {
        Capture capture;
        synchronized (lock) {
            capture = active;
            active = null;
        }
        if (capture == null) {
            return false;
        }
        capture.cancelled = true;
        capture.running = false;
        capture.buffer.clear();
        LOG.info("Recording cancelled, audio discarded");
        Thread thread = capture.thread;
        if (thread != null && thread != Thread.currentThread()) {
            PendingCapture.joinQuietly(thread, releaseTimeout());
        }
        return true;
    }

    public boolean isActive() {
        synchronized (lock) {
            return active != null;
        }
    }

    private void awaitRelease(Thread previous) {
        if (previous == null || !previous.isAlive() || previous == Thread.currentThread()) {
            return;
        }
        PendingCapture.joinQuietly(previous, releaseTimeout());
        if (previous.isAlive()) {
            throw new AudioDeviceException("MIC_BUSY", "Microphone is still held by the previous recording");
        }
    }

    private Duration releaseTimeout() {
        return Duration.ofMillis(props.chunkMillis() + RELEASE_MARGIN_MS);
    }

    @PreDestroy
    public void shutdown() {
        Capture capture;
        synchronized (lock) {
            capture = active;
        }
        if (cancel() && capture.thread != null) {
            PendingCapture.joinQuietly(capture.thread, ProcessTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT);
        }
    }

    private void doCapture(Capture capture) {
        byte[] chunk = new byte[Math.max(AudioFormat.REQUIRED_BLOCK_ALIGN, AudioFormat.bytesFor(props.chunkMillis()))];
        long written = 0;
        try {
            while (capture.running) {
                int n = source.read(chunk);
                if (n <= 0) {
                    continue;
                }
                if (!capture.running) {
                    break;
                }
                capture.buffer.write(chunk, 0, n);
                written += n;
                if (capture.buffer.isFull()) {
                    LOG.info("Max capture duration reached ({} ms)", props.maxDurationMs());
                    break;
                }
            }
            LOG.info("Audio capture completed: {} bytes captured", written);
        } catch (AudioDeviceException e) {
            reportFailure(capture, e);
        } catch (RuntimeException e) {
            reportFailure(capture, new AudioDeviceException("CAPTURE_ERROR", "Capture failed: " + e.getMessage(), e));
        } finally {
            source.close();
            if (capture.cancelled) {
                capture.buffer.clear();
            }
            Arrays.fill(chunk, (byte) 0);
        }
    }

    private void reportFailure(Capture capture, AudioDeviceException failure) {
        if (capture.cancelled || !capture.running) {
            LOG.debug("Ignoring capture error after stop: {}", failure.getMessage());
            return;
        }
        LOG.warn("Capture failed: {}", failure.getMessage());
        capture.running = false;
        capture.buffer.clear();
        if (capture.listener != null) {
            capture.listener.onCaptureFailed(failure);
        }
    }

    private static final class Capture {
        final PcmRingBuffer buffer;
        final CaptureListener listener;
        volatile boolean running = true;
        volatile boolean cancelled = false;
        volatile Thread thread;

        Capture(PcmRingBuffer buffer, CaptureListener listener) {
            this.buffer = buffer;
            this.listener = listener;
        }
    }
}
