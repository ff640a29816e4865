package com.phillippitts.voicedaemon.service.recording;

import com.phillippitts.voicedaemon.domain.AudioBuffer;
import com.phillippitts.voicedaemon.service.transcription.AudioInput;
import com.phillippitts.voicedaemon.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Samples of a stopped recording whose capture thread may still be finishing its last read.
 */
public final class PendingCapture implements AudioInput {

    private static final Logger LOG = LogManager.getLogger(PendingCapture.class);

    private final Thread captureThread;
    private final PcmRingBuffer buffer;

    PendingCapture(Thread captureThread, PcmRingBuffer buffer) {
        this.captureThread = captureThread;
        this.buffer = buffer;
    }

    /**
     * Waits for the capture thread to finish and moves the samples into an {@link AudioBuffer}.
     */
    @Override
    public AudioBuffer awaitBuffer() throws InterruptedException {
        if (captureThread != null && captureThread.isAlive()) {
            captureThread.join(ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
            if (captureThread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms",
                        ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
            }
        }
        return AudioBuffer.adopt(buffer.drain());
    }

    @Override
    public void discard() {
        buffer.clear();
    }

    static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }
}
