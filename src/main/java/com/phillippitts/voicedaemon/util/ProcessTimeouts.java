package com.phillippitts.voicedaemon.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and thread management.
 *
 * <p>Used by {@link com.phillippitts.voicedaemon.service.transcription.whisper.WhisperProcessManager},
 * {@link com.phillippitts.voicedaemon.service.recording.RecordingWorkflow} and
 * {@link com.phillippitts.voicedaemon.ipc.IpcServer}.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /** Stream gobblers flushing buffered output after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Stream gobblers during best-effort cleanup. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Graceful termination via {@link Process#destroy()}. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Forceful termination via {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Capture thread finishing its last chunk after stop. Longer than one chunk read so the
     * tail of the recording is kept.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /** Capture thread after cancel or shutdown (best-effort). */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Connection reader/writer threads when the server stops. */
    public static final Duration CONNECTION_THREAD_JOIN_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
