package com.phillippitts.voicedaemon.exception;

/**
 * Thrown when the audio capture resource cannot be opened or fails while capturing.
 * Recoverable: the daemon returns to (or stays in) {@code idle}.
 */
public class AudioDeviceException extends VoiceDaemonException {

    private final String reason;

    public AudioDeviceException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AudioDeviceException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Short machine-readable reason such as MIC_UNAVAILABLE or MIC_PERMISSION_DENIED. */
    public String getReason() {
        return reason;
    }

    @Override
    public String errorType() {
        return "AudioDeviceError";
    }
}
