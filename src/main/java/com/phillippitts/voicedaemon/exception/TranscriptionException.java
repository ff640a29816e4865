package com.phillippitts.voicedaemon.exception;

/**
 * Thrown when the speech engine fails on a segment: process crash, timeout, non-zero exit,
 * or an engine that was never initialized. The transcription workflow retries once before
 * surfacing it.
 */
public class TranscriptionException extends VoiceDaemonException {

    private final String engineName;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }

    @Override
    public String errorType() {
        return "TranscriptionError";
    }
}
