package com.phillippitts.voicedaemon.exception;

/**
 * Thrown when wire data cannot be split into frames: the declared length exceeds the
 * configured maximum, the stream ends mid-frame, or the payload is not valid UTF-8.
 * Fatal for the connection that produced it.
 */
public class FramingException extends VoiceDaemonException {

    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "FramingError";
    }
}
