package com.phillippitts.voicedaemon.exception;

/**
 * Base exception for all voicedaemon application-specific errors.
 * All domain exceptions extend this class so the control path can translate any of them
 * into an error response carrying {@link #errorType()}.
 */
public class VoiceDaemonException extends RuntimeException {

    public VoiceDaemonException(String message) {
        super(message);
    }

    public VoiceDaemonException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceDaemonException(Throwable cause) {
        super(cause);
    }

    /**
     * Wire name of this error category, sent to clients as {@code error_type}.
     *
     * @return error type name (e.g. "ProtocolError")
     */
    public String errorType() {
        return "DaemonError";
    }
}
