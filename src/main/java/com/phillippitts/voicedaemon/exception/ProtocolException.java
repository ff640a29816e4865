package com.phillippitts.voicedaemon.exception;

/**
 * Thrown when a well-framed request is malformed, names an unknown command, carries an
 * invalid payload, or asks for a transition the current phase does not allow.
 * Only the offending request is rejected; the connection survives.
 */
public class ProtocolException extends VoiceDaemonException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "ProtocolError";
    }
}
