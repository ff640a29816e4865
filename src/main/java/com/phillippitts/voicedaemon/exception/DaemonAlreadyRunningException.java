package com.phillippitts.voicedaemon.exception;

import java.nio.file.Path;

/**
 * Thrown at startup when another daemon instance is already accepting connections on the socket.
 */
public class DaemonAlreadyRunningException extends VoiceDaemonException {

    public DaemonAlreadyRunningException(Path socketPath) {
        super("Daemon already running on socket " + socketPath);
    }

    @Override
    public String errorType() {
        return "AlreadyRunningError";
    }
}
