package com.phillippitts.voicedaemon.exception;

import com.phillippitts.voicedaemon.domain.DaemonPhase;

/**
 * Thrown when a command contends for a resource that an active workflow already owns.
 * The command is rejected, never queued.
 */
public class StateConflictException extends VoiceDaemonException {

    private final DaemonPhase phase;

    public StateConflictException(String message, DaemonPhase phase) {
        super(message);
        this.phase = phase;
    }

    /** Phase that held the resource when the command was rejected. */
    public DaemonPhase getPhase() {
        return phase;
    }

    @Override
    public String errorType() {
        return "StateConflictError";
    }
}
