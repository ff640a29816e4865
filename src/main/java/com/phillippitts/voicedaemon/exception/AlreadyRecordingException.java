package com.phillippitts.voicedaemon.exception;

import com.phillippitts.voicedaemon.domain.DaemonPhase;

import java.util.UUID;

/**
 * Thrown when recording is requested while another recording is in progress.
 */
public class AlreadyRecordingException extends StateConflictException {

    private final UUID owner;

    public AlreadyRecordingException(UUID owner) {
        super("Already recording (owner session: " + owner + ")", DaemonPhase.RECORDING);
        this.owner = owner;
    }

    public UUID getOwner() {
        return owner;
    }
}
