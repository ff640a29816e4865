package com.phillippitts.voicedaemon.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable view of the process-wide daemon state at one sequence number.
 *
 * <p>Only the state machine produces new snapshots; everything else reads the latest one.
 *
 * @param phase          current phase (never null)
 * @param sequence       monotonic transition counter, 0 at startup
 * @param recordingOwner session that started the current recording, or null
 * @param transcript     last completed transcript, cleared when a new recording starts
 * @param lastError      message of the most recent failure, or null
 */
public record DaemonSnapshot(
        DaemonPhase phase,
        long sequence,
        UUID recordingOwner,
        String transcript,
        String lastError
) {

    public DaemonSnapshot {
        Objects.requireNonNull(phase, "phase must not be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must not be negative, got: " + sequence);
        }
        transcript = transcript == null ? "" : transcript;
    }

    public static DaemonSnapshot initial() {
        return new DaemonSnapshot(DaemonPhase.IDLE, 0L, null, "", null);
    }

    /** Copy in the target phase with the sequence advanced by one. */
    public DaemonSnapshot advanceTo(DaemonPhase target) {
        return new DaemonSnapshot(target, sequence + 1, recordingOwner, transcript, lastError);
    }

    public DaemonSnapshot withRecordingOwner(UUID owner) {
        return new DaemonSnapshot(phase, sequence, owner, transcript, lastError);
    }

    public DaemonSnapshot withTranscript(String text) {
        return new DaemonSnapshot(phase, sequence, recordingOwner, text, lastError);
    }

    public DaemonSnapshot withLastError(String error) {
        return new DaemonSnapshot(phase, sequence, recordingOwner, transcript, error);
    }

    public boolean isNewerThan(DaemonSnapshot other) {
        return other == null || sequence > other.sequence;
    }
}
