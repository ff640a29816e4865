package com.phillippitts.voicedaemon.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * The single enumerated value describing what the daemon is doing.
 *
 * <p>Busy phases are those in which a workflow owns the microphone, the speech engine or the
 * LLM call. A command that would need the same resource during a busy phase is a state
 * conflict rather than a protocol error.
 */
public enum DaemonPhase {
    IDLE("idle", false),
    RECORDING("recording", true),
    TRANSCRIBING("transcribing", true),
    PROCESSING("processing", true),
    PAUSED("paused", false),
    ERROR("error", false),
    RESTARTING("restarting", true),
    SHUTTING_DOWN("shutting_down", false);

    private final String wireName;
    private final boolean busy;

    DaemonPhase(String wireName, boolean busy) {
        this.wireName = wireName;
        this.busy = busy;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isBusy() {
        return busy;
    }

    public static Optional<DaemonPhase> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(p -> p.wireName.equals(name))
                .findFirst();
    }
}
