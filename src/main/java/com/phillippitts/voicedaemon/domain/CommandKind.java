package com.phillippitts.voicedaemon.domain;

import java.util.Optional;

/**
 * Commands accepted by the daemon. The wire name is the constant name.
 */
public enum CommandKind {
    START_RECORDING,
    STOP_RECORDING,
    TOGGLE_RECORDING,
    GET_STATUS,
    PROCESS_TEXT,
    TRANSLATE_TEXT,
    TRANSCRIBE_FILE,
    PAUSE,
    RESUME,
    RESTART,
    SHUTDOWN,
    PING,
    GET_CONFIG,
    UPDATE_CONFIG;

    public static Optional<CommandKind> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (CommandKind kind : values()) {
            if (kind.name().equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
