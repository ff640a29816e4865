package com.phillippitts.voicedaemon.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * A decoded client request. Immutable and consumed exactly once by the dispatcher.
 *
 * @param kind      command kind
 * @param payload   payload matching the kind
 * @param sessionId originating session, or null for requests built on the client side
 */
public record Command(CommandKind kind, CommandPayload payload, UUID sessionId) {

    public Command {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }

    public static Command of(CommandKind kind) {
        return new Command(kind, CommandPayload.NoPayload.INSTANCE, null);
    }

    public static Command of(CommandKind kind, CommandPayload payload) {
        return new Command(kind, payload, null);
    }

    public Command fromSession(UUID session) {
        return new Command(kind, payload, session);
    }

    /**
     * Returns the payload cast to the expected shape.
     *
     * @throws IllegalStateException if the payload has a different shape
     */
    public <T extends CommandPayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(kind + " carries " + payload.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(payload);
    }
}
