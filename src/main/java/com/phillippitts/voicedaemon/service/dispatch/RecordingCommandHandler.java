package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.service.state.WorkflowCoordinator;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * START_RECORDING, STOP_RECORDING and TOGGLE_RECORDING.
 */
@Component
class RecordingCommandHandler implements CommandHandler {

    private final WorkflowCoordinator coordinator;

    RecordingCommandHandler(WorkflowCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.START_RECORDING, CommandKind.STOP_RECORDING, CommandKind.TOGGLE_RECORDING);
    }

    @Override
    public Map<String, Object> handle(Command command) {
        switch (command.kind()) {
            case START_RECORDING:
                coordinator.startRecording(command.sessionId());
                return Map.of("session_id", String.valueOf(command.sessionId()));
            case STOP_RECORDING:
                coordinator.stopRecording(command.sessionId());
                return null;
            case TOGGLE_RECORDING:
                boolean started = coordinator.toggle(command.sessionId());
                return started
                        ? Map.of("action", "started", "session_id", String.valueOf(command.sessionId()))
                        : Map.of("action", "stopped");
            default:
                throw new IllegalArgumentException("Unsupported command " + command.kind());
        }
    }
}
