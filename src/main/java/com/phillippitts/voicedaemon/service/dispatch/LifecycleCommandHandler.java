package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.service.state.WorkflowCoordinator;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
class LifecycleCommandHandler implements CommandHandler {

    private final WorkflowCoordinator coordinator;

    LifecycleCommandHandler(WorkflowCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.PAUSE, CommandKind.RESUME, CommandKind.RESTART, CommandKind.SHUTDOWN);
    }

    @Override
    public Map<String, Object> handle(Command command) {
        switch (command.kind()) {
            case PAUSE -> coordinator.pause();
            case RESUME -> coordinator.resume();
            case RESTART -> coordinator.restart();
            case SHUTDOWN -> coordinator.shutdown();
            default -> throw new IllegalArgumentException("Unsupported command " + command.kind());
        }
        return null;
    }
}
