package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.config.RuntimeSettings;
import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.CommandPayload;
import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.exception.StateConflictException;
import com.phillippitts.voicedaemon.service.state.DaemonStateMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * GET_CONFIG and UPDATE_CONFIG. Updates are accepted only while idle so the engine and the
 * provider never change under a running workflow.
 */
@Component
class ConfigCommandHandler implements CommandHandler {

    private static final Logger LOG = LogManager.getLogger(ConfigCommandHandler.class);

    private final RuntimeSettings settings;
    private final DaemonStateMachine machine;

    ConfigCommandHandler(RuntimeSettings settings, DaemonStateMachine machine) {
        this.settings = settings;
        this.machine = machine;
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.GET_CONFIG, CommandKind.UPDATE_CONFIG);
    }

    @Override
    public Map<String, Object> handle(Command command) {
        if (command.kind() == CommandKind.GET_CONFIG) {
            return settings.effectiveConfig();
        }
        DaemonPhase phase = machine.phase();
        if (phase != DaemonPhase.IDLE) {
            String message = "Configuration can only change while idle (phase " + phase.wireName() + ")";
            if (phase.isBusy()) {
                throw new StateConflictException(message, phase);
            }
            throw new ProtocolException(message);
        }
        Map<String, Object> effective = settings.apply(command.payloadAs(CommandPayload.ConfigPayload.class).settings());
        LOG.info("Runtime configuration updated: {}", effective);
        return effective;
    }
}
