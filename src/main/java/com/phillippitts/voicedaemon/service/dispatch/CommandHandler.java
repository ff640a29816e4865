package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;

import java.util.Map;
import java.util.Set;

/**
 * Handles a group of command kinds on the control thread.
 *
 * <p>Implementations are discovered as Spring beans; every {@link CommandKind} must be claimed by
 * exactly one handler.
 */
public interface CommandHandler {

    /**
     * @return the command kinds this handler accepts
     */
    Set<CommandKind> kinds();

    /**
     * Executes the command, firing any transition it implies.
     *
     * @return response data, or {@code null} for none
     * @throws com.phillippitts.voicedaemon.exception.VoiceDaemonException when the command is
     *         rejected
     */
    Map<String, Object> handle(Command command);
}
