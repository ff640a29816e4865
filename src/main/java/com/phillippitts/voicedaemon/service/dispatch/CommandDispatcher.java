package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.exception.VoiceDaemonException;
import com.phillippitts.voicedaemon.ipc.ProtocolCodec;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.state.DaemonStateMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Decodes one request frame, routes it to its {@link CommandHandler} and builds the response.
 *
 * <p>Runs on the control thread only. Validation failures and rejected transitions become error
 * responses; the connection is never closed from here.
 */
@Component
public class CommandDispatcher {

    private static final Logger LOG = LogManager.getLogger(CommandDispatcher.class);

    static final String MDC_SESSION = "sessionId";
    static final String MDC_COMMAND = "command";

    private final Map<CommandKind, CommandHandler> handlers = new EnumMap<>(CommandKind.class);
    private final DaemonStateMachine machine;
    private final DaemonMetrics metrics;

    public CommandDispatcher(List<CommandHandler> handlerBeans, DaemonStateMachine machine, DaemonMetrics metrics) {
        this.machine = machine;
        this.metrics = metrics;
        for (CommandHandler handler : handlerBeans) {
            for (CommandKind kind : handler.kinds()) {
                CommandHandler previous = handlers.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Command " + kind + " claimed by both "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
        List<CommandKind> missing = Arrays.stream(CommandKind.values())
                .filter(kind -> !handlers.containsKey(kind))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler for commands " + missing);
        }
    }

    /**
     * Handles one raw request from {@code sessionId}.
     *
     * @return the response for the requester; never null
     */
    public DaemonResponse dispatch(String rawJson, UUID sessionId) {
        ThreadContext.put(MDC_SESSION, String.valueOf(sessionId));
        try {
            Command command = ProtocolCodec.decodeRequest(rawJson, sessionId);
            ThreadContext.put(MDC_COMMAND, command.kind().name());
            metrics.recordCommand(command.kind());
            LOG.debug("Dispatching {}", command.kind());
            Map<String, Object> data = handlers.get(command.kind()).handle(command);
            return DaemonResponse.success(machine.current(), data);
        } catch (VoiceDaemonException e) {
            LOG.info("Request rejected ({}): {}", e.errorType(), e.getMessage());
            return DaemonResponse.error(e, machine.current());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while handling request", e);
            return DaemonResponse.error(new ProtocolException("Internal error: " + e.getMessage(), e),
                    machine.current());
        } finally {
            ThreadContext.remove(MDC_COMMAND);
            ThreadContext.remove(MDC_SESSION);
        }
    }
}
