package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.exception.FramingException;
import com.phillippitts.voicedaemon.service.dispatch.CommandDispatcher;
import com.phillippitts.voicedaemon.service.session.BroadcastHub;
import com.phillippitts.voicedaemon.service.session.Session;
import com.phillippitts.voicedaemon.service.session.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Entry point of the transport into the daemon core.
 *
 * <p>Connection reader threads hand every frame to the single control thread, in arrival order,
 * so each session observes its responses in request order and the state machine is mutated by
 * one thread only. The response is queued after any events the command emitted.
 */
@Component
public class DaemonController {

    private static final Logger LOG = LogManager.getLogger(DaemonController.class);

    private final CommandDispatcher dispatcher;
    private final BroadcastHub hub;
    private final SessionRegistry registry;
    private final DaemonStateMachine machine;
    private final Executor controlExecutor;

    public DaemonController(CommandDispatcher dispatcher,
                            BroadcastHub hub,
                            SessionRegistry registry,
                            DaemonStateMachine machine,
                            @Qualifier("controlExecutor") Executor controlExecutor) {
        this.dispatcher = dispatcher;
        this.hub = hub;
        this.registry = registry;
        this.machine = machine;
        this.controlExecutor = controlExecutor;
    }

    /**
     * Queues one request frame from {@code session} for dispatch.
     */
    public void submit(Session session, String rawJson) {
        execute(() -> {
            if (!session.isAlive()) {
                LOG.debug("Session {} gone before its request ran", session.id());
                return;
            }
            DaemonResponse response = dispatcher.dispatch(rawJson, session.id());
            hub.sendTo(session, response);
        });
    }

    /**
     * Answers a framing error and closes the session once the answer is written.
     */
    public void rejectFrame(Session session, FramingException error) {
        LOG.warn("Framing error on session {}: {}", session.id(), error.getMessage());
        execute(() -> {
            hub.sendTo(session, DaemonResponse.error(error, machine.current()));
            session.closeAfterFlush();
        });
    }

    /**
     * Called by the transport when a connection ends.
     */
    public void disconnected(Session session) {
        registry.unregister(session.id());
    }

    private void execute(Runnable task) {
        try {
            controlExecutor.execute(task);
        } catch (TaskRejectedException e) {
            LOG.debug("Control executor stopped; request dropped");
        }
    }
}
