package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.DaemonSnapshot;
import com.phillippitts.voicedaemon.exception.AlreadyRecordingException;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.exception.StateConflictException;
import com.phillippitts.voicedaemon.exception.VoiceDaemonException;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Single owner of the {@link DaemonSnapshot}.
 *
 * <p>{@link #fire} and {@link #fail} are only called on the control thread; every accepted
 * transition advances the sequence by one and emits exactly one event. Any thread may read
 * {@link #current()}.
 */
@Component
public class DaemonStateMachine {

    private static final Logger LOG = LogManager.getLogger(DaemonStateMachine.class);

    private final StateEventListener listener;
    private final DaemonMetrics metrics;

    private volatile DaemonSnapshot current = DaemonSnapshot.initial();

    public DaemonStateMachine(StateEventListener listener, DaemonMetrics metrics) {
        this.listener = listener;
        this.metrics = metrics;
    }

    public DaemonSnapshot current() {
        return current;
    }

    public DaemonPhase phase() {
        return current.phase();
    }

    /**
     * Throws the rejection {@code trigger} would cause in the current phase, without changing state.
     */
    public void ensureAllowed(Trigger trigger) {
        DaemonSnapshot snapshot = current;
        if (!TransitionTable.isAllowed(trigger, snapshot.phase())) {
            throw rejection(trigger, snapshot);
        }
    }

    public boolean canFire(Trigger trigger) {
        return TransitionTable.isAllowed(trigger, current.phase());
    }

    /**
     * Applies a successful transition.
     *
     * @param mutation adjusts the advanced snapshot (owner, transcript); may be identity
     * @param data     event data, may be null
     * @return the new snapshot
     */
    public DaemonSnapshot fire(Trigger trigger, UnaryOperator<DaemonSnapshot> mutation, Map<String, Object> data) {
        DaemonSnapshot next = transition(trigger, s -> mutation.apply(s.withLastError(null)));
        emit(DaemonResponse.event(trigger.eventName(), next, data));
        return next;
    }

    public DaemonSnapshot fire(Trigger trigger) {
        return fire(trigger, UnaryOperator.identity(), null);
    }

    /**
     * Applies a failure transition, recording the error in the snapshot and broadcasting it.
     */
    public DaemonSnapshot fail(Trigger trigger, VoiceDaemonException cause, Map<String, Object> data) {
        if (!trigger.isFailure()) {
            throw new IllegalArgumentException(trigger + " is not a failure trigger");
        }
        DaemonSnapshot next = transition(trigger, s -> s.withLastError(cause.getMessage()));
        emit(DaemonResponse.errorEvent(trigger.eventName(), next, data, cause.getMessage(), cause.errorType()));
        return next;
    }

    private DaemonSnapshot transition(Trigger trigger, UnaryOperator<DaemonSnapshot> mutation) {
        DaemonSnapshot before = current;
        DaemonPhase target = TransitionTable.target(trigger, before.phase())
                .orElseThrow(() -> rejection(trigger, before));
        DaemonSnapshot advanced = before.advanceTo(target);
        if (target != DaemonPhase.RECORDING) {
            advanced = advanced.withRecordingOwner(null);
        }
        DaemonSnapshot next = mutation.apply(advanced);
        current = next;
        metrics.recordTransition(trigger.eventName());
        LOG.info("{}: {} -> {} (seq {})", trigger.eventName(), before.phase().wireName(),
                next.phase().wireName(), next.sequence());
        return next;
    }

    private void emit(DaemonResponse event) {
        listener.onStateEvent(event);
    }

    private static VoiceDaemonException rejection(Trigger trigger, DaemonSnapshot snapshot) {
        DaemonPhase phase = snapshot.phase();
        if (trigger == Trigger.START_RECORDING && phase == DaemonPhase.RECORDING) {
            return new AlreadyRecordingException(snapshot.recordingOwner());
        }
        String message = "Cannot " + describe(trigger) + " while " + phase.wireName();
        if (phase.isBusy()) {
            return new StateConflictException(message, phase);
        }
        return new ProtocolException(message);
    }

    private static String describe(Trigger trigger) {
        return trigger.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
