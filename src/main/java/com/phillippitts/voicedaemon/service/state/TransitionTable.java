package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.domain.DaemonPhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.phillippitts.voicedaemon.domain.DaemonPhase.ERROR;
import static com.phillippitts.voicedaemon.domain.DaemonPhase.IDLE;
import static com.phillippitts.voicedaemon.domain.DaemonPhase.PAUSED;
import static com.phillippitts.voicedaemon.domain.DaemonPhase.PROCESSING;
import static com.phillippitts.voicedaemon.domain.DaemonPhase.RECORDING;
import static com.phillippitts.voicedaemon.domain.DaemonPhase.RESTARTING;
import static com.phillippitts.voicedaemon.domain.DaemonPhase.SHUTTING_DOWN;
import static com.phillippitts.voicedaemon.domain.DaemonPhase.TRANSCRIBING;

/**
 * The complete set of legal transitions: each trigger maps a set of source phases to one target.
 * Anything not listed here is rejected.
 */
public final class TransitionTable {

    private record Transition(Set<DaemonPhase> from, DaemonPhase to) {}

    private static final Map<Trigger, Transition> TRANSITIONS;

    static {
        Map<Trigger, Transition> t = new EnumMap<>(Trigger.class);
        t.put(Trigger.START_RECORDING, new Transition(EnumSet.of(IDLE), RECORDING));
        t.put(Trigger.STOP_RECORDING, new Transition(EnumSet.of(RECORDING), TRANSCRIBING));
        t.put(Trigger.CAPTURE_FAILED, new Transition(EnumSet.of(RECORDING), IDLE));
        t.put(Trigger.TRANSCRIPTION_SUCCEEDED, new Transition(EnumSet.of(TRANSCRIBING), IDLE));
        t.put(Trigger.TRANSCRIPTION_FAILED, new Transition(EnumSet.of(TRANSCRIBING), ERROR));
        t.put(Trigger.TRANSCRIBE_FILE, new Transition(EnumSet.of(IDLE, ERROR), TRANSCRIBING));
        t.put(Trigger.PROCESS_TEXT, new Transition(EnumSet.of(IDLE, ERROR), PROCESSING));
        t.put(Trigger.REFINEMENT_SUCCEEDED, new Transition(EnumSet.of(PROCESSING), IDLE));
        t.put(Trigger.REFINEMENT_FAILED, new Transition(EnumSet.of(PROCESSING), ERROR));
        t.put(Trigger.PAUSE, new Transition(EnumSet.of(IDLE, RECORDING, TRANSCRIBING, PROCESSING), PAUSED));
        t.put(Trigger.RESUME, new Transition(EnumSet.of(PAUSED, ERROR), IDLE));
        t.put(Trigger.RESTART, new Transition(EnumSet.complementOf(EnumSet.of(RESTARTING, SHUTTING_DOWN)), RESTARTING));
        t.put(Trigger.RESTART_COMPLETED, new Transition(EnumSet.of(RESTARTING), IDLE));
        t.put(Trigger.RESTART_FAILED, new Transition(EnumSet.of(RESTARTING), ERROR));
        t.put(Trigger.SHUTDOWN, new Transition(EnumSet.complementOf(EnumSet.of(SHUTTING_DOWN)), SHUTTING_DOWN));
        for (Trigger trigger : Trigger.values()) {
            if (!t.containsKey(trigger)) {
                throw new IllegalStateException("No transition defined for " + trigger);
            }
        }
        TRANSITIONS = Collections.unmodifiableMap(t);
    }

    private TransitionTable() {}

    /**
     * @return the target phase, or empty if {@code trigger} is not legal in {@code from}
     */
    public static Optional<DaemonPhase> target(Trigger trigger, DaemonPhase from) {
        Transition transition = TRANSITIONS.get(trigger);
        return transition.from().contains(from) ? Optional.of(transition.to()) : Optional.empty();
    }

    public static boolean isAllowed(Trigger trigger, DaemonPhase from) {
        return TRANSITIONS.get(trigger).from().contains(from);
    }

    public static Set<DaemonPhase> sources(Trigger trigger) {
        return Collections.unmodifiableSet(TRANSITIONS.get(trigger).from());
    }
}
