package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.DaemonSnapshot;
import com.phillippitts.voicedaemon.exception.AlreadyRecordingException;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.exception.StateConflictException;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.testutil.CapturingEventListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DaemonStateMachineTest {

    private CapturingEventListener listener;
    private DaemonStateMachine machine;

    @BeforeEach
    void setUp() {
        listener = new CapturingEventListener();
        machine = new DaemonStateMachine(listener, new DaemonMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void everyTransitionAdvancesSequenceAndEmitsOneEvent() {
        UUID owner = UUID.randomUUID();

        machine.fire(Trigger.START_RECORDING, s -> s.withRecordingOwner(owner), Map.of("session_id", owner.toString()));
        machine.fire(Trigger.STOP_RECORDING);
        machine.fire(Trigger.TRANSCRIPTION_SUCCEEDED, s -> s.withTranscript("hello"), Map.of("transcription", "hello"));

        assertThat(listener.names()).containsExactly("recording_started", "recording_stopped", "transcription_completed");
        assertThat(listener.events()).extracting(e -> e.state().sequence()).containsExactly(1L, 2L, 3L);
        assertThat(machine.current().phase()).isEqualTo(DaemonPhase.IDLE);
        assertThat(machine.current().transcript()).isEqualTo("hello");
    }

    @Test
    void ownerOnlyHeldWhileRecording() {
        UUID owner = UUID.randomUUID();

        DaemonSnapshot recording = machine.fire(Trigger.START_RECORDING, s -> s.withRecordingOwner(owner), null);
        DaemonSnapshot transcribing = machine.fire(Trigger.STOP_RECORDING);

        assertThat(recording.recordingOwner()).isEqualTo(owner);
        assertThat(transcribing.recordingOwner()).isNull();
    }

    @Test
    void failureRecordsErrorAndSuccessClearsIt() {
        machine.fire(Trigger.START_RECORDING);
        machine.fire(Trigger.STOP_RECORDING);

        machine.fail(Trigger.TRANSCRIPTION_FAILED, new TranscriptionException("Model crashed"), null);

        DaemonResponse event = listener.last();
        assertThat(event.isSuccess()).isFalse();
        assertThat(event.error()).isEqualTo("Model crashed");
        assertThat(event.errorType()).isEqualTo("TranscriptionError");
        assertThat(machine.current().phase()).isEqualTo(DaemonPhase.ERROR);
        assertThat(machine.current().lastError()).isEqualTo("Model crashed");

        machine.fire(Trigger.RESUME);
        assertThat(machine.current().lastError()).isNull();
    }

    @Test
    void rejectedTriggerLeavesStateUntouched() {
        DaemonSnapshot before = machine.current();

        assertThatThrownBy(() -> machine.fire(Trigger.STOP_RECORDING))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Cannot stop recording while idle");

        assertThat(machine.current()).isSameAs(before);
        assertThat(listener.events()).isEmpty();
    }

    @Test
    void startWhileRecordingNamesOwner() {
        UUID owner = UUID.randomUUID();
        machine.fire(Trigger.START_RECORDING, s -> s.withRecordingOwner(owner), null);

        assertThatThrownBy(() -> machine.ensureAllowed(Trigger.START_RECORDING))
                .isInstanceOfSatisfying(AlreadyRecordingException.class,
                        e -> assertThat(e.getOwner()).isEqualTo(owner));
    }

    @Test
    void busyPhaseRejectionIsStateConflict() {
        machine.fire(Trigger.START_RECORDING);
        machine.fire(Trigger.STOP_RECORDING);

        assertThatThrownBy(() -> machine.ensureAllowed(Trigger.PROCESS_TEXT))
                .isInstanceOfSatisfying(StateConflictException.class,
                        e -> assertThat(e.getPhase()).isEqualTo(DaemonPhase.TRANSCRIBING));
        assertThat(machine.canFire(Trigger.PAUSE)).isTrue();
    }

    @Test
    void failRequiresFailureTrigger() {
        assertThatThrownBy(() -> machine.fail(Trigger.PAUSE, new TranscriptionException("x"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
