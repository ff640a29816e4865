package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import com.phillippitts.voicedaemon.exception.AudioDeviceException;
import com.phillippitts.voicedaemon.exception.ProtocolException;
import com.phillippitts.voicedaemon.exception.RefinementException;
import com.phillippitts.voicedaemon.exception.StateConflictException;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.recording.CaptureListener;
import com.phillippitts.voicedaemon.service.recording.PendingCapture;
import com.phillippitts.voicedaemon.service.recording.RecordingWorkflow;
import com.phillippitts.voicedaemon.service.refinement.RefinementTask;
import com.phillippitts.voicedaemon.service.refinement.RefinementWorkflow;
import com.phillippitts.voicedaemon.service.session.Session;
import com.phillippitts.voicedaemon.service.session.SessionRegistry;
import com.phillippitts.voicedaemon.service.transcription.EngineLifecycle;
import com.phillippitts.voicedaemon.service.transcription.TranscriptionTask;
import com.phillippitts.voicedaemon.service.transcription.TranscriptionWorkflow;
import com.phillippitts.voicedaemon.testutil.CapturingEventListener;
import com.phillippitts.voicedaemon.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkflowCoordinatorTest {

    private CapturingEventListener events;
    private DaemonStateMachine machine;
    private RecordingWorkflow recording;
    private TranscriptionWorkflow transcription;
    private RefinementWorkflow refinement;
    private EngineLifecycle engine;
    private SessionRegistry registry;
    private ShutdownCoordinator shutdown;
    private DaemonProperties properties;
    private WorkflowCoordinator coordinator;

    private final CompletableFuture<String> transcript = new CompletableFuture<>();
    private final CompletableFuture<String> refined = new CompletableFuture<>();
    private final CompletableFuture<Void> restarted = new CompletableFuture<>();
    private TranscriptionTask transcriptionTask;
    private RefinementTask refinementTask;

    @BeforeEach
    void setUp() {
        events = new CapturingEventListener();
        machine = new DaemonStateMachine(events, new DaemonMetrics(new SimpleMeterRegistry()));
        recording = mock(RecordingWorkflow.class);
        transcription = mock(TranscriptionWorkflow.class);
        refinement = mock(RefinementWorkflow.class);
        engine = mock(EngineLifecycle.class);
        shutdown = mock(ShutdownCoordinator.class);
        properties = new DaemonProperties();
        registry = new SessionRegistry(properties);

        transcriptionTask = mock(TranscriptionTask.class);
        when(transcriptionTask.result()).thenReturn(transcript);
        when(transcription.submit(any())).thenReturn(transcriptionTask);
        when(transcription.submitFile(any())).thenReturn(transcriptionTask);
        when(recording.stop()).thenReturn(mock(PendingCapture.class));

        refinementTask = mock(RefinementTask.class);
        when(refinementTask.result()).thenReturn(refined);
        when(refinement.submit(anyString(), any())).thenReturn(refinementTask);

        when(engine.restart(any(Duration.class))).thenReturn(restarted);

        coordinator = new WorkflowCoordinator(machine, recording, transcription, refinement, engine,
                registry, shutdown, properties, new SyncExecutor());
    }

    @Test
    void recordingPipelineEndsIdleWithTranscript() {
        UUID session = UUID.randomUUID();

        coordinator.startRecording(session);
        assertThat(machine.current().recordingOwner()).isEqualTo(session);

        coordinator.stopRecording(session);
        assertThat(machine.phase()).isEqualTo(DaemonPhase.TRANSCRIBING);

        transcript.complete("hello world");

        assertThat(machine.phase()).isEqualTo(DaemonPhase.IDLE);
        assertThat(machine.current().transcript()).isEqualTo("hello world");
        assertThat(events.names()).containsExactly("recording_started", "recording_stopped", "transcription_completed");
        assertThat(events.last().dataString("transcription")).isEqualTo("hello world");
    }

    @Test
    void deviceFailureOnStartLeavesIdle() {
        doThrow(new AudioDeviceException("MIC_UNAVAILABLE", "Microphone unavailable"))
                .when(recording).start(any());

        assertThatThrownBy(() -> coordinator.startRecording(UUID.randomUUID()))
                .isInstanceOf(AudioDeviceException.class);

        assertThat(machine.phase()).isEqualTo(DaemonPhase.IDLE);
        assertThat(events.events()).isEmpty();
    }

    @Test
    void captureFailureMidRecordingReturnsToIdle() {
        coordinator.startRecording(UUID.randomUUID());
        ArgumentCaptor<CaptureListener> listener = ArgumentCaptor.forClass(CaptureListener.class);
        verify(recording).start(listener.capture());

        listener.getValue().onCaptureFailed(new AudioDeviceException("CAPTURE_ERROR", "Line closed"));

        assertThat(machine.phase()).isEqualTo(DaemonPhase.IDLE);
        assertThat(machine.current().lastError()).isEqualTo("Line closed");
        assertThat(events.last().errorType()).isEqualTo("AudioDeviceError");
        verify(recording).cancel();
    }

    @Test
    void foreignStopAllowedByDefault() {
        Session owner = registry.open();
        coordinator.startRecording(owner.id());

        coordinator.stopRecording(UUID.randomUUID());

        assertThat(machine.phase()).isEqualTo(DaemonPhase.TRANSCRIBING);
    }

    @Test
    void foreignStopRejectedWhenOwnerStillConnected() {
        properties.setAllowForeignStop(false);
        Session owner = registry.open();
        coordinator.startRecording(owner.id());

        assertThatThrownBy(() -> coordinator.stopRecording(UUID.randomUUID()))
                .isInstanceOf(StateConflictException.class);

        registry.unregister(owner.id());
        coordinator.stopRecording(UUID.randomUUID());
        assertThat(machine.phase()).isEqualTo(DaemonPhase.TRANSCRIBING);
    }

    @Test
    void toggleAlternatesStartAndStop() {
        UUID session = UUID.randomUUID();

        assertThat(coordinator.toggle(session)).isTrue();
        assertThat(coordinator.toggle(session)).isFalse();
        assertThat(machine.phase()).isEqualTo(DaemonPhase.TRANSCRIBING);
        assertThatThrownBy(() -> coordinator.toggle(session)).isInstanceOf(StateConflictException.class);
    }

    @Test
    void transcriptionFailureEntersError() {
        coordinator.startRecording(UUID.randomUUID());
        coordinator.stopRecording(null);

        transcript.completeExceptionally(new TranscriptionException("Engine crashed", "whisper"));

        assertThat(machine.phase()).isEqualTo(DaemonPhase.ERROR);
        assertThat(events.last().event()).isEqualTo("transcription_failed");
        assertThat(events.last().error()).contains("Engine crashed");
    }

    @Test
    void refinementSuccessCarriesBothTexts() {
        coordinator.processText("um hello", RefinementRequest.refine());
        assertThat(events.last().dataString("mode")).isEqualTo("refine");

        refined.complete("Hello.");

        DaemonResponse done = events.last();
        assertThat(done.event()).isEqualTo("processing_completed");
        assertThat(done.dataString("text")).isEqualTo("Hello.");
        assertThat(done.dataString("original_text")).isEqualTo("um hello");
        assertThat(machine.phase()).isEqualTo(DaemonPhase.IDLE);
    }

    @Test
    void refinementFailureKeepsOriginalText() {
        coordinator.processText("hola", RefinementRequest.translate("en"));
        assertThat(events.last().dataString("target_lang")).isEqualTo("en");

        refined.completeExceptionally(new RefinementException("Provider unreachable", "hola", 3, null));

        assertThat(machine.phase()).isEqualTo(DaemonPhase.ERROR);
        assertThat(events.last().dataString("text")).isEqualTo("hola");
        assertThat(events.last().errorType()).isEqualTo("RefinementError");
    }

    @Test
    void pauseCancelsWorkAndDropsLateResult() {
        coordinator.startRecording(UUID.randomUUID());
        coordinator.stopRecording(null);

        coordinator.pause();
        transcript.complete("too late");

        verify(transcriptionTask).cancel();
        assertThat(machine.phase()).isEqualTo(DaemonPhase.PAUSED);
        assertThat(events.names()).doesNotContain("transcription_completed");

        coordinator.resume();
        assertThat(machine.phase()).isEqualTo(DaemonPhase.IDLE);
    }

    @Test
    void pauseWhilePausedIsRejected() {
        coordinator.pause();

        assertThatThrownBy(coordinator::pause).isInstanceOf(ProtocolException.class);
    }

    @Test
    void restartCompletesBackToIdle() {
        coordinator.processText("text", RefinementRequest.refine());

        coordinator.restart();
        assertThat(machine.phase()).isEqualTo(DaemonPhase.RESTARTING);
        verify(refinementTask).cancel();

        refined.complete("stale");
        restarted.complete(null);

        assertThat(machine.phase()).isEqualTo(DaemonPhase.IDLE);
        assertThat(events.names()).containsExactly("processing_started", "restarting", "restarted");
    }

    @Test
    void failedRestartEntersError() {
        coordinator.restart();

        restarted.completeExceptionally(new TranscriptionException("Model missing", "whisper"));

        assertThat(machine.phase()).isEqualTo(DaemonPhase.ERROR);
        assertThat(events.last().event()).isEqualTo("restart_failed");
    }

    @Test
    void shutdownCancelsRecordingAndSchedulesExit() {
        coordinator.startRecording(UUID.randomUUID());

        coordinator.shutdown();

        verify(recording).cancel();
        verify(shutdown).initiate();
        assertThat(machine.phase()).isEqualTo(DaemonPhase.SHUTTING_DOWN);
        assertThatThrownBy(() -> coordinator.startRecording(UUID.randomUUID()))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void rejectedStopDoesNotTouchRecorder() {
        assertThatThrownBy(() -> coordinator.stopRecording(UUID.randomUUID()))
                .isInstanceOf(ProtocolException.class);

        verify(recording, never()).stop();
    }

    @Test
    void fileTranscriptionSharesTheTranscriptionCompletion() {
        Path wav = Path.of("/tmp/dictation.wav");

        coordinator.transcribeFile(wav);
        assertThat(machine.phase()).isEqualTo(DaemonPhase.TRANSCRIBING);
        verify(transcription).submitFile(wav);

        transcript.complete("from file");

        assertThat(machine.phase()).isEqualTo(DaemonPhase.IDLE);
        assertThat(machine.current().transcript()).isEqualTo("from file");
        assertThat(events.names()).containsExactly("file_transcription_started", "transcription_completed");
        assertThat(events.events().get(0).dataString("file_path")).isEqualTo("/tmp/dictation.wav");
    }

    @Test
    void fileTranscriptionIsRejectedWhilePausedAndBusy() {
        coordinator.pause();

        assertThatThrownBy(() -> coordinator.transcribeFile(Path.of("/tmp/a.wav")))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Cannot transcribe file while paused");

        coordinator.resume();
        coordinator.startRecording(UUID.randomUUID());
        assertThatThrownBy(() -> coordinator.transcribeFile(Path.of("/tmp/a.wav")))
                .isInstanceOf(StateConflictException.class);
        verify(transcription, never()).submitFile(any());
    }

    @Test
    void pauseCancelsFileTranscription() {
        coordinator.transcribeFile(Path.of("/tmp/a.wav"));

        coordinator.pause();
        transcript.complete("late");

        verify(transcriptionTask).cancel();
        assertThat(machine.phase()).isEqualTo(DaemonPhase.PAUSED);
        assertThat(events.names()).doesNotContain("transcription_completed");
    }
}
