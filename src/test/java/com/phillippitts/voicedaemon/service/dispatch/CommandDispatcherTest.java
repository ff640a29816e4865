package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.config.RefinementProperties;
import com.phillippitts.voicedaemon.config.RuntimeSettings;
import com.phillippitts.voicedaemon.config.WhisperConfig;
import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.domain.DaemonResponse;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import com.phillippitts.voicedaemon.exception.AlreadyRecordingException;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.session.SessionRegistry;
import com.phillippitts.voicedaemon.service.state.DaemonStateMachine;
import com.phillippitts.voicedaemon.service.state.Trigger;
import com.phillippitts.voicedaemon.service.state.WorkflowCoordinator;
import com.phillippitts.voicedaemon.testutil.CapturingEventListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CommandDispatcherTest {

    private final UUID session = UUID.randomUUID();

    private DaemonStateMachine machine;
    private WorkflowCoordinator coordinator;
    private DaemonMetrics metrics;
    private RefinementProperties refinement;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        metrics = new DaemonMetrics(new SimpleMeterRegistry());
        machine = new DaemonStateMachine(new CapturingEventListener(), metrics);
        coordinator = mock(WorkflowCoordinator.class);
        refinement = new RefinementProperties();
        DaemonProperties daemon = new DaemonProperties();
        WhisperConfig whisper = new WhisperConfig("/usr/local/bin/whisper-cli", "/models/ggml-base.en.bin", 10, "en", 4, 1_048_576);
        RuntimeSettings settings = new RuntimeSettings(whisper, refinement, daemon);
        dispatcher = new CommandDispatcher(List.of(
                new RecordingCommandHandler(coordinator),
                new TextCommandHandler(coordinator, refinement),
                new FileCommandHandler(coordinator),
                new LifecycleCommandHandler(coordinator),
                new StatusCommandHandler(new SessionRegistry(daemon), metrics),
                new ConfigCommandHandler(settings, machine)), machine, metrics);
    }

    @Test
    void pingAnswersPong() {
        DaemonResponse response = dispatcher.dispatch("{\"command\":\"PING\"}", session);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.isEvent()).isFalse();
        assertThat(response.dataString("message")).isEqualTo("PONG");
        assertThat(response.state().phase()).isEqualTo(DaemonPhase.IDLE);
    }

    @Test
    void statusReportsSessionsAndTelemetry() {
        dispatcher.dispatch("{\"command\":\"PING\"}", session);

        DaemonResponse response = dispatcher.dispatch("{\"command\":\"GET_STATUS\"}", session);

        assertThat(response.data()).containsKeys("sessions", "telemetry", "uptime_ms");
        @SuppressWarnings("unchecked")
        Map<String, Object> telemetry = (Map<String, Object>) response.data().get("telemetry");
        assertThat(telemetry).containsEntry("commands_total", 2L);
    }

    @Test
    void startReturnsSessionId() {
        DaemonResponse response = dispatcher.dispatch("{\"command\":\"START_RECORDING\"}", session);

        verify(coordinator).startRecording(session);
        assertThat(response.dataString("session_id")).isEqualTo(session.toString());
    }

    @Test
    void toggleReportsAction() {
        when(coordinator.toggle(session)).thenReturn(true, false);

        assertThat(dispatcher.dispatch("{\"command\":\"TOGGLE_RECORDING\"}", session).dataString("action"))
                .isEqualTo("started");
        assertThat(dispatcher.dispatch("{\"command\":\"TOGGLE_RECORDING\"}", session).dataString("action"))
                .isEqualTo("stopped");
    }

    @Test
    void rejectedTransitionBecomesErrorResponse() {
        UUID owner = UUID.randomUUID();
        doThrow(new AlreadyRecordingException(owner)).when(coordinator).startRecording(session);

        DaemonResponse response = dispatcher.dispatch("{\"command\":\"START_RECORDING\"}", session);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.errorType()).isEqualTo("StateConflictError");
        assertThat(response.error()).contains(owner.toString());
    }

    @Test
    void malformedJsonBecomesProtocolError() {
        DaemonResponse response = dispatcher.dispatch("{oops", session);

        assertThat(response.errorType()).isEqualTo("ProtocolError");
        verifyNoInteractions(coordinator);
    }

    @Test
    void unexpectedFailureIsReportedAsInternalError() {
        doThrow(new IllegalStateException("boom")).when(coordinator).pause();

        DaemonResponse response = dispatcher.dispatch("{\"command\":\"PAUSE\"}", session);

        assertThat(response.errorType()).isEqualTo("ProtocolError");
        assertThat(response.error()).isEqualTo("Internal error: boom");
    }

    @Test
    void processTextRoutesToRefinement() {
        DaemonResponse response = dispatcher.dispatch(
                "{\"command\":\"PROCESS_TEXT\",\"payload\":{\"text\":\"hello\"}}", session);

        verify(coordinator).processText(eq("hello"), eq(RefinementRequest.refine()));
        assertThat(response.data()).containsEntry("chars", 5L);
    }

    @Test
    void translateCarriesTargetLanguage() {
        DaemonResponse response = dispatcher.dispatch(
                "{\"command\":\"TRANSLATE_TEXT\",\"payload\":{\"text\":\"hola\",\"target_lang\":\"de\"}}", session);

        verify(coordinator).processText(eq("hola"), eq(RefinementRequest.translate("de")));
        assertThat(response.dataString("target_lang")).isEqualTo("de");
    }

    @Test
    void overlongTextIsRejectedBeforeProcessing() {
        refinement.setMaxInputChars(10);

        DaemonResponse response = dispatcher.dispatch(
                "{\"command\":\"PROCESS_TEXT\",\"payload\":{\"text\":\"" + "x".repeat(11) + "\"}}", session);

        assertThat(response.errorType()).isEqualTo("ProtocolError");
        assertThat(response.error()).isEqualTo("Text of 11 characters exceeds limit of 10");
        verifyNoInteractions(coordinator);
    }

    @Test
    void responseCarriesStateAfterCommand() {
        doAnswer(inv -> machine.fire(Trigger.PAUSE))
                .when(coordinator).pause();

        DaemonResponse response = dispatcher.dispatch("{\"command\":\"PAUSE\"}", session);

        assertThat(response.state().phase()).isEqualTo(DaemonPhase.PAUSED);
        assertThat(response.state().sequence()).isEqualTo(1);
    }

    @Test
    void clearsLoggingContextAfterDispatch() {
        dispatcher.dispatch("{\"command\":\"PING\"}", session);

        assertThat(ThreadContext.get(CommandDispatcher.MDC_SESSION)).isNull();
        assertThat(ThreadContext.get(CommandDispatcher.MDC_COMMAND)).isNull();
    }

    @Test
    void everyCommandNeedsExactlyOneHandler() {
        CommandHandler ping = new CommandHandler() {
            @Override
            public Set<CommandKind> kinds() {
                return Set.of(CommandKind.PING);
            }

            @Override
            public Map<String, Object> handle(Command command) {
                return null;
            }
        };

        assertThatThrownBy(() -> new CommandDispatcher(List.of(ping), machine, metrics))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No handler");
        assertThatThrownBy(() -> new CommandDispatcher(List.of(ping, ping), machine, metrics))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("claimed by both");
    }

    @Test
    void configUpdateOnlyWhileIdle() {
        DaemonResponse ok = dispatcher.dispatch(
                "{\"command\":\"UPDATE_CONFIG\",\"payload\":{\"transcription.language\":\"de\"}}", session);
        assertThat(ok.dataString("transcription.language")).isEqualTo("de");

        machine.fire(Trigger.START_RECORDING);
        DaemonResponse busy = dispatcher.dispatch(
                "{\"command\":\"UPDATE_CONFIG\",\"payload\":{\"transcription.language\":\"fr\"}}", session);
        assertThat(busy.errorType()).isEqualTo("StateConflictError");

        assertThat(dispatcher.dispatch("{\"command\":\"GET_CONFIG\"}", session).dataString("transcription.language"))
                .isEqualTo("de");
    }

    @Test
    void configUpdateInPausedIsProtocolError() {
        machine.fire(Trigger.PAUSE);

        DaemonResponse response = dispatcher.dispatch(
                "{\"command\":\"UPDATE_CONFIG\",\"payload\":{\"refinement.provider\":\"gemini\"}}", session);

        assertThat(response.errorType()).isEqualTo("ProtocolError");
    }

    @Test
    void transcribeFileRoutesExistingAbsolutePath(@TempDir Path dir) throws Exception {
        Path file = Files.write(dir.resolve("memo.wav"), new byte[]{0});

        DaemonResponse response = dispatcher.dispatch(
                "{\"command\":\"TRANSCRIBE_FILE\",\"payload\":{\"file_path\":\"" + file + "\"}}", session);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.dataString("file_path")).isEqualTo(file.toString());
        verify(coordinator).transcribeFile(file);
    }

    @Test
    void transcribeFileRejectsMissingRelativeOrAbsentPaths(@TempDir Path dir) {
        DaemonResponse missingField = dispatcher.dispatch("{\"command\":\"TRANSCRIBE_FILE\",\"payload\":{}}", session);
        DaemonResponse relative = dispatcher.dispatch(
                "{\"command\":\"TRANSCRIBE_FILE\",\"payload\":{\"file_path\":\"memo.wav\"}}", session);
        DaemonResponse absent = dispatcher.dispatch(
                "{\"command\":\"TRANSCRIBE_FILE\",\"payload\":{\"file_path\":\"" + dir.resolve("none.wav") + "\"}}",
                session);

        assertThat(missingField.error()).contains("'file_path'");
        assertThat(relative.error()).contains("must be absolute");
        assertThat(absent.error()).startsWith("File not found");
        assertThat(List.of(missingField, relative, absent))
                .allSatisfy(r -> assertThat(r.errorType()).isEqualTo("ProtocolError"));
        verifyNoInteractions(coordinator);
    }
}
