package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import com.phillippitts.voicedaemon.domain.DaemonPhase;
import com.phillippitts.voicedaemon.domain.DaemonSnapshot;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import com.phillippitts.voicedaemon.exception.AudioDeviceException;
import com.phillippitts.voicedaemon.exception.RefinementException;
import com.phillippitts.voicedaemon.exception.StateConflictException;
import com.phillippitts.voicedaemon.exception.TranscriptionException;
import com.phillippitts.voicedaemon.service.recording.PendingCapture;
import com.phillippitts.voicedaemon.service.recording.RecordingWorkflow;
import com.phillippitts.voicedaemon.service.refinement.RefinementTask;
import com.phillippitts.voicedaemon.service.refinement.RefinementWorkflow;
import com.phillippitts.voicedaemon.service.session.SessionRegistry;
import com.phillippitts.voicedaemon.service.transcription.EngineLifecycle;
import com.phillippitts.voicedaemon.service.transcription.TranscriptionTask;
import com.phillippitts.voicedaemon.service.transcription.TranscriptionWorkflow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Starts, cancels and completes the daemon workflows on behalf of the command handlers.
 *
 * <p>Every public method runs on the control thread. Workers never touch the state machine:
 * their completions are posted back to the control thread tagged with the run token that was
 * current when they started, and completions whose token is no longer current (after PAUSE,
 * RESTART or SHUTDOWN) are dropped.
 */
@Component
public class WorkflowCoordinator {

    private static final Logger LOG = LogManager.getLogger(WorkflowCoordinator.class);

    private final DaemonStateMachine machine;
    private final RecordingWorkflow recording;
    private final TranscriptionWorkflow transcriptionWorkflow;
    private final RefinementWorkflow refinementWorkflow;
    private final EngineLifecycle engineLifecycle;
    private final SessionRegistry registry;
    private final ShutdownCoordinator shutdownCoordinator;
    private final DaemonProperties properties;
    private final Executor controlExecutor;

    // Control-thread confined
    private long runToken;
    private TranscriptionTask transcription;
    private RefinementTask refinement;

    public WorkflowCoordinator(DaemonStateMachine machine,
                               RecordingWorkflow recording,
                               TranscriptionWorkflow transcriptionWorkflow,
                               RefinementWorkflow refinementWorkflow,
                               EngineLifecycle engineLifecycle,
                               SessionRegistry registry,
                               ShutdownCoordinator shutdownCoordinator,
                               DaemonProperties properties,
                               @Qualifier("controlExecutor") Executor controlExecutor) {
        this.machine = machine;
        this.recording = recording;
        this.transcriptionWorkflow = transcriptionWorkflow;
        this.refinementWorkflow = refinementWorkflow;
        this.engineLifecycle = engineLifecycle;
        this.registry = registry;
        this.shutdownCoordinator = shutdownCoordinator;
        this.properties = properties;
        this.controlExecutor = controlExecutor;
    }

    /**
     * Opens the microphone for {@code session}. A device failure leaves the daemon idle.
     */
    public DaemonSnapshot startRecording(UUID session) {
        machine.ensureAllowed(Trigger.START_RECORDING);
        long token = ++runToken;
        recording.start(failure -> post(() -> onCaptureFailed(token, failure)));
        Map<String, Object> data = Map.of("session_id", String.valueOf(session));
        return machine.fire(Trigger.START_RECORDING, s -> s.withRecordingOwner(session).withTranscript(""), data);
    }

    /**
     * Ends the recording and hands the audio to the transcription worker.
     */
    public DaemonSnapshot stopRecording(UUID requester) {
        machine.ensureAllowed(Trigger.STOP_RECORDING);
        UUID owner = machine.current().recordingOwner();
        if (owner != null && !owner.equals(requester)
                && !properties.isAllowForeignStop() && registry.isLive(owner)) {
            throw new StateConflictException("Recording is owned by session " + owner, DaemonPhase.RECORDING);
        }
        PendingCapture pending = recording.stop();
        long token = ++runToken;
        DaemonSnapshot snapshot = machine.fire(Trigger.STOP_RECORDING, UnaryOperator.identity(), null);
        TranscriptionTask task = transcriptionWorkflow.submit(pending);
        transcription = task;
        task.result().whenComplete((text, error) -> post(() -> onTranscriptionDone(token, text, error)));
        return snapshot;
    }

    /**
     * Transcribes a WAV file through the same engine and completion path as a recording.
     */
    public DaemonSnapshot transcribeFile(Path wavFile) {
        machine.ensureAllowed(Trigger.TRANSCRIBE_FILE);
        long token = ++runToken;
        DaemonSnapshot snapshot = machine.fire(Trigger.TRANSCRIBE_FILE, s -> s.withTranscript(""),
                Map.of("file_path", wavFile.toString()));
        TranscriptionTask task = transcriptionWorkflow.submitFile(wavFile);
        transcription = task;
        task.result().whenComplete((text, error) -> post(() -> onTranscriptionDone(token, text, error)));
        return snapshot;
    }

    /**
     * STOP while recording, START otherwise (which yields START's rejection outside idle).
     *
     * @return true if this call started a recording
     */
    public boolean toggle(UUID session) {
        if (machine.phase() == DaemonPhase.RECORDING) {
            stopRecording(session);
            return false;
        }
        startRecording(session);
        return true;
    }

    public DaemonSnapshot processText(String text, RefinementRequest request) {
        machine.ensureAllowed(Trigger.PROCESS_TEXT);
        long token = ++runToken;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("mode", request.mode().name().toLowerCase(Locale.ROOT));
        if (request.targetLanguage() != null) {
            data.put("target_lang", request.targetLanguage());
        }
        DaemonSnapshot snapshot = machine.fire(Trigger.PROCESS_TEXT, UnaryOperator.identity(), data);
        RefinementTask task = refinementWorkflow.submit(text, request);
        refinement = task;
        task.result().whenComplete((refined, error) -> post(() -> onRefinementDone(token, text, refined, error)));
        return snapshot;
    }

    public DaemonSnapshot pause() {
        machine.ensureAllowed(Trigger.PAUSE);
        cancelActive();
        return machine.fire(Trigger.PAUSE);
    }

    public DaemonSnapshot resume() {
        return machine.fire(Trigger.RESUME);
    }

    /**
     * Cancels any workflow and restarts the speech engine on the lifecycle thread.
     */
    public DaemonSnapshot restart() {
        machine.ensureAllowed(Trigger.RESTART);
        cancelActive();
        long token = runToken;
        DaemonSnapshot snapshot = machine.fire(Trigger.RESTART);
        engineLifecycle.restart(Duration.ofMillis(properties.getCancellationTimeoutMs()))
                .whenComplete((ignored, error) -> post(() -> onRestartDone(token, error)));
        return snapshot;
    }

    /**
     * Cancels any workflow and schedules process exit after the current response is queued.
     */
    public DaemonSnapshot shutdown() {
        machine.ensureAllowed(Trigger.SHUTDOWN);
        cancelActive();
        DaemonSnapshot snapshot = machine.fire(Trigger.SHUTDOWN);
        post(shutdownCoordinator::initiate);
        return snapshot;
    }

    private void cancelActive() {
        runToken++;
        if (recording.cancel()) {
            LOG.info("Active recording discarded");
        }
        if (transcription != null) {
            transcription.cancel();
            transcription = null;
            LOG.info("Transcription cancelled");
        }
        if (refinement != null) {
            refinement.cancel();
            refinement = null;
            LOG.info("Refinement cancelled");
        }
    }

    void onCaptureFailed(long token, AudioDeviceException failure) {
        if (token != runToken || machine.phase() != DaemonPhase.RECORDING) {
            LOG.debug("Ignoring stale capture failure");
            return;
        }
        recording.cancel();
        machine.fail(Trigger.CAPTURE_FAILED, failure, null);
    }

    void onTranscriptionDone(long token, String text, Throwable error) {
        if (token != runToken || machine.phase() != DaemonPhase.TRANSCRIBING) {
            LOG.debug("Ignoring stale transcription result");
            return;
        }
        transcription = null;
        if (error == null) {
            machine.fire(Trigger.TRANSCRIPTION_SUCCEEDED, s -> s.withTranscript(text), Map.of("transcription", text));
            return;
        }
        Throwable cause = unwrap(error);
        TranscriptionException failure = cause instanceof TranscriptionException te ? te
                : new TranscriptionException("Transcription failed: " + cause.getMessage(), cause);
        machine.fail(Trigger.TRANSCRIPTION_FAILED, failure, null);
    }

    void onRefinementDone(long token, String original, String refined, Throwable error) {
        if (token != runToken || machine.phase() != DaemonPhase.PROCESSING) {
            LOG.debug("Ignoring stale refinement result");
            return;
        }
        refinement = null;
        if (error == null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("text", refined);
            data.put("original_text", original);
            machine.fire(Trigger.REFINEMENT_SUCCEEDED, UnaryOperator.identity(), data);
            return;
        }
        Throwable cause = unwrap(error);
        RefinementException failure = cause instanceof RefinementException re ? re
                : new RefinementException("Refinement failed: " + cause.getMessage(), original, 0, cause);
        machine.fail(Trigger.REFINEMENT_FAILED, failure, Map.of("text", failure.getOriginalText()));
    }

    void onRestartDone(long token, Throwable error) {
        if (token != runToken || machine.phase() != DaemonPhase.RESTARTING) {
            LOG.debug("Ignoring stale restart result");
            return;
        }
        if (error == null) {
            machine.fire(Trigger.RESTART_COMPLETED);
            return;
        }
        Throwable cause = unwrap(error);
        TranscriptionException failure = cause instanceof TranscriptionException te ? te
                : new TranscriptionException("Engine restart failed: " + cause.getMessage(), cause);
        machine.fail(Trigger.RESTART_FAILED, failure, null);
    }

    private void post(Runnable completion) {
        try {
            controlExecutor.execute(completion);
        } catch (TaskRejectedException e) {
            LOG.debug("Control executor stopped; dropping workflow completion");
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
