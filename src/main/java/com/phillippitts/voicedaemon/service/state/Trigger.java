package com.phillippitts.voicedaemon.service.state;

/**
 * Inputs of the daemon state machine, each with the name of the event it broadcasts.
 *
 * <p>Failure triggers record the error in the snapshot and broadcast an error event; every
 * other accepted trigger clears the last error.
 */
public enum Trigger {
    START_RECORDING("recording_started", false),
    STOP_RECORDING("recording_stopped", false),
    CAPTURE_FAILED("capture_failed", true),
    TRANSCRIPTION_SUCCEEDED("transcription_completed", false),
    TRANSCRIPTION_FAILED("transcription_failed", true),
    TRANSCRIBE_FILE("file_transcription_started", false),
    PROCESS_TEXT("processing_started", false),
    REFINEMENT_SUCCEEDED("processing_completed", false),
    REFINEMENT_FAILED("processing_failed", true),
    PAUSE("paused", false),
    RESUME("resumed", false),
    RESTART("restarting", false),
    RESTART_COMPLETED("restarted", false),
    RESTART_FAILED("restart_failed", true),
    SHUTDOWN("shutting_down", false);

    private final String eventName;
    private final boolean failure;

    Trigger(String eventName, boolean failure) {
        this.eventName = eventName;
        this.failure = failure;
    }

    public String eventName() {
        return eventName;
    }

    public boolean isFailure() {
        return failure;
    }
}
