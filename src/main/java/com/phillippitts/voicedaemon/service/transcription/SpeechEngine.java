package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.domain.TranscriptionResult;
import com.phillippitts.voicedaemon.exception.TranscriptionException;

/**
 * Contract for the external speech-to-text engine.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #initialize()} prepares the engine (checks binary and model)</li>
 *   <li>{@link #transcribe(byte[])} processes one speech segment</li>
 *   <li>{@link #close()} releases resources; a closed engine may be initialized again on restart</li>
 * </ol>
 *
 * <p>Audio Format: 16kHz, 16-bit signed PCM, mono, little-endian
 * ({@link com.phillippitts.voicedaemon.service.recording.AudioFormat}).
 *
 * <p>Callers serialize access through {@link EngineGuard}; implementations need not be
 * thread-safe for concurrent transcriptions.
 */
public interface SpeechEngine extends AutoCloseable {

    /**
     * @throws TranscriptionException if the engine cannot be prepared
     */
    void initialize();

    /**
     * Transcribes the given audio. Must respond to thread interruption by aborting the work.
     *
     * @param audioData raw PCM audio data in the required format
     * @return transcription result with text and metadata
     * @throws TranscriptionException if transcription fails or is interrupted
     * @throws IllegalArgumentException if audioData is null or empty
     */
    TranscriptionResult transcribe(byte[] audioData);

    /**
     * @return engine name for logs and error messages (e.g. "whisper")
     */
    String getEngineName();

    boolean isHealthy();

    @Override
    void close();
}
