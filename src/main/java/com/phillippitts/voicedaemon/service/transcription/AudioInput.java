package com.phillippitts.voicedaemon.service.transcription;

import com.phillippitts.voicedaemon.domain.AudioBuffer;

/**
 * Source of the samples a transcription works on: a stopped recording or a WAV file.
 */
public interface AudioInput {

    /**
     * Blocks until the samples are available and hands them over.
     *
     * @throws com.phillippitts.voicedaemon.exception.TranscriptionException if the samples cannot
     *         be produced
     */
    AudioBuffer awaitBuffer() throws InterruptedException;

    /** Zeroes any samples still held without handing them out. Idempotent. */
    void discard();
}
