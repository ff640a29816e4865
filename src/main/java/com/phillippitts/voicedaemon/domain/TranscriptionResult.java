package com.phillippitts.voicedaemon.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of transcribing one speech segment.
 *
 * @param text       transcribed text, may be empty
 * @param confidence score between 0.0 and 1.0
 * @param noSpeech   true when the engine reported that the segment contained no speech
 * @param timestamp  when the result was produced
 * @param engineName engine that produced it (e.g. "whisper")
 */
public record TranscriptionResult(
        String text,
        double confidence,
        boolean noSpeech,
        Instant timestamp,
        String engineName
) {

    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    public static TranscriptionResult of(String text, double confidence, String engineName) {
        return new TranscriptionResult(text, confidence, false, Instant.now(), engineName);
    }

    public static TranscriptionResult noSpeech(String engineName) {
        return new TranscriptionResult("", 0.0, true, Instant.now(), engineName);
    }
}
